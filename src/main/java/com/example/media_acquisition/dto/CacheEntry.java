package com.example.media_acquisition.dto;

import com.example.media_acquisition.util.AudioPresence;
import com.example.media_acquisition.util.MediaFormat;
import com.example.media_acquisition.util.MediaPlatform;

import java.time.Instant;

/**
 * {@code linkedPlatform}/{@code linkedCanonicalId} sit on a secondary entry and point back at the media its
 * track was first recognized in. {@code trackPlatform}/{@code trackCanonicalId} sit on the origin and point
 * forward at the acquired track, so every origin finds its track even when the track is shared.
 */
public record CacheEntry(MediaPlatform platform,
                         String canonicalId,
                         MediaFormat format,
                         String title,
                         String deliveryHandle,
                         Integer durationSeconds,
                         AudioPresence audioPresence,
                         TrackMatch recognizedTrack,
                         MediaPlatform linkedPlatform,
                         String linkedCanonicalId,
                         MediaPlatform trackPlatform,
                         String trackCanonicalId,
                         Instant createdAt) {

    public CacheEntry {
        if (format == null && platform != null) {
            format = platform.deliveryFormat();
        }
    }

    public static CacheEntry of(MediaPlatform platform, String canonicalId, MediaFormat format, String title,
                                String deliveryHandle, Integer durationSeconds, AudioPresence audioPresence,
                                TrackMatch recognizedTrack) {
        return new CacheEntry(platform, canonicalId, format, title, deliveryHandle, durationSeconds, audioPresence,
                recognizedTrack, null, null, null, null, null);
    }

    public CacheKey key() {
        return new CacheKey(platform, canonicalId, format);
    }

    public boolean hasDeliveryHandle() {
        return deliveryHandle != null && !deliveryHandle.isBlank();
    }

    public CacheKey trackKey() {
        return trackPlatform == null || trackCanonicalId == null ? null : new CacheKey(trackPlatform, trackCanonicalId);
    }

    public CacheEntry linkedTo(CacheKey origin) {
        return new CacheEntry(platform, canonicalId, format, title, deliveryHandle, durationSeconds, audioPresence,
                recognizedTrack, origin.platform(), origin.canonicalId(), trackPlatform, trackCanonicalId, createdAt);
    }

    public CacheEntry withTrack(CacheKey track) {
        return new CacheEntry(platform, canonicalId, format, title, deliveryHandle, durationSeconds, audioPresence,
                recognizedTrack, linkedPlatform, linkedCanonicalId, track.platform(), track.canonicalId(), createdAt);
    }
}
