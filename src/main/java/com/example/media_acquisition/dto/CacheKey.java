package com.example.media_acquisition.dto;

import com.example.media_acquisition.util.MediaFormat;
import com.example.media_acquisition.util.MediaPlatform;

import java.util.Objects;

/**
 * Identity of one cached artifact. A YouTube video cached as mp3 and as mp4 has two keys.
 */
public record CacheKey(MediaPlatform platform, String canonicalId, MediaFormat format) {
    public CacheKey {
        Objects.requireNonNull(platform, "platform");
        Objects.requireNonNull(canonicalId, "canonicalId");
        Objects.requireNonNull(format, "format");
    }

    public CacheKey(MediaPlatform platform, String canonicalId) {
        this(platform, canonicalId, platform.deliveryFormat());
    }

    @Override
    public String toString() {
        return platform.id() + ":" + canonicalId + "." + format.extension();
    }
}
