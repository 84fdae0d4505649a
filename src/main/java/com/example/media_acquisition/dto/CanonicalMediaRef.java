package com.example.media_acquisition.dto;

import com.example.media_acquisition.util.ContentKind;
import com.example.media_acquisition.util.MediaFormat;
import com.example.media_acquisition.util.MediaPlatform;

import java.util.Objects;

/**
 * Immutable identity of a piece of remote media. {@code canonicalUrl} is the URL backends are
 * invoked with; it is rebuilt from the id wherever the platform allows it.
 */
public record CanonicalMediaRef(MediaPlatform platform, String canonicalId, ContentKind contentKind, String canonicalUrl) {
    public CanonicalMediaRef {
        Objects.requireNonNull(platform, "platform");
        Objects.requireNonNull(contentKind, "contentKind");
        if (canonicalId == null || canonicalId.isBlank()) {
            throw new IllegalArgumentException("canonicalId is blank");
        }
    }

    public CacheKey key() {
        return new CacheKey(platform, canonicalId);
    }

    public CacheKey key(MediaFormat format) {
        return new CacheKey(platform, canonicalId, format);
    }
}
