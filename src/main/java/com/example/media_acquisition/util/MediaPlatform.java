package com.example.media_acquisition.util;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Normalized set of supported external media platforms.
 */
public enum MediaPlatform {
    INSTAGRAM("instagram", MediaFormat.VIDEO, List.of(MediaFormat.VIDEO), List.of("instagram.com", "instagr.am")),
    TIKTOK("tiktok", MediaFormat.VIDEO, List.of(MediaFormat.VIDEO), List.of("tiktok.com")),
    YOUTUBE("youtube", MediaFormat.AUDIO, List.of(MediaFormat.AUDIO, MediaFormat.VIDEO), List.of("youtube.com", "youtu.be"));

    private final String id;
    private final MediaFormat deliveryFormat;
    private final List<MediaFormat> formats;
    private final List<String> hosts;

    MediaPlatform(String id, MediaFormat deliveryFormat, List<MediaFormat> formats, List<String> hosts) {
        this.id = id;
        this.deliveryFormat = deliveryFormat;
        this.formats = formats;
        this.hosts = hosts;
    }

    public String id() {
        return id;
    }

    /**
     * Format delivered when the caller does not ask for a specific one.
     */
    public MediaFormat deliveryFormat() {
        return deliveryFormat;
    }

    public boolean offers(MediaFormat format) {
        return formats.contains(format);
    }

    public List<String> hosts() {
        return hosts;
    }

    public boolean matchesHost(String host) {
        if (host == null) {
            return false;
        }
        String normalized = host.toLowerCase(Locale.ROOT);
        for (String candidate : hosts) {
            if (normalized.equals(candidate) || normalized.endsWith("." + candidate)) {
                return true;
            }
        }
        return false;
    }

    public static Optional<MediaPlatform> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        var normalized = id.toLowerCase(Locale.ROOT);
        for (var value : values()) {
            if (value.id.equals(normalized)) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }
}
