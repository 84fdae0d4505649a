package com.example.media_acquisition.util;

/**
 * Tri-state audio presence. {@link #UNKNOWN} means the probing tool was unavailable,
 * never that a probe failed.
 */
public enum AudioPresence {
    PRESENT,
    ABSENT,
    UNKNOWN;

    public static AudioPresence of(boolean present) {
        return present ? PRESENT : ABSENT;
    }
}
