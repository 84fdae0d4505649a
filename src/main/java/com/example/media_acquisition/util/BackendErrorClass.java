package com.example.media_acquisition.util;

public enum BackendErrorClass {
    TRANSIENT,
    RATE_LIMITED,
    BOT_DETECTED,
    POOL_EXHAUSTED,
    FATAL;

    public boolean isRateLimit() {
        return this == RATE_LIMITED || this == BOT_DETECTED;
    }
}
