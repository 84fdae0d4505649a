package com.example.media_acquisition.util;

public enum BackendCapability {
    VIDEO,
    AUDIO,
    STORIES
}
