package com.example.media_acquisition.util;

public enum ContentKind {
    POST,
    REEL,
    STORY,
    VIDEO,
    TRACK,
    UNKNOWN
}
