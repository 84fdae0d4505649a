package com.example.media_acquisition.util;

public enum FailureKind {
    RESOLUTION_ERROR,
    ALL_BACKENDS_FAILED,
    POOL_EXHAUSTED,
    EXTRACTION_FAILED,
    UPLOAD_FAILED,
    NO_MATCH,
    NO_CANDIDATES,
    TIMEOUT,
    CANCELLED,
    INTERNAL
}
