package com.example.media_acquisition.exception;

/**
 * Raised when a source reference cannot be mapped to any known platform.
 */
public class MediaResolutionException extends RuntimeException {
    public MediaResolutionException(String message) {
        super(message);
    }

    public MediaResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
