package com.example.media_acquisition.exception;

import com.example.media_acquisition.util.BackendErrorClass;

/**
 * Failure of a single backend attempt. The classification may be left empty, in which case
 * the backend's classifier decides from the message.
 */
public class BackendException extends RuntimeException {
    private final BackendErrorClass classification;

    public BackendException(String message) {
        this(null, message, null);
    }

    public BackendException(String message, Throwable cause) {
        this(null, message, cause);
    }

    public BackendException(BackendErrorClass classification, String message) {
        this(classification, message, null);
    }

    public BackendException(BackendErrorClass classification, String message, Throwable cause) {
        super(message, cause);
        this.classification = classification;
    }

    public BackendErrorClass getClassification() {
        return classification;
    }
}
