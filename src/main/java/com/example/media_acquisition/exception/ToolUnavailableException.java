package com.example.media_acquisition.exception;

/**
 * The external binary could not be started at all (missing from PATH or not executable).
 */
public class ToolUnavailableException extends RuntimeException {
    private final String binary;

    public ToolUnavailableException(String binary, Throwable cause) {
        super("Tool unavailable: " + binary, cause);
        this.binary = binary;
    }

    public String getBinary() {
        return binary;
    }
}
