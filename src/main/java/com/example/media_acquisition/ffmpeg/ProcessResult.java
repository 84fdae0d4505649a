package com.example.media_acquisition.ffmpeg;

/**
 * Exit status and captured streams of one external tool invocation. {@code code} is -1 on timeout.
 */
public record ProcessResult(int code, String stdout, String stderr, boolean timedOut) {

    public boolean succeeded() {
        return !timedOut && code == 0;
    }

    public String combinedOutput() {
        if (stderr == null || stderr.isBlank()) {
            return stdout == null ? "" : stdout;
        }
        if (stdout == null || stdout.isBlank()) {
            return stderr;
        }
        return stdout + System.lineSeparator() + stderr;
    }
}
