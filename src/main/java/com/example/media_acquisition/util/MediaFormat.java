package com.example.media_acquisition.util;

public enum MediaFormat {
    VIDEO("mp4"),
    AUDIO("mp3");

    private final String extension;

    MediaFormat(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }
}
