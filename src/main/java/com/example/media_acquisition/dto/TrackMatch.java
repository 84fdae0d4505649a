package com.example.media_acquisition.dto;

public record TrackMatch(String title, String artist) {
    public TrackMatch {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("title is blank");
        }
        artist = artist == null ? "" : artist.trim();
        title = title.trim();
    }

    public boolean hasArtist() {
        return !artist.isEmpty();
    }

    public String displayName() {
        return hasArtist() ? artist + " - " + title : title;
    }
}
