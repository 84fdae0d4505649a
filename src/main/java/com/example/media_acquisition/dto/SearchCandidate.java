package com.example.media_acquisition.dto;

public record SearchCandidate(String videoId, String title, String channel, String description, Integer durationSeconds) {
    public String watchUrl() {
        return "https://www.youtube.com/watch?v=" + videoId;
    }
}
