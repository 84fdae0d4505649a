package com.example.media_acquisition.dto;

import java.nio.file.Path;

public record FetchedMedia(Path file, String title, Integer durationSeconds, String backend) {
    public FetchedMedia withFile(Path replacement) {
        return new FetchedMedia(replacement, title, durationSeconds, backend);
    }

    public FetchedMedia withBackend(String name) {
        return new FetchedMedia(file, title, durationSeconds, name);
    }
}
