package com.example.media_acquisition.engine.Interfaces;

import com.example.media_acquisition.dto.TrackMatch;

import java.nio.file.Path;
import java.util.Optional;

public interface RecognitionEngine {
    /**
     * Identifies the track playing in {@code audio}. May throw on transport errors.
     */
    Optional<TrackMatch> recognize(Path audio);
}
