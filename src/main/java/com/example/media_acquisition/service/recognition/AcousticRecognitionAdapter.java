package com.example.media_acquisition.service.recognition;

import com.example.media_acquisition.config.PipelineProperties;
import com.example.media_acquisition.config.RecognitionProperties;
import com.example.media_acquisition.dto.TrackMatch;
import com.example.media_acquisition.engine.Interfaces.RecognitionEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Recognition never fails the pipeline: errors, tiny inputs and empty answers all become "no match".
 */
@Service
public class AcousticRecognitionAdapter {
    private static final Logger LOGGER = LoggerFactory.getLogger(AcousticRecognitionAdapter.class);

    private final RecognitionEngine engine;
    private final boolean enabled;
    private final long minInputBytes;

    public AcousticRecognitionAdapter(RecognitionEngine engine,
                                      PipelineProperties pipelineProperties,
                                      RecognitionProperties recognitionProperties) {
        this.engine = engine;
        this.enabled = pipelineProperties.getRecognition().isEnabled();
        this.minInputBytes = recognitionProperties.getMinInputBytes();
    }

    public boolean isEnabled() {
        return enabled;
    }

    public Optional<TrackMatch> recognize(Path audio) {
        if (!enabled || audio == null) {
            return Optional.empty();
        }
        try {
            if (!Files.isRegularFile(audio) || Files.size(audio) < minInputBytes) {
                LOGGER.info("recognition skipped, sample too small file={}", audio.getFileName());
                return Optional.empty();
            }
        } catch (IOException e) {
            return Optional.empty();
        }
        try {
            Optional<TrackMatch> match = engine.recognize(audio);
            if (match.isPresent()) {
                LOGGER.info("recognized {} in {}", match.get().displayName(), audio.getFileName());
            } else {
                LOGGER.info("no track recognized in {}", audio.getFileName());
            }
            return match;
        } catch (RuntimeException e) {
            LOGGER.warn("recognition failed for {}: {}", audio.getFileName(), e.getMessage());
            return Optional.empty();
        }
    }
}
