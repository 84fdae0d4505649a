package com.example.media_acquisition.service.media;

import com.example.media_acquisition.config.ToolProperties;
import com.example.media_acquisition.dto.ProbeReport;
import com.example.media_acquisition.engine.FfprobeMediaProbe;
import com.example.media_acquisition.exception.ExtractionFailedException;
import com.example.media_acquisition.exception.ToolUnavailableException;
import com.example.media_acquisition.ffmpeg.EncodeStrategy;
import com.example.media_acquisition.ffmpeg.EncodeStrategyRunner;
import com.example.media_acquisition.util.AudioPresence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Best-effort container/codec validation of fetched artifacts and audio presence detection.
 */
@Service
public class MediaPostProcessor {
    private static final Logger LOGGER = LoggerFactory.getLogger(MediaPostProcessor.class);

    static final List<EncodeStrategy> TRANSCODE_STRATEGIES = List.of(
            new EncodeStrategy("h264-aac", List.of("-c:v", "libx264", "-c:a", "aac", "-movflags", "+faststart")),
            new EncodeStrategy("h264-veryfast-copy-audio", List.of("-c:v", "libx264", "-preset", "veryfast",
                    "-crf", "23", "-c:a", "copy", "-movflags", "+faststart"))
    );

    private final FfprobeMediaProbe probe;
    private final EncodeStrategyRunner strategyRunner;
    private final ArtifactValidator validator;
    private final Set<String> acceptedCodecs;
    private final Duration transcodeTimeout;

    public MediaPostProcessor(FfprobeMediaProbe probe,
                              EncodeStrategyRunner strategyRunner,
                              ArtifactValidator validator,
                              ToolProperties tools) {
        this.probe = probe;
        this.strategyRunner = strategyRunner;
        this.validator = validator;
        this.acceptedCodecs = tools.getAcceptedVideoCodecs().stream()
                .map(c -> c.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        this.transcodeTimeout = tools.getTranscodeTimeout();
    }

    /**
     * Returns a playable artifact: the input itself, or a transcoded replacement when its video codec
     * is not accepted. Probe or transcode problems leave the input untouched.
     *
     * @throws ExtractionFailedException when the artifact is missing or empty
     */
    public Path validate(Path artifact) {
        if (ArtifactValidator.sizeOf(artifact) <= 0) {
            throw new ExtractionFailedException("Fetched artifact is missing or empty: " + artifact);
        }
        Optional<ProbeReport> report;
        try {
            if (!probe.isAvailable()) {
                LOGGER.warn("ffprobe unavailable, skipping validation file={}", artifact.getFileName());
                return artifact;
            }
            report = probe.probe(artifact);
        } catch (ToolUnavailableException e) {
            return artifact;
        }
        if (report.isEmpty()) {
            LOGGER.warn("probe failed, keeping original file={}", artifact.getFileName());
            return artifact;
        }
        Optional<ProbeReport.Stream> video = report.get().firstVideo();
        if (video.isEmpty()) {
            return artifact;
        }
        ProbeReport.Stream v = video.get();
        String codec = v.codecName() == null ? "" : v.codecName().toLowerCase(Locale.ROOT);
        boolean dimensionsOk = v.width() != null && v.width() > 0 && v.height() != null && v.height() > 0;
        if (acceptedCodecs.contains(codec) && dimensionsOk) {
            return artifact;
        }

        LOGGER.info("transcoding file={} codec={} {}x{}", artifact.getFileName(), codec, v.width(), v.height());
        Path transcoded = artifact.resolveSibling(baseName(artifact) + ".transcoded.mp4");
        return strategyRunner.runFirstValid("transcode", artifact, transcoded, TRANSCODE_STRATEGIES, transcodeTimeout,
                        p -> validator.isValid(p, ArtifactValidator.Expectation.VIDEO))
                .map(outcome -> replace(artifact, outcome.output()))
                .orElseGet(() -> {
                    LOGGER.warn("transcode failed, keeping original file={}", artifact.getFileName());
                    return artifact;
                });
    }

    public AudioPresence detectAudioPresence(Path artifact) {
        if (!probe.isAvailable()) {
            return AudioPresence.UNKNOWN;
        }
        if (ArtifactValidator.sizeOf(artifact) < ArtifactValidator.MIN_ARTIFACT_BYTES) {
            return AudioPresence.ABSENT;
        }
        try {
            if (probe.listsAudioStream(artifact)) {
                return AudioPresence.PRESENT;
            }
            if (probe.hasDetailedAudioStream(artifact)) {
                return AudioPresence.PRESENT;
            }
            return AudioPresence.of(probe.hasAudioDuration(artifact));
        } catch (ToolUnavailableException e) {
            LOGGER.warn("ffprobe disappeared during audio detection: {}", e.getMessage());
            return AudioPresence.UNKNOWN;
        }
    }

    private Path replace(Path original, Path transcoded) {
        Path target = original.resolveSibling(baseName(original) + ".mp4");
        try {
            Files.move(transcoded, target, StandardCopyOption.REPLACE_EXISTING);
            if (!target.equals(original)) {
                Files.deleteIfExists(original);
            }
            return target;
        } catch (IOException e) {
            LOGGER.warn("could not replace original with transcoded file, using transcoded copy: {}", e.getMessage());
            return transcoded;
        }
    }

    static String baseName(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
