package com.example.media_acquisition.service.media;

import com.example.media_acquisition.config.ToolProperties;
import com.example.media_acquisition.ffmpeg.EncodeStrategy;
import com.example.media_acquisition.ffmpeg.EncodeStrategyRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Cuts a short mp3 clip out of a media artifact, trying encoder settings from most explicit to most lenient.
 */
@Service
public class AudioExtractor {
    private static final Logger LOGGER = LoggerFactory.getLogger(AudioExtractor.class);

    private final EncodeStrategyRunner strategyRunner;
    private final ArtifactValidator validator;
    private final Duration timeout;

    public AudioExtractor(EncodeStrategyRunner strategyRunner, ArtifactValidator validator, ToolProperties tools) {
        this.strategyRunner = strategyRunner;
        this.validator = validator;
        this.timeout = tools.getExtractionTimeout();
    }

    /**
     * Writes the clip into {@code outputDir}, never next to {@code media}; the caller owns that directory.
     */
    public Optional<Path> extractClip(Path media, Path outputDir, int maxSeconds) {
        if (!strategyRunner.isAvailable()) {
            LOGGER.warn("ffmpeg unavailable, cannot extract audio from {}", media.getFileName());
            return Optional.empty();
        }
        if (ArtifactValidator.sizeOf(media) < ArtifactValidator.MIN_ARTIFACT_BYTES) {
            LOGGER.warn("input too small for audio extraction file={}", media.getFileName());
            return Optional.empty();
        }
        Path output = outputDir.resolve(MediaPostProcessor.baseName(media) + ".clip.mp3");
        return strategyRunner.runFirstValid("audio-extract", media, output, strategies(maxSeconds), timeout,
                        p -> validator.isValid(p, ArtifactValidator.Expectation.AUDIO))
                .map(EncodeStrategyRunner.StrategyOutcome::output);
    }

    static List<EncodeStrategy> strategies(int maxSeconds) {
        String limit = String.valueOf(maxSeconds);
        return List.of(
                strategy("high-quality", limit, "-vn", "-map", "0:a:0", "-acodec", "libmp3lame", "-b:a", "192k",
                        "-ar", "44100", "-ac", "2", "-avoid_negative_ts", "make_zero", "-fflags", "+genpts"),
                strategy("compatible", limit, "-vn", "-acodec", "libmp3lame", "-ab", "128k", "-ar", "44100", "-ac", "2"),
                strategy("quality-auto", limit, "-vn", "-q:a", "2", "-ar", "44100"),
                strategy("minimal", limit, "-vn", "-acodec", "mp3", "-f", "mp3")
        );
    }

    private static EncodeStrategy strategy(String name, String limit, String... args) {
        List<String> all = new ArrayList<>(List.of(args));
        all.add("-t");
        all.add(limit);
        return new EncodeStrategy(name, all);
    }
}
