package com.example.media_acquisition.ffmpeg;

import com.example.media_acquisition.config.ToolProperties;
import com.example.media_acquisition.exception.ToolUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Tries ordered ffmpeg strategies until one produces an output the validator accepts.
 * Outputs of failed attempts are deleted before the next strategy runs.
 */
@Component
public class EncodeStrategyRunner {
    private static final Logger LOGGER = LoggerFactory.getLogger(EncodeStrategyRunner.class);

    private final ProcessRunner processRunner;
    private final String ffmpegBin;

    public EncodeStrategyRunner(ProcessRunner processRunner, ToolProperties tools) {
        this.processRunner = processRunner;
        this.ffmpegBin = tools.getFfmpegBin();
    }

    public boolean isAvailable() {
        return processRunner.isAvailable(ffmpegBin);
    }

    public Optional<StrategyOutcome> runFirstValid(String purpose,
                                                   Path input,
                                                   Path output,
                                                   List<EncodeStrategy> strategies,
                                                   Duration timeout,
                                                   Predicate<Path> validator) {
        for (EncodeStrategy strategy : strategies) {
            List<String> cmd = new ArrayList<>(List.of(ffmpegBin, "-y", "-hide_banner", "-loglevel", "error",
                    "-i", input.toAbsolutePath().toString()));
            cmd.addAll(strategy.outputArgs());
            cmd.add(output.toAbsolutePath().toString());
            try {
                ProcessResult result = processRunner.run(cmd, timeout);
                if (result.succeeded() && validator.test(output)) {
                    LOGGER.info("{} OK strategy={} output={}", purpose, strategy.name(), output.getFileName());
                    return Optional.of(new StrategyOutcome(strategy.name(), output));
                }
                LOGGER.warn("{} strategy={} rejected exit={} timedOut={} err={}", purpose, strategy.name(),
                        result.code(), result.timedOut(), ProcessRunner.truncate(result.stderr()));
            } catch (ToolUnavailableException e) {
                LOGGER.warn("{} aborted: {}", purpose, e.getMessage());
                deleteQuietly(output);
                return Optional.empty();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                deleteQuietly(output);
                return Optional.empty();
            } catch (IOException e) {
                LOGGER.warn("{} strategy={} failed: {}", purpose, strategy.name(), e.getMessage());
            }
            deleteQuietly(output);
        }
        return Optional.empty();
    }

    private void deleteQuietly(Path p) {
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            LOGGER.warn("Failed to delete rejected output path={}", p, e);
        }
    }

    public record StrategyOutcome(String strategy, Path output) { }
}
