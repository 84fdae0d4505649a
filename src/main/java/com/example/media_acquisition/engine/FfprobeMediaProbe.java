package com.example.media_acquisition.engine;

import com.example.media_acquisition.config.ToolProperties;
import com.example.media_acquisition.dto.ProbeReport;
import com.example.media_acquisition.ffmpeg.ProcessResult;
import com.example.media_acquisition.ffmpeg.ProcessRunner;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Thin ffprobe wrapper. Every call is bounded by {@code tools.probe-timeout}.
 * A missing binary surfaces as {@link com.example.media_acquisition.exception.ToolUnavailableException};
 * any other probe problem is reported as "nothing found".
 */
@Component
public class FfprobeMediaProbe {
    private static final Logger LOGGER = LoggerFactory.getLogger(FfprobeMediaProbe.class);

    private final ProcessRunner processRunner;
    private final ObjectMapper objectMapper;
    private final String ffprobeBin;
    private final Duration timeout;

    public FfprobeMediaProbe(ProcessRunner processRunner, ObjectMapper objectMapper, ToolProperties tools) {
        this.processRunner = processRunner;
        this.objectMapper = objectMapper;
        this.ffprobeBin = tools.getFfprobeBin();
        this.timeout = tools.getProbeTimeout();
    }

    public boolean isAvailable() {
        return processRunner.isAvailable(ffprobeBin);
    }

    public Optional<ProbeReport> probe(Path file) {
        Optional<String> json = runForStdout(file, List.of("-v", "error", "-print_format", "json", "-show_format", "-show_streams"));
        if (json.isEmpty()) {
            return Optional.empty();
        }
        try {
            JsonNode root = objectMapper.readTree(json.get());
            List<ProbeReport.Stream> streams = new ArrayList<>();
            for (JsonNode s : root.path("streams")) {
                streams.add(toStream(s));
            }
            JsonNode format = root.path("format");
            return Optional.of(new ProbeReport(streams, doubleOrNull(format, "duration"), longOrNull(format, "size")));
        } catch (IOException e) {
            LOGGER.warn("ffprobe output unparseable file={}: {}", file.getFileName(), e.getMessage());
            return Optional.empty();
        }
    }

    /** Fast check: does ffprobe list at least one audio stream. */
    public boolean listsAudioStream(Path file) {
        return runForStdout(file, List.of("-v", "error", "-select_streams", "a",
                "-show_entries", "stream=codec_type", "-of", "csv=p=0"))
                .map(out -> out.toLowerCase(Locale.ROOT).contains("audio"))
                .orElse(false);
    }

    /** Detailed check: an audio stream with codec, channel count and sample rate. */
    public boolean hasDetailedAudioStream(Path file) {
        Optional<String> json = runForStdout(file, List.of("-v", "error",
                "-show_entries", "stream=codec_type,codec_name,channels,sample_rate", "-of", "json"));
        if (json.isEmpty()) {
            return false;
        }
        try {
            for (JsonNode s : objectMapper.readTree(json.get()).path("streams")) {
                if (toStream(s).hasRealAudioParameters()) {
                    return true;
                }
            }
        } catch (IOException e) {
            LOGGER.debug("detailed audio probe unparseable file={}: {}", file.getFileName(), e.getMessage());
        }
        return false;
    }

    /** Last resort: first audio stream reports a positive duration. */
    public boolean hasAudioDuration(Path file) {
        return runForStdout(file, List.of("-v", "error", "-select_streams", "a:0",
                "-show_entries", "stream=duration", "-of", "csv=p=0"))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(s -> {
                    try {
                        return Double.parseDouble(s.lines().findFirst().orElse("0").trim()) > 0;
                    } catch (NumberFormatException e) {
                        return false;
                    }
                })
                .orElse(false);
    }

    private Optional<String> runForStdout(Path file, List<String> args) {
        List<String> cmd = new ArrayList<>();
        cmd.add(ffprobeBin);
        cmd.addAll(args);
        cmd.add(file.toAbsolutePath().toString());
        try {
            ProcessResult result = processRunner.run(cmd, timeout);
            if (!result.succeeded()) {
                LOGGER.debug("ffprobe exit={} timedOut={} file={} err={}", result.code(), result.timedOut(),
                        file.getFileName(), ProcessRunner.truncate(result.stderr()));
                return Optional.empty();
            }
            return Optional.ofNullable(result.stdout());
        } catch (IOException e) {
            LOGGER.debug("ffprobe failed file={}: {}", file.getFileName(), e.getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }

    private ProbeReport.Stream toStream(JsonNode s) {
        return new ProbeReport.Stream(
                textOrNull(s, "codec_type"),
                textOrNull(s, "codec_name"),
                intOrNull(s, "channels"),
                intOrNull(s, "sample_rate"),
                intOrNull(s, "width"),
                intOrNull(s, "height"),
                doubleOrNull(s, "duration"));
    }

    private String textOrNull(JsonNode node, String field) {
        if (node == null || !node.hasNonNull(field)) {
            return null;
        }
        var value = node.get(field).asText();
        return value != null && !value.isBlank() ? value : null;
    }

    private Integer intOrNull(JsonNode node, String field) {
        String raw = textOrNull(node, field);
        if (raw == null) {
            return null;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private Long longOrNull(JsonNode node, String field) {
        String raw = textOrNull(node, field);
        if (raw == null) {
            return null;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private Double doubleOrNull(JsonNode node, String field) {
        String raw = textOrNull(node, field);
        if (raw == null) {
            return null;
        }
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
