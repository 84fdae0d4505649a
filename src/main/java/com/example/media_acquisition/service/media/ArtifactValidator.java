package com.example.media_acquisition.service.media;

import com.example.media_acquisition.dto.ProbeReport;
import com.example.media_acquisition.engine.FfprobeMediaProbe;
import com.example.media_acquisition.exception.ToolUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Output contract shared by transcoding and audio extraction: the file exists, is larger than
 * {@link #MIN_ARTIFACT_BYTES} and, when ffprobe is around, reports a real duration and stream.
 */
@Component
public class ArtifactValidator {
    private static final Logger LOGGER = LoggerFactory.getLogger(ArtifactValidator.class);

    public static final long MIN_ARTIFACT_BYTES = 1_000;
    private static final double MIN_DURATION_SECONDS = 0.1;

    public enum Expectation { AUDIO, VIDEO }

    private final FfprobeMediaProbe probe;

    public ArtifactValidator(FfprobeMediaProbe probe) {
        this.probe = probe;
    }

    public boolean isValid(Path file, Expectation expectation) {
        long size = sizeOf(file);
        if (size <= MIN_ARTIFACT_BYTES) {
            LOGGER.debug("artifact too small file={} size={}", file.getFileName(), size);
            return false;
        }
        if (!probe.isAvailable()) {
            return true;
        }
        Optional<ProbeReport> report;
        try {
            report = probe.probe(file);
        } catch (ToolUnavailableException e) {
            return true;
        }
        if (report.isEmpty()) {
            return false;
        }
        ProbeReport r = report.get();
        if (!hasDuration(r, expectation)) {
            LOGGER.debug("artifact has no usable duration file={}", file.getFileName());
            return false;
        }
        if (expectation == Expectation.AUDIO) {
            return r.firstAudio().map(ProbeReport.Stream::hasRealAudioParameters).orElse(false);
        }
        return r.firstVideo()
                .map(v -> v.codecName() != null && v.width() != null && v.width() > 0 && v.height() != null && v.height() > 0)
                .orElse(false);
    }

    private boolean hasDuration(ProbeReport report, Expectation expectation) {
        if (report.formatDuration() != null) {
            return report.formatDuration() > MIN_DURATION_SECONDS;
        }
        Optional<ProbeReport.Stream> stream = expectation == Expectation.AUDIO ? report.firstAudio() : report.firstVideo();
        return stream.map(ProbeReport.Stream::duration).map(d -> d > MIN_DURATION_SECONDS).orElse(false);
    }

    static long sizeOf(Path file) {
        try {
            return file != null && Files.isRegularFile(file) ? Files.size(file) : -1;
        } catch (IOException e) {
            return -1;
        }
    }
}
