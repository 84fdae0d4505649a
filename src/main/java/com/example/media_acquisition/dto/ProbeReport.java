package com.example.media_acquisition.dto;

import java.util.List;
import java.util.Optional;

/**
 * Parsed ffprobe output: streams plus container-level duration and size.
 */
public record ProbeReport(List<Stream> streams, Double formatDuration, Long formatSize) {

    public ProbeReport {
        streams = streams == null ? List.of() : List.copyOf(streams);
    }

    public Optional<Stream> firstVideo() {
        return streams.stream().filter(Stream::isVideo).findFirst();
    }

    public Optional<Stream> firstAudio() {
        return streams.stream().filter(Stream::isAudio).findFirst();
    }

    public record Stream(String codecType, String codecName, Integer channels, Integer sampleRate,
                         Integer width, Integer height, Double duration) {
        public boolean isVideo() {
            return "video".equals(codecType);
        }

        public boolean isAudio() {
            return "audio".equals(codecType);
        }

        /** Codec, channel count and sample rate all reported. */
        public boolean hasRealAudioParameters() {
            return isAudio()
                    && codecName != null && !codecName.isBlank()
                    && channels != null && channels > 0
                    && sampleRate != null && sampleRate > 0;
        }
    }
}
