package com.example.media_acquisition.ffmpeg;

import java.util.List;

/**
 * One ffmpeg parameter set; {@code outputArgs} go between the input and the output path.
 */
public record EncodeStrategy(String name, List<String> outputArgs) {
    public EncodeStrategy {
        outputArgs = List.copyOf(outputArgs);
    }
}
