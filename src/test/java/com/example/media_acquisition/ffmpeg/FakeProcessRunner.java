package com.example.media_acquisition.ffmpeg;

import com.example.media_acquisition.exception.ToolUnavailableException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Scripted stand-in for {@link ProcessRunner}: no subprocess is started, every command is recorded
 * and answered by the supplied handler.
 */
public class FakeProcessRunner extends ProcessRunner {

    private final Set<String> available = new HashSet<>();
    private final Function<List<String>, ProcessResult> handler;
    public final List<List<String>> commands = Collections.synchronizedList(new ArrayList<>());

    public FakeProcessRunner(Function<List<String>, ProcessResult> handler, String... availableBinaries) {
        this.handler = handler;
        this.available.addAll(List.of(availableBinaries));
    }

    public static ProcessResult ok(String stdout) {
        return new ProcessResult(0, stdout, "", false);
    }

    public static ProcessResult failed(String stderr) {
        return new ProcessResult(1, "", stderr, false);
    }

    @Override
    public ProcessResult run(List<String> cmd, Duration timeout) {
        commands.add(List.copyOf(cmd));
        if (!available.contains(cmd.get(0))) {
            throw new ToolUnavailableException(cmd.get(0), null);
        }
        return handler.apply(cmd);
    }

    @Override
    public boolean isAvailable(String binary) {
        return available.contains(binary);
    }
}
