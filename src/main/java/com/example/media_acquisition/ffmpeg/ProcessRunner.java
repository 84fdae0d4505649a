package com.example.media_acquisition.ffmpeg;

import com.example.media_acquisition.exception.ToolUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Runs external tools (ffmpeg, ffprobe, yt-dlp) as bounded subprocesses.
 * An interrupted caller kills the child process before the interrupt is rethrown.
 */
@Component
public class ProcessRunner {
    private static final Logger LOGGER = LoggerFactory.getLogger(ProcessRunner.class);
    private static final int LOG_SNIPPET_MAX = 4_000;
    private static final long DRAIN_JOIN_MILLIS = 5_000;

    private final Map<String, Boolean> availability = new ConcurrentHashMap<>();

    public ProcessResult run(List<String> cmd, Duration timeout) throws IOException, InterruptedException {
        LOGGER.debug("exec {}", String.join(" ", cmd));
        Process p;
        try {
            p = new ProcessBuilder(cmd).redirectErrorStream(false).start();
        } catch (IOException e) {
            throw new ToolUnavailableException(cmd.get(0), e);
        }
        StringBuffer out = new StringBuffer();
        StringBuffer err = new StringBuffer();
        Thread tOut = drain(p.getInputStream(), out, "proc-out");
        Thread tErr = drain(p.getErrorStream(), err, "proc-err");

        boolean finished;
        try {
            finished = p.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            p.destroyForcibly();
            throw e;
        }
        if (!finished) {
            p.destroyForcibly();
            p.waitFor(5, TimeUnit.SECONDS);
            LOGGER.warn("process timed out after {} cmd={}", timeout, cmd.get(0));
        }
        tOut.join(DRAIN_JOIN_MILLIS);
        tErr.join(DRAIN_JOIN_MILLIS);
        int code = finished ? p.exitValue() : -1;
        return new ProcessResult(code, out.toString(), err.toString(), !finished);
    }

    /**
     * True when the binary is an executable path or can be found on {@code PATH}.
     */
    public boolean isAvailable(String binary) {
        if (binary == null || binary.isBlank()) {
            return false;
        }
        return availability.computeIfAbsent(binary, this::lookup);
    }

    public static String truncate(String output) {
        if (output == null || output.isBlank()) {
            return "<no output>";
        }
        if (output.length() <= LOG_SNIPPET_MAX) {
            return output;
        }
        return output.substring(0, LOG_SNIPPET_MAX) + "...";
    }

    private boolean lookup(String binary) {
        try {
            if (binary.contains("/") || binary.contains(File.separator)) {
                return Files.isExecutable(Path.of(binary));
            }
            String pathEnv = System.getenv("PATH");
            if (pathEnv == null) {
                return false;
            }
            for (String dir : pathEnv.split(File.pathSeparator)) {
                if (dir.isBlank()) {
                    continue;
                }
                Path candidate = Path.of(dir, binary);
                if (Files.isExecutable(candidate) || Files.isExecutable(Path.of(dir, binary + ".exe"))) {
                    return true;
                }
            }
        } catch (InvalidPathException e) {
            LOGGER.debug("invalid tool path {}: {}", binary, e.getMessage());
        }
        return false;
    }

    private Thread drain(InputStream stream, StringBuffer sink, String name) {
        Thread t = new Thread(() -> {
            try (var br = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = br.readLine()) != null) {
                    sink.append(line).append('\n');
                }
            } catch (IOException e) {
                LOGGER.trace("stream closed early: {}", e.getMessage());
            }
        }, name);
        t.setDaemon(true);
        t.start();
        return t;
    }
}
