package com.example.media_acquisition.engine;

import com.example.media_acquisition.config.ToolProperties;
import com.example.media_acquisition.dto.FetchedMedia;
import com.example.media_acquisition.dto.SearchCandidate;
import com.example.media_acquisition.exception.BackendException;
import com.example.media_acquisition.ffmpeg.ProcessResult;
import com.example.media_acquisition.ffmpeg.ProcessRunner;
import com.example.media_acquisition.service.backend.ErrorClassifiers;
import com.example.media_acquisition.util.BackendErrorClass;
import com.example.media_acquisition.util.MediaFormat;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Invokes yt-dlp for downloads and flat searches.
 */
@Component
public class YtDlpClient {
    private static final Logger log = LoggerFactory.getLogger(YtDlpClient.class);
    private static final Duration SEARCH_TIMEOUT = Duration.ofSeconds(60);

    private final ProcessRunner processRunner;
    private final ObjectMapper objectMapper;
    private final String ytdlp;
    private final String ytdlpCookiesFile;
    private final Duration timeout;

    public YtDlpClient(ProcessRunner processRunner, ObjectMapper objectMapper, ToolProperties tools) {
        this.processRunner = processRunner;
        this.objectMapper = objectMapper;
        this.ytdlp = tools.getYtdlpBin();
        this.ytdlpCookiesFile = tools.getYtdlpCookiesFile();
        this.timeout = tools.getYtdlpTimeout();
    }

    /**
     * Downloads {@code url} into {@code workDir} as {@code baseName.<ext>} and reads title/duration from
     * the info json yt-dlp writes next to it.
     */
    public FetchedMedia download(String url, Path workDir, String baseName, MediaFormat format,
                                 List<String> profileArgs, boolean useCookies) {
        List<String> cmd = new ArrayList<>(List.of(
                ytdlp,
                "--no-progress", "--newline",
                "--no-playlist",
                "--write-info-json"
        ));
        cmd.addAll(profileArgs);
        if (format == MediaFormat.AUDIO) {
            if (!profileArgs.contains("-f")) {
                cmd.add("-f");
                cmd.add("bestaudio/best");
            }
            cmd.addAll(List.of("-x", "--audio-format", "mp3", "--audio-quality", "192K"));
        } else {
            cmd.addAll(List.of("--merge-output-format", "mp4"));
        }
        if (useCookies) {
            maybeAddCookies(cmd);
        }
        Path template = workDir.resolve(baseName + ".%(ext)s");
        cmd.add("-o");
        cmd.add(template.toString());
        cmd.add(url);

        ProcessResult result;
        try {
            Files.createDirectories(workDir);
            result = processRunner.run(cmd, timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cleanupPartial(workDir, baseName);
            throw new BackendException(BackendErrorClass.TRANSIENT, "yt-dlp interrupted for " + url, e);
        } catch (IOException e) {
            throw new BackendException(BackendErrorClass.TRANSIENT, "yt-dlp I/O failure for " + url + ": " + e.getMessage(), e);
        }

        if (result.timedOut()) {
            String partialNote = cleanupPartial(workDir, baseName);
            throw new BackendException(BackendErrorClass.TRANSIENT, "yt-dlp timeout after " + timeout + " for " + url
                    + partialNote + " log=" + ProcessRunner.truncate(result.combinedOutput()));
        }

        Optional<Path> output = locateOutput(workDir, baseName, format);
        if (result.code() != 0 || output.isEmpty()) {
            String out = result.combinedOutput();
            String partialNote = cleanupPartial(workDir, baseName);
            if (ErrorClassifiers.isAuthWall(out)) {
                throw new BackendException(BackendErrorClass.BOT_DETECTED, "Download requires authentication/cookies for "
                        + url + partialNote + " log=" + ProcessRunner.truncate(out));
            }
            throw new BackendException("yt-dlp exit=" + result.code() + " output missing for " + baseName + partialNote
                    + " log=" + ProcessRunner.truncate(out));
        }

        Path infoJson = workDir.resolve(baseName + ".info.json");
        String title = null;
        Integer duration = null;
        if (Files.exists(infoJson)) {
            try {
                JsonNode info = objectMapper.readTree(infoJson.toFile());
                title = textOrNull(info, "title");
                duration = info.hasNonNull("duration") ? (int) Math.round(info.get("duration").asDouble()) : null;
            } catch (IOException e) {
                log.warn("unreadable yt-dlp info json path={}: {}", infoJson, e.getMessage());
            } finally {
                deleteQuietly(infoJson);
            }
        }
        log.info("yt-dlp download OK target={} url={}", output.get().getFileName(), url);
        return new FetchedMedia(output.get(), title, duration, null);
    }

    public List<SearchCandidate> search(String query, int maxResults) {
        List<String> cmd = List.of(ytdlp, "--flat-playlist", "-J", "--no-warnings",
                "ytsearch" + maxResults + ":" + query);
        try {
            ProcessResult result = processRunner.run(cmd, SEARCH_TIMEOUT);
            if (!result.succeeded()) {
                throw new BackendException("yt-dlp search exit=" + result.code() + " log="
                        + ProcessRunner.truncate(result.stderr()));
            }
            List<SearchCandidate> candidates = new ArrayList<>();
            for (JsonNode entry : objectMapper.readTree(result.stdout()).path("entries")) {
                String id = textOrNull(entry, "id");
                if (id == null) {
                    continue;
                }
                String channel = textOrNull(entry, "channel");
                candidates.add(new SearchCandidate(id,
                        textOrNull(entry, "title"),
                        channel != null ? channel : textOrNull(entry, "uploader"),
                        textOrNull(entry, "description"),
                        entry.hasNonNull("duration") ? (int) Math.round(entry.get("duration").asDouble()) : null));
            }
            return candidates;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendException(BackendErrorClass.TRANSIENT, "yt-dlp search interrupted", e);
        } catch (IOException e) {
            throw new BackendException(BackendErrorClass.TRANSIENT, "yt-dlp search failed: " + e.getMessage(), e);
        }
    }

    private Optional<Path> locateOutput(Path workDir, String baseName, MediaFormat format) {
        Path expected = workDir.resolve(baseName + "." + format.extension());
        if (Files.isRegularFile(expected)) {
            return Optional.of(expected);
        }
        try (Stream<Path> files = Files.list(workDir)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(p -> {
                        String name = p.getFileName().toString();
                        return name.startsWith(baseName + ".")
                                && !name.endsWith(".info.json")
                                && !name.endsWith(".part")
                                && !name.endsWith(".ytdl");
                    })
                    .max(Comparator.comparingLong(p -> p.toFile().length()));
        } catch (IOException e) {
            return Optional.empty();
        }
    }

    private void maybeAddCookies(List<String> cmd) {
        if (ytdlpCookiesFile == null || ytdlpCookiesFile.isBlank()) {
            return;
        }
        Path cookiesPath = Path.of(ytdlpCookiesFile).toAbsolutePath();
        if (Files.exists(cookiesPath)) {
            cmd.add("--cookies");
            cmd.add(cookiesPath.toString());
        } else {
            log.warn("yt-dlp cookies file configured but missing path={}", cookiesPath);
        }
    }

    private String cleanupPartial(Path workDir, String baseName) {
        if (!Files.isDirectory(workDir)) {
            return "";
        }
        List<Path> partials;
        try (Stream<Path> files = Files.list(workDir)) {
            partials = files.filter(p -> {
                String name = p.getFileName().toString();
                return name.startsWith(baseName + ".") && (name.endsWith(".part") || name.endsWith(".ytdl"));
            }).toList();
        } catch (IOException e) {
            return "";
        }
        if (partials.isEmpty()) {
            return "";
        }
        partials.forEach(this::deleteQuietly);
        return " partial=" + partials.get(0);
    }

    private void deleteQuietly(Path p) {
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            log.warn("Failed to delete yt-dlp leftover path={}", p, e);
        }
    }

    private String textOrNull(JsonNode node, String field) {
        if (node == null || !node.hasNonNull(field)) {
            return null;
        }
        var value = node.get(field).asText();
        return value != null && !value.isBlank() ? value : null;
    }
}
