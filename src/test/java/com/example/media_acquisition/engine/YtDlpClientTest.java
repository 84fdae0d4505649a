package com.example.media_acquisition.engine;

import com.example.media_acquisition.config.ToolProperties;
import com.example.media_acquisition.dto.FetchedMedia;
import com.example.media_acquisition.dto.SearchCandidate;
import com.example.media_acquisition.exception.BackendException;
import com.example.media_acquisition.ffmpeg.FakeProcessRunner;
import com.example.media_acquisition.ffmpeg.ProcessResult;
import com.example.media_acquisition.util.BackendErrorClass;
import com.example.media_acquisition.util.MediaFormat;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class YtDlpClientTest {

    @TempDir
    Path dir;

    @Test
    void audioDownloadReadsInfoJsonAndRemovesIt() {
        FakeProcessRunner runner = new FakeProcessRunner(cmd -> {
            write(dir.resolve("abc.mp3"), new byte[1024]);
            write(dir.resolve("abc.info.json"), "{\"title\":\"Track\",\"duration\":212.6}".getBytes());
            return FakeProcessRunner.ok("");
        }, "yt-dlp");

        FetchedMedia media = client(runner).download("https://www.youtube.com/watch?v=abc", dir, "abc",
                MediaFormat.AUDIO, List.of(), false);

        assertThat(media.file()).isEqualTo(dir.resolve("abc.mp3"));
        assertThat(media.title()).isEqualTo("Track");
        assertThat(media.durationSeconds()).isEqualTo(213);
        assertThat(dir.resolve("abc.info.json")).doesNotExist();
        assertThat(runner.commands.get(0))
                .containsSequence("-f", "bestaudio/best")
                .containsSequence("-x", "--audio-format", "mp3")
                .endsWith("https://www.youtube.com/watch?v=abc");
    }

    @Test
    void videoDownloadKeepsProfileFormatAndMergesToMp4() {
        FakeProcessRunner runner = new FakeProcessRunner(cmd -> {
            write(dir.resolve("XYZ.mp4"), new byte[1024]);
            return FakeProcessRunner.ok("");
        }, "yt-dlp");

        FetchedMedia media = client(runner).download("https://www.instagram.com/p/XYZ/", dir, "XYZ",
                MediaFormat.VIDEO, List.of("-f", "best"), false);

        assertThat(media.file()).isEqualTo(dir.resolve("XYZ.mp4"));
        assertThat(media.title()).isNull();
        assertThat(runner.commands.get(0))
                .containsSequence("-f", "best")
                .containsSequence("--merge-output-format", "mp4")
                .doesNotContain("-x");
    }

    @Test
    void authWallOutputIsBotDetected() {
        FakeProcessRunner runner = new FakeProcessRunner(cmd -> new ProcessResult(1, "",
                "ERROR: [youtube] abc: Sign in to confirm you’re not a bot. Use --cookies-from-browser", false),
                "yt-dlp");

        assertThatThrownBy(() -> client(runner).download("https://www.youtube.com/watch?v=abc", dir, "abc",
                MediaFormat.AUDIO, List.of(), false))
                .isInstanceOf(BackendException.class)
                .extracting(e -> ((BackendException) e).getClassification())
                .isEqualTo(BackendErrorClass.BOT_DETECTED);
    }

    @Test
    void timeoutRemovesPartialFilesAndIsTransient() {
        FakeProcessRunner runner = new FakeProcessRunner(cmd -> {
            write(dir.resolve("abc.mp3.part"), new byte[512]);
            return new ProcessResult(-1, "", "", true);
        }, "yt-dlp");

        assertThatThrownBy(() -> client(runner).download("https://www.youtube.com/watch?v=abc", dir, "abc",
                MediaFormat.AUDIO, List.of(), false))
                .isInstanceOf(BackendException.class)
                .extracting(e -> ((BackendException) e).getClassification())
                .isEqualTo(BackendErrorClass.TRANSIENT);
        assertThat(dir.resolve("abc.mp3.part")).doesNotExist();
    }

    @Test
    void searchParsesFlatPlaylistEntries() {
        FakeProcessRunner runner = new FakeProcessRunner(cmd -> FakeProcessRunner.ok("""
                {"entries":[
                  {"id":"abc","title":"Artist - Track","uploader":"Artist","duration":201.0},
                  {"title":"no id"},
                  {"id":"def","title":"Track (cover)","channel":"Someone"}
                ]}
                """), "yt-dlp");

        List<SearchCandidate> results = client(runner).search("artist track", 5);

        assertThat(results).extracting(SearchCandidate::videoId).containsExactly("abc", "def");
        assertThat(results.get(0).channel()).isEqualTo("Artist");
        assertThat(results.get(0).durationSeconds()).isEqualTo(201);
        assertThat(runner.commands.get(0)).endsWith("ytsearch5:artist track");
    }

    @Test
    void failedSearchThrows() {
        FakeProcessRunner runner = new FakeProcessRunner(cmd -> FakeProcessRunner.failed("boom"), "yt-dlp");

        assertThatThrownBy(() -> client(runner).search("q", 5)).isInstanceOf(BackendException.class);
    }

    private static YtDlpClient client(FakeProcessRunner runner) {
        ToolProperties tools = new ToolProperties();
        tools.setYtdlpBin("yt-dlp");
        tools.setYtdlpTimeout(Duration.ofSeconds(30));
        return new YtDlpClient(runner, new ObjectMapper(), tools);
    }

    private static void write(Path file, byte[] content) {
        try {
            Files.write(file, content);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
