package com.example.media_acquisition.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Locations and time limits of the external media tools.
 */
@ConfigurationProperties(prefix = "tools")
public class ToolProperties {

    private String ffmpegBin = "ffmpeg";
    private String ffprobeBin = "ffprobe";
    private String ytdlpBin = "yt-dlp";
    private String ytdlpCookiesFile;
    private Duration probeTimeout = Duration.ofSeconds(30);
    private Duration transcodeTimeout = Duration.ofSeconds(120);
    private Duration extractionTimeout = Duration.ofSeconds(60);
    private Duration ytdlpTimeout = Duration.ofMinutes(15);
    private List<String> acceptedVideoCodecs = new ArrayList<>(List.of("h264"));

    public String getFfmpegBin() {
        return ffmpegBin;
    }

    public void setFfmpegBin(String ffmpegBin) {
        this.ffmpegBin = ffmpegBin;
    }

    public String getFfprobeBin() {
        return ffprobeBin;
    }

    public void setFfprobeBin(String ffprobeBin) {
        this.ffprobeBin = ffprobeBin;
    }

    public String getYtdlpBin() {
        return ytdlpBin;
    }

    public void setYtdlpBin(String ytdlpBin) {
        this.ytdlpBin = ytdlpBin;
    }

    public String getYtdlpCookiesFile() {
        return ytdlpCookiesFile;
    }

    public void setYtdlpCookiesFile(String ytdlpCookiesFile) {
        this.ytdlpCookiesFile = ytdlpCookiesFile;
    }

    public Duration getProbeTimeout() {
        return probeTimeout;
    }

    public void setProbeTimeout(Duration probeTimeout) {
        this.probeTimeout = probeTimeout;
    }

    public Duration getTranscodeTimeout() {
        return transcodeTimeout;
    }

    public void setTranscodeTimeout(Duration transcodeTimeout) {
        this.transcodeTimeout = transcodeTimeout;
    }

    public Duration getExtractionTimeout() {
        return extractionTimeout;
    }

    public void setExtractionTimeout(Duration extractionTimeout) {
        this.extractionTimeout = extractionTimeout;
    }

    public Duration getYtdlpTimeout() {
        return ytdlpTimeout;
    }

    public void setYtdlpTimeout(Duration ytdlpTimeout) {
        this.ytdlpTimeout = ytdlpTimeout;
    }

    public List<String> getAcceptedVideoCodecs() {
        return acceptedVideoCodecs;
    }

    public void setAcceptedVideoCodecs(List<String> acceptedVideoCodecs) {
        this.acceptedVideoCodecs = acceptedVideoCodecs;
    }
}
