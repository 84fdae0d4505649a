package com.example.media_acquisition.engine;

import com.example.media_acquisition.dto.FetchRequest;
import com.example.media_acquisition.dto.FetchedMedia;
import com.example.media_acquisition.dto.SearchCandidate;
import com.example.media_acquisition.engine.Interfaces.MediaBackend;
import com.example.media_acquisition.exception.BackendException;
import com.example.media_acquisition.service.backend.BackendDescriptor;
import com.example.media_acquisition.util.BackendErrorClass;

import java.util.List;

/**
 * Confirms the video through the Data API (one quota unit on a rotated key), then downloads it with yt-dlp.
 * Title and duration come from the API since they are more reliable than the extractor's.
 */
public class YouTubeApiAssistedBackend implements MediaBackend {

    private final BackendDescriptor descriptor;
    private final YouTubeDataApiClient api;
    private final YtDlpClient ytDlp;
    private final List<String> profileArgs;

    public YouTubeApiAssistedBackend(BackendDescriptor descriptor, YouTubeDataApiClient api, YtDlpClient ytDlp,
                                     List<String> profileArgs) {
        this.descriptor = descriptor;
        this.api = api;
        this.ytDlp = ytDlp;
        this.profileArgs = List.copyOf(profileArgs);
    }

    @Override
    public BackendDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public FetchedMedia fetch(FetchRequest request) {
        if (request.credential() == null) {
            throw new BackendException(BackendErrorClass.POOL_EXHAUSTED, "No API key leased for " + descriptor.name());
        }
        String videoId = request.ref().canonicalId();
        SearchCandidate details = api.videoDetails(videoId, request.credential())
                .orElseThrow(() -> new BackendException(BackendErrorClass.FATAL, "Video not found via API: " + videoId));
        FetchedMedia media = ytDlp.download(request.url(), request.workDir(), YtDlpBackend.fileBaseName(request),
                request.format(), profileArgs, true);
        return new FetchedMedia(media.file(),
                details.title() != null ? details.title() : media.title(),
                details.durationSeconds() != null ? details.durationSeconds() : media.durationSeconds(),
                null);
    }
}
