package com.example.media_acquisition.engine;

import com.example.media_acquisition.dto.FetchRequest;
import com.example.media_acquisition.dto.FetchedMedia;
import com.example.media_acquisition.engine.Interfaces.MediaBackend;
import com.example.media_acquisition.service.backend.BackendDescriptor;

import java.util.List;

/**
 * yt-dlp with a fixed argument profile. Several instances with different profiles form the
 * subprocess part of each platform chain.
 */
public class YtDlpBackend implements MediaBackend {

    private final BackendDescriptor descriptor;
    private final YtDlpClient client;
    private final List<String> profileArgs;
    private final boolean useCookies;

    public YtDlpBackend(BackendDescriptor descriptor, YtDlpClient client, List<String> profileArgs, boolean useCookies) {
        this.descriptor = descriptor;
        this.client = client;
        this.profileArgs = List.copyOf(profileArgs);
        this.useCookies = useCookies;
    }

    @Override
    public BackendDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public FetchedMedia fetch(FetchRequest request) {
        return client.download(request.url(), request.workDir(), fileBaseName(request), request.format(),
                profileArgs, useCookies);
    }

    static String fileBaseName(FetchRequest request) {
        return request.ref().canonicalId().replaceAll("[^A-Za-z0-9_-]", "_");
    }
}
