package com.example.media_acquisition.engine.Interfaces;

import com.example.media_acquisition.dto.FetchRequest;
import com.example.media_acquisition.dto.FetchedMedia;
import com.example.media_acquisition.service.backend.BackendDescriptor;

/**
 * One concrete way of fetching media for a platform. Implementations write into
 * {@link FetchRequest#workDir()} and report failures as exceptions; classification happens in the chain.
 */
public interface MediaBackend {

    BackendDescriptor descriptor();

    FetchedMedia fetch(FetchRequest request);
}
