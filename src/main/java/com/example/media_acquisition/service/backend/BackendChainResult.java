package com.example.media_acquisition.service.backend;

import com.example.media_acquisition.dto.BackendAttempt;
import com.example.media_acquisition.dto.FetchedMedia;
import com.example.media_acquisition.util.BackendErrorClass;

import java.util.List;

/**
 * Either the media fetched by the first successful backend, or every attempt that failed.
 */
public record BackendChainResult(FetchedMedia media, List<BackendAttempt> attempts) {

    public BackendChainResult {
        attempts = List.copyOf(attempts);
    }

    public boolean succeeded() {
        return media != null;
    }

    /** True when nothing was actually attempted because no credential could be obtained. */
    public boolean onlyPoolExhausted() {
        return !attempts.isEmpty()
                && attempts.stream().allMatch(a -> a.classification() == BackendErrorClass.POOL_EXHAUSTED);
    }
}
