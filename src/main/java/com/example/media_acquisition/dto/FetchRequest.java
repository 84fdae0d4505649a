package com.example.media_acquisition.dto;

import com.example.media_acquisition.util.MediaFormat;

import java.nio.file.Path;

/**
 * Input of a single backend attempt. {@code credential} is only set for backends bound to a credential pool.
 */
public record FetchRequest(CanonicalMediaRef ref, MediaFormat format, Path workDir, String credential) {

    public FetchRequest withCredential(String secret) {
        return new FetchRequest(ref, format, workDir, secret);
    }

    public String url() {
        return ref.canonicalUrl();
    }
}
