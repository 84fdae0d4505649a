package com.example.media_acquisition.service.Interfaces;

import com.example.media_acquisition.dto.UploadMetadata;

import java.nio.file.Path;

/**
 * Durable home of delivered artifacts. A returned handle stays valid for re-delivery without re-upload.
 */
public interface DeliveryStore {

    /**
     * @throws com.example.media_acquisition.exception.UploadFailedException when the store rejects the artifact
     */
    String upload(Path artifact, UploadMetadata metadata);

    boolean exists(String handle);
}
