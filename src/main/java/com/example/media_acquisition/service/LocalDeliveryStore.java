package com.example.media_acquisition.service;

import com.example.media_acquisition.dto.UploadMetadata;
import com.example.media_acquisition.exception.StorageException;
import com.example.media_acquisition.exception.UploadFailedException;
import com.example.media_acquisition.service.Interfaces.DeliveryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

/**
 * Filesystem-backed delivery store. Handles are object keys relative to the delivery root,
 * laid out as {@code <platform>/<canonical id>.<ext>}.
 */
public class LocalDeliveryStore implements DeliveryStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(LocalDeliveryStore.class);

    private final Path baseDir;
    private final Path deliveryDir;
    private final long maxFileSizeBytes;

    public LocalDeliveryStore(Path baseDir, String deliveryPrefix, long maxFileSizeBytes) {
        this.baseDir = baseDir.toAbsolutePath().normalize();
        this.deliveryDir = this.baseDir.resolve(deliveryPrefix).normalize();
        this.maxFileSizeBytes = maxFileSizeBytes;

        try {
            Files.createDirectories(deliveryDir);
            LOGGER.info("LocalDeliveryStore ready. base={}, delivery={}", this.baseDir, this.deliveryDir);
        } catch (IOException e) {
            throw new StorageException("Cannot create delivery directory", e);
        }
    }

    @Override
    public String upload(Path artifact, UploadMetadata metadata) {
        long size;
        try {
            size = Files.size(artifact);
        } catch (IOException e) {
            throw new UploadFailedException("Artifact unreadable: " + artifact, e);
        }
        if (size > maxFileSizeBytes) {
            throw new UploadFailedException("Artifact too large: " + size + " > " + maxFileSizeBytes + " bytes");
        }
        String objectKey = objectKey(metadata);
        try {
            copyFile(artifact, safeResolve(deliveryDir, objectKey));
        } catch (StorageException e) {
            throw new UploadFailedException("Upload failed for " + objectKey, e);
        }
        LOGGER.info("stored {} bytes key={}", size, objectKey);
        return objectKey;
    }

    @Override
    public boolean exists(String handle) {
        return Files.exists(safeResolve(deliveryDir, handle));
    }

    private String objectKey(UploadMetadata metadata) {
        String id = metadata.canonicalId().replaceAll("[^A-Za-z0-9_-]", "_");
        return metadata.platform().id() + "/" + id + "." + metadata.format().extension();
    }

    private Path safeResolve(Path root, String objectKey) {
        if (objectKey == null || objectKey.isBlank()) {
            throw new StorageException("objectKey is blank");
        }
        // Force forward slashes; strip leading slashes
        String normalizedKey = objectKey.replace('\\', '/').replaceAll("^/+", "");
        Path p = root.resolve(normalizedKey).normalize();
        if (!p.startsWith(root)) {
            throw new StorageException("Invalid objectKey (path traversal?): " + objectKey);
        }
        return p;
    }

    private void copyFile(Path source, Path target) {
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            Files.createDirectories(target.getParent());
            Files.copy(source, tmp, REPLACE_EXISTING);
            Files.move(tmp, target, REPLACE_EXISTING);
        } catch (IOException e) {
            throw new StorageException("Copy failed to " + target, e);
        }
    }
}
