package com.example.media_acquisition.service.backend;

import com.example.media_acquisition.util.BackendCapability;
import com.example.media_acquisition.util.ContentKind;
import com.example.media_acquisition.util.MediaFormat;
import com.example.media_acquisition.util.MediaPlatform;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Static description of one backend: where it sits in its platform's chain, what it can fetch,
 * how long it may run and how its errors are classified.
 *
 * @param credentialPool pool to draw a credential from before each attempt, or {@code null}
 * @param credentialCost quota units charged per attempt
 */
public record BackendDescriptor(String name,
                                MediaPlatform platform,
                                int priority,
                                Set<BackendCapability> capabilities,
                                Duration timeout,
                                ErrorClassifier classifier,
                                String credentialPool,
                                int credentialCost) {

    public BackendDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(platform, "platform");
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(classifier, "classifier");
        capabilities = capabilities == null || capabilities.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(capabilities));
    }

    public static BackendDescriptor of(String name, MediaPlatform platform, int priority, Duration timeout,
                                       ErrorClassifier classifier, BackendCapability... capabilities) {
        return new BackendDescriptor(name, platform, priority, Set.of(capabilities), timeout, classifier, null, 0);
    }

    public BackendDescriptor withCredentialPool(String pool, int cost) {
        return new BackendDescriptor(name, platform, priority, capabilities, timeout, classifier, pool, cost);
    }

    public BackendDescriptor withPriority(int newPriority) {
        return new BackendDescriptor(name, platform, newPriority, capabilities, timeout, classifier, credentialPool, credentialCost);
    }

    public BackendDescriptor withTimeout(Duration newTimeout) {
        return new BackendDescriptor(name, platform, priority, capabilities, newTimeout, classifier, credentialPool, credentialCost);
    }

    public boolean requiresCredential() {
        return credentialPool != null && !credentialPool.isBlank();
    }

    public boolean supports(ContentKind kind, MediaFormat format) {
        if (kind == ContentKind.STORY && !capabilities.contains(BackendCapability.STORIES)) {
            return false;
        }
        return format == MediaFormat.AUDIO
                ? capabilities.contains(BackendCapability.AUDIO)
                : capabilities.contains(BackendCapability.VIDEO);
    }
}
