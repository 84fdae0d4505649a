package com.example.media_acquisition.service.credentials;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable quota state of one named pool. Only {@link CredentialRotator} touches it, always while
 * holding the pool's monitor.
 */
public final class CredentialPool {

    private final String name;
    private final List<String> credentials;
    private final int quotaLimit;
    private final Duration window;
    private final boolean degradeWhenSaturated;

    final Map<String, Integer> quotaUsed = new HashMap<>();
    final Set<String> rejected = new HashSet<>();
    Instant windowStartedAt;
    int rotor;

    public CredentialPool(String name, List<String> secrets, int quotaLimit, Duration window,
                          boolean degradeWhenSaturated, Instant windowStartedAt) {
        if (quotaLimit <= 0) {
            throw new IllegalArgumentException("quotaLimit must be positive for pool " + name);
        }
        this.name = name;
        Set<String> unique = new LinkedHashSet<>();
        for (String s : secrets) {
            if (s != null && !s.isBlank()) {
                unique.add(s.trim());
            }
        }
        this.credentials = List.copyOf(unique);
        this.quotaLimit = quotaLimit;
        this.window = window;
        this.degradeWhenSaturated = degradeWhenSaturated;
        this.windowStartedAt = windowStartedAt;
        for (String c : credentials) {
            quotaUsed.put(c, 0);
        }
    }

    public String getName() {
        return name;
    }

    public List<String> getCredentials() {
        return credentials;
    }

    public int getQuotaLimit() {
        return quotaLimit;
    }

    public Duration getWindow() {
        return window;
    }

    public boolean isDegradeWhenSaturated() {
        return degradeWhenSaturated;
    }

    int used(String secret) {
        return quotaUsed.getOrDefault(secret, 0);
    }

    boolean contains(String secret) {
        return quotaUsed.containsKey(secret);
    }
}
