package com.example.media_acquisition.service.credentials;

import com.example.media_acquisition.exception.PoolExhaustedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Round-robin selection over quota-limited credentials. Selection and usage accounting for a pool
 * happen under that pool's monitor, so two concurrent callers never both see the same stale count.
 */
public class CredentialRotator {
    private static final Logger LOGGER = LoggerFactory.getLogger(CredentialRotator.class);

    private final Map<String, CredentialPool> pools = new LinkedHashMap<>();
    private final Clock clock;

    public CredentialRotator(Collection<CredentialPool> pools, Clock clock) {
        for (CredentialPool pool : pools) {
            this.pools.put(pool.getName(), pool);
        }
        this.clock = clock;
    }

    public boolean hasCredentials(String poolName) {
        CredentialPool pool = pools.get(poolName);
        return pool != null && !pool.getCredentials().isEmpty();
    }

    /**
     * Selects the next usable credential and charges {@code cost} to it in one step.
     *
     * @throws PoolExhaustedException when the pool is empty, every credential was rejected by the
     *                                remote service, or the pool is saturated and degradation is disabled
     */
    public CredentialLease acquire(String poolName, int cost) {
        CredentialPool pool = require(poolName);
        synchronized (pool) {
            String secret = select(pool);
            pool.quotaUsed.merge(secret, Math.max(cost, 0), Integer::sum);
            return new CredentialLease(poolName, secret);
        }
    }

    /**
     * Selects the next credential without charging it. Prefer {@link #acquire(String, int)} when the
     * cost is known up front.
     */
    public String nextCredential(String poolName) {
        CredentialPool pool = require(poolName);
        synchronized (pool) {
            return select(pool);
        }
    }

    public void recordUsage(String poolName, String secret, int cost) {
        if (cost <= 0) {
            return;
        }
        CredentialPool pool = require(poolName);
        synchronized (pool) {
            rollIfElapsed(pool);
            if (pool.contains(secret)) {
                pool.quotaUsed.merge(secret, cost, Integer::sum);
            }
        }
    }

    /**
     * Marks a credential as rejected by the remote service (HTTP 403 / quota exceeded). Its usage is
     * pinned to the limit until the window rolls over and the rotor moves past it.
     *
     * @return {@code true} when every credential of the pool is now rejected
     */
    public boolean recordExhausted(String poolName, String secret) {
        CredentialPool pool = require(poolName);
        synchronized (pool) {
            rollIfElapsed(pool);
            if (!pool.contains(secret)) {
                return false;
            }
            pool.quotaUsed.put(secret, Math.max(pool.used(secret), pool.getQuotaLimit()));
            pool.rejected.add(secret);
            List<String> credentials = pool.getCredentials();
            int idx = credentials.indexOf(secret);
            if (pool.rotor % credentials.size() == idx) {
                pool.rotor = (idx + 1) % credentials.size();
            }
            boolean exhausted = pool.rejected.size() >= credentials.size();
            LOGGER.warn("credential rejected pool={} key={} poolExhausted={}", poolName, CredentialLease.mask(secret), exhausted);
            return exhausted;
        }
    }

    public Map<String, Integer> usageSnapshot(String poolName) {
        CredentialPool pool = require(poolName);
        synchronized (pool) {
            rollIfElapsed(pool);
            return Map.copyOf(pool.quotaUsed);
        }
    }

    private String select(CredentialPool pool) {
        rollIfElapsed(pool);
        List<String> credentials = pool.getCredentials();
        if (credentials.isEmpty()) {
            throw new PoolExhaustedException(pool.getName(), "No credentials configured for pool " + pool.getName());
        }
        int n = credentials.size();
        for (int i = 0; i < n; i++) {
            int idx = (pool.rotor + i) % n;
            String candidate = credentials.get(idx);
            if (!pool.rejected.contains(candidate) && pool.used(candidate) < pool.getQuotaLimit()) {
                pool.rotor = (idx + 1) % n;
                return candidate;
            }
        }
        if (pool.rejected.size() >= n) {
            throw new PoolExhaustedException(pool.getName(), "All credentials rejected for pool " + pool.getName());
        }
        if (!pool.isDegradeWhenSaturated()) {
            throw new PoolExhaustedException(pool.getName(), "All credentials at quota for pool " + pool.getName());
        }
        String leastUsed = null;
        int leastIdx = 0;
        for (int idx = 0; idx < n; idx++) {
            String candidate = credentials.get(idx);
            if (pool.rejected.contains(candidate)) {
                continue;
            }
            if (leastUsed == null || pool.used(candidate) < pool.used(leastUsed)) {
                leastUsed = candidate;
                leastIdx = idx;
            }
        }
        pool.rotor = (leastIdx + 1) % n;
        LOGGER.warn("pool={} saturated, reusing least-used key={} used={} limit={}", pool.getName(),
                CredentialLease.mask(leastUsed), pool.used(leastUsed), pool.getQuotaLimit());
        return leastUsed;
    }

    private void rollIfElapsed(CredentialPool pool) {
        Instant now = clock.instant();
        if (pool.windowStartedAt == null) {
            pool.windowStartedAt = now;
            return;
        }
        if (!now.isBefore(pool.windowStartedAt.plus(pool.getWindow()))) {
            pool.quotaUsed.replaceAll((k, v) -> 0);
            pool.rejected.clear();
            pool.windowStartedAt = now;
            LOGGER.info("credential window rolled over pool={}", pool.getName());
        }
    }

    private CredentialPool require(String poolName) {
        CredentialPool pool = pools.get(poolName);
        if (pool == null) {
            throw new PoolExhaustedException(poolName, "Unknown credential pool " + poolName);
        }
        return pool;
    }
}
