package com.example.media_acquisition.service.backend;

import com.example.media_acquisition.config.BackendProperties;
import com.example.media_acquisition.dto.BackendAttempt;
import com.example.media_acquisition.dto.FetchRequest;
import com.example.media_acquisition.dto.FetchedMedia;
import com.example.media_acquisition.engine.Interfaces.MediaBackend;
import com.example.media_acquisition.exception.PoolExhaustedException;
import com.example.media_acquisition.service.credentials.CredentialLease;
import com.example.media_acquisition.service.credentials.CredentialRotator;
import com.example.media_acquisition.util.BackendErrorClass;
import com.example.media_acquisition.util.MediaPlatform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a platform's backends one after another, in priority order, until one of them returns media.
 * Every attempt is bounded by the backend's own timeout and by the overall deadline.
 */
@Service
public class BackendChainExecutor {
    private static final Logger LOGGER = LoggerFactory.getLogger(BackendChainExecutor.class);

    private final Map<MediaPlatform, List<ChainLink>> chains = new EnumMap<>(MediaPlatform.class);
    private final CredentialRotator rotator;
    private final AsyncTaskExecutor backendExecutor;
    private final Clock clock;
    private final int transientRetries;
    private final Duration transientBackoff;

    public BackendChainExecutor(List<MediaBackend> backends,
                                CredentialRotator rotator,
                                @Qualifier("backendTaskExecutor") AsyncTaskExecutor backendExecutor,
                                BackendProperties properties,
                                Clock clock) {
        this.rotator = rotator;
        this.backendExecutor = backendExecutor;
        this.clock = clock;
        this.transientRetries = Math.max(0, properties.getTransientRetries());
        this.transientBackoff = properties.getTransientBackoff();
        for (MediaBackend backend : backends) {
            BackendDescriptor descriptor = backend.descriptor();
            BackendProperties.BackendOverride override = properties.overrideFor(descriptor.name());
            if (!override.isEnabled()) {
                LOGGER.info("backend {} disabled by configuration", descriptor.name());
                continue;
            }
            if (override.getPriority() != null) {
                descriptor = descriptor.withPriority(override.getPriority());
            }
            if (override.getTimeout() != null) {
                descriptor = descriptor.withTimeout(override.getTimeout());
            }
            chains.computeIfAbsent(descriptor.platform(), p -> new ArrayList<>()).add(new ChainLink(backend, descriptor));
        }
        chains.values().forEach(list -> list.sort(Comparator
                .comparingInt((ChainLink l) -> l.descriptor().priority())
                .thenComparing(l -> l.descriptor().name())));
        chains.forEach((platform, list) -> LOGGER.info("backend chain {} -> {}", platform.id(),
                list.stream().map(l -> l.descriptor().name()).toList()));
    }

    public List<BackendDescriptor> chainFor(MediaPlatform platform) {
        return chains.getOrDefault(platform, List.of()).stream().map(ChainLink::descriptor).toList();
    }

    /**
     * @throws CancellationException when the calling thread is interrupted; the running attempt is cancelled too
     */
    public BackendChainResult acquire(FetchRequest request, Instant deadline) {
        List<BackendAttempt> attempts = new ArrayList<>();
        List<ChainLink> chain = chains.getOrDefault(request.ref().platform(), List.of());
        for (ChainLink link : chain) {
            BackendDescriptor descriptor = link.descriptor();
            if (!descriptor.supports(request.ref().contentKind(), request.format())) {
                LOGGER.debug("backend {} skipped for kind={} format={}", descriptor.name(),
                        request.ref().contentKind(), request.format());
                continue;
            }
            for (int attempt = 0; attempt <= transientRetries; attempt++) {
                if (attempt > 0) {
                    backOff(attempt, deadline);
                }
                Duration remaining = Duration.between(clock.instant(), deadline);
                if (remaining.isNegative() || remaining.isZero()) {
                    attempts.add(new BackendAttempt(descriptor.name(), BackendErrorClass.TRANSIENT, "pipeline deadline reached"));
                    return new BackendChainResult(null, attempts);
                }
                AttemptOutcome outcome = attemptOnce(link, request, remaining);
                if (outcome.media() != null) {
                    LOGGER.info("backend {} OK for {}", descriptor.name(), request.ref().key());
                    return new BackendChainResult(outcome.media().withBackend(descriptor.name()), attempts);
                }
                BackendAttempt failed = outcome.failure();
                attempts.add(failed);
                LOGGER.warn("backend {} failed [{}] for {}: {}", descriptor.name(), failed.classification(),
                        request.ref().key(), failed.reason());
                if (failed.classification() != BackendErrorClass.TRANSIENT) {
                    break;
                }
            }
        }
        if (chain.isEmpty()) {
            LOGGER.warn("no backends configured for platform {}", request.ref().platform().id());
        }
        return new BackendChainResult(null, attempts);
    }

    private AttemptOutcome attemptOnce(ChainLink link, FetchRequest request, Duration remaining) {
        BackendDescriptor descriptor = link.descriptor();
        CredentialLease lease = null;
        if (descriptor.requiresCredential()) {
            try {
                lease = rotator.acquire(descriptor.credentialPool(), descriptor.credentialCost());
            } catch (PoolExhaustedException e) {
                return AttemptOutcome.failed(descriptor.name(), BackendErrorClass.POOL_EXHAUSTED, e.getMessage());
            }
        }
        FetchRequest scoped = lease == null ? request : request.withCredential(lease.secret());
        Duration budget = descriptor.timeout().compareTo(remaining) < 0 ? descriptor.timeout() : remaining;

        Future<FetchedMedia> future = backendExecutor.submit(() -> link.backend().fetch(scoped));
        try {
            FetchedMedia media = future.get(budget.toMillis(), TimeUnit.MILLISECONDS);
            if (media == null || media.file() == null) {
                return AttemptOutcome.failed(descriptor.name(), BackendErrorClass.FATAL, "backend returned no media");
            }
            return new AttemptOutcome(media, null);
        } catch (TimeoutException e) {
            future.cancel(true);
            return AttemptOutcome.failed(descriptor.name(), BackendErrorClass.TRANSIENT, "timed out after " + budget);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            BackendErrorClass classification = descriptor.classifier().classify(cause);
            if (lease != null && classification == BackendErrorClass.RATE_LIMITED
                    && ErrorClassifiers.isCredentialRejection(cause)) {
                rotator.recordExhausted(lease.pool(), lease.secret());
            }
            return AttemptOutcome.failed(descriptor.name(), classification, String.valueOf(cause.getMessage()));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new CancellationException("acquisition interrupted during " + descriptor.name());
        }
    }

    /**
     * Sleeps {@code transientBackoff * attempt}, never past the deadline.
     */
    private void backOff(int attempt, Instant deadline) {
        Duration delay = transientBackoff.multipliedBy(attempt);
        Duration remaining = Duration.between(clock.instant(), deadline);
        if (delay.compareTo(remaining) > 0) {
            delay = remaining;
        }
        if (delay.isNegative() || delay.isZero()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("acquisition interrupted while backing off");
        }
    }

    private record ChainLink(MediaBackend backend, BackendDescriptor descriptor) { }

    private record AttemptOutcome(FetchedMedia media, BackendAttempt failure) {
        static AttemptOutcome failed(String backend, BackendErrorClass classification, String reason) {
            return new AttemptOutcome(null, new BackendAttempt(backend, classification, reason));
        }
    }
}
