package com.example.media_acquisition.service;

import com.example.media_acquisition.config.PipelineProperties;
import com.example.media_acquisition.dto.AcquisitionResult;
import com.example.media_acquisition.dto.CacheEntry;
import com.example.media_acquisition.dto.CacheKey;
import com.example.media_acquisition.dto.CanonicalMediaRef;
import com.example.media_acquisition.dto.FetchRequest;
import com.example.media_acquisition.dto.FetchedMedia;
import com.example.media_acquisition.dto.LinkedTrack;
import com.example.media_acquisition.dto.TrackMatch;
import com.example.media_acquisition.dto.UploadMetadata;
import com.example.media_acquisition.exception.ExtractionFailedException;
import com.example.media_acquisition.exception.MediaResolutionException;
import com.example.media_acquisition.exception.UploadFailedException;
import com.example.media_acquisition.service.Interfaces.DeliveryStore;
import com.example.media_acquisition.service.backend.BackendChainExecutor;
import com.example.media_acquisition.service.backend.BackendChainResult;
import com.example.media_acquisition.service.cache.MediaCacheStore;
import com.example.media_acquisition.service.media.AudioExtractor;
import com.example.media_acquisition.service.media.MediaPostProcessor;
import com.example.media_acquisition.service.recognition.AcousticRecognitionAdapter;
import com.example.media_acquisition.service.resolver.MediaResolver;
import com.example.media_acquisition.service.secondary.SecondaryResolutionService;
import com.example.media_acquisition.util.AudioPresence;
import com.example.media_acquisition.util.FailureKind;
import com.example.media_acquisition.util.MediaFormat;
import com.example.media_acquisition.util.MediaPlatform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Stream;

/**
 * Entry point of the acquisition flow: resolve, look up the cache, fetch through the backend chain,
 * post-process, recognize, store and optionally pull in the recognized track from another platform.
 * <p>
 * Nothing thrown below this class escapes it; every outcome is an {@link AcquisitionResult}.
 */
@Service
public class AcquisitionPipeline {
    private static final Logger LOGGER = LoggerFactory.getLogger(AcquisitionPipeline.class);
    private static final int SECONDARY_DEPTH = 1;
    private static final Duration LINK_RESERVE = Duration.ofMillis(500);

    private final MediaResolver resolver;
    private final MediaCacheStore cache;
    private final BackendChainExecutor backendChain;
    private final MediaPostProcessor postProcessor;
    private final AudioExtractor audioExtractor;
    private final AcousticRecognitionAdapter recognition;
    private final SecondaryResolutionService secondary;
    private final DeliveryStore deliveryStore;
    private final Executor acquisitionExecutor;
    private final Executor secondaryExecutor;
    private final Clock clock;
    private final Duration timeout;
    private final Path workRoot;
    private final int clipSeconds;
    private final boolean secondaryEnabled;

    public AcquisitionPipeline(MediaResolver resolver,
                               MediaCacheStore cache,
                               BackendChainExecutor backendChain,
                               MediaPostProcessor postProcessor,
                               AudioExtractor audioExtractor,
                               AcousticRecognitionAdapter recognition,
                               SecondaryResolutionService secondary,
                               DeliveryStore deliveryStore,
                               PipelineProperties properties,
                               @Qualifier("acquisitionTaskExecutor") Executor acquisitionExecutor,
                               @Qualifier("secondaryTaskExecutor") Executor secondaryExecutor,
                               Clock clock) {
        this.resolver = resolver;
        this.cache = cache;
        this.backendChain = backendChain;
        this.postProcessor = postProcessor;
        this.audioExtractor = audioExtractor;
        this.recognition = recognition;
        this.secondary = secondary;
        this.deliveryStore = deliveryStore;
        this.acquisitionExecutor = acquisitionExecutor;
        this.secondaryExecutor = secondaryExecutor;
        this.clock = clock;
        this.timeout = properties.getTimeout();
        this.workRoot = Paths.get(properties.getWorkDir()).toAbsolutePath().normalize();
        this.clipSeconds = properties.getRecognition().getClipSeconds();
        this.secondaryEnabled = properties.getSecondary().isEnabled();
    }

    /**
     * Resolves a source reference to a delivered artifact in the platform's default format, from cache when
     * possible. Blocks for at most the configured pipeline timeout.
     */
    public AcquisitionResult acquire(String sourceReference) {
        return acquire(sourceReference, null);
    }

    /**
     * Same as {@link #acquire(String)} for an explicit format; {@code null} means the platform default.
     * Each format of a video is fetched and cached on its own.
     */
    public AcquisitionResult acquire(String sourceReference, MediaFormat format) {
        LOGGER.info("AcquisitionPipeline START ref={} format={}", sourceReference, format);
        Instant deadline = clock.instant().plus(timeout);
        CanonicalMediaRef ref;
        try {
            ref = resolver.resolve(sourceReference);
        } catch (MediaResolutionException e) {
            LOGGER.warn("AcquisitionPipeline unresolvable ref={}: {}", sourceReference, e.getMessage());
            return AcquisitionResult.failure(FailureKind.RESOLUTION_ERROR, e.getMessage());
        }
        MediaFormat wanted = format == null ? ref.platform().deliveryFormat() : format;
        if (!ref.platform().offers(wanted)) {
            return unsupportedFormat(ref, wanted);
        }
        AcquisitionResult result = acquire(ref, wanted, 0, deadline);
        logDone(ref, result);
        return result;
    }

    public CompletableFuture<AcquisitionResult> acquireAsync(String sourceReference) {
        return acquireAsync(sourceReference, null);
    }

    /**
     * Non-blocking variant. The returned future always completes within the pipeline timeout, with a
     * {@link FailureKind#TIMEOUT} failure when the acquisition takes longer. Cancelling it detaches this
     * caller only; the shared acquisition stops once no caller is left waiting for it.
     */
    public CompletableFuture<AcquisitionResult> acquireAsync(String sourceReference, MediaFormat format) {
        Instant deadline = clock.instant().plus(timeout);
        CanonicalMediaRef ref;
        try {
            ref = resolver.resolve(sourceReference);
        } catch (MediaResolutionException e) {
            return CompletableFuture.completedFuture(AcquisitionResult.failure(FailureKind.RESOLUTION_ERROR, e.getMessage()));
        }
        MediaFormat wanted = format == null ? ref.platform().deliveryFormat() : format;
        if (!ref.platform().offers(wanted)) {
            return CompletableFuture.completedFuture(unsupportedFormat(ref, wanted));
        }
        CacheKey key = ref.key(wanted);
        CompletableFuture<AcquisitionResult> waiter;
        try {
            Optional<AcquisitionResult> cached = fromCache(ref, wanted, 0);
            if (cached.isPresent()) {
                return CompletableFuture.completedFuture(cached.get());
            }
            waiter = cache.withSingleFlight(key, acquisitionExecutor, () -> doAcquire(ref, wanted, 0, deadline));
        } catch (RuntimeException e) {
            LOGGER.error("AcquisitionPipeline FAILED key={}", key, e);
            return CompletableFuture.completedFuture(AcquisitionResult.failure(FailureKind.INTERNAL, e.getMessage()));
        }
        CompletableFuture<AcquisitionResult> result = new CompletableFuture<>();
        waiter.whenComplete((value, error) -> result.complete(error == null ? value : failureOf(key, error)));
        result.completeOnTimeout(AcquisitionResult.failure(FailureKind.TIMEOUT, "Acquisition exceeded " + timeout),
                timeout.toMillis(), TimeUnit.MILLISECONDS);
        // timed out or cancelled by the caller: leave the flight
        result.whenComplete((value, error) -> {
            if (!waiter.isDone()) {
                waiter.cancel(true);
            }
        });
        return result;
    }

    /**
     * Recognizes the track in a local audio or video sample and acquires it from the search platform.
     * The sample itself is not stored, and nothing is written next to it.
     */
    public AcquisitionResult recognizeAndAcquire(Path sample) {
        LOGGER.info("AcquisitionPipeline START sample={}", sample.getFileName());
        if (!Files.isRegularFile(sample)) {
            return AcquisitionResult.failure(FailureKind.EXTRACTION_FAILED, "Sample not found: " + sample);
        }
        Instant deadline = clock.instant().plus(timeout);
        Path workDir = workRoot.resolve(UUID.randomUUID().toString());
        try {
            Files.createDirectories(workDir);
            Optional<Path> clip = audioExtractor.extractClip(sample, workDir, clipSeconds);
            if (clip.isEmpty()) {
                return AcquisitionResult.failure(FailureKind.EXTRACTION_FAILED, "No audio could be extracted from the sample");
            }
            Optional<TrackMatch> track = recognition.recognize(clip.get());
            if (track.isEmpty()) {
                LOGGER.info("AcquisitionPipeline DONE sample={} no match", sample.getFileName());
                return AcquisitionResult.failure(FailureKind.NO_MATCH, "Track not recognized");
            }
            TrackMatch match = track.get();
            AcquisitionResult result = secondary.resolveSecondary(match, null,
                            ref -> acquire(ref, ref.platform().deliveryFormat(), SECONDARY_DEPTH, deadline))
                    .map(r -> r instanceof AcquisitionResult.Success s ? s.withRecognizedTrack(match) : r)
                    .orElseGet(() -> AcquisitionResult.failure(FailureKind.NO_CANDIDATES,
                            "No search results for " + match.displayName()));
            LOGGER.info("AcquisitionPipeline DONE sample={} track={} success={}", sample.getFileName(),
                    match.displayName(), result.isSuccess());
            return result;
        } catch (IOException e) {
            LOGGER.error("AcquisitionPipeline work dir unavailable sample={}", sample.getFileName(), e);
            return AcquisitionResult.failure(FailureKind.INTERNAL, e.getMessage());
        } catch (RuntimeException e) {
            LOGGER.error("AcquisitionPipeline FAILED sample={}", sample.getFileName(), e);
            return AcquisitionResult.failure(FailureKind.INTERNAL, e.getMessage());
        } finally {
            deleteRecursively(workDir);
        }
    }

    /**
     * Free-text track search: the best matching search result is acquired and cached.
     */
    public AcquisitionResult searchAndAcquire(String query) {
        if (query == null || query.isBlank()) {
            return AcquisitionResult.failure(FailureKind.NO_CANDIDATES, "Empty query");
        }
        LOGGER.info("AcquisitionPipeline START query='{}'", query);
        Instant deadline = clock.instant().plus(timeout);
        try {
            Optional<CanonicalMediaRef> candidate = secondary.findCandidate(new TrackMatch(query.strip(), ""));
            if (candidate.isEmpty()) {
                return AcquisitionResult.failure(FailureKind.NO_CANDIDATES, "No search results for '" + query + "'");
            }
            CanonicalMediaRef ref = candidate.get();
            AcquisitionResult result = acquire(ref, ref.platform().deliveryFormat(), 0, deadline);
            logDone(ref, result);
            return result;
        } catch (RuntimeException e) {
            LOGGER.error("AcquisitionPipeline FAILED query='{}'", query, e);
            return AcquisitionResult.failure(FailureKind.INTERNAL, e.getMessage());
        }
    }

    /**
     * Waits until {@code deadline} at the latest. A flight joined here keeps the deadline of the caller
     * that started it.
     */
    AcquisitionResult acquire(CanonicalMediaRef ref, MediaFormat format, int depth, Instant deadline) {
        CacheKey key = ref.key(format);
        CompletableFuture<AcquisitionResult> waiter;
        Duration budget;
        try {
            Optional<AcquisitionResult> cached = fromCache(ref, format, depth);
            if (cached.isPresent()) {
                return cached.get();
            }
            budget = Duration.between(clock.instant(), deadline);
            if (budget.isNegative() || budget.isZero()) {
                return AcquisitionResult.failure(FailureKind.TIMEOUT, "No time left to acquire " + key);
            }
            Executor executor = depth == 0 ? acquisitionExecutor : secondaryExecutor;
            waiter = cache.withSingleFlight(key, executor, () -> doAcquire(ref, format, depth, deadline));
        } catch (RuntimeException e) {
            LOGGER.error("AcquisitionPipeline FAILED key={}", key, e);
            return AcquisitionResult.failure(FailureKind.INTERNAL, e.getMessage());
        }
        try {
            return waiter.get(budget.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            waiter.cancel(true);
            return AcquisitionResult.failure(FailureKind.TIMEOUT, "Acquisition exceeded " + budget);
        } catch (InterruptedException e) {
            waiter.cancel(true);
            Thread.currentThread().interrupt();
            return AcquisitionResult.failure(FailureKind.CANCELLED, "Interrupted while waiting for " + key);
        } catch (CancellationException e) {
            return AcquisitionResult.failure(FailureKind.CANCELLED, "Acquisition cancelled for " + key);
        } catch (ExecutionException e) {
            return failureOf(key, e.getCause() != null ? e.getCause() : e);
        }
    }

    private Optional<AcquisitionResult> fromCache(CanonicalMediaRef ref, MediaFormat format, int depth) {
        return cache.get(ref.key(format)).map(entry -> {
            LOGGER.info("cache hit {}", entry.key());
            return AcquisitionResult.fromCache(ref, entry, depth == 0 ? linkedTrackFor(entry) : null);
        });
    }

    private AcquisitionResult doAcquire(CanonicalMediaRef ref, MediaFormat format, int depth, Instant deadline) {
        // a flight that started just after another one finished still finds the fresh entry
        Optional<AcquisitionResult> cached = fromCache(ref, format, depth);
        if (cached.isPresent()) {
            return cached.get();
        }
        CacheKey key = ref.key(format);
        Path workDir = workRoot.resolve(UUID.randomUUID().toString());
        try {
            Files.createDirectories(workDir);
            BackendChainResult chainResult = backendChain.acquire(new FetchRequest(ref, format, workDir, null), deadline);
            if (!chainResult.succeeded()) {
                FailureKind kind = chainResult.onlyPoolExhausted() ? FailureKind.POOL_EXHAUSTED : FailureKind.ALL_BACKENDS_FAILED;
                LOGGER.warn("AcquisitionPipeline {} key={} attempts={}", kind, key, chainResult.attempts());
                return new AcquisitionResult.Failure(kind, "No backend delivered " + key, chainResult.attempts());
            }
            FetchedMedia media = chainResult.media();
            Path artifact = format == MediaFormat.VIDEO ? postProcessor.validate(media.file()) : media.file();
            AudioPresence audio = postProcessor.detectAudioPresence(artifact);

            TrackMatch track = null;
            if (depth == 0 && audio == AudioPresence.PRESENT && ref.platform() != MediaPlatform.YOUTUBE) {
                track = recognize(artifact, workDir).orElse(null);
            }

            String title = media.title() != null && !media.title().isBlank()
                    ? media.title()
                    : ref.platform().id() + " " + ref.canonicalId();
            String handle = deliveryStore.upload(artifact, new UploadMetadata(ref.platform(), ref.canonicalId(), title, format));
            CacheEntry saved = cache.put(CacheEntry.of(ref.platform(), ref.canonicalId(), format, title, handle,
                    media.durationSeconds(), audio, track));

            AcquisitionResult.Success success = new AcquisitionResult.Success(ref, saved.deliveryHandle(), saved.title(),
                    saved.durationSeconds(), saved.audioPresence(), saved.recognizedTrack(), null, false);
            if (track != null && depth == 0 && secondaryEnabled) {
                success = success.withLinkedTrack(acquireLinked(track, key, deadline.minus(LINK_RESERVE)));
            }
            return success;
        } catch (ExtractionFailedException e) {
            LOGGER.warn("AcquisitionPipeline extraction failed key={}: {}", key, e.getMessage());
            return AcquisitionResult.failure(FailureKind.EXTRACTION_FAILED, e.getMessage());
        } catch (UploadFailedException e) {
            LOGGER.warn("AcquisitionPipeline upload failed key={}: {}", key, e.getMessage());
            return AcquisitionResult.failure(FailureKind.UPLOAD_FAILED, e.getMessage());
        } catch (CancellationException e) {
            LOGGER.info("AcquisitionPipeline cancelled key={}", key);
            return AcquisitionResult.failure(FailureKind.CANCELLED, e.getMessage());
        } catch (IOException e) {
            LOGGER.error("AcquisitionPipeline work dir unavailable key={}", key, e);
            return AcquisitionResult.failure(FailureKind.INTERNAL, e.getMessage());
        } catch (RuntimeException e) {
            LOGGER.error("AcquisitionPipeline FAILED key={}", key, e);
            return AcquisitionResult.failure(FailureKind.INTERNAL, e.getMessage());
        } finally {
            deleteRecursively(workDir);
        }
    }

    private Optional<TrackMatch> recognize(Path artifact, Path workDir) {
        if (!recognition.isEnabled()) {
            return Optional.empty();
        }
        Optional<Path> clip = audioExtractor.extractClip(artifact, workDir, clipSeconds);
        if (clip.isEmpty()) {
            LOGGER.info("no audio clip for recognition file={}", artifact.getFileName());
            return Optional.empty();
        }
        Optional<TrackMatch> track = recognition.recognize(clip.get());
        track.ifPresent(t -> LOGGER.info("recognized '{}' in {}", t.displayName(), artifact.getFileName()));
        return track;
    }

    /**
     * The track acquisition only gets the time the origin has left, so a slow track never costs the
     * origin its own result.
     */
    private LinkedTrack acquireLinked(TrackMatch track, CacheKey origin, Instant deadline) {
        if (!clock.instant().isBefore(deadline)) {
            LOGGER.info("no time left to acquire '{}' for {}", track.displayName(), origin);
            return null;
        }
        try {
            return secondary.resolveSecondary(track, origin,
                            ref -> acquire(ref, ref.platform().deliveryFormat(), SECONDARY_DEPTH, deadline))
                    .filter(AcquisitionResult.Success.class::isInstance)
                    .map(AcquisitionResult.Success.class::cast)
                    .map(s -> new LinkedTrack(s.ref().platform(), s.ref().canonicalId(), s.title(), s.deliveryHandle()))
                    .orElse(null);
        } catch (RuntimeException e) {
            LOGGER.warn("secondary acquisition failed for {}: {}", origin, e.getMessage());
            return null;
        }
    }

    private LinkedTrack linkedTrackFor(CacheEntry origin) {
        Optional<CacheEntry> track = origin.trackKey() == null ? Optional.empty() : cache.get(origin.trackKey());
        if (track.isEmpty()) {
            track = cache.findLinkedTo(origin.key());
        }
        return track.map(e -> new LinkedTrack(e.platform(), e.canonicalId(), e.title(), e.deliveryHandle()))
                .orElse(null);
    }

    private static AcquisitionResult unsupportedFormat(CanonicalMediaRef ref, MediaFormat format) {
        return AcquisitionResult.failure(FailureKind.RESOLUTION_ERROR,
                ref.platform().id() + " does not deliver " + format.extension());
    }

    private static AcquisitionResult failureOf(CacheKey key, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof CancellationException) {
            return AcquisitionResult.failure(FailureKind.CANCELLED, "Acquisition cancelled for " + key);
        }
        LOGGER.error("AcquisitionPipeline FAILED key={}", key, cause);
        return AcquisitionResult.failure(FailureKind.INTERNAL, String.valueOf(cause.getMessage()));
    }

    private void logDone(CanonicalMediaRef ref, AcquisitionResult result) {
        if (result instanceof AcquisitionResult.Success s) {
            LOGGER.info("AcquisitionPipeline DONE platform={} id={} handle={} fromCache={} audio={} track={} linked={}",
                    ref.platform().id(), ref.canonicalId(), s.deliveryHandle(), s.fromCache(), s.audioPresence(),
                    s.recognizedTrack() == null ? null : s.recognizedTrack().displayName(),
                    s.linkedTrack() == null ? null : s.linkedTrack().canonicalId());
        } else if (result instanceof AcquisitionResult.Failure f) {
            LOGGER.info("AcquisitionPipeline DONE platform={} id={} failure={} detail={}",
                    ref.platform().id(), ref.canonicalId(), f.kind(), f.detail());
        }
    }

    private static void deleteRecursively(Path dir) {
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(AcquisitionPipeline::deleteQuietly);
        } catch (IOException | UncheckedIOException e) {
            LOGGER.warn("could not clean work dir {}: {}", dir, e.getMessage());
        }
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOGGER.debug("could not delete {}: {}", path, e.getMessage());
        }
    }
}
