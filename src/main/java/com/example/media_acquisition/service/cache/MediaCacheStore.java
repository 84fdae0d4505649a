package com.example.media_acquisition.service.cache;

import com.example.media_acquisition.dto.AcquisitionResult;
import com.example.media_acquisition.dto.CacheEntry;
import com.example.media_acquisition.dto.CacheKey;
import com.example.media_acquisition.dto.TrackMatch;
import com.example.media_acquisition.model.CachedMedia;
import com.example.media_acquisition.repository.CachedMediaRepository;
import com.example.media_acquisition.util.AudioPresence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Persistent map from (platform, canonical id, format) to a delivered artifact, plus the single-flight
 * gate that keeps concurrent acquisitions of one key down to a single execution.
 */
@Service
public class MediaCacheStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(MediaCacheStore.class);

    private final CachedMediaRepository repository;
    private final SingleFlight<CacheKey, AcquisitionResult> singleFlight = new SingleFlight<>();

    public MediaCacheStore(CachedMediaRepository repository) {
        this.repository = repository;
    }

    /**
     * Returns the entry for the key when it carries a delivery handle.
     */
    @Transactional(readOnly = true)
    public Optional<CacheEntry> get(CacheKey key) {
        return repository.findByPlatformAndCanonicalIdAndFormat(key.platform(), key.canonicalId(), key.format())
                .filter(m -> m.getDeliveryHandle() != null && !m.getDeliveryHandle().isBlank())
                .map(MediaCacheStore::toEntry);
    }

    /**
     * Oldest delivered entry whose back link points at {@code origin}, whatever the origin's format.
     */
    @Transactional(readOnly = true)
    public Optional<CacheEntry> findLinkedTo(CacheKey origin) {
        return repository.findLinkedTo(origin.platform(), origin.canonicalId()).stream()
                .findFirst()
                .map(MediaCacheStore::toEntry);
    }

    /**
     * Upsert keyed by (platform, canonical id, format). Existing values are kept; missing ones are filled in.
     * An unknown audio state is replaced by a known one.
     */
    @Transactional
    public CacheEntry put(CacheEntry entry) {
        CachedMedia row = repository.findByPlatformAndCanonicalIdAndFormat(entry.platform(), entry.canonicalId(), entry.format())
                .orElseGet(() -> new CachedMedia(entry.platform(), entry.canonicalId(), entry.format()));
        boolean created = row.getId() == null;

        if (isBlank(row.getDeliveryHandle()) && !isBlank(entry.deliveryHandle())) {
            row.setDeliveryHandle(entry.deliveryHandle());
        }
        if (isBlank(row.getTitle()) && !isBlank(entry.title())) {
            row.setTitle(entry.title());
        }
        if (row.getDurationSeconds() == null && entry.durationSeconds() != null) {
            row.setDurationSeconds(entry.durationSeconds());
        }
        if ((row.getHasAudio() == null || row.getHasAudio() == AudioPresence.UNKNOWN) && entry.audioPresence() != null) {
            row.setHasAudio(entry.audioPresence());
        }
        if (row.getRecognizedTitle() == null && entry.recognizedTrack() != null) {
            row.setRecognizedTitle(entry.recognizedTrack().title());
            row.setRecognizedArtist(entry.recognizedTrack().artist());
        }
        if (row.getLinkedCanonicalId() == null && entry.linkedCanonicalId() != null) {
            row.setLinkedPlatform(entry.linkedPlatform());
            row.setLinkedCanonicalId(entry.linkedCanonicalId());
        }
        if (row.getTrackCanonicalId() == null && entry.trackCanonicalId() != null) {
            row.setTrackPlatform(entry.trackPlatform());
            row.setTrackCanonicalId(entry.trackCanonicalId());
        }
        CachedMedia saved = repository.save(row);
        LOGGER.info("cache {} key={}", created ? "insert" : "update", entry.key());
        return toEntry(saved);
    }

    public CompletableFuture<AcquisitionResult> withSingleFlight(CacheKey key, Executor executor,
                                                                 Supplier<AcquisitionResult> fn) {
        return singleFlight.execute(key, executor, fn);
    }

    public int inFlightCount() {
        return singleFlight.inFlightCount();
    }

    static CacheEntry toEntry(CachedMedia m) {
        TrackMatch track = isBlank(m.getRecognizedTitle()) ? null : new TrackMatch(m.getRecognizedTitle(), m.getRecognizedArtist());
        return new CacheEntry(m.getPlatform(), m.getCanonicalId(), m.getFormat(), m.getTitle(), m.getDeliveryHandle(),
                m.getDurationSeconds(), m.getHasAudio(), track, m.getLinkedPlatform(), m.getLinkedCanonicalId(),
                m.getTrackPlatform(), m.getTrackCanonicalId(), m.getCreatedAt());
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
