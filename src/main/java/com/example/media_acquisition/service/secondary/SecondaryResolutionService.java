package com.example.media_acquisition.service.secondary;

import com.example.media_acquisition.config.PipelineProperties;
import com.example.media_acquisition.dto.AcquisitionResult;
import com.example.media_acquisition.dto.CacheKey;
import com.example.media_acquisition.dto.CanonicalMediaRef;
import com.example.media_acquisition.dto.SearchCandidate;
import com.example.media_acquisition.dto.TrackMatch;
import com.example.media_acquisition.service.cache.MediaCacheStore;
import com.example.media_acquisition.service.resolver.MediaResolver;
import com.example.media_acquisition.util.ContentKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Turns a recognized track into a search, picks the most plausible result, has it acquired and links
 * the resulting cache entry back to the media the track was recognized in.
 */
@Service
public class SecondaryResolutionService {
    private static final Logger LOGGER = LoggerFactory.getLogger(SecondaryResolutionService.class);

    private final TrackSearchService searchService;
    private final TrackCandidateScorer scorer;
    private final MediaResolver resolver;
    private final MediaCacheStore cacheStore;
    private final int maxResults;
    private final int maxQueries;

    public SecondaryResolutionService(TrackSearchService searchService,
                                      TrackCandidateScorer scorer,
                                      MediaResolver resolver,
                                      MediaCacheStore cacheStore,
                                      PipelineProperties properties) {
        this.searchService = searchService;
        this.scorer = scorer;
        this.resolver = resolver;
        this.cacheStore = cacheStore;
        this.maxResults = properties.getSecondary().getMaxResults();
        this.maxQueries = properties.getSecondary().getMaxQueries();
    }

    /**
     * @param origin   key of the media the track was recognized in, or {@code null} for local samples
     * @param acquirer runs the candidate through the pipeline; never re-enters secondary resolution
     * @return empty when no search candidate was found
     */
    public Optional<AcquisitionResult> resolveSecondary(TrackMatch track, CacheKey origin,
                                                        Function<CanonicalMediaRef, AcquisitionResult> acquirer) {
        Optional<CanonicalMediaRef> candidate = findCandidate(track);
        if (candidate.isEmpty()) {
            LOGGER.info("no search candidates for {}", track.displayName());
            return Optional.empty();
        }
        CanonicalMediaRef ref = candidate.get();
        AcquisitionResult result = acquirer.apply(ref);
        if (result instanceof AcquisitionResult.Success && origin != null) {
            link(ref, origin);
        }
        return Optional.of(result);
    }

    public Optional<CanonicalMediaRef> findCandidate(TrackMatch track) {
        for (String query : queriesFor(track)) {
            List<SearchCandidate> results = searchService.search(query, maxResults);
            if (results.isEmpty()) {
                continue;
            }
            Optional<SearchCandidate> best = scorer.pickBest(track, results);
            if (best.isPresent()) {
                LOGGER.info("'{}' -> {} '{}'", query, best.get().videoId(), best.get().title());
                return Optional.of(resolver.youtube(best.get().videoId(), ContentKind.TRACK));
            }
        }
        return Optional.empty();
    }

    List<String> queriesFor(TrackMatch track) {
        Set<String> queries = new LinkedHashSet<>();
        String title = track.title();
        if (track.hasArtist()) {
            String artist = track.artist();
            queries.add(artist + " " + title + " official");
            queries.add(artist + " " + title + " audio");
            queries.add(artist + " " + title);
            queries.add(title + " " + artist);
            queries.add(title + " by " + artist);
        } else {
            queries.add(title + " official audio");
            queries.add(title);
        }
        return queries.stream().limit(maxQueries).toList();
    }

    /**
     * The track's back link keeps the first origin; each origin gets its own forward link to the track.
     */
    private void link(CanonicalMediaRef ref, CacheKey origin) {
        cacheStore.get(ref.key()).ifPresent(entry -> {
            if (entry.linkedCanonicalId() == null) {
                cacheStore.put(entry.linkedTo(origin));
                LOGGER.info("linked {} -> {}", ref.key(), origin);
            }
        });
        cacheStore.get(origin).ifPresent(entry -> {
            if (entry.trackCanonicalId() == null) {
                cacheStore.put(entry.withTrack(ref.key()));
                LOGGER.info("linked {} -> {}", origin, ref.key());
            }
        });
    }
}
