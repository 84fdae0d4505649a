package com.example.media_acquisition.service.secondary;

import com.example.media_acquisition.config.YouTubeApiProperties;
import com.example.media_acquisition.dto.SearchCandidate;
import com.example.media_acquisition.engine.YouTubeDataApiClient;
import com.example.media_acquisition.engine.YtDlpClient;
import com.example.media_acquisition.exception.PoolExhaustedException;
import com.example.media_acquisition.service.credentials.CredentialLease;
import com.example.media_acquisition.service.credentials.CredentialRotator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Track search on the Data API with rotated keys; yt-dlp's {@code ytsearch} takes over when no key is
 * usable or the API call fails.
 */
@Service
public class TrackSearchService {
    private static final Logger LOGGER = LoggerFactory.getLogger(TrackSearchService.class);

    private final YouTubeDataApiClient api;
    private final YtDlpClient ytDlp;
    private final CredentialRotator rotator;
    private final String pool;
    private final int searchCost;
    private final int videosListCost;

    public TrackSearchService(YouTubeDataApiClient api, YtDlpClient ytDlp, CredentialRotator rotator,
                              YouTubeApiProperties properties) {
        this.api = api;
        this.ytDlp = ytDlp;
        this.rotator = rotator;
        this.pool = properties.getPool();
        this.searchCost = properties.getSearchCost();
        this.videosListCost = properties.getVideosListCost();
    }

    public List<SearchCandidate> search(String query, int maxResults) {
        if (rotator.hasCredentials(pool)) {
            CredentialLease lease = null;
            try {
                lease = rotator.acquire(pool, searchCost);
                List<SearchCandidate> results = api.search(query, maxResults, lease.secret());
                LOGGER.debug("api search '{}' -> {} results", query, results.size());
                return withDurations(results, lease);
            } catch (PoolExhaustedException e) {
                LOGGER.warn("search pool exhausted, falling back to yt-dlp: {}", e.getMessage());
            } catch (WebClientResponseException e) {
                int status = e.getStatusCode().value();
                if (lease != null && (status == 403 || status == 429)) {
                    rotator.recordExhausted(lease.pool(), lease.secret());
                }
                LOGGER.warn("api search failed status={} for '{}', falling back to yt-dlp", status, query);
            } catch (RuntimeException e) {
                LOGGER.warn("api search failed for '{}', falling back to yt-dlp: {}", query, e.getMessage());
            }
        }
        try {
            return ytDlp.search(query, maxResults);
        } catch (RuntimeException e) {
            LOGGER.warn("yt-dlp search failed for '{}': {}", query, e.getMessage());
            return List.of();
        }
    }

    private List<SearchCandidate> withDurations(List<SearchCandidate> results, CredentialLease lease) {
        if (results.isEmpty()) {
            return results;
        }
        try {
            rotator.recordUsage(lease.pool(), lease.secret(), videosListCost);
            Map<String, SearchCandidate> details = api.videosDetails(
                    results.stream().map(SearchCandidate::videoId).toList(), lease.secret());
            List<SearchCandidate> merged = new ArrayList<>(results.size());
            for (SearchCandidate c : results) {
                SearchCandidate d = details.get(c.videoId());
                merged.add(d == null ? c : new SearchCandidate(c.videoId(), c.title(), c.channel(),
                        d.description() != null ? d.description() : c.description(), d.durationSeconds()));
            }
            return merged;
        } catch (RuntimeException e) {
            LOGGER.debug("duration lookup failed, ranking without durations: {}", e.getMessage());
            return results;
        }
    }
}
