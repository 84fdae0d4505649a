package com.example.media_acquisition.service.secondary;

import com.example.media_acquisition.dto.SearchCandidate;
import com.example.media_acquisition.dto.TrackMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Weighted text/duration heuristics that rank search results against a recognized track.
 */
@Component
public class TrackCandidateScorer {
    private static final Logger LOGGER = LoggerFactory.getLogger(TrackCandidateScorer.class);

    static final int TITLE_HAS_TRACK = 10;
    static final int TITLE_HAS_ARTIST = 10;
    static final int CHANNEL_HAS_ARTIST = 8;
    static final int DESCRIPTION_HAS_TRACK = 3;
    static final int DESCRIPTION_HAS_ARTIST = 3;
    static final int SONG_LENGTH = 5;
    static final int TOO_LONG = -5;
    static final int OFFICIAL_MARKER = 5;
    static final int VARIANT_MARKER = -3;

    private static final int SONG_MIN_SECONDS = 60;
    private static final int SONG_MAX_SECONDS = 480;
    private static final int TOO_LONG_SECONDS = 600;
    private static final List<String> OFFICIAL_MARKERS = List.of("official", "audio", "music video");
    private static final List<String> VARIANT_MARKERS = List.of("live", "cover", "remix", "karaoke");

    public record ScoredCandidate(SearchCandidate candidate, int score) { }

    public List<ScoredCandidate> rank(TrackMatch target, List<SearchCandidate> candidates) {
        List<ScoredCandidate> scored = new ArrayList<>();
        for (SearchCandidate candidate : candidates) {
            int score = score(target, candidate);
            scored.add(new ScoredCandidate(candidate, score));
            LOGGER.trace("candidate {} '{}' score={}", candidate.videoId(), candidate.title(), score);
        }
        scored.sort(Comparator.comparingInt(ScoredCandidate::score).reversed());
        return scored;
    }

    /**
     * Highest positive score wins, earlier results win ties; with nothing above zero the first result is used.
     */
    public Optional<SearchCandidate> pickBest(TrackMatch target, List<SearchCandidate> candidates) {
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        List<ScoredCandidate> ranked = rank(target, candidates);
        ScoredCandidate top = ranked.get(0);
        if (top.score() > 0) {
            LOGGER.debug("best candidate {} '{}' score={}", top.candidate().videoId(), top.candidate().title(), top.score());
            return Optional.of(top.candidate());
        }
        LOGGER.debug("no candidate scored above zero, falling back to first result");
        return Optional.of(candidates.get(0));
    }

    public int score(TrackMatch target, SearchCandidate candidate) {
        String title = lower(candidate.title());
        String channel = lower(candidate.channel());
        String description = lower(candidate.description());
        String track = lower(target.title());
        String artist = lower(target.artist());

        int score = 0;
        if (!track.isEmpty() && title.contains(track)) {
            score += TITLE_HAS_TRACK;
        }
        if (!artist.isEmpty() && title.contains(artist)) {
            score += TITLE_HAS_ARTIST;
        }
        if (!artist.isEmpty() && channel.contains(artist)) {
            score += CHANNEL_HAS_ARTIST;
        }
        if (!track.isEmpty() && description.contains(track)) {
            score += DESCRIPTION_HAS_TRACK;
        }
        if (!artist.isEmpty() && description.contains(artist)) {
            score += DESCRIPTION_HAS_ARTIST;
        }
        Integer duration = candidate.durationSeconds();
        if (duration != null) {
            if (duration >= SONG_MIN_SECONDS && duration <= SONG_MAX_SECONDS) {
                score += SONG_LENGTH;
            } else if (duration > TOO_LONG_SECONDS) {
                score += TOO_LONG;
            }
        }
        if (OFFICIAL_MARKERS.stream().anyMatch(title::contains)) {
            score += OFFICIAL_MARKER;
        }
        if (VARIANT_MARKERS.stream().anyMatch(title::contains)) {
            score += VARIANT_MARKER;
        }
        return score;
    }

    private static String lower(String s) {
        return s == null ? "" : s.toLowerCase(Locale.ROOT);
    }
}
