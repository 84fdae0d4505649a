package com.example.media_acquisition.service.secondary;

import com.example.media_acquisition.config.PipelineProperties;
import com.example.media_acquisition.dto.AcquisitionResult;
import com.example.media_acquisition.dto.CacheEntry;
import com.example.media_acquisition.dto.CacheKey;
import com.example.media_acquisition.dto.CanonicalMediaRef;
import com.example.media_acquisition.dto.SearchCandidate;
import com.example.media_acquisition.dto.TrackMatch;
import com.example.media_acquisition.service.cache.MediaCacheStore;
import com.example.media_acquisition.service.resolver.MediaResolver;
import com.example.media_acquisition.util.AudioPresence;
import com.example.media_acquisition.util.ContentKind;
import com.example.media_acquisition.util.FailureKind;
import com.example.media_acquisition.util.MediaFormat;
import com.example.media_acquisition.util.MediaPlatform;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SecondaryResolutionServiceTest {

    private static final TrackMatch TRACK = new TrackMatch("Track", "Artist");
    private static final CacheKey ORIGIN = new CacheKey(MediaPlatform.INSTAGRAM, "XYZ");
    private static final CacheKey TRACK_KEY = new CacheKey(MediaPlatform.YOUTUBE, "vid42");

    @Mock
    TrackSearchService searchService;

    @Mock
    MediaCacheStore cacheStore;

    private PipelineProperties properties;

    @BeforeEach
    void setUp() {
        properties = new PipelineProperties();
    }

    @Test
    void queriesPreferOfficialUploadsAndRespectTheLimit() {
        properties.getSecondary().setMaxQueries(5);

        assertThat(service().queriesFor(TRACK)).containsExactly(
                "Artist Track official",
                "Artist Track audio",
                "Artist Track",
                "Track Artist",
                "Track by Artist");

        properties.getSecondary().setMaxQueries(2);
        assertThat(service().queriesFor(TRACK)).hasSize(2);
        assertThat(service().queriesFor(new TrackMatch("Track", ""))).containsExactly("Track official audio", "Track");
    }

    @Test
    void laterQueriesAreTriedWhenEarlierOnesFindNothing() {
        when(searchService.search("Artist Track official", 5)).thenReturn(List.of());
        when(searchService.search("Artist Track audio", 5)).thenReturn(List.of(
                new SearchCandidate("cover", "Track (karaoke cover)", "Someone", null, null),
                new SearchCandidate("vid42", "Artist - Track (Official Audio)", "Artist", null, 200)));

        Optional<CanonicalMediaRef> ref = service().findCandidate(TRACK);

        assertThat(ref).contains(new CanonicalMediaRef(MediaPlatform.YOUTUBE, "vid42", ContentKind.TRACK,
                "https://www.youtube.com/watch?v=vid42"));
    }

    @Test
    void successfulAcquisitionIsLinkedBothWays() {
        when(searchService.search(anyString(), anyInt())).thenReturn(List.of(
                new SearchCandidate("vid42", "Artist - Track", "Artist", null, null)));
        when(cacheStore.get(TRACK_KEY)).thenReturn(Optional.of(entry("vid42", null)));
        when(cacheStore.get(ORIGIN)).thenReturn(Optional.of(origin("XYZ", null)));
        List<CanonicalMediaRef> acquired = new ArrayList<>();

        Optional<AcquisitionResult> result = service().resolveSecondary(TRACK, ORIGIN, ref -> {
            acquired.add(ref);
            return success(ref);
        });

        assertThat(result).containsInstanceOf(AcquisitionResult.Success.class);
        assertThat(acquired).extracting(CanonicalMediaRef::canonicalId).containsExactly("vid42");
        ArgumentCaptor<CacheEntry> saved = ArgumentCaptor.forClass(CacheEntry.class);
        verify(cacheStore, times(2)).put(saved.capture());
        CacheEntry track = saved.getAllValues().get(0);
        assertThat(track.key()).isEqualTo(TRACK_KEY);
        assertThat(track.linkedPlatform()).isEqualTo(MediaPlatform.INSTAGRAM);
        assertThat(track.linkedCanonicalId()).isEqualTo("XYZ");
        CacheEntry origin = saved.getAllValues().get(1);
        assertThat(origin.key()).isEqualTo(ORIGIN);
        assertThat(origin.trackKey()).isEqualTo(TRACK_KEY);
    }

    @Test
    void laterOriginKeepsTheFirstBackLinkButGetsItsOwnForwardLink() {
        when(searchService.search(anyString(), anyInt())).thenReturn(List.of(
                new SearchCandidate("vid42", "Artist - Track", "Artist", null, null)));
        when(cacheStore.get(TRACK_KEY)).thenReturn(Optional.of(entry("vid42", "FIRST")));
        when(cacheStore.get(ORIGIN)).thenReturn(Optional.of(origin("XYZ", null)));

        service().resolveSecondary(TRACK, ORIGIN, SecondaryResolutionServiceTest::success);

        ArgumentCaptor<CacheEntry> saved = ArgumentCaptor.forClass(CacheEntry.class);
        verify(cacheStore).put(saved.capture());
        assertThat(saved.getValue().key()).isEqualTo(ORIGIN);
        assertThat(saved.getValue().trackKey()).isEqualTo(TRACK_KEY);
    }

    @Test
    void existingLinksAreNotOverwritten() {
        when(searchService.search(anyString(), anyInt())).thenReturn(List.of(
                new SearchCandidate("vid42", "Artist - Track", "Artist", null, null)));
        when(cacheStore.get(TRACK_KEY)).thenReturn(Optional.of(entry("vid42", "FIRST")));
        when(cacheStore.get(ORIGIN)).thenReturn(Optional.of(origin("XYZ", "older")));

        service().resolveSecondary(TRACK, ORIGIN, SecondaryResolutionServiceTest::success);

        verify(cacheStore, never()).put(any());
    }

    @Test
    void failedAcquisitionIsReturnedWithoutLinking() {
        when(searchService.search(anyString(), anyInt())).thenReturn(List.of(
                new SearchCandidate("vid42", "Artist - Track", "Artist", null, null)));

        Optional<AcquisitionResult> result = service().resolveSecondary(TRACK, ORIGIN,
                ref -> AcquisitionResult.failure(FailureKind.ALL_BACKENDS_FAILED, "nope"));

        assertThat(result).get().extracting(AcquisitionResult::isSuccess).isEqualTo(false);
        verifyNoInteractions(cacheStore);
    }

    @Test
    void noLinkWithoutOrigin() {
        when(searchService.search(anyString(), anyInt())).thenReturn(List.of(
                new SearchCandidate("vid42", "Artist - Track", "Artist", null, null)));

        assertThat(service().resolveSecondary(TRACK, null, SecondaryResolutionServiceTest::success)).isPresent();
        verifyNoInteractions(cacheStore);
    }

    @Test
    void noSearchResultsMeansNoCandidate() {
        when(searchService.search(anyString(), anyInt())).thenReturn(List.of());

        Optional<AcquisitionResult> result = service().resolveSecondary(TRACK, ORIGIN, ref -> {
            throw new AssertionError("nothing to acquire");
        });

        assertThat(result).isEmpty();
    }

    private SecondaryResolutionService service() {
        return new SecondaryResolutionService(searchService, new TrackCandidateScorer(),
                new MediaResolver(properties), cacheStore, properties);
    }

    private static AcquisitionResult success(CanonicalMediaRef ref) {
        return new AcquisitionResult.Success(ref, "youtube/" + ref.canonicalId() + ".mp3", "Track", 200,
                AudioPresence.PRESENT, null, null, false);
    }

    private static CacheEntry entry(String id, String linkedId) {
        return new CacheEntry(MediaPlatform.YOUTUBE, id, MediaFormat.AUDIO, "Track", "youtube/" + id + ".mp3", 200,
                AudioPresence.PRESENT, null, linkedId == null ? null : MediaPlatform.TIKTOK, linkedId, null, null,
                Instant.parse("2024-05-01T00:00:00Z"));
    }

    private static CacheEntry origin(String id, String trackId) {
        return new CacheEntry(MediaPlatform.INSTAGRAM, id, MediaFormat.VIDEO, "Clip", "instagram/" + id + ".mp4", 12,
                AudioPresence.PRESENT, TRACK, null, null, trackId == null ? null : MediaPlatform.YOUTUBE, trackId,
                Instant.parse("2024-05-01T00:00:00Z"));
    }
}
