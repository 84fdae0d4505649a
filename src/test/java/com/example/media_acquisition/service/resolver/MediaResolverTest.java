package com.example.media_acquisition.service.resolver;

import com.example.media_acquisition.config.PipelineProperties;
import com.example.media_acquisition.dto.CanonicalMediaRef;
import com.example.media_acquisition.exception.MediaResolutionException;
import com.example.media_acquisition.util.ContentKind;
import com.example.media_acquisition.util.MediaPlatform;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class MediaResolverTest {

    private final MediaResolver resolver = new MediaResolver(new PipelineProperties());

    @ParameterizedTest
    @CsvSource({
            "https://www.instagram.com/p/CxYz_12-a/, INSTAGRAM, CxYz_12-a, POST",
            "instagram.com/reel/ABC123/?igsh=xyz, INSTAGRAM, ABC123, REEL",
            "https://www.instagram.com/reels/ABC123, INSTAGRAM, ABC123, REEL",
            "https://www.instagram.com/someuser/p/QWE/, INSTAGRAM, QWE, POST",
            "https://www.instagram.com/tv/TV1/, INSTAGRAM, TV1, VIDEO",
            "https://www.instagram.com/stories/some.user/3141592653/, INSTAGRAM, 3141592653, STORY",
            "https://www.tiktok.com/@user.name/video/7234567890123456789?lang=en, TIKTOK, 7234567890123456789, VIDEO",
            "https://www.tiktok.com/embed/v2/7234567890123456789, TIKTOK, 7234567890123456789, VIDEO",
            "https://vm.tiktok.com/ZMabc123/, TIKTOK, ZMabc123, VIDEO",
            "https://www.youtube.com/watch?v=dQw4w9WgXcQ&t=42, YOUTUBE, dQw4w9WgXcQ, VIDEO",
            "https://youtu.be/dQw4w9WgXcQ?si=abc, YOUTUBE, dQw4w9WgXcQ, VIDEO",
            "https://m.youtube.com/shorts/dQw4w9WgXcQ, YOUTUBE, dQw4w9WgXcQ, VIDEO",
            "https://music.youtube.com/watch?v=dQw4w9WgXcQ&list=RD, YOUTUBE, dQw4w9WgXcQ, TRACK"
    })
    void resolvesKnownPatterns(String url, MediaPlatform platform, String id, ContentKind kind) {
        CanonicalMediaRef ref = resolver.resolve(url);

        assertThat(ref.platform()).isEqualTo(platform);
        assertThat(ref.canonicalId()).isEqualTo(id);
        assertThat(ref.contentKind()).isEqualTo(kind);
    }

    @ParameterizedTest
    @CsvSource({
            "https://www.instagram.com/reel/ABC123/?igsh=a|b, INSTAGRAM, ABC123, REEL",
            "https://www.instagram.com/reel/ABC123/?utm_source=ig web, INSTAGRAM, ABC123, REEL",
            "https://www.youtube.com/watch?v=dQw4w9WgXcQ&t=1{x}, YOUTUBE, dQw4w9WgXcQ, VIDEO",
            "https://www.tiktok.com/@user/video/123?q=%zz, TIKTOK, 123, VIDEO",
            "https://www.instagram.com/p/QWE/#frag ment, INSTAGRAM, QWE, POST"
    })
    void illegalCharactersInQueryOrFragmentDoNotBlockResolution(String url, MediaPlatform platform, String id,
                                                                ContentKind kind) {
        CanonicalMediaRef ref = resolver.resolve(url);

        assertThat(ref.platform()).isEqualTo(platform);
        assertThat(ref.canonicalId()).isEqualTo(id);
        assertThat(ref.contentKind()).isEqualTo(kind);
    }

    @Test
    void equivalentReferencesShareOneCanonicalUrl() {
        CanonicalMediaRef a = resolver.resolve("https://www.instagram.com/reels/ABC123/?utm_source=ig_web");
        CanonicalMediaRef b = resolver.resolve("http://instagram.com/reel/ABC123#comments");

        assertThat(a.key()).isEqualTo(b.key());
        assertThat(a.canonicalUrl()).isEqualTo("https://www.instagram.com/reel/ABC123/");
        assertThat(resolver.resolve("https://youtu.be/dQw4w9WgXcQ").canonicalUrl())
                .isEqualTo("https://www.youtube.com/watch?v=dQw4w9WgXcQ");
    }

    @Test
    void unmatchedPathOnKnownHostFallsBackToStableHash() {
        CanonicalMediaRef first = resolver.resolve("https://www.instagram.com/explore/tags/music/?hl=en");
        CanonicalMediaRef second = resolver.resolve("instagram.com/explore/tags/music/");

        assertThat(first.contentKind()).isEqualTo(ContentKind.UNKNOWN);
        assertThat(first.platform()).isEqualTo(MediaPlatform.INSTAGRAM);
        assertThat(first.canonicalId()).hasSize(24).matches("[0-9a-f]+");
        assertThat(second.canonicalId()).isEqualTo(first.canonicalId());
        assertThat(first.canonicalId()).isEqualTo(MediaResolver.hashId("https://instagram.com/explore/tags/music"));
    }

    @Test
    void unknownHostOrMalformedInputIsAResolutionError() {
        assertThrows(MediaResolutionException.class, () -> resolver.resolve("https://example.org/p/XYZ"));
        assertThrows(MediaResolutionException.class, () -> resolver.resolve("   "));
        assertThrows(MediaResolutionException.class, () -> resolver.resolve("ftp://instagram.com/p/XYZ"));
        assertThrows(MediaResolutionException.class, () -> resolver.resolve("https://exa mple.com/%%"));
    }

    @Test
    void hostAliasesMapExtraHostsToAPlatform() {
        PipelineProperties properties = new PipelineProperties();
        properties.setHostAliases(Map.of("instagram", List.of("platformA.example")));
        MediaResolver aliased = new MediaResolver(properties);

        CanonicalMediaRef ref = aliased.resolve("https://platformA.example/p/XYZ");

        assertThat(ref.platform()).isEqualTo(MediaPlatform.INSTAGRAM);
        assertThat(ref.canonicalId()).isEqualTo("XYZ");
        assertThat(ref.contentKind()).isEqualTo(ContentKind.POST);
    }

    @Test
    void searchResultIdsBecomeYouTubeTrackRefs() {
        CanonicalMediaRef ref = resolver.youtube("abcDEF12345", ContentKind.TRACK);

        assertThat(ref.platform()).isEqualTo(MediaPlatform.YOUTUBE);
        assertThat(ref.contentKind()).isEqualTo(ContentKind.TRACK);
        assertThat(ref.canonicalUrl()).isEqualTo("https://www.youtube.com/watch?v=abcDEF12345");
    }
}
