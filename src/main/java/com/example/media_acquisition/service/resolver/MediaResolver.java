package com.example.media_acquisition.service.resolver;

import com.example.media_acquisition.config.PipelineProperties;
import com.example.media_acquisition.dto.CanonicalMediaRef;
import com.example.media_acquisition.exception.MediaResolutionException;
import com.example.media_acquisition.util.ContentKind;
import com.example.media_acquisition.util.MediaPlatform;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps raw source references to {@link CanonicalMediaRef}s. References on a known host whose path
 * matches no pattern still resolve, to a hash of the normalized URL with kind {@link ContentKind#UNKNOWN}.
 */
@Service
public class MediaResolver {

    private static final int HASH_ID_LENGTH = 24;
    private static final String ID = "([A-Za-z0-9_-]+)";

    private static final Pattern IG_POST = Pattern.compile("^/(?:[^/]+/)?p/" + ID + "$");
    private static final Pattern IG_REEL = Pattern.compile("^/(?:[^/]+/)?reels?/" + ID + "$");
    private static final Pattern IG_TV = Pattern.compile("^/(?:[^/]+/)?tv/" + ID + "$");
    private static final Pattern IG_STORY = Pattern.compile("^/stories/([A-Za-z0-9._]+)/(\\d+)$");

    private static final Pattern TT_VIDEO = Pattern.compile("^/@([^/]+)/video/(\\d+)$");
    private static final Pattern TT_EMBED = Pattern.compile("^/(?:v|embed(?:/v2)?)/(\\d+)(?:\\.html)?$");
    private static final Pattern TT_SHORT = Pattern.compile("^/(?:t/)?([A-Za-z0-9]+)$");

    private static final Pattern YT_SHORT_HOST = Pattern.compile("^/([A-Za-z0-9_-]{6,})$");
    private static final Pattern YT_PATH = Pattern.compile("^/(?:shorts|embed|v|live)/([A-Za-z0-9_-]{6,})$");
    private static final Pattern YT_ID = Pattern.compile("^[A-Za-z0-9_-]{6,}$");

    private final Map<MediaPlatform, List<String>> hostAliases = new EnumMap<>(MediaPlatform.class);

    public MediaResolver(PipelineProperties properties) {
        properties.getHostAliases().forEach((platformId, hosts) -> {
            MediaPlatform platform = MediaPlatform.fromId(platformId)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown platform in host aliases: " + platformId));
            List<String> normalized = new ArrayList<>();
            hosts.forEach(h -> normalized.add(h.toLowerCase(Locale.ROOT)));
            hostAliases.put(platform, normalized);
        });
    }

    public CanonicalMediaRef resolve(String sourceReference) {
        ParsedReference parsed = parse(sourceReference);
        URI uri = parsed.uri();
        String host = stripHostPrefixes(uri.getHost().toLowerCase(Locale.ROOT));
        MediaPlatform platform = detectPlatform(host)
                .orElseThrow(() -> new MediaResolutionException("Unsupported host: " + uri.getHost()));
        String path = trimTrailingSlashes(uri.getRawPath() == null ? "" : uri.getRawPath());
        String normalized = "https://" + host + path;

        Optional<CanonicalMediaRef> matched = switch (platform) {
            case INSTAGRAM -> matchInstagram(path, normalized);
            case TIKTOK -> matchTikTok(host, path, normalized);
            case YOUTUBE -> matchYouTube(host, path, parsed.rawQuery());
        };
        return matched.orElseGet(() -> new CanonicalMediaRef(platform, hashId(normalized), ContentKind.UNKNOWN, normalized));
    }

    public Optional<MediaPlatform> detectPlatform(String host) {
        if (host == null) {
            return Optional.empty();
        }
        String normalized = stripHostPrefixes(host.toLowerCase(Locale.ROOT));
        for (MediaPlatform platform : MediaPlatform.values()) {
            if (platform.matchesHost(normalized)) {
                return Optional.of(platform);
            }
            for (String alias : hostAliases.getOrDefault(platform, List.of())) {
                if (normalized.equals(alias) || normalized.endsWith("." + alias)) {
                    return Optional.of(platform);
                }
            }
        }
        return Optional.empty();
    }

    private Optional<CanonicalMediaRef> matchInstagram(String path, String normalized) {
        Matcher m = IG_STORY.matcher(path);
        if (m.matches()) {
            return Optional.of(new CanonicalMediaRef(MediaPlatform.INSTAGRAM, m.group(2), ContentKind.STORY,
                    "https://www.instagram.com/stories/" + m.group(1) + "/" + m.group(2) + "/"));
        }
        m = IG_POST.matcher(path);
        if (m.matches()) {
            return Optional.of(instagram(m.group(1), ContentKind.POST, "p"));
        }
        m = IG_REEL.matcher(path);
        if (m.matches()) {
            return Optional.of(instagram(m.group(1), ContentKind.REEL, "reel"));
        }
        m = IG_TV.matcher(path);
        if (m.matches()) {
            return Optional.of(instagram(m.group(1), ContentKind.VIDEO, "tv"));
        }
        return Optional.empty();
    }

    private CanonicalMediaRef instagram(String id, ContentKind kind, String segment) {
        return new CanonicalMediaRef(MediaPlatform.INSTAGRAM, id, kind, "https://www.instagram.com/" + segment + "/" + id + "/");
    }

    private Optional<CanonicalMediaRef> matchTikTok(String host, String path, String normalized) {
        Matcher m = TT_VIDEO.matcher(path);
        if (m.matches()) {
            return Optional.of(new CanonicalMediaRef(MediaPlatform.TIKTOK, m.group(2), ContentKind.VIDEO,
                    "https://www.tiktok.com/@" + m.group(1) + "/video/" + m.group(2)));
        }
        m = TT_EMBED.matcher(path);
        if (m.matches()) {
            return Optional.of(new CanonicalMediaRef(MediaPlatform.TIKTOK, m.group(1), ContentKind.VIDEO,
                    "https://www.tiktok.com/embed/v2/" + m.group(1)));
        }
        boolean shortHost = host.startsWith("vm.") || host.startsWith("vt.");
        m = TT_SHORT.matcher(path);
        if (m.matches() && (shortHost || path.startsWith("/t/"))) {
            return Optional.of(new CanonicalMediaRef(MediaPlatform.TIKTOK, m.group(1), ContentKind.VIDEO, normalized));
        }
        return Optional.empty();
    }

    private Optional<CanonicalMediaRef> matchYouTube(String host, String path, String rawQuery) {
        ContentKind kind = host.startsWith("music.") ? ContentKind.TRACK : ContentKind.VIDEO;
        String id = null;
        if (host.equals("youtu.be")) {
            Matcher m = YT_SHORT_HOST.matcher(path);
            if (m.matches()) {
                id = m.group(1);
            }
        } else if (path.equals("/watch")) {
            id = queryParam(rawQuery, "v");
        } else {
            Matcher m = YT_PATH.matcher(path);
            if (m.matches()) {
                id = m.group(1);
            }
        }
        if (id == null || !YT_ID.matcher(id).matches()) {
            return Optional.empty();
        }
        return Optional.of(youtube(id, kind));
    }

    /**
     * Reference for a YouTube video id that came from a search result rather than a URL.
     */
    public CanonicalMediaRef youtube(String videoId, ContentKind kind) {
        return new CanonicalMediaRef(MediaPlatform.YOUTUBE, videoId, kind, "https://www.youtube.com/watch?v=" + videoId);
    }

    /**
     * Only scheme, host and path go through {@link URI}; the query is kept raw because share links
     * routinely carry characters (spaces, pipes, braces, bad escapes) that {@link URI} rejects.
     */
    private ParsedReference parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new MediaResolutionException("Source reference is blank");
        }
        String trimmed = raw.trim();
        int hash = trimmed.indexOf('#');
        if (hash >= 0) {
            trimmed = trimmed.substring(0, hash);
        }
        String rawQuery = null;
        int question = trimmed.indexOf('?');
        if (question >= 0) {
            rawQuery = trimmed.substring(question + 1);
            trimmed = trimmed.substring(0, question);
        }
        if (!trimmed.contains("://")) {
            trimmed = "https://" + trimmed;
        }
        URI uri;
        try {
            uri = new URI(trimmed);
        } catch (URISyntaxException e) {
            throw new MediaResolutionException("Malformed source reference: " + raw, e);
        }
        String scheme = uri.getScheme();
        if (scheme == null || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
            throw new MediaResolutionException("Unsupported scheme in: " + raw);
        }
        if (uri.getHost() == null || uri.getHost().isBlank()) {
            throw new MediaResolutionException("No host in: " + raw);
        }
        return new ParsedReference(uri.normalize(), rawQuery);
    }

    private static String stripHostPrefixes(String host) {
        if (host.startsWith("www.")) {
            return host.substring(4);
        }
        if (host.startsWith("m.")) {
            return host.substring(2);
        }
        return host;
    }

    private static String trimTrailingSlashes(String path) {
        String p = path;
        while (p.length() > 1 && p.endsWith("/")) {
            p = p.substring(0, p.length() - 1);
        }
        return p.equals("/") ? "" : p;
    }

    private static String queryParam(String rawQuery, String name) {
        if (rawQuery == null) {
            return null;
        }
        for (String pair : rawQuery.split("&")) {
            int eq = pair.indexOf('=');
            if (eq > 0 && pair.substring(0, eq).equals(name)) {
                return pair.substring(eq + 1);
            }
        }
        return null;
    }

    private record ParsedReference(URI uri, String rawQuery) { }

    static String hashId(String normalized) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(normalized.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, HASH_ID_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
