package org.smileyface.riskcrawler.crawler;

import org.smileyface.riskcrawler.model.TargetKind;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.StringJoiner;
import java.util.regex.Pattern;

/**
 * Maps equivalent spellings of a page URL or channel handle onto one canonical identifier.
 * Canonical channels are {@code @handle}; canonical pages are absolute http(s) URLs.
 */
public final class TargetCanonicalizer {

    private static final Pattern HANDLE = Pattern.compile("[a-z0-9_]{5,32}");
    private static final Pattern BARE_HANDLE = Pattern.compile("@?[A-Za-z0-9_]{5,32}");
    private static final Set<String> CHANNEL_HOSTS = Set.of("t.me", "telegram.me", "www.t.me", "www.telegram.me");
    private static final Set<String> TRACKING_PARAMS = Set.of("ref", "source");

    private TargetCanonicalizer() {
    }

    /**
     * Guesses the kind from the spelling: {@code @name}, a bare handle or a t.me / telegram.me link
     * is a channel, anything else a page.
     */
    public static TargetKind inferKind(String raw) {
        if (raw == null) throw new IllegalArgumentException("identifier must not be null");
        String s = raw.trim();
        if (s.startsWith("@") || BARE_HANDLE.matcher(s).matches()) {
            return TargetKind.CHANNEL;
        }
        String lower = s.toLowerCase(Locale.ROOT);
        String withoutScheme = lower.replaceFirst("^https?://", "");
        int slash = withoutScheme.indexOf('/');
        String host = slash >= 0 ? withoutScheme.substring(0, slash) : withoutScheme;
        return CHANNEL_HOSTS.contains(host) ? TargetKind.CHANNEL : TargetKind.PAGE;
    }

    /**
     * Kind of an already-canonical identifier.
     */
    public static TargetKind kindOf(String canonical) {
        return canonical != null && canonical.startsWith("@") ? TargetKind.CHANNEL : TargetKind.PAGE;
    }

    public static String canonicalize(String raw, TargetKind kind) {
        if (kind == null) kind = inferKind(raw);
        return kind == TargetKind.CHANNEL ? canonicalHandle(raw) : canonicalUrl(raw);
    }

    public static Optional<String> tryCanonicalize(String raw, TargetKind kind) {
        try {
            return Optional.of(canonicalize(raw, kind));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /**
     * Host for pages, handle without '@' for channels.
     */
    public static String domainOf(String canonical) {
        if (canonical == null) return null;
        if (canonical.startsWith("@")) return canonical.substring(1);
        return URI.create(canonical).getHost();
    }

    /**
     * @throws IllegalArgumentException for non-http(s), host-less or malformed URLs
     */
    public static String canonicalUrl(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("url must not be null/blank");
        }
        URI uri;
        try {
            uri = new URI(raw.trim());
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Malformed url: " + raw, e);
        }
        String scheme = uri.getScheme();
        if (scheme == null) {
            throw new IllegalArgumentException("url needs a scheme: " + raw);
        }
        String lowerScheme = scheme.toLowerCase(Locale.ROOT);
        if (!lowerScheme.equals("http") && !lowerScheme.equals("https")) {
            throw new IllegalArgumentException("Only http/https urls are tracked: " + raw);
        }
        String host = uri.getHost();
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("url has no host: " + raw);
        }

        StringBuilder sb = new StringBuilder();
        sb.append(lowerScheme).append("://").append(host.toLowerCase(Locale.ROOT));
        int port = uri.getPort();
        if (port != -1 && port != defaultPort(lowerScheme)) {
            sb.append(':').append(port);
        }
        String path = uri.getRawPath();
        if (path == null || path.isEmpty()) path = "/";
        while (path.length() > 1 && path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        sb.append(path);
        String query = stripTrackingParams(uri.getRawQuery());
        if (!query.isEmpty()) sb.append('?').append(query);
        return sb.toString();
    }

    /**
     * Accepts {@code @Name}, {@code Name}, {@code t.me/Name}, {@code https://t.me/s/Name},
     * {@code telegram.me/Name}; message links like {@code t.me/Name/42} map to the channel.
     *
     * @throws IllegalArgumentException when no valid handle can be extracted
     */
    public static String canonicalHandle(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("handle must not be null/blank");
        }
        String s = raw.trim();
        String lower = s.toLowerCase(Locale.ROOT);
        String withoutScheme = lower.replaceFirst("^https?://", "");
        int slash = withoutScheme.indexOf('/');
        String candidate;
        if (slash > 0 && CHANNEL_HOSTS.contains(withoutScheme.substring(0, slash))) {
            String[] segments = withoutScheme.substring(slash + 1).split("[/?#]");
            int idx = 0;
            if (segments.length > 1 && "s".equals(segments[0])) idx = 1;
            candidate = segments.length > idx ? segments[idx] : "";
        } else {
            candidate = lower.startsWith("@") ? lower.substring(1) : lower;
        }
        if (!HANDLE.matcher(candidate).matches()) {
            throw new IllegalArgumentException("Not a channel handle: " + raw);
        }
        return "@" + candidate;
    }

    private static String stripTrackingParams(String rawQuery) {
        if (rawQuery == null || rawQuery.isBlank()) return "";
        StringJoiner kept = new StringJoiner("&");
        for (String param : rawQuery.split("&")) {
            if (param.isEmpty()) continue;
            int eq = param.indexOf('=');
            String name = (eq >= 0 ? param.substring(0, eq) : param).toLowerCase(Locale.ROOT);
            if (name.startsWith("utm_") || TRACKING_PARAMS.contains(name)) continue;
            kept.add(param);
        }
        return kept.toString();
    }

    private static int defaultPort(String scheme) {
        return "https".equals(scheme) ? 443 : 80;
    }
}
