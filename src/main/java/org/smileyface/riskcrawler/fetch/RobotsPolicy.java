package org.smileyface.riskcrawler.fetch;

import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.riskcrawler.crawler.CrawlerProperties;

import java.io.IOException;
import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * robots.txt gate for page fetches. Rules are cached per origin for {@code robotsCacheTtlMs}, in an
 * LRU map of at most {@code robotsCacheMaxEntries} origins. A missing robots.txt (4xx) is cached as
 * allow-all; an unreachable one (I/O error, 5xx) allows the fetch but is asked again next time.
 */
public class RobotsPolicy {

    private static final Logger log = LoggerFactory.getLogger(RobotsPolicy.class);

    private final CrawlerProperties.FetchConfig config;
    private final Clock clock;
    private final Map<String, CachedRules> cache;

    public RobotsPolicy(CrawlerProperties properties, Clock clock) {
        this.config = properties.getFetch();
        this.clock = clock;
        int maxEntries = Math.max(1, config.getRobotsCacheMaxEntries());
        this.cache = Collections.synchronizedMap(new LinkedHashMap<String, CachedRules>(64, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, CachedRules> eldest) {
                return size() > maxEntries;
            }
        });
    }

    public boolean isAllowed(String url) {
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            return true;
        }
        if (uri.getHost() == null || uri.getScheme() == null) return true;
        String origin = uri.getScheme().toLowerCase(Locale.ROOT) + "://" + uri.getHost().toLowerCase(Locale.ROOT)
                + (uri.getPort() == -1 ? "" : ":" + uri.getPort());
        String path = uri.getRawPath() == null || uri.getRawPath().isBlank() ? "/" : uri.getRawPath();
        if (uri.getRawQuery() != null && !uri.getRawQuery().isBlank()) {
            path = path + "?" + uri.getRawQuery();
        }
        return rulesFor(origin).isAllowed(path);
    }

    private RobotsRules rulesFor(String origin) {
        Instant now = clock.instant();
        CachedRules cached = cache.get(origin);
        if (cached != null && now.isBefore(cached.expiresAt())) {
            return cached.rules();
        }
        // fetched outside the cache lock; two workers may both load a cold origin
        Optional<RobotsRules> loaded = load(origin);
        if (loaded.isEmpty()) {
            return RobotsRules.allowAll();
        }
        cache.put(origin, new CachedRules(loaded.get(), now.plusMillis(config.getRobotsCacheTtlMs())));
        return loaded.get();
    }

    /** Empty when the answer is not definitive and must not be cached. */
    private Optional<RobotsRules> load(String origin) {
        String robotsUrl = origin + "/robots.txt";
        try {
            Connection.Response res = Jsoup.connect(robotsUrl)
                    .userAgent(config.getUserAgent())
                    .timeout(Math.max(0, config.getRequestTimeoutMs()))
                    .ignoreContentType(true)
                    .ignoreHttpErrors(true)
                    .followRedirects(true)
                    .execute();
            int status = res.statusCode();
            if (status / 100 == 2) {
                return Optional.of(RobotsRules.parse(res.body()));
            }
            if (status / 100 == 4) {
                log.debug("robots.txt at {} returned {}; allowing all", robotsUrl, status);
                return Optional.of(RobotsRules.allowAll());
            }
            log.debug("robots.txt at {} returned {}; allowing this fetch, will retry", robotsUrl, status);
            return Optional.empty();
        } catch (IOException | IllegalArgumentException e) {
            log.debug("robots.txt at {} unavailable ({}); allowing this fetch, will retry", robotsUrl, e.getMessage());
            return Optional.empty();
        }
    }

    int cachedOrigins() {
        return cache.size();
    }

    private record CachedRules(RobotsRules rules, Instant expiresAt) {
    }
}
