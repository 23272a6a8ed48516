package org.smileyface.riskcrawler.fetch;

import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.riskcrawler.crawler.CrawlerProperties;
import org.smileyface.riskcrawler.model.FetchResult;
import org.smileyface.riskcrawler.model.TargetKind;

import java.io.IOException;
import java.net.MalformedURLException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Fetches pages and public channel previews with jsoup. HTTP status, content type and I/O errors
 * are mapped to transient or permanent outcomes.
 */
public class JsoupFetchClient implements FetchClient {

    private static final Logger log = LoggerFactory.getLogger(JsoupFetchClient.class);

    private static final Set<Integer> PERMANENT_STATUSES = Set.of(401, 403, 404, 410, 451);

    private final CrawlerProperties.FetchConfig config;
    private final RobotsPolicy robots; // null disables robots.txt checks
    private final HostThrottle throttle;
    private final Clock clock;

    public JsoupFetchClient(CrawlerProperties properties, RobotsPolicy robots, Clock clock) {
        this.config = Objects.requireNonNull(properties, "properties").getFetch();
        this.robots = config.isRespectRobots() ? robots : null;
        this.throttle = new HostThrottle(config.getPerHostDelayMs());
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public FetchResult fetch(String identifier, TargetKind kind) {
        Instant now = clock.instant();
        try {
            return kind == TargetKind.CHANNEL
                    ? fetchChannel(identifier, now)
                    : fetchPage(identifier, now);
        } catch (FetchException e) {
            log.debug("{} fetch failure for {}: {}", e.isRetryable() ? "Transient" : "Permanent",
                    identifier, e.getMessage());
            return e.isRetryable()
                    ? FetchResult.transientFailure(identifier, now, e.getMessage())
                    : FetchResult.permanentFailure(identifier, now, e.getMessage());
        }
    }

    private FetchResult fetchPage(String url, Instant now) throws FetchException {
        if (robots != null && !robots.isAllowed(url)) {
            throw new PermanentFetchException("blocked by robots.txt");
        }
        Connection.Response res = get(url);
        return FetchResult.success(url, now, res.body(), res.url().toString());
    }

    /**
     * Channels are read through their public web preview; a response without any message container
     * means the channel has no public preview.
     */
    private FetchResult fetchChannel(String handle, Instant now) throws FetchException {
        String name = handle.startsWith("@") ? handle.substring(1) : handle;
        String base = config.getChannelPreviewBaseUrl();
        String previewUrl = (base.endsWith("/") ? base.substring(0, base.length() - 1) : base) + "/s/" + name;
        Connection.Response res = get(previewUrl);
        String body = res.body();
        if (Jsoup.parse(body, previewUrl).select(config.getChannelMessageSelector()).isEmpty()) {
            throw new PermanentFetchException("no public preview");
        }
        return FetchResult.success(handle, now, body, res.url().toString());
    }

    private Connection.Response get(String url) throws FetchException {
        awaitHostSlot(url);
        Connection.Response res;
        try {
            res = Jsoup.connect(url)
                    .userAgent(Objects.toString(config.getUserAgent(), "SmileyfaceRiskCrawler/0.1"))
                    .timeout(Math.max(0, config.getRequestTimeoutMs()))
                    .maxBodySize(Math.max(0, config.getMaxBodyBytes()))
                    .followRedirects(true)
                    .ignoreHttpErrors(true)
                    .ignoreContentType(true)
                    .execute();
        } catch (UnknownHostException e) {
            throw new PermanentFetchException("unknown host " + e.getMessage(), e);
        } catch (MalformedURLException | IllegalArgumentException e) {
            throw new PermanentFetchException("malformed url: " + e.getMessage(), e);
        } catch (SocketTimeoutException e) {
            throw new TransientFetchException("timeout after " + config.getRequestTimeoutMs() + " ms", e);
        } catch (IOException e) {
            throw new TransientFetchException("I/O error: " + e.getMessage(), e);
        }

        int status = res.statusCode();
        if (status >= 200 && status < 300) {
            String contentType = res.contentType();
            if (contentType != null && !isTextual(contentType)) {
                throw new PermanentFetchException("unsupported content type " + contentType);
            }
            return res;
        }
        if (PERMANENT_STATUSES.contains(status)) {
            throw new PermanentFetchException("HTTP " + status);
        }
        if (status == 408 || status == 429 || status >= 500) {
            throw new TransientFetchException("HTTP " + status);
        }
        if (status >= 400) {
            throw new PermanentFetchException("HTTP " + status);
        }
        throw new TransientFetchException("unexpected HTTP " + status);
    }

    private void awaitHostSlot(String url) throws FetchException {
        String host;
        try {
            host = URI.create(url).getHost();
        } catch (IllegalArgumentException e) {
            // jsoup reports the malformed url itself
            return;
        }
        try {
            throttle.acquire(host);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientFetchException("interrupted while waiting for " + host, e);
        }
    }

    private static boolean isTextual(String contentType) {
        String ct = contentType.toLowerCase(Locale.ROOT);
        return ct.startsWith("text/") || ct.contains("html") || ct.contains("xml");
    }
}
