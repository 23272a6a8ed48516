package org.smileyface.riskcrawler.extractor;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.riskcrawler.crawler.CrawlerProperties;
import org.smileyface.riskcrawler.crawler.TargetCanonicalizer;
import org.smileyface.riskcrawler.model.FetchResult;
import org.smileyface.riskcrawler.model.TargetKind;
import org.smileyface.riskcrawler.util.CrawlerUtils;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.StringJoiner;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the raw HTML of a successful fetch into normalized text and discovered targets.
 */
public class ContentExtractor {

    private static final Logger log = LoggerFactory.getLogger(ContentExtractor.class);

    private static final String NOISE = "script, style, noscript, header, footer, nav, svg, form, iframe";
    private static final Pattern MENTION = Pattern.compile("(?<![\\w@.])@([A-Za-z0-9_]{5,32})\\b");
    private static final Set<String> CHANNEL_HOSTS = Set.of("t.me", "telegram.me", "www.t.me", "www.telegram.me");

    private final CrawlerProperties properties;
    private final List<Pattern> includes;
    private final List<Pattern> excludes;

    public ContentExtractor(CrawlerProperties properties) {
        this.properties = properties;
        this.includes = compilePatterns(properties.getFetch().getIncludeUrlPatterns());
        this.excludes = compilePatterns(properties.getFetch().getExcludeUrlPatterns());
    }

    public ExtractedContent extract(FetchResult result, TargetKind kind) {
        if (result == null || !result.isSuccess() || result.rawContent() == null) {
            return ExtractedContent.empty();
        }
        String baseUrl = result.finalUrl() != null ? result.finalUrl() : result.target();
        Document doc = Jsoup.parse(result.rawContent(), baseUrl.startsWith("@") ? "" : baseUrl);
        return kind == TargetKind.CHANNEL
                ? extractChannel(doc, result.target())
                : extractPage(doc, result.target());
    }

    private ExtractedContent extractPage(Document doc, String self) {
        // discovery runs on the full document, navigation links included
        Set<String> discovered = discover(doc.select("a[href]"), doc.body() != null ? doc.body().text() : "", self);

        doc.select(NOISE).remove();
        String selector = properties.selectorFor(self);
        List<String> segments = new ArrayList<>();
        if (selector != null && !selector.isBlank()) {
            for (Element el : doc.select(selector)) {
                segments.add(el.text());
            }
        } else if (doc.body() != null) {
            segments.add(doc.body().text());
        }
        return new ExtractedContent(normalize(segments), discovered);
    }

    private ExtractedContent extractChannel(Document doc, String self) {
        CrawlerProperties.FetchConfig fetch = properties.getFetch();
        Elements messages = doc.select(fetch.getChannelMessageSelector());
        int max = Math.max(0, fetch.getMaxMessagesPerChannel());
        // previews list oldest first; keep the most recent messages
        List<Element> kept = messages.size() > max ? messages.subList(messages.size() - max, messages.size()) : messages;
        List<String> segments = new ArrayList<>(kept.size());
        Elements links = new Elements();
        for (Element m : kept) {
            segments.add(m.text());
            links.addAll(m.select("a[href]"));
        }
        String text = normalize(segments);
        return new ExtractedContent(text, discover(links, text, self));
    }

    private String normalize(List<String> segments) {
        StringJoiner joiner = new StringJoiner("\n");
        for (String s : segments) {
            String line = CrawlerUtils.collapseWhitespace(s);
            if (!line.isEmpty()) joiner.add(line);
        }
        return CrawlerUtils.truncate(joiner.toString(), properties.getEnsemble().getMaxTextLength());
    }

    private Set<String> discover(Elements links, String text, String self) {
        CrawlerProperties.FetchConfig fetch = properties.getFetch();
        int cap = Math.max(0, fetch.getMaxDiscoveredPerPage());
        Set<String> out = new LinkedHashSet<>();
        for (Element a : links) {
            if (out.size() >= cap) break;
            String abs = a.attr("abs:href");
            if (abs.isBlank()) continue;
            canonicalLink(abs).filter(id -> !id.equals(self)).ifPresent(out::add);
        }
        if (fetch.isDiscoverChannels()) {
            Matcher m = MENTION.matcher(text == null ? "" : text);
            while (m.find() && out.size() < cap) {
                TargetCanonicalizer.tryCanonicalize(m.group(1), TargetKind.CHANNEL)
                        .filter(id -> !id.equals(self))
                        .ifPresent(out::add);
            }
        }
        return out;
    }

    private Optional<String> canonicalLink(String abs) {
        CrawlerProperties.FetchConfig fetch = properties.getFetch();
        String host = CrawlerUtils.hostOf(abs);
        if (host != null && CHANNEL_HOSTS.contains(host)) {
            return fetch.isDiscoverChannels()
                    ? TargetCanonicalizer.tryCanonicalize(abs, TargetKind.CHANNEL)
                    : Optional.empty();
        }
        if (!fetch.isDiscoverPages()) return Optional.empty();
        return TargetCanonicalizer.tryCanonicalize(abs, TargetKind.PAGE)
                .filter(this::isAcceptedByFilters);
    }

    boolean isAcceptedByFilters(String url) {
        // Excludes take precedence
        for (Pattern p : excludes) {
            if (p.matcher(url).find()) return false;
        }
        if (includes.isEmpty()) return true;
        for (Pattern p : includes) {
            if (p.matcher(url).find()) return true;
        }
        return false;
    }

    private static List<Pattern> compilePatterns(List<String> raw) {
        List<Pattern> out = new ArrayList<>();
        if (raw == null) return out;
        for (String s : raw) {
            if (s == null || s.isBlank()) continue;
            try {
                out.add(Pattern.compile(s, Pattern.CASE_INSENSITIVE));
            } catch (Exception e) {
                log.warn("Invalid regex pattern in crawler config: {} (ignored)", s);
            }
        }
        return out;
    }
}
