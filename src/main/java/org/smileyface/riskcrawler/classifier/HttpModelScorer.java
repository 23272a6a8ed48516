package org.smileyface.riskcrawler.classifier;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.riskcrawler.crawler.CrawlerProperties;
import org.smileyface.riskcrawler.model.RiskLabel;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Calls an external text model over HTTP: POST {@code {"text", "url"}}, expecting one of
 * <pre>
 *   {"prob": {"fraud": 0.4, "benign": 0.6}}     (or "probabilities")
 *   {"label": "spam", "score": 0.93}             probability of the predicted label
 *   {"prob_fraud": 0.93}
 * </pre>
 * Model label names are mapped through the configured aliases. Any non-200 response, timeout,
 * I/O error or unrecognized body yields {@link ModelScore#unavailable(String)}.
 */
public class HttpModelScorer implements ModelScorer {

    private static final Logger log = LoggerFactory.getLogger(HttpModelScorer.class);

    private final URI endpoint;
    private final Duration timeout;
    private final Map<String, String> aliases = new LinkedHashMap<>();
    private final HttpClient client;
    private final ObjectMapper mapper = new ObjectMapper();

    public HttpModelScorer(CrawlerProperties.ScorerConfig config) {
        Objects.requireNonNull(config, "config");
        if (config.getEndpoint() == null || config.getEndpoint().isBlank()) {
            throw new IllegalArgumentException("crawler.scorer.endpoint must be set when the scorer is enabled");
        }
        this.endpoint = URI.create(config.getEndpoint().trim());
        this.timeout = Duration.ofMillis(Math.max(1, config.getTimeoutMs()));
        config.getLabelAliases().forEach((k, v) -> {
            if (k != null && v != null) aliases.put(k.trim().toLowerCase(Locale.ROOT), v.trim());
        });
        this.client = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    @Override
    public ModelScore score(String text, String target) {
        try {
            ObjectNode body = mapper.createObjectNode();
            body.put("text", text == null ? "" : text);
            if (target != null) body.put("url", target);
            HttpRequest request = HttpRequest.newBuilder(endpoint)
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .header("Accept", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body), StandardCharsets.UTF_8))
                    .build();
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            if (response.statusCode() != 200) {
                return ModelScore.unavailable("HTTP " + response.statusCode());
            }
            return parse(response.body());
        } catch (HttpTimeoutException e) {
            return ModelScore.unavailable("timeout after " + timeout.toMillis() + " ms");
        } catch (IOException e) {
            return ModelScore.unavailable("I/O error: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ModelScore.unavailable("interrupted");
        }
    }

    ModelScore parse(String json) {
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (IOException e) {
            return ModelScore.unavailable("unparsable response");
        }
        if (root == null || !root.isObject()) {
            return ModelScore.unavailable("unrecognized response");
        }
        Map<RiskLabel, Double> probs = new EnumMap<>(RiskLabel.class);
        JsonNode dist = root.has("prob") ? root.get("prob") : root.get("probabilities");
        if (dist != null && dist.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = dist.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                RiskLabel label = mapLabel(e.getKey());
                if (label != null && e.getValue().isNumber()) {
                    probs.merge(label, e.getValue().asDouble(), Double::sum);
                }
            }
        } else if (root.hasNonNull("label") && root.path("score").isNumber()) {
            RiskLabel label = mapLabel(root.get("label").asText());
            if (label != null) {
                double score = root.get("score").asDouble();
                probs.put(label, score);
                // binary model: the remainder belongs to the opposite class
                probs.merge(label.isRisky() ? RiskLabel.BENIGN : RiskLabel.FRAUD, 1.0 - score, Double::sum);
            }
        } else if (root.path("prob_fraud").isNumber()) {
            double p = root.get("prob_fraud").asDouble();
            probs.put(RiskLabel.FRAUD, p);
            probs.put(RiskLabel.BENIGN, 1.0 - p);
        } else {
            return ModelScore.unavailable("unrecognized response");
        }
        if (probs.isEmpty()) {
            return ModelScore.unavailable("no known labels in response");
        }
        return ModelScore.of(probs);
    }

    private RiskLabel mapLabel(String modelLabel) {
        if (modelLabel == null) return null;
        String key = modelLabel.trim().toLowerCase(Locale.ROOT);
        String name = aliases.getOrDefault(key, key);
        try {
            return RiskLabel.fromName(name);
        } catch (IllegalArgumentException e) {
            log.debug("Ignoring unknown model label {}", modelLabel);
            return null;
        }
    }
}
