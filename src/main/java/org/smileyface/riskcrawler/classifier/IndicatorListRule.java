package org.smileyface.riskcrawler.classifier;

import org.smileyface.riskcrawler.model.RiskLabel;
import org.springframework.core.io.ClassPathResource;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Keyword rule whose terms come from a known-indicator list on the classpath (one indicator per
 * line, '#' starts a comment).
 */
public class IndicatorListRule extends KeywordRule {

    private final String resource;

    public IndicatorListRule(String name, RiskLabel label, double weight, String resource) {
        super(name, label, weight, load(resource));
        this.resource = resource;
    }

    public String resource() {
        return resource;
    }

    static List<String> load(String resource) {
        if (resource == null || resource.isBlank()) {
            throw new IllegalArgumentException("indicator list resource must not be null/blank");
        }
        ClassPathResource res = new ClassPathResource(resource);
        if (!res.exists()) {
            throw new IllegalArgumentException("indicator list not found on classpath: " + resource);
        }
        List<String> out = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(res.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                int hash = line.indexOf('#');
                String term = (hash >= 0 ? line.substring(0, hash) : line).trim();
                if (!term.isEmpty()) out.add(term);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read indicator list " + resource, e);
        }
        return out;
    }
}
