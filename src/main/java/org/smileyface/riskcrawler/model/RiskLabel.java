package org.smileyface.riskcrawler.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Closed set of classification labels. Declaration order is the tie-break order
 * used when two labels score the same.
 */
public enum RiskLabel {
    BENIGN,
    FRAUD,
    PHISHING,
    GAMBLING,
    MALWARE,
    SUSPICIOUS;

    public boolean isRisky() {
        return this != BENIGN;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a label name case-insensitively.
     *
     * @throws IllegalArgumentException for null, blank or unknown names
     */
    @JsonCreator
    public static RiskLabel fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("label must not be null/blank");
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (RiskLabel label : values()) {
            if (label.name().equals(normalized)) {
                return label;
            }
        }
        throw new IllegalArgumentException("Unknown risk label: " + name);
    }
}
