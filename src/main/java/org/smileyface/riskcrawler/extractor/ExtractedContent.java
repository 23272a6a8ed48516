package org.smileyface.riskcrawler.extractor;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Normalized text of a fetched target plus the canonical identifiers discovered in it, in
 * document order.
 */
public record ExtractedContent(String text, Set<String> discoveredTargets) {

    public ExtractedContent {
        text = text == null ? "" : text;
        discoveredTargets = discoveredTargets == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(discoveredTargets));
    }

    public static ExtractedContent empty() {
        return new ExtractedContent("", Set.of());
    }
}
