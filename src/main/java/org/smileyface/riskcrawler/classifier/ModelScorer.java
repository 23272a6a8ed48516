package org.smileyface.riskcrawler.classifier;

/**
 * Pluggable, stateless scoring function. Implementations bound their own latency and report
 * failures as {@link ModelScore#unavailable(String)}.
 */
@FunctionalInterface
public interface ModelScorer {

    /**
     * @param text   normalized text
     * @param target canonical identifier the text came from, may be null
     */
    ModelScore score(String text, String target);
}
