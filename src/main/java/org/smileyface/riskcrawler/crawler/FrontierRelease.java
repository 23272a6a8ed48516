package org.smileyface.riskcrawler.crawler;

import org.smileyface.riskcrawler.model.TargetStatus;

import java.time.Instant;

/**
 * Outcome of {@link Frontier#release}: the target status the State Store should record, the next
 * eligible instant (null once permanently failed) and the consecutive failure count.
 */
public record FrontierRelease(TargetStatus status, Instant notBefore, int failures) {

    public boolean isTerminal() {
        return status == TargetStatus.PERMANENTLY_FAILED;
    }
}
