package org.smileyface.riskcrawler.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Read-side pairing of a target with its current verdict (null if never classified).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TargetView(Target target, Verdict verdict, RiskBand band) {

    public static TargetView of(Target target, Verdict verdict) {
        return new TargetView(target, verdict, verdict == null ? null : verdict.band());
    }
}
