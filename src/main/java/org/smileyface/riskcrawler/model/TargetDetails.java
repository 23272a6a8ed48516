package org.smileyface.riskcrawler.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * A target with its current verdict and full verdict history, oldest first.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TargetDetails(Target target, Verdict verdict, RiskBand band, List<Verdict> history) {

    public TargetDetails {
        history = history == null ? List.of() : List.copyOf(history);
    }
}
