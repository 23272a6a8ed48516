package org.smileyface.riskcrawler.fetch;

import org.smileyface.riskcrawler.model.FetchResult;
import org.smileyface.riskcrawler.model.TargetKind;

/**
 * Performs one bounded-time fetch of a page URL or channel handle. Implementations never throw for
 * per-target failures; those are reported through the result's outcome.
 */
public interface FetchClient {

    FetchResult fetch(String identifier, TargetKind kind);
}
