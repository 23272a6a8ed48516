package org.smileyface.riskcrawler.model;

import java.util.List;

public record TargetPage(List<TargetView> items, long totalCount, int offset, int limit) {

    public TargetPage {
        items = items == null ? List.of() : List.copyOf(items);
    }
}
