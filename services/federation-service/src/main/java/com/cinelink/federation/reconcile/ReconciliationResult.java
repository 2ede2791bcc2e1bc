package com.cinelink.federation.reconcile;

import java.util.List;

public record ReconciliationResult(int documentCount, int graphCount, List<String> commonTitles) {
    public ReconciliationResult {
        commonTitles = List.copyOf(commonTitles);
    }

    public int commonCount() {
        return commonTitles.size();
    }
}
