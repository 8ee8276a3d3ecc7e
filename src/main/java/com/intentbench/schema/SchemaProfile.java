package com.intentbench.schema;

import java.util.List;

/**
 * Baseline performance estimates for a schema, used by
 * {@link SchemaRegistry#selectOptimal(SchemaSelectionCriteria)}.
 */
public record SchemaProfile(
        double baselineAccuracy,
        long baselineLatencyMs,
        double parsingReliability,
        List<String> recommendedFor) {

    public SchemaProfile {
        recommendedFor = recommendedFor == null ? List.of() : List.copyOf(recommendedFor);
    }
}
