package com.intentbench.schema;

/**
 * Filters and priorities for {@link SchemaRegistry#selectOptimal}. Null filters are ignored.
 */
public record SchemaSelectionCriteria(
        String useCase,
        Long maxLatencyMs,
        Double minAccuracy,
        boolean prioritizeSpeed,
        boolean prioritizeAccuracy) {

    public static SchemaSelectionCriteria balanced() {
        return new SchemaSelectionCriteria(null, null, null, false, false);
    }

    public static SchemaSelectionCriteria fastest() {
        return new SchemaSelectionCriteria(null, null, null, true, false);
    }

    public static SchemaSelectionCriteria mostAccurate() {
        return new SchemaSelectionCriteria(null, null, null, false, true);
    }
}
