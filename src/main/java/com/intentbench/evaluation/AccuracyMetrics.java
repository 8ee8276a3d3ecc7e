package com.intentbench.evaluation;

import java.util.List;

/**
 * Aggregate accuracy over a set of outcomes. {@code correct + incorrect + errors == totalTests}
 * and the category totals sum to {@code totalTests}. {@code accuracyRate} is a percentage.
 */
public record AccuracyMetrics(
        int totalTests,
        int correct,
        int incorrect,
        int errors,
        double accuracyRate,
        long averageLatency,
        List<CategoryMetrics> categoryBreakdown) {

    public AccuracyMetrics {
        categoryBreakdown = categoryBreakdown == null ? List.of() : List.copyOf(categoryBreakdown);
    }

    public double errorRate() {
        return totalTests == 0 ? 0.0 : errors * 100.0 / totalTests;
    }
}
