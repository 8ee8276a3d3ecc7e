package com.intentbench.evaluation;

public record CategoryMetrics(
        String category,
        int totalTests,
        int correct,
        int incorrect,
        int errors,
        double accuracyRate,
        long averageLatency) {
}
