package com.intentbench.evaluation;

/**
 * Bounds are proportions in [0, 1].
 */
public record ConfidenceInterval(double lower, double upper, double level) {
}
