package com.intentbench.evaluation;

import java.util.List;
import java.util.Map;

/**
 * Confusion matrix and per-label precision, recall and F1.
 *
 * @param confusion expected label, then predicted label (or {@code error}), to count
 */
public record ClassQualityMetrics(
        List<String> labels,
        Map<String, Map<String, Long>> confusion,
        List<ClassScore> scores,
        double macroF1) {

    public record ClassScore(
            String label,
            long support,
            double precision,
            double recall,
            double f1) {
    }
}
