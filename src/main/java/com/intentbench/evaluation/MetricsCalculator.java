package com.intentbench.evaluation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.intentbench.classifier.IntentType;

/**
 * Pure functions from evaluation outcomes to metrics. Inputs are never modified.
 */
public final class MetricsCalculator {
    public static final String ERROR_COLUMN = "error";

    private static final double Z_95 = 1.959964;

    private MetricsCalculator() {
    }

    public static AccuracyMetrics calculate(List<EvaluationOutcome> outcomes) {
        Map<String, List<EvaluationOutcome>> byCategory = new LinkedHashMap<>();
        for (EvaluationOutcome outcome : outcomes) {
            byCategory.computeIfAbsent(outcome.sample().expected().label(), key -> new ArrayList<>()).add(outcome);
        }

        List<CategoryMetrics> categories = new ArrayList<>(byCategory.size());
        for (Map.Entry<String, List<EvaluationOutcome>> entry : byCategory.entrySet()) {
            Counts counts = count(entry.getValue());
            categories.add(new CategoryMetrics(
                    entry.getKey(),
                    counts.total,
                    counts.correct,
                    counts.incorrect,
                    counts.errors,
                    counts.accuracyRate(),
                    counts.averageLatency()));
        }

        Counts overall = count(outcomes);
        return new AccuracyMetrics(
                overall.total,
                overall.correct,
                overall.incorrect,
                overall.errors,
                overall.accuracyRate(),
                overall.averageLatency(),
                categories);
    }

    /**
     * Metrics per {@code model/method} configuration, in first-seen order.
     */
    public static Map<String, AccuracyMetrics> byConfiguration(List<EvaluationOutcome> outcomes) {
        Map<String, List<EvaluationOutcome>> grouped = new LinkedHashMap<>();
        for (EvaluationOutcome outcome : outcomes) {
            grouped.computeIfAbsent(outcome.configuration(), key -> new ArrayList<>()).add(outcome);
        }
        Map<String, AccuracyMetrics> metrics = new LinkedHashMap<>();
        grouped.forEach((configuration, group) -> metrics.put(configuration, calculate(group)));
        return metrics;
    }

    public static ClassQualityMetrics classQuality(List<EvaluationOutcome> outcomes) {
        List<String> labels = new ArrayList<>();
        for (IntentType type : IntentType.values()) {
            boolean seen = outcomes.stream().anyMatch(outcome -> outcome.sample().expected() == type
                    || (!outcome.failed() && outcome.result().type() == type));
            if (seen) {
                labels.add(type.label());
            }
        }

        Map<String, Map<String, Long>> confusion = new LinkedHashMap<>();
        for (String expected : labels) {
            Map<String, Long> row = new LinkedHashMap<>();
            labels.forEach(predicted -> row.put(predicted, 0L));
            row.put(ERROR_COLUMN, 0L);
            confusion.put(expected, row);
        }
        for (EvaluationOutcome outcome : outcomes) {
            String predicted = outcome.failed() ? ERROR_COLUMN : outcome.result().type().label();
            confusion.get(outcome.sample().expected().label()).merge(predicted, 1L, Long::sum);
        }

        List<ClassQualityMetrics.ClassScore> scores = new ArrayList<>();
        double f1Sum = 0.0;
        int scored = 0;
        for (String label : labels) {
            long truePositives = confusion.get(label).get(label);
            long support = confusion.get(label).values().stream().mapToLong(Long::longValue).sum();
            long predictedAsLabel = confusion.values().stream().mapToLong(row -> row.get(label)).sum();

            double precision = predictedAsLabel == 0 ? 0.0 : (double) truePositives / predictedAsLabel;
            double recall = support == 0 ? 0.0 : (double) truePositives / support;
            double f1 = precision + recall == 0.0 ? 0.0 : 2 * precision * recall / (precision + recall);
            scores.add(new ClassQualityMetrics.ClassScore(label, support, precision, recall, f1));
            if (support > 0) {
                f1Sum += f1;
                scored++;
            }
        }
        return new ClassQualityMetrics(labels, confusion, scores, scored == 0 ? 0.0 : f1Sum / scored);
    }

    /**
     * Wilson score interval for {@code correct / total} at 95% confidence.
     */
    public static ConfidenceInterval wilsonInterval(long correct, long total) {
        if (total <= 0) {
            return new ConfidenceInterval(0.0, 0.0, 0.95);
        }
        double p = (double) correct / total;
        double z2 = Z_95 * Z_95;
        double denominator = 1 + z2 / total;
        double center = (p + z2 / (2.0 * total)) / denominator;
        double margin = Z_95 * Math.sqrt(p * (1 - p) / total + z2 / (4.0 * total * total)) / denominator;
        return new ConfidenceInterval(Math.max(0.0, center - margin), Math.min(1.0, center + margin), 0.95);
    }

    /**
     * Distinct error descriptions with their counts, most frequent first, ties by description.
     */
    public static List<ErrorFrequency> errorBreakdown(List<EvaluationOutcome> outcomes) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (EvaluationOutcome outcome : outcomes) {
            if (outcome.failed()) {
                counts.merge(outcome.error().describe(), 1L, Long::sum);
            }
        }
        return counts.entrySet().stream()
                .map(entry -> new ErrorFrequency(entry.getKey(), entry.getValue()))
                .sorted(Comparator.comparingLong(ErrorFrequency::count).reversed()
                        .thenComparing(ErrorFrequency::error))
                .toList();
    }

    private static Counts count(List<EvaluationOutcome> outcomes) {
        Counts counts = new Counts();
        for (EvaluationOutcome outcome : outcomes) {
            counts.total++;
            counts.latencySum += outcome.latencyMs();
            if (outcome.failed()) {
                counts.errors++;
            } else if (outcome.correct()) {
                counts.correct++;
            } else {
                counts.incorrect++;
            }
        }
        return counts;
    }

    private static final class Counts {
        private int total;
        private int correct;
        private int incorrect;
        private int errors;
        private long latencySum;

        double accuracyRate() {
            return total == 0 ? 0.0 : (double) correct / total * 100;
        }

        long averageLatency() {
            return total == 0 ? 0L : Math.round((double) latencySum / total);
        }
    }
}
