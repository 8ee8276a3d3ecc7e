package com.intentbench.evaluation;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders an evaluation run as plain text. Output depends only on the input: no clock and no
 * I/O.
 */
public final class EvaluationReporter {
    private static final int PREVIEW_LENGTH = 40;
    private static final String RULE = "=".repeat(60);

    private EvaluationReporter() {
    }

    public record ReportInput(
            String datasetPath,
            List<String> models,
            List<String> methods,
            String schemaName,
            int sampleCount,
            List<EvaluationOutcome> outcomes) {

        public ReportInput {
            models = List.copyOf(models);
            methods = List.copyOf(methods);
            outcomes = List.copyOf(outcomes);
        }
    }

    public static String render(ReportInput input) {
        List<EvaluationOutcome> outcomes = input.outcomes();
        AccuracyMetrics overall = MetricsCalculator.calculate(outcomes);
        Map<String, AccuracyMetrics> configurations = MetricsCalculator.byConfiguration(outcomes);
        ClassQualityMetrics quality = MetricsCalculator.classQuality(outcomes);
        ConfidenceInterval interval = MetricsCalculator.wilsonInterval(overall.correct(), overall.totalTests());
        List<ErrorFrequency> errors = MetricsCalculator.errorBreakdown(outcomes);

        StringBuilder out = new StringBuilder();
        section(out, "EXECUTIVE SUMMARY");
        line(out, "Dataset: %s", input.datasetPath() == null ? "n/a" : input.datasetPath());
        line(out, "Models: %s", String.join(", ", input.models()));
        line(out, "Methods: %s", String.join(", ", input.methods()));
        if (input.schemaName() != null) {
            line(out, "Schema: %s", input.schemaName());
        }
        line(out, "Samples: %d", input.sampleCount());
        line(out, "Total tests: %d (%d models x %d methods x %d samples)",
                overall.totalTests(), input.models().size(), input.methods().size(), input.sampleCount());
        line(out, "Correct: %d (%.1f%%)", overall.correct(), overall.accuracyRate());
        line(out, "Incorrect: %d (%.1f%%)", overall.incorrect(), percent(overall.incorrect(), overall.totalTests()));
        line(out, "Errors: %d (%.1f%%)", overall.errors(), overall.errorRate());
        line(out, "Accuracy 95%% CI: [%.1f%%, %.1f%%]", interval.lower() * 100, interval.upper() * 100);
        line(out, "Average latency: %dms", overall.averageLatency());
        out.append('\n');
        line(out, "%-40s %8s %9s %8s %9s", "Configuration", "Tests", "Accuracy", "Errors", "Latency");
        for (Map.Entry<String, AccuracyMetrics> entry : configurations.entrySet()) {
            AccuracyMetrics metrics = entry.getValue();
            line(out, "%-40s %8d %8.1f%% %8d %7dms",
                    entry.getKey(), metrics.totalTests(), metrics.accuracyRate(), metrics.errors(), metrics.averageLatency());
        }

        section(out, "CATEGORY PERFORMANCE");
        for (CategoryMetrics category : overall.categoryBreakdown()) {
            line(out, "%-10s tests=%d correct=%d incorrect=%d errors=%d accuracy=%.1f%% latency=%dms",
                    category.category(),
                    category.totalTests(),
                    category.correct(),
                    category.incorrect(),
                    category.errors(),
                    category.accuracyRate(),
                    category.averageLatency());
        }
        for (ClassQualityMetrics.ClassScore score : quality.scores()) {
            line(out, "%-10s precision=%.3f recall=%.3f f1=%.3f support=%d",
                    score.label(), score.precision(), score.recall(), score.f1(), score.support());
        }
        line(out, "Macro F1: %.3f", quality.macroF1());

        section(out, "DETAILED RESULTS");
        for (int i = 0; i < outcomes.size(); i++) {
            EvaluationOutcome outcome = outcomes.get(i);
            String status = outcome.failed() ? "ERROR" : outcome.correct() ? "CORRECT" : "WRONG";
            String predicted = outcome.failed()
                    ? outcome.error().kind().displayName()
                    : String.format(Locale.ROOT, "%s (%.1f%%)", outcome.result().type().label(), outcome.result().confidence() * 100);
            line(out, "%d. [%s] \"%s\" -> %s [%s] (expected: %s)",
                    i + 1,
                    outcome.configuration(),
                    preview(outcome.sample().input()),
                    predicted,
                    status,
                    outcome.sample().expected().label());
        }

        section(out, "ERROR BREAKDOWN");
        if (errors.isEmpty()) {
            out.append("No errors\n");
        }
        for (ErrorFrequency error : errors) {
            line(out, "%5d  %s", error.count(), error.error());
        }
        return out.toString();
    }

    static String preview(String input) {
        String flattened = input.replaceAll("\\s+", " ").trim();
        if (flattened.length() <= PREVIEW_LENGTH) {
            return flattened;
        }
        return flattened.substring(0, PREVIEW_LENGTH - 3) + "...";
    }

    private static void section(StringBuilder out, String title) {
        if (out.length() > 0) {
            out.append('\n');
        }
        out.append(title).append('\n').append(RULE).append('\n');
    }

    private static void line(StringBuilder out, String format, Object... args) {
        out.append(String.format(Locale.ROOT, format, args)).append('\n');
    }

    private static double percent(int part, int total) {
        return total == 0 ? 0.0 : part * 100.0 / total;
    }
}
