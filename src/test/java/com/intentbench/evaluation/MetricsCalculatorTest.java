package com.intentbench.evaluation;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.intentbench.classifier.ClassificationError;
import com.intentbench.classifier.ClassificationResult;
import com.intentbench.classifier.ErrorKind;
import com.intentbench.classifier.IntentType;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MetricsCalculatorTest {

    @Test
    void shouldCountOutcomesOverallAndPerCategoryInFirstSeenOrder() {
        List<EvaluationOutcome> outcomes = List.of(
                success("m", "rule-based", sample("1", IntentType.WORKFLOW), IntentType.WORKFLOW, 10),
                success("m", "rule-based", sample("2", IntentType.PROMPT), IntentType.PROMPT, 20),
                success("m", "rule-based", sample("3", IntentType.PROMPT), IntentType.WORKFLOW, 30),
                failure("m", "rule-based", sample("4", IntentType.WORKFLOW), ErrorKind.TIMEOUT, "slow", 41));

        AccuracyMetrics metrics = MetricsCalculator.calculate(outcomes);

        assertEquals(4, metrics.totalTests());
        assertEquals(2, metrics.correct());
        assertEquals(1, metrics.incorrect());
        assertEquals(1, metrics.errors());
        assertEquals(metrics.totalTests(), metrics.correct() + metrics.incorrect() + metrics.errors());
        assertEquals(50.0, metrics.accuracyRate(), 1e-9);
        assertEquals(25.0, metrics.errorRate(), 1e-9);
        assertEquals(25, metrics.averageLatency());

        List<CategoryMetrics> categories = metrics.categoryBreakdown();
        assertEquals(List.of("workflow", "prompt"), categories.stream().map(CategoryMetrics::category).toList());
        assertEquals(4, categories.stream().mapToInt(CategoryMetrics::totalTests).sum());
        assertEquals(1, categories.get(0).errors());
        assertEquals(1, categories.get(1).incorrect());
        assertEquals(50.0, categories.get(1).accuracyRate(), 1e-9);
    }

    @Test
    void shouldReturnZerosForEmptyOutcomes() {
        AccuracyMetrics metrics = MetricsCalculator.calculate(List.of());

        assertEquals(0, metrics.totalTests());
        assertEquals(0.0, metrics.accuracyRate());
        assertEquals(0, metrics.averageLatency());
        assertTrue(metrics.categoryBreakdown().isEmpty());
    }

    @Test
    void shouldGroupByConfigurationInFirstSeenOrder() {
        List<EvaluationOutcome> outcomes = List.of(
                success("qwen", "hybrid", sample("1", IntentType.PROMPT), IntentType.PROMPT, 5),
                success("llama", "rule-based", sample("1", IntentType.PROMPT), IntentType.WORKFLOW, 5),
                success("qwen", "hybrid", sample("2", IntentType.PROMPT), IntentType.PROMPT, 5));

        Map<String, AccuracyMetrics> byConfiguration = MetricsCalculator.byConfiguration(outcomes);

        assertEquals(List.of("qwen/hybrid", "llama/rule-based"), List.copyOf(byConfiguration.keySet()));
        assertEquals(100.0, byConfiguration.get("qwen/hybrid").accuracyRate(), 1e-9);
        assertEquals(0.0, byConfiguration.get("llama/rule-based").accuracyRate(), 1e-9);
    }

    @Test
    void shouldComputeConfusionMatrixAndPerLabelScores() {
        List<EvaluationOutcome> outcomes = List.of(
                success("m", "x", sample("1", IntentType.PROMPT), IntentType.PROMPT, 1),
                success("m", "x", sample("2", IntentType.PROMPT), IntentType.WORKFLOW, 1),
                success("m", "x", sample("3", IntentType.WORKFLOW), IntentType.WORKFLOW, 1),
                failure("m", "x", sample("4", IntentType.WORKFLOW), ErrorKind.PARSE, "bad json", 1));

        ClassQualityMetrics quality = MetricsCalculator.classQuality(outcomes);

        assertEquals(List.of("prompt", "workflow"), quality.labels());
        assertEquals(1L, quality.confusion().get("prompt").get("workflow"));
        assertEquals(1L, quality.confusion().get("workflow").get(MetricsCalculator.ERROR_COLUMN));
        ClassQualityMetrics.ClassScore prompt = quality.scores().get(0);
        assertEquals(1.0, prompt.precision(), 1e-9);
        assertEquals(0.5, prompt.recall(), 1e-9);
        ClassQualityMetrics.ClassScore workflow = quality.scores().get(1);
        assertEquals(0.5, workflow.precision(), 1e-9);
        assertEquals(0.5, workflow.recall(), 1e-9);
        assertEquals(2, workflow.support());
        assertEquals((2.0 / 3.0 + 0.5) / 2, quality.macroF1(), 1e-9);
    }

    @Test
    void shouldComputeWilsonInterval() {
        ConfidenceInterval eightOfTen = MetricsCalculator.wilsonInterval(8, 10);
        assertEquals(0.4902, eightOfTen.lower(), 1e-3);
        assertEquals(0.9433, eightOfTen.upper(), 1e-3);
        assertEquals(0.95, eightOfTen.level());

        ConfidenceInterval noneOfFive = MetricsCalculator.wilsonInterval(0, 5);
        assertEquals(0.0, noneOfFive.lower(), 1e-9);
        assertEquals(0.4345, noneOfFive.upper(), 1e-3);

        ConfidenceInterval empty = MetricsCalculator.wilsonInterval(0, 0);
        assertEquals(0.0, empty.lower());
        assertEquals(0.0, empty.upper());
    }

    @Test
    void shouldOrderErrorBreakdownByCountThenDescription() {
        List<EvaluationOutcome> outcomes = List.of(
                failure("m", "x", sample("1", IntentType.PROMPT), ErrorKind.PARSE, "bad", 1),
                failure("m", "x", sample("2", IntentType.PROMPT), ErrorKind.TIMEOUT, "slow", 1),
                failure("m", "x", sample("3", IntentType.PROMPT), ErrorKind.CONNECTION, "refused", 1),
                failure("m", "x", sample("4", IntentType.PROMPT), ErrorKind.TIMEOUT, "slow", 1),
                success("m", "x", sample("5", IntentType.PROMPT), IntentType.PROMPT, 1));

        List<ErrorFrequency> errors = MetricsCalculator.errorBreakdown(outcomes);

        assertEquals(List.of(
                new ErrorFrequency("TimeoutError: slow", 2),
                new ErrorFrequency("ConnectionError: refused", 1),
                new ErrorFrequency("ParseError: bad", 1)), errors);
    }

    static TestSample sample(String id, IntentType expected) {
        return sample(id, "input " + id, expected);
    }

    static TestSample sample(String id, String input, IntentType expected) {
        return new TestSample(id, input, expected, "test", "simple");
    }

    static EvaluationOutcome success(String model, String method, TestSample sample, IntentType predicted, long latencyMs) {
        return new EvaluationOutcome(model, method, sample,
                ClassificationResult.of(predicted, 0.8, "because", method), null, latencyMs);
    }

    static EvaluationOutcome failure(String model, String method, TestSample sample, ErrorKind kind, String message, long latencyMs) {
        return new EvaluationOutcome(model, method, sample, null,
                ClassificationError.of(kind, message, method), latencyMs);
    }
}
