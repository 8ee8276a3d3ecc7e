package com.intentbench.classifier;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ClassificationResultTest {

    @Test
    void shouldRejectConfidenceOutsideUnitInterval() {
        assertThrows(IllegalArgumentException.class, () -> ClassificationResult.of(IntentType.PROMPT, 1.2, "", "t"));
        assertThrows(IllegalArgumentException.class, () -> ClassificationResult.of(IntentType.PROMPT, -0.1, "", "t"));
        assertThrows(IllegalArgumentException.class, () -> ClassificationResult.of(IntentType.PROMPT, Double.NaN, "", "t"));
    }

    @Test
    void shouldTruncateLongReasoning() {
        ClassificationResult result = ClassificationResult.of(IntentType.WORKFLOW, 0.5, "x".repeat(800), "t");

        assertEquals(ClassificationResult.MAX_REASONING_LENGTH, result.reasoning().length());
        assertTrue(result.reasoning().endsWith("..."));
    }

    @Test
    void shouldMergeMetadataIntoCopy() {
        ClassificationResult original = new ClassificationResult(IntentType.PROMPT, 0.5, "r", "t", 3, Map.of("a", "1"));
        ClassificationResult merged = original.withMetadata(Map.of("b", "2"));

        assertEquals(Map.of("a", "1"), original.metadata());
        assertEquals(Map.of("a", "1", "b", "2"), merged.metadata());
        assertEquals(3, merged.latencyMs());
    }

    @Test
    void shouldParseIntentLabelsStrictly() {
        assertEquals(IntentType.WORKFLOW, IntentType.parse("Workflow"));
        assertFalse(IntentType.fromLabel("task").isPresent());
        assertThrows(IllegalArgumentException.class, () -> IntentType.parse("task"));
    }

    @Test
    void shouldResolveMethodAliases() {
        assertEquals(MethodKind.SCHEMA_CONSTRAINED, MethodKind.fromName("llm-based").orElseThrow());
        assertEquals(MethodKind.RULE_BASED, MethodKind.fromName("RULE_BASED").orElseThrow());
        assertFalse(MethodKind.fromName("neural-magic").isPresent());
    }

    @Test
    void shouldRetryOnlyTransientErrors() {
        List<ErrorKind> retryable = List.of(ErrorKind.values()).stream().filter(ErrorKind::retryable).toList();

        assertEquals(List.of(ErrorKind.CONNECTION, ErrorKind.TIMEOUT), retryable);
    }

    @Test
    void shouldRejectInvalidEnsembleQuorum() {
        List<MethodSettings> members = List.of(MethodSettings.RuleBased.defaults());

        assertThrows(IllegalArgumentException.class, () -> new MethodSettings.Ensemble(members, 2, 1000, false));
        assertEquals(1, new MethodSettings.Ensemble(members, 0, 1000, false).effectiveQuorum());
    }
}
