package com.intentbench.classifier;

import org.junit.jupiter.api.Test;

import com.intentbench.schema.SchemaRegistry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HybridMethodTest {

    @Test
    void shouldEscalateLowConfidenceToModel() {
        StubMethod rules = StubMethod.returning(IntentType.PROMPT, 0.6);
        StubMethod model = StubMethod.returning(IntentType.WORKFLOW, 0.9);

        ClassificationResult result = new HybridMethod(rules, model, 0.8).classify("plan a trip").result();

        assertEquals(1, model.calls());
        assertEquals(IntentType.WORKFLOW, result.type());
        assertEquals(0.9, result.confidence());
        assertEquals("hybrid", result.methodTag());
        assertEquals("rule-then-model", result.metadata().get("hybridStage"));
        assertEquals("prompt", result.metadata().get("ruleType"));
        assertEquals("false", result.metadata().get("agreement"));
        assertEquals("stub says workflow | rule-based: stub says prompt", result.reasoning());
    }

    @Test
    void shouldKeepConfidentRuleResult() {
        StubMethod rules = StubMethod.returning(IntentType.PROMPT, 0.9);
        StubMethod model = StubMethod.returning(IntentType.WORKFLOW, 0.9);

        ClassificationResult result = new HybridMethod(rules, model, 0.8).classify("hello").result();

        assertEquals(0, model.calls());
        assertEquals(IntentType.PROMPT, result.type());
        assertEquals("rule-only", result.metadata().get("hybridStage"));
    }

    @Test
    void shouldNotEscalateAtExactlyTheThreshold() {
        StubMethod rules = StubMethod.returning(IntentType.PROMPT, 0.8);
        StubMethod model = StubMethod.returning(IntentType.WORKFLOW, 0.9);

        new HybridMethod(rules, model, 0.8).classify("hello");

        assertEquals(0, model.calls());
    }

    @Test
    void shouldFallBackToRulesWhenModelFails() {
        StubMethod rules = StubMethod.returning(IntentType.WORKFLOW, 0.6);
        StubMethod model = StubMethod.failing(ErrorKind.CONNECTION);

        MethodResult outcome = new HybridMethod(rules, model, 0.8).classify("update the docs");

        assertTrue(outcome.isSuccess());
        assertEquals(IntentType.WORKFLOW, outcome.result().type());
        assertEquals(0.6, outcome.result().confidence());
        assertEquals("model-fallback", outcome.result().metadata().get("hybridStage"));
        assertEquals("ConnectionError", outcome.result().metadata().get("fallbackReason"));
    }

    @Test
    void shouldFallBackWhenModelTimesOut() {
        SchemaRegistry registry = SchemaRegistry.builtIn();
        MethodSettings.SchemaConstrained settings = new MethodSettings.SchemaConstrained(
                "http://localhost:11434", "test-model", 0.1, 200, "optimized", 1, 0, 0);
        SchemaConstrainedMethod model = new SchemaConstrainedMethod(settings, registry.require("optimized"), request -> {
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return "{}";
        });

        try (HybridMethod hybrid = new HybridMethod(new RuleBasedMethod(), model, 0.8)) {
            ClassificationResult result = hybrid.classify("hello").result();

            assertEquals(IntentType.PROMPT, result.type());
            assertEquals(0.7, result.confidence(), 1e-9);
            assertEquals("TimeoutError", result.metadata().get("fallbackReason"));
        }
    }
}
