package com.intentbench.classifier;

import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the rule-based classifier first and escalates to the model only when the rule-based
 * confidence is strictly below the threshold. A failed escalation falls back to the
 * rule-based result, so this method never fails.
 */
public class HybridMethod implements ClassificationMethod {
    static final String TAG = "hybrid";

    private static final Logger log = LoggerFactory.getLogger(HybridMethod.class);

    private final ClassificationMethod rules;
    private final ClassificationMethod model;
    private final double confidenceThreshold;

    public HybridMethod(ClassificationMethod rules, ClassificationMethod model, double confidenceThreshold) {
        if (rules == null || model == null) {
            throw new IllegalArgumentException("hybrid requires rule-based and model stages");
        }
        if (confidenceThreshold < 0.0 || confidenceThreshold > 1.0) {
            throw new IllegalArgumentException("confidenceThreshold must be within [0, 1]");
        }
        this.rules = rules;
        this.model = model;
        this.confidenceThreshold = confidenceThreshold;
    }

    @Override
    public MethodResult classify(String input, Map<String, String> context) {
        long start = System.nanoTime();
        MethodResult ruleOutcome = rules.classify(input, context);
        if (ruleOutcome.isFailure()) {
            return ruleOutcome;
        }
        ClassificationResult ruleResult = ruleOutcome.result();

        if (ruleResult.confidence() >= confidenceThreshold) {
            return MethodResult.success(ruleResult
                    .withMethodTag(TAG)
                    .withMetadata(Map.of("hybridStage", "rule-only"))
                    .withLatency(elapsedMs(start)));
        }

        MethodResult modelOutcome = model.classify(input, context);
        if (modelOutcome.isFailure()) {
            ClassificationError error = modelOutcome.error();
            log.debug("hybrid.fallback ruleConfidence={} reason={}", ruleResult.confidence(), error.describe());
            Map<String, String> metadata = new LinkedHashMap<>();
            metadata.put("hybridStage", "model-fallback");
            metadata.put("fallbackReason", error.kind().displayName());
            return MethodResult.success(ruleResult
                    .withMethodTag(TAG)
                    .withReasoning(ruleResult.reasoning() + " (model unavailable: " + error.describe() + ")")
                    .withMetadata(metadata)
                    .withLatency(elapsedMs(start)));
        }

        ClassificationResult modelResult = modelOutcome.result();
        Map<String, String> metadata = new LinkedHashMap<>(modelResult.metadata());
        metadata.put("hybridStage", "rule-then-model");
        metadata.put("ruleType", ruleResult.type().label());
        metadata.put("ruleConfidence", String.valueOf(ruleResult.confidence()));
        metadata.put("agreement", String.valueOf(ruleResult.type() == modelResult.type()));
        return MethodResult.success(new ClassificationResult(
                modelResult.type(),
                modelResult.confidence(),
                ResultAggregator.mergeReasoning(modelResult.reasoning(), ruleResult.reasoning()),
                TAG,
                elapsedMs(start),
                metadata));
    }

    @Override
    public String methodTag() {
        return TAG;
    }

    @Override
    public void close() {
        model.close();
        rules.close();
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
