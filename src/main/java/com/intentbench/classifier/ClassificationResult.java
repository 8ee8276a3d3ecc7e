package com.intentbench.classifier;

import java.util.LinkedHashMap;
import java.util.Map;

public record ClassificationResult(
        IntentType type,
        double confidence,
        String reasoning,
        String methodTag,
        long latencyMs,
        Map<String, String> metadata) {

    public static final int MAX_REASONING_LENGTH = 500;

    public ClassificationResult {
        if (type == null) {
            throw new IllegalArgumentException("Classification type must not be null");
        }
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be within [0, 1] but was " + confidence);
        }
        if (latencyMs < 0) {
            throw new IllegalArgumentException("Latency must be >= 0 but was " + latencyMs);
        }
        reasoning = truncate(reasoning == null ? "" : reasoning);
        methodTag = methodTag == null ? "unknown" : methodTag;
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static ClassificationResult of(IntentType type, double confidence, String reasoning, String methodTag) {
        return new ClassificationResult(type, confidence, reasoning, methodTag, 0L, Map.of());
    }

    public ClassificationResult withLatency(long latencyMs) {
        return new ClassificationResult(type, confidence, reasoning, methodTag, latencyMs, metadata);
    }

    public ClassificationResult withMethodTag(String methodTag) {
        return new ClassificationResult(type, confidence, reasoning, methodTag, latencyMs, metadata);
    }

    public ClassificationResult withReasoning(String reasoning) {
        return new ClassificationResult(type, confidence, reasoning, methodTag, latencyMs, metadata);
    }

    public ClassificationResult withMetadata(Map<String, String> extra) {
        Map<String, String> merged = new LinkedHashMap<>(metadata);
        merged.putAll(extra);
        return new ClassificationResult(type, confidence, reasoning, methodTag, latencyMs, merged);
    }

    private static String truncate(String value) {
        if (value.length() <= MAX_REASONING_LENGTH) {
            return value;
        }
        return value.substring(0, MAX_REASONING_LENGTH - 3) + "...";
    }
}
