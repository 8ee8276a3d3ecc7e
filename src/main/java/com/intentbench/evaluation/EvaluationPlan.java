package com.intentbench.evaluation;

import java.nio.file.Path;
import java.util.List;

/**
 * @param sampleLimit maximum samples to evaluate, or {@code null} for all
 * @param artifactsDir root directory for run artifacts, or {@code null} to skip writing them
 */
public record EvaluationPlan(
        List<String> models,
        List<String> methods,
        Path dataPath,
        String schemaName,
        int batchSize,
        Integer sampleLimit,
        Path artifactsDir) {

    public EvaluationPlan {
        if (models == null || models.isEmpty()) {
            throw new IllegalArgumentException("at least one model is required");
        }
        if (methods == null || methods.isEmpty()) {
            throw new IllegalArgumentException("at least one method is required");
        }
        if (dataPath == null) {
            throw new IllegalArgumentException("dataPath is required");
        }
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1 but was " + batchSize);
        }
        if (sampleLimit != null && sampleLimit < 0) {
            throw new IllegalArgumentException("sampleLimit must be >= 0 but was " + sampleLimit);
        }
        models = List.copyOf(models);
        methods = List.copyOf(methods);
    }
}
