package com.intentbench.evaluation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.intentbench.classifier.ClassificationError;
import com.intentbench.classifier.ClassificationResult;
import com.intentbench.classifier.MethodResult;

/**
 * One classification of one sample by one model/method configuration. Exactly one of
 * {@code result} and {@code error} is set.
 */
public record EvaluationOutcome(
        String model,
        String method,
        TestSample sample,
        ClassificationResult result,
        ClassificationError error,
        long latencyMs) {

    public EvaluationOutcome {
        if ((result == null) == (error == null)) {
            throw new IllegalArgumentException("exactly one of result and error must be set");
        }
    }

    public static EvaluationOutcome of(String model, String method, TestSample sample, MethodResult outcome, long latencyMs) {
        if (outcome.isSuccess()) {
            return new EvaluationOutcome(model, method, sample, outcome.result(), null, latencyMs);
        }
        return new EvaluationOutcome(model, method, sample, null, outcome.error(), latencyMs);
    }

    @JsonIgnore
    public boolean failed() {
        return error != null;
    }

    @JsonIgnore
    public boolean correct() {
        return error == null && result.type() == sample.expected();
    }

    @JsonIgnore
    public String configuration() {
        return model + "/" + method;
    }
}
