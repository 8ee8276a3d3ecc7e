package com.intentbench.evaluation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.intentbench.classifier.IntentType;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TestSample(
        String id,
        String input,
        IntentType expected,
        String source,
        String complexity) {
}
