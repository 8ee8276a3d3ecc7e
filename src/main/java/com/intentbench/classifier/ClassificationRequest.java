package com.intentbench.classifier;

import java.util.Map;

public record ClassificationRequest(String input, Map<String, String> context) {

    public ClassificationRequest {
        input = input == null ? "" : input;
        context = context == null ? Map.of() : Map.copyOf(context);
    }
}
