package com.intentbench.oracle;

import com.fasterxml.jackson.databind.node.ObjectNode;

public record OracleRequest(
        String prompt,
        ObjectNode jsonSchema,
        String modelId,
        double temperature,
        int maxTokens) {

    public OracleRequest {
        if (prompt == null) {
            throw new IllegalArgumentException("prompt must not be null");
        }
        if (modelId == null || modelId.isBlank()) {
            throw new IllegalArgumentException("modelId must not be blank");
        }
    }
}
