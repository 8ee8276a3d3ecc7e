package com.intentbench.classifier;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

public enum MethodKind {
    RULE_BASED("rule-based", List.of("rules", "rule")),
    SCHEMA_CONSTRAINED("schema-constrained", List.of("llm-based", "model-call", "llm")),
    HYBRID("hybrid", List.of()),
    ENSEMBLE("ensemble", List.of());

    private final String methodName;
    private final List<String> aliases;

    MethodKind(String methodName, List<String> aliases) {
        this.methodName = methodName;
        this.aliases = aliases;
    }

    public String methodName() {
        return methodName;
    }

    public static Optional<MethodKind> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (MethodKind kind : values()) {
            if (kind.methodName.equals(normalized) || kind.aliases.contains(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return methodName;
    }
}
