package com.intentbench.schema;

import java.util.Locale;
import java.util.Optional;

public enum ComplexityLevel {
    MINIMAL,
    STANDARD,
    DETAILED,
    OPTIMIZED,
    CONTEXT_AWARE;

    public String label() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    public static Optional<ComplexityLevel> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        String normalized = label.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (ComplexityLevel level : values()) {
            if (level.name().equals(normalized)) {
                return Optional.of(level);
            }
        }
        return Optional.empty();
    }
}
