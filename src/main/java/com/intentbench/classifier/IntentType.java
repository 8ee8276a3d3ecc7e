package com.intentbench.classifier;

import java.util.Locale;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum IntentType {
    COMMAND("command"),
    PROMPT("prompt"),
    WORKFLOW("workflow");

    private final String label;

    IntentType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static Optional<IntentType> fromLabel(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (IntentType type : values()) {
            if (type.label.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static IntentType parse(String value) {
        return fromLabel(value)
                .orElseThrow(() -> new IllegalArgumentException("Unknown intent type: " + value));
    }

    @Override
    public String toString() {
        return label;
    }
}
