package com.intentbench.schema;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Checks a parsed model response against a {@link Schema}. Returns every violation found;
 * an empty list means the response conforms.
 */
public final class SchemaValidator {

    private SchemaValidator() {
    }

    public static List<String> validate(Schema schema, JsonNode response) {
        List<String> violations = new ArrayList<>();
        if (response == null || !response.isObject()) {
            violations.add("response must be a JSON object");
            return violations;
        }

        for (FieldSpec field : schema.fields()) {
            JsonNode value = response.get(field.name());
            if (value == null || value.isNull()) {
                if (field.required()) {
                    violations.add("missing required field '" + field.name() + "'");
                }
                continue;
            }
            checkField(field, value, violations);
        }
        return violations;
    }

    private static void checkField(FieldSpec field, JsonNode value, List<String> violations) {
        String name = field.name();
        switch (field.fieldType()) {
            case STRING -> {
                if (!value.isTextual()) {
                    violations.add("field '" + name + "' must be a string");
                    return;
                }
                String text = value.asText();
                if (field.minLength() != null && text.length() < field.minLength()) {
                    violations.add("field '" + name + "' is shorter than " + field.minLength() + " characters");
                }
                if (field.maxLength() != null && text.length() > field.maxLength()) {
                    violations.add("field '" + name + "' is longer than " + field.maxLength() + " characters");
                }
                if (!field.allowedValues().isEmpty() && !field.allowedValues().contains(text)) {
                    violations.add("field '" + name + "' has value '" + text + "' not in " + field.allowedValues());
                }
            }
            case NUMBER -> {
                if (!value.isNumber()) {
                    violations.add("field '" + name + "' must be a number");
                    return;
                }
                checkRange(field, value.asDouble(), violations);
            }
            case INTEGER -> {
                if (!value.isIntegralNumber() && !(value.isNumber() && value.asDouble() == Math.rint(value.asDouble()))) {
                    violations.add("field '" + name + "' must be an integer");
                    return;
                }
                checkRange(field, value.asDouble(), violations);
            }
            case BOOLEAN -> {
                if (!value.isBoolean()) {
                    violations.add("field '" + name + "' must be a boolean");
                }
            }
            case STRING_ARRAY -> {
                if (!value.isArray()) {
                    violations.add("field '" + name + "' must be an array");
                    return;
                }
                for (JsonNode element : value) {
                    if (!element.isTextual()) {
                        violations.add("field '" + name + "' must contain only strings");
                        return;
                    }
                }
            }
        }
    }

    private static void checkRange(FieldSpec field, double number, List<String> violations) {
        if (Double.isNaN(number)) {
            violations.add("field '" + field.name() + "' is not a number");
            return;
        }
        if (field.minimum() != null && number < field.minimum()) {
            violations.add("field '" + field.name() + "' is below minimum " + field.minimum());
        }
        if (field.maximum() != null && number > field.maximum()) {
            violations.add("field '" + field.name() + "' is above maximum " + field.maximum());
        }
    }
}
