package com.intentbench.schema;

import java.util.List;

/**
 * One field of a {@link Schema}. Bounds that do not apply to the field type are {@code null}.
 */
public record FieldSpec(
        String name,
        FieldType fieldType,
        boolean required,
        Double minimum,
        Double maximum,
        Integer minLength,
        Integer maxLength,
        List<String> allowedValues,
        String description) {

    public FieldSpec {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Field name must not be blank");
        }
        if (fieldType == null) {
            throw new IllegalArgumentException("Field type must not be null for " + name);
        }
        allowedValues = allowedValues == null ? List.of() : List.copyOf(allowedValues);
        description = description == null ? "" : description;
    }

    public static FieldSpec string(String name, String description) {
        return new FieldSpec(name, FieldType.STRING, true, null, null, null, null, List.of(), description);
    }

    public static FieldSpec boundedString(String name, Integer minLength, Integer maxLength, String description) {
        return new FieldSpec(name, FieldType.STRING, true, null, null, minLength, maxLength, List.of(), description);
    }

    public static FieldSpec oneOf(String name, List<String> allowedValues, String description) {
        return new FieldSpec(name, FieldType.STRING, true, null, null, null, null, allowedValues, description);
    }

    public static FieldSpec number(String name, Double minimum, Double maximum, String description) {
        return new FieldSpec(name, FieldType.NUMBER, true, minimum, maximum, null, null, List.of(), description);
    }

    public static FieldSpec integer(String name, Double minimum, String description) {
        return new FieldSpec(name, FieldType.INTEGER, true, minimum, null, null, null, List.of(), description);
    }

    public static FieldSpec bool(String name, String description) {
        return new FieldSpec(name, FieldType.BOOLEAN, true, null, null, null, null, List.of(), description);
    }

    public static FieldSpec stringArray(String name, String description) {
        return new FieldSpec(name, FieldType.STRING_ARRAY, true, null, null, null, null, List.of(), description);
    }
}
