package com.intentbench.schema;

import java.util.List;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Named contract for the JSON object a model must return. Every schema has a {@code type}
 * field restricted to the natural-language intents and a {@code confidence} number in [0, 1].
 */
public record Schema(
        String name,
        ComplexityLevel complexityLevel,
        String description,
        String version,
        List<FieldSpec> fields,
        SchemaProfile profile) {

    public Schema {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Schema name must not be blank");
        }
        if (complexityLevel == null) {
            throw new IllegalArgumentException("Schema complexity must not be null for " + name);
        }
        if (fields == null || fields.isEmpty()) {
            throw new IllegalArgumentException("Schema must declare fields: " + name);
        }
        fields = List.copyOf(fields);
        description = description == null ? "" : description;
        version = version == null ? "1.0.0" : version;
    }

    public List<String> requiredFieldNames() {
        return fields.stream().filter(FieldSpec::required).map(FieldSpec::name).toList();
    }

    public ObjectNode toJsonSchema() {
        JsonNodeFactory nodes = JsonNodeFactory.instance;
        ObjectNode root = nodes.objectNode();
        root.put("type", "object");
        ObjectNode properties = root.putObject("properties");
        ArrayNode required = nodes.arrayNode();

        for (FieldSpec field : fields) {
            ObjectNode property = properties.putObject(field.name());
            property.put("type", field.fieldType().jsonType());
            if (field.fieldType() == FieldType.STRING_ARRAY) {
                property.putObject("items").put("type", "string");
            }
            if (!field.description().isEmpty()) {
                property.put("description", field.description());
            }
            if (field.minimum() != null) {
                property.put("minimum", field.minimum());
            }
            if (field.maximum() != null) {
                property.put("maximum", field.maximum());
            }
            if (field.minLength() != null) {
                property.put("minLength", field.minLength());
            }
            if (field.maxLength() != null) {
                property.put("maxLength", field.maxLength());
            }
            if (!field.allowedValues().isEmpty()) {
                ArrayNode values = property.putArray("enum");
                field.allowedValues().forEach(values::add);
            }
            if (field.required()) {
                required.add(field.name());
            }
        }
        root.set("required", required);
        return root;
    }
}
