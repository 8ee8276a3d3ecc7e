package com.intentbench.schema;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.node.ObjectNode;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SchemaRegistryTest {
    private final SchemaRegistry registry = SchemaRegistry.builtIn();

    @Test
    void shouldRegisterBuiltInSchemasInOrder() {
        assertEquals(List.of("minimal", "standard", "detailed", "optimized", "context-aware"), registry.names());
    }

    @Test
    void shouldNormaliseLookupNames() {
        assertEquals("context-aware", registry.find("context_aware").orElseThrow().name());
        assertEquals("standard", registry.find(" STANDARD ").orElseThrow().name());
        assertFalse(registry.find("verbose").isPresent());
        assertThrows(IllegalArgumentException.class, () -> registry.require("verbose"));
    }

    @Test
    void shouldFindSchemaByComplexity() {
        assertEquals("detailed", registry.byComplexity(ComplexityLevel.DETAILED).orElseThrow().name());
        assertEquals("context-aware", registry.byComplexity(ComplexityLevel.CONTEXT_AWARE).orElseThrow().name());
        assertEquals(ComplexityLevel.CONTEXT_AWARE, ComplexityLevel.fromLabel("context-aware").orElseThrow());
        assertFalse(ComplexityLevel.fromLabel("huge").isPresent());
    }

    @Test
    void shouldExposeFieldDefinitions() {
        Schema contextAware = registry.require("context-aware");

        assertEquals(FieldType.BOOLEAN, contextAware.fields().stream()
                .filter(field -> field.name().equals("requires_coordination"))
                .findFirst().orElseThrow().fieldType());
        assertTrue(contextAware.requiredFieldNames().containsAll(List.of("type", "confidence")));
        assertFalse(contextAware.requiredFieldNames().contains("task_steps"));
    }

    @Test
    void shouldResolveNamesBeforeComplexityLabels() {
        assertEquals("standard", registry.resolve("Standard").orElseThrow().name());
        assertEquals("context-aware", registry.resolve("CONTEXT_AWARE").orElseThrow().name());
        assertEquals("optimized", registry.resolve("auto").orElseThrow().name());
        assertFalse(registry.resolve("huge").isPresent());
        assertFalse(registry.resolve(null).isPresent());
    }

    @Test
    void shouldSelectOptimalSchemaByCriteria() {
        assertEquals("optimized", registry.selectOptimal(SchemaSelectionCriteria.balanced()).name());
        assertEquals("minimal", registry.selectOptimal(SchemaSelectionCriteria.fastest()).name());
        assertEquals("detailed", registry.selectOptimal(SchemaSelectionCriteria.mostAccurate()).name());
        assertEquals("optimized", registry.selectOptimal(
                new SchemaSelectionCriteria("production", null, null, true, false)).name());
        assertEquals("standard", registry.selectOptimal(
                new SchemaSelectionCriteria("general-purpose", null, null, false, false)).name());
    }

    @Test
    void shouldFallBackToAllSchemasWhenFiltersExcludeEverything() {
        Schema selected = registry.selectOptimal(new SchemaSelectionCriteria(null, 10L, 0.99, false, false));

        assertEquals("optimized", selected.name());
    }

    @Test
    void shouldRejectDuplicateNames() {
        Schema minimal = registry.require("minimal");

        assertThrows(IllegalArgumentException.class, () -> new SchemaRegistry(List.of(minimal, minimal)));
    }

    @Test
    void shouldRenderJsonSchema() {
        ObjectNode jsonSchema = registry.require("optimized").toJsonSchema();

        assertEquals("object", jsonSchema.get("type").asText());
        assertEquals("prompt", jsonSchema.at("/properties/type/enum/0").asText());
        assertEquals("workflow", jsonSchema.at("/properties/type/enum/1").asText());
        assertEquals(1.0, jsonSchema.at("/properties/confidence/maximum").asDouble());
        assertEquals(100, jsonSchema.at("/properties/reasoning/maxLength").asInt());
        assertEquals("integer", jsonSchema.at("/properties/task_steps/type").asText());
        assertTrue(jsonSchema.get("required").toString().contains("task_steps"));
    }
}
