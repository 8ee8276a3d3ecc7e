package com.intentbench.schema;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SchemaValidatorTest {
    private final SchemaRegistry registry = SchemaRegistry.builtIn();
    private final ObjectMapper mapper = new ObjectMapper();

    private List<String> validate(String schemaName, String json) throws Exception {
        JsonNode node = mapper.readTree(json);
        return SchemaValidator.validate(registry.require(schemaName), node);
    }

    @Test
    void shouldAcceptConformingResponse() throws Exception {
        assertEquals(List.of(), validate("context-aware", """
                {"type": "workflow", "confidence": 0.7, "reasoning": "two steps",
                 "conversation_context": "multi_step", "step_count": 2, "requires_coordination": true}
                """));
    }

    @Test
    void shouldReportMissingRequiredFields() throws Exception {
        List<String> violations = validate("standard", "{\"type\": \"prompt\"}");

        assertEquals(2, violations.size());
        assertTrue(violations.get(0).contains("confidence"));
        assertTrue(violations.get(1).contains("reasoning"));
    }

    @Test
    void shouldReportRangeAndLengthViolations() throws Exception {
        List<String> violations = validate("detailed", """
                {"type": "prompt", "confidence": 0.5, "reasoning": "%s",
                 "indicators": ["greeting"], "complexity_score": 9}
                """.formatted("r".repeat(250)));

        assertEquals(2, violations.size());
        assertTrue(violations.get(0).contains("longer than 200"));
        assertTrue(violations.get(1).contains("above maximum"));
    }

    @Test
    void shouldReportTypeMismatches() throws Exception {
        List<String> violations = validate("context-aware", """
                {"type": "prompt", "confidence": "high", "reasoning": "hi",
                 "conversation_context": "chit-chat", "step_count": 1.5, "requires_coordination": "no"}
                """);

        assertEquals(4, violations.size());
        assertTrue(violations.get(0).contains("'confidence' must be a number"));
        assertTrue(violations.get(1).contains("not in"));
        assertTrue(violations.get(2).contains("'step_count' must be an integer"));
        assertTrue(violations.get(3).contains("must be a boolean"));
    }

    @Test
    void shouldRejectNonObjectResponse() throws Exception {
        assertEquals(List.of("response must be a JSON object"), validate("minimal", "[1, 2]"));
    }
}
