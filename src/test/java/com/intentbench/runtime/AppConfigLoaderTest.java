package com.intentbench.runtime;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AppConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldUseDefaultsWhenFileIsMissing() throws Exception {
        AppConfig config = AppConfigLoader.load(tempDir.resolve("missing.yml"));

        assertEquals("rule-based", config.getClassifier().getMethod());
        assertEquals("optimized", config.getClassifier().getSchemaName());
        assertEquals(0.8, config.getClassifier().getConfidenceThreshold());
        assertEquals("http://localhost:11434", config.getClassifier().getLlm().getBaseUrl());
        assertEquals(2, config.getClassifier().getLlm().getMaxRetries());
        assertEquals(0.5, config.getClassifier().getRules().getDefaultConfidence());
        assertNull(config.getClassifier().getRules().getPromptIndicators());
        assertEquals(5, config.getEvaluation().getBatchSize());
        assertNull(config.getEvaluation().getSampleLimit());
        assertTrue(config.getClassifier().getEnsemble().isShortCircuitOnQuorum());
    }

    @Test
    void shouldBindYamlAndKeepDefaultsForOmittedSections() throws Exception {
        Path file = tempDir.resolve("config.yml");
        Files.writeString(file, """
                classifier:
                  method: hybrid
                  confidenceThreshold: 0.65
                  llm:
                    modelId: qwen2.5:7b
                    timeoutMs: 5000
                  rules:
                    workflowIndicators: [ship, release]
                  ensemble:
                    quorum: 2
                    shortCircuitOnQuorum: false
                    members:
                      - method: rule-based
                      - method: schema-constrained
                        model: llama3.2:3b
                        temperature: 0.0
                evaluation:
                  models: [qwen2.5:7b]
                  methods: [rule-based, hybrid]
                  sampleLimit: 20
                  schema:
                    name: minimal
                unknownSection:
                  ignored: true
                """);

        AppConfig config = AppConfigLoader.load(file);

        assertEquals("hybrid", config.getClassifier().getMethod());
        assertEquals(0.65, config.getClassifier().getConfidenceThreshold());
        assertEquals("qwen2.5:7b", config.getClassifier().getLlm().getModelId());
        assertEquals(5000, config.getClassifier().getLlm().getTimeoutMs());
        assertEquals("http://localhost:11434", config.getClassifier().getLlm().getBaseUrl());
        assertEquals(List.of("ship", "release"), config.getClassifier().getRules().getWorkflowIndicators());
        assertEquals(2, config.getClassifier().getEnsemble().getMembers().size());
        assertEquals(0.0, config.getClassifier().getEnsemble().getMembers().get(1).getTemperature());
        assertFalse(config.getClassifier().getEnsemble().isShortCircuitOnQuorum());
        assertEquals(List.of("rule-based", "hybrid"), config.getEvaluation().getMethods());
        assertEquals(20, config.getEvaluation().getSampleLimit());
        assertEquals("minimal", config.getEvaluation().getSchema().getName());
        assertEquals("src/main/resources/datasets/sample-intents.json", config.getEvaluation().getDataPath());
    }

    @Test
    void shouldLoadBundledApplicationConfig() throws Exception {
        AppConfig config = AppConfigLoader.load(Path.of("src/main/resources/application.yml"));

        assertEquals(3, config.getClassifier().getEnsemble().getMembers().size());
        assertTrue(config.getClassifier().getEnsemble().isShortCircuitOnQuorum());
        assertEquals(List.of("rule-based", "hybrid"), config.getEvaluation().getMethods());
    }
}
