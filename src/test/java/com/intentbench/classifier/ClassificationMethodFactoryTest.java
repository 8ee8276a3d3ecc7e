package com.intentbench.classifier;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.intentbench.oracle.OracleProvider;
import com.intentbench.schema.ComplexityLevel;
import com.intentbench.schema.Schema;
import com.intentbench.schema.SchemaProfile;
import com.intentbench.schema.SchemaRegistry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

class ClassificationMethodFactoryTest {
    private static final OracleProvider NO_ORACLE = baseUrl -> request -> {
        throw new IOException("no oracle in this test");
    };

    private final ClassificationMethodFactory factory = new ClassificationMethodFactory(SchemaRegistry.builtIn(), NO_ORACLE);

    private static MethodSettings.SchemaConstrained model(String schemaName) {
        return new MethodSettings.SchemaConstrained("http://localhost:11434", "m", 0.1, 100, schemaName, 1000, 0, 0);
    }

    @Test
    void shouldBuildEveryMethodKind() {
        MethodSettings.RuleBased rules = MethodSettings.RuleBased.defaults();
        MethodSettings.Hybrid hybrid = new MethodSettings.Hybrid(rules, model("standard"), 0.8);
        MethodSettings.Ensemble ensemble = new MethodSettings.Ensemble(List.of(rules, model("minimal"), hybrid), 0, 1000, false);

        try (ClassificationMethod ruleBased = factory.create(rules);
                ClassificationMethod schemaConstrained = factory.create(model("context_aware"));
                ClassificationMethod hybridMethod = factory.create(hybrid);
                ClassificationMethod ensembleMethod = factory.create(ensemble)) {
            assertInstanceOf(RuleBasedMethod.class, ruleBased);
            assertInstanceOf(SchemaConstrainedMethod.class, schemaConstrained);
            assertEquals("context-aware", ((SchemaConstrainedMethod) schemaConstrained).schema().name());
            assertInstanceOf(HybridMethod.class, hybridMethod);
            assertInstanceOf(EnsembleMethod.class, ensembleMethod);
            assertEquals(2, ((EnsembleMethod) ensembleMethod).quorum());
        }
    }

    @Test
    void shouldProduceUnsupportedMethodForUnknownSchema() {
        try (ClassificationMethod method = factory.create(model("does-not-exist"))) {
            ClassificationError error = method.classify("hello").error();

            assertEquals(ErrorKind.UNSUPPORTED_METHOD, error.kind());
            assertEquals("schema-constrained", error.methodTag());
        }
    }

    @Test
    void shouldDegradeToRulesWhenHybridModelIsUnreachable() {
        MethodSettings.Hybrid hybrid = new MethodSettings.Hybrid(MethodSettings.RuleBased.defaults(), model("standard"), 0.8);

        try (ClassificationMethod method = factory.create(hybrid)) {
            ClassificationResult result = method.classify("hello").result();

            assertEquals(IntentType.PROMPT, result.type());
            assertEquals("model-fallback", result.metadata().get("hybridStage"));
        }
    }

    @Test
    void shouldKeepHybridRulesWhenSchemaIsUnknown() {
        MethodSettings.Hybrid hybrid = new MethodSettings.Hybrid(MethodSettings.RuleBased.defaults(), model("no-such-schema"), 0.8);

        try (ClassificationMethod method = factory.create(hybrid)) {
            assertInstanceOf(HybridMethod.class, method);

            ClassificationResult command = method.classify("/status").result();
            assertEquals(IntentType.COMMAND, command.type());
            assertEquals("rule-only", command.metadata().get("hybridStage"));

            ClassificationResult fallback = method.classify("hello").result();
            assertEquals(IntentType.PROMPT, fallback.type());
            assertEquals("model-fallback", fallback.metadata().get("hybridStage"));
            assertEquals("UnsupportedMethodError", fallback.metadata().get("fallbackReason"));
        }
    }

    @Test
    void shouldResolveComplexityLabelsAndAutoToSchemas() {
        Schema terse = new Schema("terse", ComplexityLevel.MINIMAL, "Type only", "1.0.0",
                SchemaRegistry.builtIn().require("minimal").fields(),
                new SchemaProfile(0.7, 150, 0.99, List.of("high-throughput")));
        List<Schema> schemas = new ArrayList<>(SchemaRegistry.builtIn().all());
        schemas.remove(0);
        schemas.add(terse);
        ClassificationMethodFactory custom = new ClassificationMethodFactory(new SchemaRegistry(schemas), NO_ORACLE);

        try (ClassificationMethod byLevel = custom.create(model("minimal"));
                ClassificationMethod auto = custom.create(model("auto"))) {
            assertEquals("terse", ((SchemaConstrainedMethod) byLevel).schema().name());
            assertEquals("optimized", ((SchemaConstrainedMethod) auto).schema().name());
        }
    }
}
