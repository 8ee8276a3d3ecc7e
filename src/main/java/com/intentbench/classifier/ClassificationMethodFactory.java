package com.intentbench.classifier;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.intentbench.oracle.OracleProvider;
import com.intentbench.schema.Schema;
import com.intentbench.schema.SchemaRegistry;

/**
 * Builds {@link ClassificationMethod}s from validated {@link MethodSettings}. The schema name
 * may also be a complexity label or {@code auto}. An unknown schema produces an
 * {@link UnsupportedMethod} for the model stage only, so a hybrid still answers from its rules.
 */
public class ClassificationMethodFactory {
    private static final Logger log = LoggerFactory.getLogger(ClassificationMethodFactory.class);

    private final SchemaRegistry registry;
    private final OracleProvider oracles;

    public ClassificationMethodFactory(SchemaRegistry registry, OracleProvider oracles) {
        if (registry == null || oracles == null) {
            throw new IllegalArgumentException("registry and oracles are required");
        }
        this.registry = registry;
        this.oracles = oracles;
    }

    public ClassificationMethod create(MethodSettings settings) {
        return switch (settings.kind()) {
            case RULE_BASED -> new RuleBasedMethod((MethodSettings.RuleBased) settings);
            case SCHEMA_CONSTRAINED -> schemaConstrained((MethodSettings.SchemaConstrained) settings);
            case HYBRID -> hybrid((MethodSettings.Hybrid) settings);
            case ENSEMBLE -> ensemble((MethodSettings.Ensemble) settings);
        };
    }

    private ClassificationMethod schemaConstrained(MethodSettings.SchemaConstrained settings) {
        Optional<Schema> schema = registry.resolve(settings.schemaName());
        if (schema.isEmpty()) {
            return unknownSchema(settings.schemaName());
        }
        return new SchemaConstrainedMethod(settings, schema.get(), oracles.forEndpoint(settings.baseUrl()));
    }

    private ClassificationMethod hybrid(MethodSettings.Hybrid settings) {
        return new HybridMethod(
                new RuleBasedMethod(settings.rules()),
                schemaConstrained(settings.model()),
                settings.confidenceThreshold());
    }

    private ClassificationMethod ensemble(MethodSettings.Ensemble settings) {
        List<ClassificationMethod> members = new ArrayList<>(settings.members().size());
        for (MethodSettings member : settings.members()) {
            members.add(create(member));
        }
        return new EnsembleMethod(members, settings.effectiveQuorum(), settings.timeoutMs(), settings.shortCircuitOnQuorum());
    }

    private ClassificationMethod unknownSchema(String schemaName) {
        String reason = "Unknown schema '" + schemaName + "'. Available: " + String.join(", ", registry.names());
        log.warn("classifier.unsupported method={} reason={}", MethodKind.SCHEMA_CONSTRAINED.methodName(), reason);
        return new UnsupportedMethod(MethodKind.SCHEMA_CONSTRAINED.methodName(), reason);
    }
}
