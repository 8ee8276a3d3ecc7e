package com.intentbench.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.intentbench.classifier.MethodKind;
import com.intentbench.classifier.MethodSettings;

/**
 * Turns the Jackson-bound classifier section into validated {@link MethodSettings}. Invalid
 * values throw {@link IllegalArgumentException}; unknown method names resolve to empty.
 */
public class MethodSettingsResolver {
    private static final Logger log = LoggerFactory.getLogger(MethodSettingsResolver.class);
    private static final List<String> DEFAULT_ENSEMBLE_MEMBERS = List.of("rule-based", "schema-constrained", "hybrid");

    private final AppConfig.ClassifierConfig classifier;
    private final String baseUrl;
    private final double temperature;
    private final long timeoutMs;
    private final String schemaName;

    public MethodSettingsResolver(AppConfig.ClassifierConfig classifier) {
        this(classifier,
                classifier.getLlm().getBaseUrl(),
                classifier.getLlm().getTemperature(),
                classifier.getLlm().getTimeoutMs(),
                classifier.getSchemaName());
    }

    private MethodSettingsResolver(
            AppConfig.ClassifierConfig classifier,
            String baseUrl,
            double temperature,
            long timeoutMs,
            String schemaName) {
        this.classifier = classifier;
        this.baseUrl = baseUrl;
        this.temperature = temperature;
        this.timeoutMs = timeoutMs;
        this.schemaName = schemaName;
    }

    /**
     * Resolver for evaluation runs: the evaluation section's endpoint, temperature, timeout and
     * schema override the classifier's where set.
     */
    public static MethodSettingsResolver forEvaluation(AppConfig config) {
        AppConfig.ClassifierConfig classifier = config.getClassifier();
        AppConfig.EvaluationLlmConfig overrides = config.getEvaluation().getLlm();
        String evaluationSchema = config.getEvaluation().getSchema().getName();
        return new MethodSettingsResolver(
                classifier,
                overrides.getBaseUrl() != null ? overrides.getBaseUrl() : classifier.getLlm().getBaseUrl(),
                overrides.getTemperature() != null ? overrides.getTemperature() : classifier.getLlm().getTemperature(),
                overrides.getTimeoutMs() != null ? overrides.getTimeoutMs() : classifier.getLlm().getTimeoutMs(),
                evaluationSchema != null && !evaluationSchema.isBlank() ? evaluationSchema : classifier.getSchemaName());
    }

    public Optional<MethodSettings> resolve(String methodName) {
        Optional<MethodKind> kind = MethodKind.fromName(methodName);
        if (kind.isEmpty()) {
            log.warn("config.method.unknown method={}", methodName);
            return Optional.empty();
        }
        return Optional.of(resolve(kind.get()));
    }

    public MethodSettings resolve(MethodKind kind) {
        return switch (kind) {
            case RULE_BASED -> ruleBased();
            case SCHEMA_CONSTRAINED -> schemaConstrained(null, null, null);
            case HYBRID -> hybrid(null, null, null);
            case ENSEMBLE -> ensemble();
        };
    }

    public MethodSettings.RuleBased ruleBased() {
        AppConfig.RuleConfig rules = classifier.getRules();
        return new MethodSettings.RuleBased(
                rules.getCommandPrefix(),
                rules.getPromptIndicators(),
                rules.getWorkflowIndicators(),
                rules.getDefaultConfidence());
    }

    private MethodSettings.SchemaConstrained schemaConstrained(String model, Double memberTemperature, String memberSchema) {
        AppConfig.LlmConfig llm = classifier.getLlm();
        return new MethodSettings.SchemaConstrained(
                baseUrl,
                model != null && !model.isBlank() ? model : llm.getModelId(),
                memberTemperature != null ? memberTemperature : temperature,
                llm.getMaxTokens(),
                memberSchema != null && !memberSchema.isBlank() ? memberSchema : schemaName,
                timeoutMs,
                llm.getMaxRetries(),
                llm.getRetryBackoffMs());
    }

    private MethodSettings.Hybrid hybrid(String model, Double memberTemperature, String memberSchema) {
        return new MethodSettings.Hybrid(
                ruleBased(),
                schemaConstrained(model, memberTemperature, memberSchema),
                classifier.getConfidenceThreshold());
    }

    private MethodSettings.Ensemble ensemble() {
        AppConfig.EnsembleConfig ensemble = classifier.getEnsemble();
        List<AppConfig.EnsembleMemberConfig> configured = ensemble.getMembers();
        if (configured.isEmpty()) {
            configured = DEFAULT_ENSEMBLE_MEMBERS.stream()
                    .map(method -> new AppConfig.EnsembleMemberConfig(method, null))
                    .toList();
        }

        List<MethodSettings> members = new ArrayList<>(configured.size());
        for (AppConfig.EnsembleMemberConfig member : configured) {
            MethodKind kind = MethodKind.fromName(member.getMethod())
                    .orElseThrow(() -> new IllegalArgumentException("Unknown ensemble member method: " + member.getMethod()));
            members.add(switch (kind) {
                case RULE_BASED -> ruleBased();
                case SCHEMA_CONSTRAINED -> schemaConstrained(member.getModel(), member.getTemperature(), member.getSchemaName());
                case HYBRID -> hybrid(member.getModel(), member.getTemperature(), member.getSchemaName());
                case ENSEMBLE -> throw new IllegalArgumentException("Ensemble members cannot themselves be ensembles");
            });
        }
        return new MethodSettings.Ensemble(members, ensemble.getQuorum(), ensemble.getTimeoutMs(), ensemble.isShortCircuitOnQuorum());
    }
}
