package com.intentbench.classifier;

import java.util.List;

/**
 * Validated, immutable configuration for one classification method. The set of variants is
 * closed; {@link ClassificationMethodFactory} switches over {@link #kind()} exhaustively.
 */
public sealed interface MethodSettings {

    MethodKind kind();

    /**
     * Returns a copy in which every model-backed stage uses {@code modelId}. Rule-based
     * settings have no model and are returned unchanged.
     */
    MethodSettings withModel(String modelId);

    record RuleBased(
            String commandPrefix,
            List<String> promptIndicators,
            List<String> workflowIndicators,
            double defaultConfidence) implements MethodSettings {

        public static final List<String> DEFAULT_PROMPT_INDICATORS = List.of(
                "hi", "hello", "thanks", "what", "how", "why", "when",
                "can you", "could you", "please", "explain");

        public static final List<String> DEFAULT_WORKFLOW_INDICATORS = List.of(
                "fix", "create", "refactor", "implement", "debug", "analyze", "build", "design",
                "test", "deploy", "find", "search", "book", "reserve", "schedule", "add", "remove",
                "delete", "update", "change", "set", "configure", "install", "setup");

        public RuleBased {
            if (commandPrefix == null || commandPrefix.isBlank()) {
                throw new IllegalArgumentException("commandPrefix must not be blank");
            }
            if (defaultConfidence < 0.0 || defaultConfidence > 1.0) {
                throw new IllegalArgumentException("defaultConfidence must be within [0, 1]");
            }
            promptIndicators = List.copyOf(promptIndicators == null ? DEFAULT_PROMPT_INDICATORS : promptIndicators);
            workflowIndicators = List.copyOf(workflowIndicators == null ? DEFAULT_WORKFLOW_INDICATORS : workflowIndicators);
        }

        public static RuleBased defaults() {
            return new RuleBased("/", DEFAULT_PROMPT_INDICATORS, DEFAULT_WORKFLOW_INDICATORS, 0.5);
        }

        @Override
        public MethodKind kind() {
            return MethodKind.RULE_BASED;
        }

        @Override
        public MethodSettings withModel(String modelId) {
            return this;
        }
    }

    record SchemaConstrained(
            String baseUrl,
            String modelId,
            double temperature,
            int maxTokens,
            String schemaName,
            long timeoutMs,
            int maxRetries,
            long retryBackoffMs) implements MethodSettings {

        public SchemaConstrained {
            if (baseUrl == null || baseUrl.isBlank()) {
                throw new IllegalArgumentException("baseUrl must not be blank");
            }
            if (modelId == null || modelId.isBlank()) {
                throw new IllegalArgumentException("modelId must not be blank");
            }
            if (schemaName == null || schemaName.isBlank()) {
                throw new IllegalArgumentException("schemaName must not be blank");
            }
            if (temperature < 0.0) {
                throw new IllegalArgumentException("temperature must be >= 0");
            }
            if (maxTokens <= 0) {
                throw new IllegalArgumentException("maxTokens must be > 0");
            }
            if (timeoutMs <= 0) {
                throw new IllegalArgumentException("timeoutMs must be > 0");
            }
            if (maxRetries < 0 || retryBackoffMs < 0) {
                throw new IllegalArgumentException("retry settings must be >= 0");
            }
        }

        @Override
        public MethodKind kind() {
            return MethodKind.SCHEMA_CONSTRAINED;
        }

        @Override
        public SchemaConstrained withModel(String modelId) {
            return new SchemaConstrained(baseUrl, modelId, temperature, maxTokens, schemaName, timeoutMs, maxRetries, retryBackoffMs);
        }
    }

    record Hybrid(
            RuleBased rules,
            SchemaConstrained model,
            double confidenceThreshold) implements MethodSettings {

        public Hybrid {
            if (rules == null || model == null) {
                throw new IllegalArgumentException("hybrid requires rule-based and model settings");
            }
            if (confidenceThreshold < 0.0 || confidenceThreshold > 1.0) {
                throw new IllegalArgumentException("confidenceThreshold must be within [0, 1]");
            }
        }

        @Override
        public MethodKind kind() {
            return MethodKind.HYBRID;
        }

        @Override
        public MethodSettings withModel(String modelId) {
            return new Hybrid(rules, model.withModel(modelId), confidenceThreshold);
        }
    }

    /**
     * @param members sub-methods in priority order (first wins remaining ties)
     * @param quorum minimum successful members; {@code 0} selects a simple majority
     * @param timeoutMs overall deadline for all members
     */
    record Ensemble(
            List<MethodSettings> members,
            int quorum,
            long timeoutMs,
            boolean shortCircuitOnQuorum) implements MethodSettings {

        public Ensemble {
            if (members == null || members.isEmpty()) {
                throw new IllegalArgumentException("ensemble requires at least one member");
            }
            members = List.copyOf(members);
            if (quorum < 0 || quorum > members.size()) {
                throw new IllegalArgumentException("quorum must be within [0, " + members.size() + "] but was " + quorum);
            }
            if (timeoutMs <= 0) {
                throw new IllegalArgumentException("ensemble timeoutMs must be > 0");
            }
        }

        public int effectiveQuorum() {
            return quorum > 0 ? quorum : members.size() / 2 + 1;
        }

        @Override
        public MethodKind kind() {
            return MethodKind.ENSEMBLE;
        }

        @Override
        public MethodSettings withModel(String modelId) {
            List<MethodSettings> overridden = members.stream()
                    .map(member -> member.withModel(modelId))
                    .toList();
            return new Ensemble(overridden, quorum, timeoutMs, shortCircuitOnQuorum);
        }
    }
}
