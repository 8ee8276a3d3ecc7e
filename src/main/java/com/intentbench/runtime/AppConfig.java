package com.intentbench.runtime;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private ClassifierConfig classifier = new ClassifierConfig();
    private EvaluationConfig evaluation = new EvaluationConfig();

    public ClassifierConfig getClassifier() {
        return classifier;
    }

    public void setClassifier(ClassifierConfig classifier) {
        this.classifier = classifier == null ? new ClassifierConfig() : classifier;
    }

    public EvaluationConfig getEvaluation() {
        return evaluation;
    }

    public void setEvaluation(EvaluationConfig evaluation) {
        this.evaluation = evaluation == null ? new EvaluationConfig() : evaluation;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ClassifierConfig {
        private String method = "rule-based";
        private String schemaName = "optimized";
        private double confidenceThreshold = 0.8;
        private LlmConfig llm = new LlmConfig();
        private RuleConfig rules = new RuleConfig();
        private EnsembleConfig ensemble = new EnsembleConfig();

        public String getMethod() {
            return method;
        }

        public void setMethod(String method) {
            this.method = method == null ? "rule-based" : method;
        }

        public String getSchemaName() {
            return schemaName;
        }

        public void setSchemaName(String schemaName) {
            this.schemaName = schemaName == null ? "optimized" : schemaName;
        }

        public double getConfidenceThreshold() {
            return confidenceThreshold;
        }

        public void setConfidenceThreshold(double confidenceThreshold) {
            this.confidenceThreshold = confidenceThreshold;
        }

        public LlmConfig getLlm() {
            return llm;
        }

        public void setLlm(LlmConfig llm) {
            this.llm = llm == null ? new LlmConfig() : llm;
        }

        public RuleConfig getRules() {
            return rules;
        }

        public void setRules(RuleConfig rules) {
            this.rules = rules == null ? new RuleConfig() : rules;
        }

        public EnsembleConfig getEnsemble() {
            return ensemble;
        }

        public void setEnsemble(EnsembleConfig ensemble) {
            this.ensemble = ensemble == null ? new EnsembleConfig() : ensemble;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LlmConfig {
        private String baseUrl = "http://localhost:11434";
        private String modelId = "llama3.2:3b";
        private double temperature = 0.1;
        private int maxTokens = 1000;
        private long timeoutMs = 30_000;
        private int maxRetries = 2;
        private long retryBackoffMs = 500;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getModelId() {
            return modelId;
        }

        public void setModelId(String modelId) {
            this.modelId = modelId;
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }

        public int getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
        }

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public long getRetryBackoffMs() {
            return retryBackoffMs;
        }

        public void setRetryBackoffMs(long retryBackoffMs) {
            this.retryBackoffMs = retryBackoffMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RuleConfig {
        private String commandPrefix = "/";
        private List<String> promptIndicators;
        private List<String> workflowIndicators;
        private double defaultConfidence = 0.5;

        public String getCommandPrefix() {
            return commandPrefix;
        }

        public void setCommandPrefix(String commandPrefix) {
            this.commandPrefix = commandPrefix == null ? "/" : commandPrefix;
        }

        public List<String> getPromptIndicators() {
            return promptIndicators;
        }

        public void setPromptIndicators(List<String> promptIndicators) {
            this.promptIndicators = promptIndicators;
        }

        public List<String> getWorkflowIndicators() {
            return workflowIndicators;
        }

        public void setWorkflowIndicators(List<String> workflowIndicators) {
            this.workflowIndicators = workflowIndicators;
        }

        public double getDefaultConfidence() {
            return defaultConfidence;
        }

        public void setDefaultConfidence(double defaultConfidence) {
            this.defaultConfidence = defaultConfidence;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EnsembleConfig {
        private List<EnsembleMemberConfig> members = new ArrayList<>();
        private int quorum;
        private long timeoutMs = 60_000;
        private boolean shortCircuitOnQuorum = true;

        public List<EnsembleMemberConfig> getMembers() {
            return members;
        }

        public void setMembers(List<EnsembleMemberConfig> members) {
            this.members = members == null ? new ArrayList<>() : members;
        }

        public int getQuorum() {
            return quorum;
        }

        public void setQuorum(int quorum) {
            this.quorum = quorum;
        }

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public boolean isShortCircuitOnQuorum() {
            return shortCircuitOnQuorum;
        }

        public void setShortCircuitOnQuorum(boolean shortCircuitOnQuorum) {
            this.shortCircuitOnQuorum = shortCircuitOnQuorum;
        }
    }

    /**
     * One ensemble member. Unset fields inherit from the classifier section.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EnsembleMemberConfig {
        private String method;
        private String model;
        private Double temperature;
        private String schemaName;

        public EnsembleMemberConfig() {
        }

        public EnsembleMemberConfig(String method, String model) {
            this.method = method;
            this.model = model;
        }

        public String getMethod() {
            return method;
        }

        public void setMethod(String method) {
            this.method = method;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public Double getTemperature() {
            return temperature;
        }

        public void setTemperature(Double temperature) {
            this.temperature = temperature;
        }

        public String getSchemaName() {
            return schemaName;
        }

        public void setSchemaName(String schemaName) {
            this.schemaName = schemaName;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EvaluationConfig {
        private List<String> models = new ArrayList<>(List.of("llama3.2:3b"));
        private List<String> methods = new ArrayList<>(List.of("rule-based"));
        private String dataPath = "src/main/resources/datasets/sample-intents.json";
        private EvaluationLlmConfig llm = new EvaluationLlmConfig();
        private SchemaConfig schema = new SchemaConfig();
        private int batchSize = 5;
        private Integer sampleLimit;
        private String artifactsDir = "artifacts/evaluations";

        public List<String> getModels() {
            return models;
        }

        public void setModels(List<String> models) {
            this.models = models == null ? new ArrayList<>() : models;
        }

        public List<String> getMethods() {
            return methods;
        }

        public void setMethods(List<String> methods) {
            this.methods = methods == null ? new ArrayList<>() : methods;
        }

        public String getDataPath() {
            return dataPath;
        }

        public void setDataPath(String dataPath) {
            this.dataPath = dataPath;
        }

        public EvaluationLlmConfig getLlm() {
            return llm;
        }

        public void setLlm(EvaluationLlmConfig llm) {
            this.llm = llm == null ? new EvaluationLlmConfig() : llm;
        }

        public SchemaConfig getSchema() {
            return schema;
        }

        public void setSchema(SchemaConfig schema) {
            this.schema = schema == null ? new SchemaConfig() : schema;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public Integer getSampleLimit() {
            return sampleLimit;
        }

        public void setSampleLimit(Integer sampleLimit) {
            this.sampleLimit = sampleLimit;
        }

        public String getArtifactsDir() {
            return artifactsDir;
        }

        public void setArtifactsDir(String artifactsDir) {
            this.artifactsDir = artifactsDir;
        }
    }

    /**
     * Evaluation-time overrides of the classifier's model endpoint. Null keeps the classifier value.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EvaluationLlmConfig {
        private String baseUrl;
        private Double temperature;
        private Long timeoutMs;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public Double getTemperature() {
            return temperature;
        }

        public void setTemperature(Double temperature) {
            this.temperature = temperature;
        }

        public Long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(Long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SchemaConfig {
        private String name;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }
    }
}
