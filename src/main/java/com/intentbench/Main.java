package com.intentbench;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.intentbench.classifier.ClassificationMethod;
import com.intentbench.classifier.ClassificationMethodFactory;
import com.intentbench.classifier.ClassificationResult;
import com.intentbench.classifier.MethodResult;
import com.intentbench.evaluation.DatasetLoadException;
import com.intentbench.evaluation.EvaluationHarness;
import com.intentbench.evaluation.EvaluationPlan;
import com.intentbench.oracle.InferenceOracles;
import com.intentbench.oracle.OracleProvider;
import com.intentbench.runtime.AppConfig;
import com.intentbench.runtime.AppConfigLoader;
import com.intentbench.runtime.ConfiguredMethodProvider;
import com.intentbench.runtime.MethodSettingsResolver;
import com.intentbench.schema.Schema;
import com.intentbench.schema.SchemaRegistry;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "intent-bench",
        mixinStandardHelpOptions = true,
        version = "intent-bench 0.1.0",
        description = "Classifies inputs as command, prompt or workflow and benchmarks classification methods.")
public class Main implements Callable<Integer> {
    static final int EXIT_OK = 0;
    static final int EXIT_DATASET_FAILURE = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_CLASSIFICATION_FAILURE = 3;

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    String configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "classify")
    Mode mode;

    @Option(names = { "-i", "--input" }, description = "Text to classify in classify mode")
    String input;

    @Option(names = { "-m", "--method" }, description = "Classification method (rule-based, schema-constrained, hybrid, ensemble); defaults to the configured method")
    String method;

    @Option(names = "--model", description = "Model id overriding the configured one")
    String model;

    @Option(names = "--dataset", description = "Dataset JSON overriding evaluation.dataPath")
    Path dataset;

    @Option(names = "--artifacts-dir", description = "Directory for evaluation run artifacts overriding evaluation.artifactsDir")
    Path artifactsDir;

    @Option(names = "--sample-limit", description = "Evaluate at most this many samples")
    Integer sampleLimit;

    private final ObjectMapper mapper = new ObjectMapper();
    private final OracleProvider oracleOverride;

    enum Mode {
        classify,
        evaluate,
        schemas
    }

    public Main() {
        this(null);
    }

    Main(OracleProvider oracleOverride) {
        this.oracleOverride = oracleOverride;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config;
        try {
            config = AppConfigLoader.load(Path.of(configPath));
        } catch (IOException e) {
            log.error("config.load.failed path={} reason={}", configPath, e.getMessage());
            return EXIT_USAGE;
        }
        log.info("Starting intent-bench in {} mode", mode);
        log.info("Using config file: {}", configPath);

        SchemaRegistry registry = SchemaRegistry.builtIn();
        OracleProvider oracles = oracleOverride != null
                ? oracleOverride
                : InferenceOracles.ollama(InferenceOracles.httpClient(config.getClassifier().getLlm().getTimeoutMs()));
        ClassificationMethodFactory factory = new ClassificationMethodFactory(registry, oracles);

        try {
            return switch (mode) {
                case classify -> runClassify(config, factory);
                case evaluate -> runEvaluate(config, factory);
                case schemas -> runSchemas(registry);
            };
        } catch (IllegalArgumentException e) {
            log.error("config.invalid reason={}", e.getMessage());
            return EXIT_USAGE;
        }
    }

    private int runClassify(AppConfig config, ClassificationMethodFactory factory) throws Exception {
        if (input == null) {
            log.error("--input is required in classify mode");
            return EXIT_USAGE;
        }
        String methodName = method == null || method.isBlank() ? config.getClassifier().getMethod() : method;
        ConfiguredMethodProvider provider = new ConfiguredMethodProvider(
                new MethodSettingsResolver(config.getClassifier()), factory);

        MethodResult outcome;
        try (ClassificationMethod classificationMethod = provider.build(methodName, model)) {
            outcome = classificationMethod.classify(input);
        }
        if (outcome.isFailure()) {
            log.error("classify.failed method={} error={}", methodName, outcome.error().describe());
            System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(outcome.error()));
            return EXIT_CLASSIFICATION_FAILURE;
        }
        ClassificationResult result = outcome.result();
        log.info("classify.result method={} type={} confidence={} latencyMs={}",
                result.methodTag(), result.type(), String.format(Locale.ROOT, "%.2f", result.confidence()), result.latencyMs());
        System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(result));
        return EXIT_OK;
    }

    private int runEvaluate(AppConfig config, ClassificationMethodFactory factory) throws Exception {
        AppConfig.EvaluationConfig evaluation = config.getEvaluation();
        List<String> methods = method == null || method.isBlank() ? evaluation.getMethods() : List.of(method);
        List<String> models = model == null || model.isBlank() ? evaluation.getModels() : List.of(model);
        Path dataPath = dataset != null ? dataset : Path.of(evaluation.getDataPath());
        Path artifacts = artifactsDir != null
                ? artifactsDir
                : evaluation.getArtifactsDir() == null || evaluation.getArtifactsDir().isBlank() ? null : Path.of(evaluation.getArtifactsDir());
        Integer limit = sampleLimit != null ? sampleLimit : evaluation.getSampleLimit();

        MethodSettingsResolver resolver = MethodSettingsResolver.forEvaluation(config);
        String schemaName = evaluation.getSchema().getName() != null ? evaluation.getSchema().getName() : config.getClassifier().getSchemaName();
        EvaluationPlan plan = new EvaluationPlan(models, methods, dataPath, schemaName, evaluation.getBatchSize(), limit, artifacts);
        EvaluationHarness harness = new EvaluationHarness(new ConfiguredMethodProvider(resolver, factory));
        try {
            EvaluationHarness.EvaluationRun run = harness.run(plan);
            System.out.println(run.report());
            if (run.artifactDirectory() != null) {
                log.info("evaluation.artifacts path={}", run.artifactDirectory());
            }
            return EXIT_OK;
        } catch (DatasetLoadException e) {
            log.error("evaluation.failed state={} reason={}", harness.state(), e.getMessage());
            return EXIT_DATASET_FAILURE;
        }
    }

    private int runSchemas(SchemaRegistry registry) {
        for (Schema schema : registry.all()) {
            System.out.printf(Locale.ROOT, "%-14s %-13s accuracy~%.2f latency~%dms fields=%s%n",
                    schema.name(),
                    schema.complexityLevel().label(),
                    schema.profile().baselineAccuracy(),
                    schema.profile().baselineLatencyMs(),
                    String.join(",", schema.fields().stream().map(field -> field.name()).toList()));
        }
        return EXIT_OK;
    }
}
