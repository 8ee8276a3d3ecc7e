package com.intentbench.evaluation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.intentbench.classifier.ClassificationError;
import com.intentbench.classifier.ClassificationMethod;
import com.intentbench.classifier.ErrorKind;
import com.intentbench.classifier.MethodResult;
import com.intentbench.classifier.UnsupportedMethod;

/**
 * Runs every sample of a dataset through every model/method configuration and reports the
 * results. A harness performs a single run; its {@link #state()} follows
 * {@code LOADING -> RUNNING -> REPORTING -> DONE}, or {@code LOADING -> FAILED} when the
 * dataset cannot be loaded.
 */
public class EvaluationHarness {
    private static final Logger log = LoggerFactory.getLogger(EvaluationHarness.class);
    private static final DateTimeFormatter RUN_ID_FORMATTER = DateTimeFormatter.ofPattern("yyyyMMddHHmmss", Locale.ROOT)
            .withZone(ZoneOffset.UTC);

    private final MethodProvider methods;
    private final DatasetLoader datasetLoader;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private volatile RunState state = RunState.LOADING;
    private boolean started;

    public EvaluationHarness(MethodProvider methods) {
        this(methods, new DatasetLoader(), new ObjectMapper(), Clock.systemUTC());
    }

    EvaluationHarness(MethodProvider methods, DatasetLoader datasetLoader, ObjectMapper objectMapper, Clock clock) {
        this.methods = methods;
        this.datasetLoader = datasetLoader;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public RunState state() {
        return state;
    }

    public synchronized EvaluationRun run(EvaluationPlan plan) throws IOException {
        if (started) {
            throw new IllegalStateException("An evaluation harness performs a single run");
        }
        started = true;

        TestDataset dataset;
        try {
            dataset = datasetLoader.load(plan.dataPath());
        } catch (DatasetLoadException e) {
            state = RunState.FAILED;
            log.error("evaluation.dataset.failed path={} reason={}", plan.dataPath(), e.getMessage());
            throw e;
        }
        if (plan.sampleLimit() != null) {
            dataset = dataset.limit(plan.sampleLimit());
        }

        state = RunState.RUNNING;
        log.info("evaluation.start models={} methods={} samples={} batchSize={} totalTests={}",
                plan.models(), plan.methods(), dataset.size(), plan.batchSize(),
                plan.models().size() * plan.methods().size() * dataset.size());
        List<EvaluationOutcome> outcomes = new ArrayList<>();
        ExecutorService pool = Executors.newFixedThreadPool(plan.batchSize());
        try {
            for (String model : plan.models()) {
                for (String methodName : plan.methods()) {
                    runConfiguration(pool, plan.batchSize(), model, methodName, dataset.samples(), outcomes);
                }
            }
        } finally {
            pool.shutdownNow();
        }

        state = RunState.REPORTING;
        AccuracyMetrics metrics = MetricsCalculator.calculate(outcomes);
        Map<String, AccuracyMetrics> byConfiguration = MetricsCalculator.byConfiguration(outcomes);
        String report = EvaluationReporter.render(new EvaluationReporter.ReportInput(
                plan.dataPath().toString(),
                plan.models(),
                plan.methods(),
                plan.schemaName(),
                dataset.size(),
                outcomes));
        Path runDirectory = plan.artifactsDir() == null
                ? null
                : writeArtifacts(plan, dataset, outcomes, metrics, byConfiguration, report);

        state = RunState.DONE;
        log.info("evaluation.done totalTests={} accuracy={} errors={} artifacts={}",
                metrics.totalTests(),
                String.format(Locale.ROOT, "%.1f", metrics.accuracyRate()),
                metrics.errors(),
                runDirectory == null ? "none" : runDirectory);
        return new EvaluationRun(dataset.metadata(), outcomes, metrics, byConfiguration, report, runDirectory);
    }

    private void runConfiguration(
            ExecutorService pool,
            int batchSize,
            String model,
            String methodName,
            List<TestSample> samples,
            List<EvaluationOutcome> outcomes) {
        long start = System.nanoTime();
        try (ClassificationMethod method = createMethod(model, methodName)) {
            for (int from = 0; from < samples.size(); from += batchSize) {
                List<TestSample> batch = samples.subList(from, Math.min(samples.size(), from + batchSize));
                List<Future<EvaluationOutcome>> futures = new ArrayList<>(batch.size());
                for (TestSample sample : batch) {
                    futures.add(pool.submit(() -> classify(method, model, methodName, sample)));
                }
                for (int i = 0; i < futures.size(); i++) {
                    outcomes.add(collect(futures.get(i), model, methodName, batch.get(i)));
                }
            }
        }
        log.info("evaluation.configuration model={} method={} samples={} elapsedMs={}",
                model, methodName, samples.size(), (System.nanoTime() - start) / 1_000_000);
    }

    private ClassificationMethod createMethod(String model, String methodName) {
        try {
            return methods.create(methodName, model);
        } catch (RuntimeException e) {
            log.error("evaluation.method.unavailable model={} method={} reason={}", model, methodName, e.toString());
            return new UnsupportedMethod(methodName, "Method '" + methodName + "' could not be built: " + e.getMessage());
        }
    }

    private static EvaluationOutcome classify(ClassificationMethod method, String model, String methodName, TestSample sample) {
        long start = System.nanoTime();
        MethodResult result;
        try {
            result = method.classify(sample.input());
        } catch (RuntimeException e) {
            log.error("evaluation.sample.failed model={} method={} sample={} reason={}", model, methodName, sample.id(), e.toString());
            result = MethodResult.failure(ErrorKind.UNEXPECTED, e.toString(), methodName);
        }
        return EvaluationOutcome.of(model, methodName, sample, result, (System.nanoTime() - start) / 1_000_000);
    }

    private static EvaluationOutcome collect(Future<EvaluationOutcome> future, String model, String methodName, TestSample sample) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            return errorOutcome(model, methodName, sample, String.valueOf(e.getCause()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return errorOutcome(model, methodName, sample, "Evaluation interrupted");
        }
    }

    private static EvaluationOutcome errorOutcome(String model, String methodName, TestSample sample, String message) {
        return new EvaluationOutcome(model, methodName, sample, null,
                ClassificationError.of(ErrorKind.UNEXPECTED, message, methodName), 0L);
    }

    private Path writeArtifacts(
            EvaluationPlan plan,
            TestDataset dataset,
            List<EvaluationOutcome> outcomes,
            AccuracyMetrics metrics,
            Map<String, AccuracyMetrics> byConfiguration,
            String report) throws IOException {
        Files.createDirectories(plan.artifactsDir());
        String runId = "run-" + RUN_ID_FORMATTER.format(clock.instant());
        Path runDirectory = plan.artifactsDir().resolve(runId);
        Files.createDirectories(runDirectory);

        objectMapper.writerWithDefaultPrettyPrinter().writeValue(runDirectory.resolve("outcomes.json").toFile(), outcomes);
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(
                runDirectory.resolve("metrics-summary.json").toFile(),
                new MetricsSummary(
                        plan.dataPath().toString(),
                        plan.models(),
                        plan.methods(),
                        plan.schemaName(),
                        dataset.size(),
                        metrics,
                        byConfiguration,
                        MetricsCalculator.classQuality(outcomes),
                        MetricsCalculator.wilsonInterval(metrics.correct(), metrics.totalTests()),
                        MetricsCalculator.errorBreakdown(outcomes)));
        Files.writeString(runDirectory.resolve("report.txt"), report);
        return runDirectory;
    }

    public record EvaluationRun(
            TestDataset.Metadata datasetMetadata,
            List<EvaluationOutcome> outcomes,
            AccuracyMetrics metrics,
            Map<String, AccuracyMetrics> byConfiguration,
            String report,
            Path artifactDirectory) {
    }

    public record MetricsSummary(
            String dataPath,
            List<String> models,
            List<String> methods,
            String schemaName,
            int samples,
            AccuracyMetrics overall,
            Map<String, AccuracyMetrics> byConfiguration,
            ClassQualityMetrics classQuality,
            ConfidenceInterval accuracyInterval,
            List<ErrorFrequency> errors) {
    }
}
