package com.intentbench.classifier;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intentbench.oracle.InferenceOracle;
import com.intentbench.oracle.OracleRequest;
import com.intentbench.schema.Schema;
import com.intentbench.schema.SchemaValidator;

/**
 * Asks an {@link InferenceOracle} for a schema-constrained JSON classification, enforcing a
 * per-call deadline and retrying connection and timeout failures with linear backoff.
 * Commands are recognised locally and never reach the oracle.
 */
public class SchemaConstrainedMethod implements ClassificationMethod {
    static final String TAG = "schema-constrained";

    private static final Logger log = LoggerFactory.getLogger(SchemaConstrainedMethod.class);
    private static final Set<String> CORE_FIELDS = Set.of("type", "confidence", "reasoning");

    private final MethodSettings.SchemaConstrained settings;
    private final Schema schema;
    private final InferenceOracle oracle;
    private final CommandDetector commandDetector;
    private final ObjectMapper mapper;
    private final ExecutorService executor;

    public SchemaConstrainedMethod(MethodSettings.SchemaConstrained settings, Schema schema, InferenceOracle oracle) {
        if (settings == null || schema == null || oracle == null) {
            throw new IllegalArgumentException("settings, schema and oracle are required");
        }
        this.settings = settings;
        this.schema = schema;
        this.oracle = oracle;
        this.commandDetector = new CommandDetector(CommandDetector.DEFAULT_PREFIX);
        this.mapper = new ObjectMapper();
        this.executor = Executors.newCachedThreadPool(DaemonThreads.named("oracle-call"));
    }

    @Override
    public MethodResult classify(String input, Map<String, String> context) {
        long start = System.nanoTime();
        String trimmed = input == null ? "" : input.trim();

        Optional<ClassificationResult> command = commandDetector.detect(trimmed, TAG);
        if (command.isPresent()) {
            return MethodResult.success(command.get()
                    .withMetadata(Map.of("prefilter", "command"))
                    .withLatency(elapsedMs(start)));
        }

        OracleRequest request = new OracleRequest(
                buildPrompt(trimmed, context),
                schema.toJsonSchema(),
                settings.modelId(),
                settings.temperature(),
                settings.maxTokens());

        int maxAttempts = settings.maxRetries() + 1;
        MethodResult outcome = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            outcome = attempt(request, attempt);
            if (outcome.isSuccess()) {
                return outcome.map(result -> result.withLatency(elapsedMs(start)));
            }
            ClassificationError error = outcome.error();
            if (!error.kind().retryable() || attempt == maxAttempts) {
                return MethodResult.failure(error.withAttempts(attempt));
            }
            long backoff = settings.retryBackoffMs() * attempt;
            log.warn("classifier.retry model={} attempt={} maxAttempts={} backoffMs={} reason={}",
                    settings.modelId(), attempt, maxAttempts, backoff, error.describe());
            if (!sleep(backoff)) {
                return MethodResult.failure(ClassificationError.of(ErrorKind.TIMEOUT, "Interrupted during retry backoff", TAG)
                        .withAttempts(attempt));
            }
        }
        return outcome;
    }

    @Override
    public String methodTag() {
        return TAG;
    }

    public Schema schema() {
        return schema;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private MethodResult attempt(OracleRequest request, int attempt) {
        String raw;
        Future<String> future = executor.submit(() -> oracle.complete(request));
        try {
            raw = future.get(settings.timeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            return MethodResult.failure(ErrorKind.TIMEOUT,
                    "Oracle did not answer within " + settings.timeoutMs() + " ms", TAG);
        } catch (ExecutionException e) {
            return MethodResult.failure(mapCause(e.getCause()));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return MethodResult.failure(ErrorKind.TIMEOUT, "Classification interrupted", TAG);
        }
        return interpret(raw, attempt);
    }

    private ClassificationError mapCause(Throwable cause) {
        if (cause instanceof InterruptedIOException) {
            return ClassificationError.of(ErrorKind.TIMEOUT, String.valueOf(cause.getMessage()), TAG);
        }
        if (cause instanceof IOException) {
            return ClassificationError.of(ErrorKind.CONNECTION, String.valueOf(cause.getMessage()), TAG);
        }
        log.error("classifier.oracle.failure model={} reason={}", settings.modelId(), cause.toString());
        return ClassificationError.of(ErrorKind.UNEXPECTED, cause.toString(), TAG);
    }

    MethodResult interpret(String raw, int attempts) {
        String body = stripCodeFence(raw == null ? "" : raw.trim());
        if (body.isEmpty()) {
            return MethodResult.failure(ErrorKind.PARSE, "Oracle returned an empty response", TAG);
        }

        JsonNode json;
        try {
            json = mapper.readTree(body);
        } catch (JsonProcessingException e) {
            return MethodResult.failure(ErrorKind.PARSE, "Response is not valid JSON: " + e.getOriginalMessage(), TAG);
        }

        List<String> violations = SchemaValidator.validate(schema, json);
        if (!violations.isEmpty()) {
            return MethodResult.failure(ErrorKind.SCHEMA_VALIDATION,
                    "Response violates schema " + schema.name() + ": " + String.join("; ", violations), TAG);
        }

        Optional<IntentType> type = IntentType.fromLabel(json.path("type").asText());
        if (type.isEmpty()) {
            return MethodResult.failure(ErrorKind.SCHEMA_VALIDATION, "Unknown type '" + json.path("type").asText() + "'", TAG);
        }
        double confidence = json.path("confidence").asDouble(Double.NaN);
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            return MethodResult.failure(ErrorKind.SCHEMA_VALIDATION, "Confidence out of range: " + confidence, TAG);
        }

        String reasoning = json.hasNonNull("reasoning")
                ? json.get("reasoning").asText()
                : "Model classification using " + schema.name() + " schema";

        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("schema", schema.name());
        metadata.put("model", settings.modelId());
        metadata.put("attempts", String.valueOf(attempts));
        Iterator<Map.Entry<String, JsonNode>> fields = json.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!CORE_FIELDS.contains(field.getKey())) {
                metadata.put(field.getKey(), render(field.getValue()));
            }
        }
        return MethodResult.success(new ClassificationResult(type.get(), confidence, reasoning, TAG, 0L, metadata));
    }

    String buildPrompt(String input, Map<String, String> context) {
        StringBuilder prompt = new StringBuilder()
                .append("Classify the following user input into one of two categories:\n\n")
                .append("1. prompt - a single-step request, question or conversational message ")
                .append("(e.g. \"hi\", \"what is recursion?\", \"write a function\")\n")
                .append("2. workflow - a multi-step task that needs orchestration, file operations or testing ")
                .append("(e.g. \"fix the bug in auth.js and run tests\")\n\n")
                .append("User input: \"").append(input).append("\"\n");
        if (context != null && !context.isEmpty()) {
            prompt.append("Context: ")
                    .append(context.entrySet().stream()
                            .map(entry -> entry.getKey() + ": " + entry.getValue())
                            .collect(Collectors.joining(" | ")))
                    .append('\n');
        }
        prompt.append("\nRespond with JSON matching the ")
                .append(schema.name())
                .append(" schema. Give a confidence between 0.0 and 1.0 reflecting how clear the classification is.\n")
                .append("Required fields: ")
                .append(String.join(", ", schema.requiredFieldNames()));
        return prompt.toString();
    }

    private static String render(JsonNode value) {
        if (value.isArray()) {
            StringBuilder joined = new StringBuilder();
            for (JsonNode element : value) {
                if (joined.length() > 0) {
                    joined.append(',');
                }
                joined.append(element.asText());
            }
            return joined.toString();
        }
        return value.asText();
    }

    private static String stripCodeFence(String body) {
        if (!body.startsWith("```")) {
            return body;
        }
        int firstNewline = body.indexOf('\n');
        int closing = body.lastIndexOf("```");
        if (firstNewline < 0 || closing <= firstNewline) {
            return body;
        }
        return body.substring(firstNewline + 1, closing).trim();
    }

    private static boolean sleep(long millis) {
        if (millis <= 0) {
            return true;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
