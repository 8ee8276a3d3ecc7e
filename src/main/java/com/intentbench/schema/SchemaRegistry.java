package com.intentbench.schema;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable set of named output contracts. Built once and shared by reference; lookups are
 * safe from any thread.
 */
public final class SchemaRegistry {
    public static final String DEFAULT_SCHEMA = "optimized";
    public static final String AUTO = "auto";

    private static final List<String> NL_TYPES = List.of("prompt", "workflow");

    private final Map<String, Schema> schemas;
    private final List<String> order;

    public SchemaRegistry(Collection<Schema> schemas) {
        Map<String, Schema> byName = new LinkedHashMap<>();
        for (Schema schema : schemas) {
            String key = normalize(schema.name());
            if (byName.putIfAbsent(key, schema) != null) {
                throw new IllegalArgumentException("Duplicate schema name: " + schema.name());
            }
        }
        this.schemas = Map.copyOf(byName);
        this.order = List.copyOf(byName.keySet());
    }

    public static SchemaRegistry builtIn() {
        FieldSpec type = FieldSpec.oneOf("type", NL_TYPES,
                "Classification: prompt (single-step request) or workflow (multi-step task)");
        FieldSpec confidence = FieldSpec.number("confidence", 0.0, 1.0, "Confidence score from 0.0 to 1.0");
        FieldSpec reasoning = FieldSpec.string("reasoning", "Brief explanation of the classification");

        Schema minimal = new Schema(
                "minimal",
                ComplexityLevel.MINIMAL,
                "Type and confidence only, optimized for speed",
                "1.0.0",
                List.of(type, confidence),
                new SchemaProfile(0.75, 200, 0.98, List.of("development", "high-throughput", "simple-models")));

        Schema standard = new Schema(
                "standard",
                ComplexityLevel.STANDARD,
                "Type, confidence and reasoning",
                "1.0.0",
                List.of(type, confidence, reasoning),
                new SchemaProfile(0.85, 350, 0.95, List.of("production", "general-purpose", "function-calling-models")));

        Schema detailed = new Schema(
                "detailed",
                ComplexityLevel.DETAILED,
                "Comprehensive output with indicators and complexity scoring",
                "1.0.0",
                List.of(
                        type,
                        confidence,
                        FieldSpec.boundedString("reasoning", null, 200, "Detailed reasoning for the classification"),
                        FieldSpec.stringArray("indicators", "Signals that influenced the classification"),
                        FieldSpec.number("complexity_score", 1.0, 5.0, "Task complexity rating: 1=simple, 5=very complex")),
                new SchemaProfile(0.92, 500, 0.88, List.of("analysis", "debugging", "research", "high-accuracy-requirements")));

        Schema optimized = new Schema(
                "optimized",
                ComplexityLevel.OPTIMIZED,
                "Balances accuracy, speed and parsing reliability",
                "1.0.0",
                List.of(
                        type,
                        confidence,
                        FieldSpec.boundedString("reasoning", 10, 100, "Concise reasoning for this classification"),
                        FieldSpec.integer("task_steps", 1.0, "Estimated number of steps required")),
                new SchemaProfile(0.89, 320, 0.94, List.of("production", "recommended-default", "balanced-performance")));

        Schema contextAware = new Schema(
                "context-aware",
                ComplexityLevel.CONTEXT_AWARE,
                "Conversation context and task coordination analysis",
                "1.0.0",
                List.of(
                        type,
                        confidence,
                        reasoning,
                        FieldSpec.oneOf("conversation_context",
                                List.of("greeting", "question", "follow_up", "task_request", "multi_step"),
                                "greeting, question and follow_up are prompts; task_request and multi_step may be workflows"),
                        FieldSpec.integer("step_count", 1.0, "Estimated number of steps (1=prompt, 2+=workflow)"),
                        FieldSpec.bool("requires_coordination", "Whether multiple tools or services must be coordinated")),
                new SchemaProfile(0.75, 450, 0.92, List.of("workflow-detection-improvement", "research", "conversational-ai")));

        return new SchemaRegistry(List.of(minimal, standard, detailed, optimized, contextAware));
    }

    public Optional<Schema> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(schemas.get(normalize(name)));
    }

    public Schema require(String name) {
        return find(name).orElseThrow(() -> new IllegalArgumentException(
                "Unknown schema '" + name + "'. Available: " + String.join(", ", names())));
    }

    /**
     * Looks up a schema by name first, then by complexity label. {@value #AUTO} picks the
     * balanced optimum.
     */
    public Optional<Schema> resolve(String nameOrLevel) {
        if (nameOrLevel == null) {
            return Optional.empty();
        }
        Optional<Schema> named = find(nameOrLevel);
        if (named.isPresent()) {
            return named;
        }
        if (normalize(nameOrLevel).equals(AUTO)) {
            return Optional.of(selectOptimal(SchemaSelectionCriteria.balanced()));
        }
        return ComplexityLevel.fromLabel(nameOrLevel).flatMap(this::byComplexity);
    }

    public Optional<Schema> byComplexity(ComplexityLevel level) {
        return all().stream().filter(schema -> schema.complexityLevel() == level).findFirst();
    }

    public List<Schema> all() {
        List<Schema> ordered = new ArrayList<>(order.size());
        for (String key : order) {
            ordered.add(schemas.get(key));
        }
        return ordered;
    }

    public List<String> names() {
        return all().stream().map(Schema::name).toList();
    }

    public Schema selectOptimal(SchemaSelectionCriteria criteria) {
        List<Schema> candidates = all();
        if (criteria.useCase() != null) {
            candidates = candidates.stream()
                    .filter(schema -> schema.profile().recommendedFor().contains(criteria.useCase()))
                    .toList();
        }
        if (criteria.maxLatencyMs() != null) {
            candidates = candidates.stream()
                    .filter(schema -> schema.profile().baselineLatencyMs() <= criteria.maxLatencyMs())
                    .toList();
        }
        if (criteria.minAccuracy() != null) {
            candidates = candidates.stream()
                    .filter(schema -> schema.profile().baselineAccuracy() >= criteria.minAccuracy())
                    .toList();
        }
        List<Schema> pool = candidates.isEmpty() ? all() : candidates;

        if (criteria.prioritizeSpeed()) {
            return pool.stream()
                    .min(Comparator.comparingLong(schema -> schema.profile().baselineLatencyMs()))
                    .orElseThrow();
        }
        if (criteria.prioritizeAccuracy()) {
            return pool.stream()
                    .max(Comparator.comparingDouble(schema -> schema.profile().baselineAccuracy()))
                    .orElseThrow();
        }
        return pool.stream().filter(schema -> schema.name().equals(DEFAULT_SCHEMA)).findFirst()
                .or(() -> pool.stream().filter(schema -> schema.name().equals("standard")).findFirst())
                .orElse(pool.get(0));
    }

    static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
