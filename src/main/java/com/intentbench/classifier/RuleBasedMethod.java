package com.intentbench.classifier;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keyword and pattern classifier. Pure: the same input always produces the same result, and
 * no input makes it fail. When no rule fires it returns the configured neutral
 * {@code prompt} classification.
 *
 * <p>Results carry {@code latencyMs = 0}; callers that need wall time measure it themselves.
 */
public class RuleBasedMethod implements ClassificationMethod {
    static final String TAG = "rule-based";

    private static final List<String> QUESTION_WORDS = List.of("what", "how", "why", "when", "where", "who");
    private static final List<String> TECHNICAL_TERMS = List.of("function", "class", "api", "database", "server", "test");
    private static final List<String> MULTI_STEP = List.of("then", "after", "and", "also", "next");
    private static final Pattern CONVERSATIONAL = Pattern.compile(
            "^(hi|hello|hey|thanks|thank you|ok|yes|no|sure)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern TASK_ORIENTED = Pattern.compile(
            "\\b(find|search|book|reserve|get|show|list|add|remove|delete|update|change|set)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern REQUEST = Pattern.compile(
            "\\b(please|can you|could you|would you|i want|i need|help me)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern FILE_NAME = Pattern.compile(
            "\\b\\w+\\.(js|ts|py|java|cpp|html|css|json|yaml|yml|md)\\b", Pattern.CASE_INSENSITIVE);
    private static final int SHORT_QUESTION_LENGTH = 30;

    private final MethodSettings.RuleBased settings;
    private final CommandDetector commandDetector;
    private final List<Indicator> promptIndicators;
    private final List<Indicator> workflowIndicators;
    private final List<Indicator> questionWords;
    private final List<Indicator> technicalTerms;
    private final List<Indicator> multiStep;

    public RuleBasedMethod() {
        this(MethodSettings.RuleBased.defaults());
    }

    public RuleBasedMethod(MethodSettings.RuleBased settings) {
        this.settings = settings;
        this.commandDetector = new CommandDetector(settings.commandPrefix());
        this.promptIndicators = compile(settings.promptIndicators());
        this.workflowIndicators = compile(settings.workflowIndicators());
        this.questionWords = compile(QUESTION_WORDS);
        this.technicalTerms = compile(TECHNICAL_TERMS);
        this.multiStep = compile(MULTI_STEP);
    }

    @Override
    public MethodResult classify(String input, Map<String, String> context) {
        String trimmed = input == null ? "" : input.trim();

        Optional<ClassificationResult> command = commandDetector.detect(trimmed, TAG);
        if (command.isPresent()) {
            return MethodResult.success(command.get());
        }

        Signals signals = extract(trimmed);
        if (isSimplePrompt(trimmed, signals)) {
            double confidence = bound(0.5
                    + signals.prompt.size() * 0.2
                    + signals.questions.size() * 0.15
                    - signals.workflow.size() * 0.15
                    - signals.files.size() * 0.2);
            return MethodResult.success(new ClassificationResult(
                    IntentType.PROMPT,
                    confidence,
                    "Simple prompt detected: greeting, question, or conversational marker",
                    TAG,
                    0L,
                    metadata("prompt", signals)));
        }

        if (isWorkflow(trimmed, signals)) {
            double confidence = bound(0.5
                    + signals.workflow.size() * 0.2
                    + signals.files.size() * 0.25
                    + signals.multiStep.size() * 0.1
                    - signals.prompt.size() * 0.2);
            Map<String, String> metadata = metadata("workflow", signals);
            metadata.put("complexity", estimateComplexity(signals));
            return MethodResult.success(new ClassificationResult(
                    IntentType.WORKFLOW,
                    confidence,
                    "Complex workflow detected: action verbs, file references, or multi-step indicators",
                    TAG,
                    0L,
                    metadata));
        }

        return MethodResult.success(new ClassificationResult(
                IntentType.PROMPT,
                settings.defaultConfidence(),
                "No rule matched; neutral prompt fallback",
                TAG,
                0L,
                Map.of("rule", "fallback")));
    }

    @Override
    public String methodTag() {
        return TAG;
    }

    private boolean isSimplePrompt(String input, Signals signals) {
        boolean strongPromptSignals = signals.prompt.size() >= 2;
        boolean shortQuestion = !signals.questions.isEmpty() && input.length() < SHORT_QUESTION_LENGTH;
        boolean conversational = CONVERSATIONAL.matcher(input).find();
        return strongPromptSignals || shortQuestion || conversational;
    }

    private boolean isWorkflow(String input, Signals signals) {
        boolean taskRequest = TASK_ORIENTED.matcher(input).find() && REQUEST.matcher(input).find();
        return !signals.workflow.isEmpty()
                || !signals.files.isEmpty()
                || !signals.technical.isEmpty()
                || !signals.multiStep.isEmpty()
                || taskRequest;
    }

    private Signals extract(String input) {
        String lower = input.toLowerCase(Locale.ROOT);
        return new Signals(
                matches(lower, promptIndicators),
                matches(lower, workflowIndicators),
                matches(lower, questionWords),
                fileReferences(input),
                matches(lower, technicalTerms),
                matches(lower, multiStep));
    }

    private static Map<String, String> metadata(String rule, Signals signals) {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("rule", rule);
        metadata.put("promptSignals", String.join(",", signals.prompt));
        metadata.put("workflowSignals", String.join(",", signals.workflow));
        if (!signals.files.isEmpty()) {
            metadata.put("fileReferences", String.join(",", signals.files));
        }
        return metadata;
    }

    private static String estimateComplexity(Signals signals) {
        int count = signals.workflow.size() + signals.files.size() + signals.multiStep.size();
        if (count > 3) {
            return "high";
        }
        return count > 1 ? "medium" : "low";
    }

    private static double bound(double confidence) {
        return Math.max(0.1, Math.min(0.95, confidence));
    }

    private static List<String> matches(String lowerInput, List<Indicator> indicators) {
        List<String> found = new ArrayList<>();
        for (Indicator indicator : indicators) {
            if (indicator.pattern().matcher(lowerInput).find()) {
                found.add(indicator.text());
            }
        }
        return found;
    }

    private static List<String> fileReferences(String input) {
        List<String> files = new ArrayList<>();
        Matcher matcher = FILE_NAME.matcher(input);
        while (matcher.find()) {
            files.add(matcher.group());
        }
        return files;
    }

    private static List<Indicator> compile(List<String> phrases) {
        return phrases.stream()
                .filter(phrase -> phrase != null && !phrase.isBlank())
                .map(phrase -> phrase.trim().toLowerCase(Locale.ROOT))
                .map(phrase -> new Indicator(phrase, Pattern.compile("(?<![a-z0-9])" + Pattern.quote(phrase) + "(?![a-z0-9])")))
                .toList();
    }

    private record Indicator(String text, Pattern pattern) {
    }

    private record Signals(
            List<String> prompt,
            List<String> workflow,
            List<String> questions,
            List<String> files,
            List<String> technical,
            List<String> multiStep) {
    }
}
