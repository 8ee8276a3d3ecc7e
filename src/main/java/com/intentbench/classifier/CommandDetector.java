package com.intentbench.classifier;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detects inputs that are commands rather than natural language: prefixed commands such as
 * {@code /status}, conversation-control flags such as {@code --continue}, and {@code @path}
 * file references.
 */
public class CommandDetector {
    public static final String DEFAULT_PREFIX = "/";
    private static final List<String> CONVERSATION_FLAGS = List.of("--continue", "--resume", "--new");
    private static final Pattern FILE_REFERENCE = Pattern.compile("(?:^|\\s)@([\\w\\-./]+)");
    private static final double FILE_REFERENCE_CONFIDENCE = 0.9;

    private final String commandPrefix;
    private final Pattern commandName;

    public CommandDetector(String commandPrefix) {
        if (commandPrefix == null || commandPrefix.isBlank()) {
            throw new IllegalArgumentException("commandPrefix must not be blank");
        }
        this.commandPrefix = commandPrefix;
        this.commandName = Pattern.compile("^" + Pattern.quote(commandPrefix) + "([A-Za-z0-9_-]+)");
    }

    public Optional<ClassificationResult> detect(String input, String methodTag) {
        if (input == null) {
            return Optional.empty();
        }
        String trimmed = input.trim();
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }

        if (trimmed.startsWith(commandPrefix)) {
            Matcher matcher = commandName.matcher(trimmed);
            String name = matcher.find() ? matcher.group(1) : "unknown";
            Map<String, String> metadata = new LinkedHashMap<>();
            metadata.put("commandType", "prefixed");
            metadata.put("commandName", name);
            metadata.put("commandArgs", String.join(" ", arguments(trimmed)));
            return Optional.of(new ClassificationResult(
                    IntentType.COMMAND,
                    1.0,
                    "Command detected with prefix \"" + commandPrefix + "\"",
                    methodTag,
                    0L,
                    metadata));
        }

        for (String flag : CONVERSATION_FLAGS) {
            if (trimmed.startsWith(flag)) {
                return Optional.of(new ClassificationResult(
                        IntentType.COMMAND,
                        1.0,
                        "Conversation control flag " + flag,
                        methodTag,
                        0L,
                        Map.of("commandType", "conversation-control", "commandName", flag.substring(2))));
            }
        }

        List<String> references = fileReferences(trimmed);
        if (!references.isEmpty()) {
            return Optional.of(new ClassificationResult(
                    IntentType.COMMAND,
                    FILE_REFERENCE_CONFIDENCE,
                    "File reference detected: " + String.join(", ", references),
                    methodTag,
                    0L,
                    Map.of("commandType", "file-reference", "fileReferences", String.join(",", references))));
        }
        return Optional.empty();
    }

    private static List<String> arguments(String trimmed) {
        String[] tokens = trimmed.split("\\s+");
        if (tokens.length <= 1) {
            return List.of();
        }
        return Arrays.asList(Arrays.copyOfRange(tokens, 1, tokens.length));
    }

    private static List<String> fileReferences(String input) {
        List<String> references = new ArrayList<>();
        Matcher matcher = FILE_REFERENCE.matcher(input);
        while (matcher.find()) {
            references.add(matcher.group(1));
        }
        return references;
    }
}
