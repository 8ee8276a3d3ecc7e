package com.intentbench.classifier;

public record ClassificationError(
        ErrorKind kind,
        String message,
        String methodTag,
        int attempts) {

    public ClassificationError {
        if (kind == null) {
            throw new IllegalArgumentException("Error kind must not be null");
        }
        message = message == null ? "" : message;
        methodTag = methodTag == null ? "unknown" : methodTag;
        attempts = Math.max(1, attempts);
    }

    public static ClassificationError of(ErrorKind kind, String message, String methodTag) {
        return new ClassificationError(kind, message, methodTag, 1);
    }

    public ClassificationError withAttempts(int attempts) {
        return new ClassificationError(kind, message, methodTag, attempts);
    }

    public String describe() {
        return kind.displayName() + ": " + message;
    }
}
