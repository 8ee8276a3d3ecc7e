package com.intentbench.classifier;

public enum ErrorKind {
    CONNECTION("ConnectionError", true),
    TIMEOUT("TimeoutError", true),
    PARSE("ParseError", false),
    SCHEMA_VALIDATION("SchemaValidationError", false),
    UNSUPPORTED_METHOD("UnsupportedMethodError", false),
    INSUFFICIENT_QUORUM("InsufficientQuorumError", false),
    UNEXPECTED("UnexpectedError", false);

    private final String displayName;
    private final boolean retryable;

    ErrorKind(String displayName, boolean retryable) {
        this.displayName = displayName;
        this.retryable = retryable;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Transient failures that a bounded retry may recover from. Parse and schema failures are
     * deterministic for a given response and are never retried.
     */
    public boolean retryable() {
        return retryable;
    }
}
