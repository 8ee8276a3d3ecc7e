package com.intentbench.classifier;

import java.util.Map;

/**
 * Stands in for a method that cannot be built, such as an unknown method name or schema.
 * Every call fails with {@link ErrorKind#UNSUPPORTED_METHOD}.
 */
public class UnsupportedMethod implements ClassificationMethod {
    private final String methodTag;
    private final String reason;

    public UnsupportedMethod(String methodTag, String reason) {
        this.methodTag = methodTag == null ? "unknown" : methodTag;
        this.reason = reason == null ? "Unsupported method" : reason;
    }

    @Override
    public MethodResult classify(String input, Map<String, String> context) {
        return MethodResult.failure(ErrorKind.UNSUPPORTED_METHOD, reason, methodTag);
    }

    @Override
    public String methodTag() {
        return methodTag;
    }
}
