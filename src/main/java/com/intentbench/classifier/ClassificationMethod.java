package com.intentbench.classifier;

import java.util.Map;

public interface ClassificationMethod extends AutoCloseable {

    /**
     * Classifies one input. Implementations are safe for concurrent use, do not mutate shared
     * state, and report failures as {@link MethodResult.Failure} rather than throwing.
     */
    MethodResult classify(String input, Map<String, String> context);

    default MethodResult classify(String input) {
        return classify(input, Map.of());
    }

    default MethodResult classify(ClassificationRequest request) {
        return classify(request.input(), request.context());
    }

    String methodTag();

    /**
     * Releases executors owned by the method. Methods without resources do nothing.
     */
    @Override
    default void close() {
    }
}
