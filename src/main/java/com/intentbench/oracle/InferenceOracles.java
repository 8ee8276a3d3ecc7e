package com.intentbench.oracle;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

import okhttp3.OkHttpClient;

public final class InferenceOracles {
    private InferenceOracles() {
    }

    public static OkHttpClient httpClient(long readTimeoutMs) {
        return new OkHttpClient.Builder()
                .connectTimeout(5, TimeUnit.SECONDS)
                .readTimeout(readTimeoutMs, TimeUnit.MILLISECONDS)
                .build();
    }

    /**
     * One {@link OllamaInferenceOracle} per base URL, all sharing {@code httpClient}.
     */
    public static OracleProvider ollama(OkHttpClient httpClient) {
        Map<String, InferenceOracle> byEndpoint = new ConcurrentHashMap<>();
        return baseUrl -> byEndpoint.computeIfAbsent(baseUrl, url -> new OllamaInferenceOracle(httpClient, url));
    }
}
