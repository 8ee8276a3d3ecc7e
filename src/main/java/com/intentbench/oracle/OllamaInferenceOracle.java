package com.intentbench.oracle;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

/**
 * Posts structured-output generation requests to an Ollama-compatible {@code /api/generate}
 * endpoint and returns the {@code response} text.
 */
public class OllamaInferenceOracle implements InferenceOracle {
    private static final Logger log = LoggerFactory.getLogger(OllamaInferenceOracle.class);
    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final String endpoint;

    public OllamaInferenceOracle(OkHttpClient httpClient, String baseUrl) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("baseUrl must not be blank");
        }
        this.httpClient = httpClient;
        this.mapper = new ObjectMapper();
        this.endpoint = stripTrailingSlash(baseUrl) + "/api/generate";
    }

    @Override
    public String complete(OracleRequest request) throws IOException {
        Map<String, Object> options = new LinkedHashMap<>();
        options.put("temperature", request.temperature());
        options.put("num_predict", request.maxTokens());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", request.modelId());
        body.put("prompt", request.prompt());
        if (request.jsonSchema() != null) {
            body.put("format", request.jsonSchema());
        }
        body.put("stream", false);
        body.put("options", options);

        Request httpRequest = new Request.Builder()
                .url(endpoint)
                .post(RequestBody.create(mapper.writeValueAsString(body), JSON))
                .build();
        try (Response response = httpClient.newCall(httpRequest).execute()) {
            if (!response.isSuccessful() || response.body() == null) {
                log.debug("oracle.http.failure endpoint={} status={}", endpoint, response.code());
                throw new IOException("Oracle returned HTTP " + response.code() + " from " + endpoint);
            }
            JsonNode root = mapper.readTree(response.body().string());
            return root.path("response").asText("");
        }
    }

    public String endpoint() {
        return endpoint;
    }

    private static String stripTrailingSlash(String baseUrl) {
        String trimmed = baseUrl.trim();
        return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }
}
