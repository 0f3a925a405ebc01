package com.llmregress.provider;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;

import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;

public class AnthropicProviderClient extends HttpProviderClient {
    public static final String DEFAULT_BASE_URL = "https://api.anthropic.com";
    private static final String API_VERSION = "2023-06-01";
    private static final int MAX_TOKENS = 1024;

    private final String apiKey;
    private final String baseUrl;

    public AnthropicProviderClient(OkHttpClient httpClient, String apiKey, String baseUrl) {
        super(httpClient);
        this.apiKey = apiKey;
        this.baseUrl = baseUrl == null || baseUrl.isBlank() ? DEFAULT_BASE_URL : baseUrl.replaceAll("/+$", "");
    }

    @Override
    protected String name() {
        return "Anthropic";
    }

    @Override
    protected Request.Builder request(RequestBody body) {
        return new Request.Builder()
                .url(baseUrl + "/v1/messages")
                .header("x-api-key", apiKey)
                .header("anthropic-version", API_VERSION)
                .post(body);
    }

    @Override
    protected Map<String, Object> payload(String prompt, ModelConfig model) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model.model());
        payload.put("max_tokens", MAX_TOKENS);
        payload.put("messages", List.of(Map.of("role", "user", "content", prompt)));
        payload.put("temperature", model.temperature());
        return payload;
    }

    @Override
    protected Completion parse(JsonNode root, String rawBody) throws ProviderException {
        JsonNode text = root.path("content").path(0).path("text");
        if (!text.isTextual()) {
            throw unexpectedFormat(rawBody);
        }
        return new Completion(text.asText(), usage(root.path("usage"), "input_tokens", "output_tokens"));
    }
}
