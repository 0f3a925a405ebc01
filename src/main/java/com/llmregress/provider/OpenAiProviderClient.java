package com.llmregress.provider;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;

import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;

public class OpenAiProviderClient extends HttpProviderClient {
    public static final String DEFAULT_BASE_URL = "https://api.openai.com";

    private final String apiKey;
    private final String baseUrl;

    public OpenAiProviderClient(OkHttpClient httpClient, String apiKey, String baseUrl) {
        super(httpClient);
        this.apiKey = apiKey;
        this.baseUrl = baseUrl == null || baseUrl.isBlank() ? DEFAULT_BASE_URL : stripTrailingSlash(baseUrl);
    }

    @Override
    protected String name() {
        return "OpenAI";
    }

    @Override
    protected Request.Builder request(RequestBody body) {
        return new Request.Builder()
                .url(baseUrl + "/v1/chat/completions")
                .header("Authorization", "Bearer " + apiKey)
                .post(body);
    }

    @Override
    protected Map<String, Object> payload(String prompt, ModelConfig model) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model.model());
        payload.put("messages", List.of(Map.of("role", "user", "content", prompt)));
        payload.put("temperature", model.temperature());
        return payload;
    }

    @Override
    protected Completion parse(JsonNode root, String rawBody) throws ProviderException {
        return parseChatCompletion(root).orElseThrow(() -> unexpectedFormat(rawBody));
    }

    static Optional<Completion> parseChatCompletion(JsonNode root) {
        JsonNode content = root.path("choices").path(0).path("message").path("content");
        if (!content.isTextual()) {
            return Optional.empty();
        }
        return Optional.of(new Completion(
                content.asText(),
                usage(root.path("usage"), "prompt_tokens", "completion_tokens")));
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
