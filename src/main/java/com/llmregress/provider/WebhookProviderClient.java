package com.llmregress.provider;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;

import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;

public class WebhookProviderClient extends HttpProviderClient {
    private final String url;

    public WebhookProviderClient(OkHttpClient httpClient, String url) {
        super(httpClient);
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("webhook url is required");
        }
        this.url = url;
    }

    @Override
    protected String name() {
        return "Webhook";
    }

    @Override
    protected Request.Builder request(RequestBody body) {
        return new Request.Builder()
                .url(url)
                .post(body);
    }

    @Override
    protected Map<String, Object> payload(String prompt, ModelConfig model) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("prompt", prompt);
        payload.put("model", model.model());
        payload.put("temperature", model.temperature());
        return payload;
    }

    @Override
    protected Completion parse(JsonNode root, String rawBody) throws ProviderException {
        JsonNode text = root.path("text");
        if (text.isTextual()) {
            return new Completion(text.asText(), usage(root.path("usage"), "prompt_tokens", "completion_tokens"));
        }
        return OpenAiProviderClient.parseChatCompletion(root)
                .orElseThrow(() -> new ProviderPermanentException(
                        "Webhook response must contain 'text' or 'choices[0].message.content': " + preview(rawBody)));
    }

    public String url() {
        return url;
    }
}
