package com.llmregress.provider;

import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

import okhttp3.OkHttpClient;

public final class ProviderClients {
    public static final String OPENAI = "openai";
    public static final String ANTHROPIC = "anthropic";
    public static final String WEBHOOK = "webhook";

    private ProviderClients() {
    }

    public static OkHttpClient httpClient(Duration requestTimeout) {
        return new OkHttpClient.Builder()
                .callTimeout(requestTimeout)
                .readTimeout(requestTimeout)
                .build();
    }

    public static ProviderClient create(String provider, String webhookUrl, OkHttpClient httpClient, Map<String, String> env) {
        return switch (provider) {
            case OPENAI -> new OpenAiProviderClient(
                    httpClient,
                    require(env, "OPENAI_API_KEY", provider),
                    env.get("OPENAI_BASE_URL"));
            case ANTHROPIC -> new AnthropicProviderClient(
                    httpClient,
                    require(env, "ANTHROPIC_API_KEY", provider),
                    env.get("ANTHROPIC_BASE_URL"));
            case WEBHOOK -> {
                String url = firstNonBlank(webhookUrl, env.get("WEBHOOK_URL"));
                if (url == null) {
                    throw new IllegalStateException("Provider 'webhook' requires WEBHOOK_URL env var or defaults.providerUrl "
                            + "(e.g. http://localhost:8080/complete)");
                }
                yield new WebhookProviderClient(httpClient, url);
            }
            default -> throw new IllegalArgumentException(
                    "Unknown provider: '" + provider + "'. Known: openai, anthropic, webhook");
        };
    }

    // all clients are built up front so a missing key fails before any dispatch
    public static ProviderRouter router(Collection<ModelConfig> models, OkHttpClient httpClient, Map<String, String> env) {
        Map<String, ProviderClient> clients = new LinkedHashMap<>();
        for (ModelConfig model : models) {
            if (!clients.containsKey(model.provider())) {
                clients.put(model.provider(), create(model.provider(), model.endpoint(), httpClient, env));
            }
        }
        return new ProviderRouter(clients);
    }

    private static String require(Map<String, String> env, String key, String provider) {
        String value = env.get(key);
        if (value == null || value.isBlank()) {
            throw new IllegalStateException(key + " not set in environment (required by provider '" + provider + "')");
        }
        return value;
    }

    private static String firstNonBlank(String first, String second) {
        if (first != null && !first.isBlank()) {
            return first;
        }
        return second == null || second.isBlank() ? null : second;
    }
}
