package com.llmregress.provider;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

public abstract class HttpProviderClient implements ProviderClient {
    private static final MediaType JSON = MediaType.parse("application/json");
    private static final int BODY_PREVIEW = 300;

    protected final OkHttpClient httpClient;
    protected final ObjectMapper mapper = new ObjectMapper();

    protected HttpProviderClient(OkHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    protected abstract String name();

    protected abstract Request.Builder request(RequestBody body);

    protected abstract Map<String, Object> payload(String prompt, ModelConfig model);

    protected abstract Completion parse(JsonNode root, String rawBody) throws ProviderException;

    @Override
    public Completion invoke(String prompt, ModelConfig model) throws ProviderException {
        RequestBody body;
        try {
            body = RequestBody.create(mapper.writeValueAsString(payload(prompt, model)), JSON);
        } catch (JsonProcessingException e) {
            throw new ProviderPermanentException(name() + " request could not be encoded: " + e.getOriginalMessage(), -1, e);
        }

        try (Response response = httpClient.newCall(request(body).build()).execute()) {
            ResponseBody responseBody = response.body();
            String text = responseBody == null ? "" : responseBody.string();
            if (!response.isSuccessful()) {
                throw ProviderException.forStatus(
                        name() + " API error (" + response.code() + "): " + preview(text),
                        response.code());
            }
            JsonNode root;
            try {
                root = mapper.readTree(text);
            } catch (JsonProcessingException e) {
                throw new ProviderPermanentException(name() + " returned invalid JSON: " + e.getOriginalMessage(), response.code(), e);
            }
            return parse(root, text);
        } catch (ProviderException e) {
            throw e;
        } catch (InterruptedIOException e) {
            throw new ProviderTransientException(name() + " request timed out: " + e.getMessage(), -1, e);
        } catch (IOException e) {
            throw new ProviderTransientException(name() + " connection failed: " + e.getMessage(), -1, e);
        }
    }

    protected static TokenUsage usage(JsonNode usageNode, String inputField, String outputField) {
        if (usageNode == null || usageNode.isMissingNode() || usageNode.isNull()) {
            return TokenUsage.NONE;
        }
        return new TokenUsage(
                Math.max(0L, usageNode.path(inputField).asLong(0)),
                Math.max(0L, usageNode.path(outputField).asLong(0)));
    }

    protected ProviderPermanentException unexpectedFormat(String rawBody) {
        return new ProviderPermanentException("Unexpected " + name() + " response format: " + preview(rawBody));
    }

    static String preview(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > BODY_PREVIEW ? body.substring(0, BODY_PREVIEW) + "..." : body;
    }
}
