package com.llmregress.provider;

import java.net.ConnectException;
import java.net.SocketTimeoutException;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OpenAiProviderClientTest {
    private static final ModelConfig MODEL = new ModelConfig("openai", "gpt-4o-mini", 0.3, null);

    @Test
    void shouldPostChatCompletionAndParseUsage() throws Exception {
        FakeHttp http = FakeHttp.respond(200, """
                {"choices":[{"message":{"role":"assistant","content":"Hello Alice"}}],
                 "usage":{"prompt_tokens":9,"completion_tokens":3}}
                """);
        OpenAiProviderClient client = new OpenAiProviderClient(http.client(), "sk-test", "http://fake-openai/");

        Completion completion = client.invoke("Say hello to Alice", MODEL);

        assertEquals("Hello Alice", completion.text());
        assertEquals(new TokenUsage(9, 3), completion.usage());
        assertEquals("http://fake-openai/v1/chat/completions", http.requests.get(0).url().toString());
        assertEquals("Bearer sk-test", http.requests.get(0).header("Authorization"));
        JsonNode payload = new ObjectMapper().readTree(http.requestBodies.get(0));
        assertEquals("gpt-4o-mini", payload.path("model").asText());
        assertEquals("Say hello to Alice", payload.path("messages").path(0).path("content").asText());
        assertEquals(0.3, payload.path("temperature").asDouble());
    }

    @Test
    void shouldClassifyRateLimitAndServerErrorsAsTransient() {
        for (int code : new int[] { 408, 429, 500, 503 }) {
            OpenAiProviderClient client = new OpenAiProviderClient(
                    FakeHttp.respond(code, "{\"error\":\"busy\"}").client(), "sk-test", "http://fake-openai");

            ProviderException error = assertThrows(ProviderException.class, () -> client.invoke("hi", MODEL));

            assertTrue(error.isTransient(), "status " + code);
            assertEquals(code, error.statusCode());
        }
    }

    @Test
    void shouldClassifyClientErrorsAsPermanent() {
        OpenAiProviderClient client = new OpenAiProviderClient(
                FakeHttp.respond(401, "{\"error\":\"bad key\"}").client(), "sk-test", "http://fake-openai");

        ProviderException error = assertThrows(ProviderException.class, () -> client.invoke("hi", MODEL));

        assertFalse(error.isTransient());
        assertTrue(error.getMessage().contains("(401)"));
    }

    @Test
    void shouldTreatMalformedBodyAsPermanent() {
        OpenAiProviderClient invalidJson = new OpenAiProviderClient(
                FakeHttp.respond(200, "not json").client(), "sk-test", "http://fake-openai");
        OpenAiProviderClient wrongShape = new OpenAiProviderClient(
                FakeHttp.respond(200, "{\"choices\":[]}").client(), "sk-test", "http://fake-openai");

        assertFalse(assertThrows(ProviderException.class, () -> invalidJson.invoke("hi", MODEL)).isTransient());
        assertFalse(assertThrows(ProviderException.class, () -> wrongShape.invoke("hi", MODEL)).isTransient());
    }

    @Test
    void shouldTreatTimeoutsAndConnectionFailuresAsTransient() {
        OpenAiProviderClient timeout = new OpenAiProviderClient(
                FakeHttp.fail(new SocketTimeoutException("read timed out")).client(), "sk-test", "http://fake-openai");
        OpenAiProviderClient refused = new OpenAiProviderClient(
                FakeHttp.fail(new ConnectException("refused")).client(), "sk-test", "http://fake-openai");

        ProviderException timedOut = assertThrows(ProviderException.class, () -> timeout.invoke("hi", MODEL));
        ProviderException notConnected = assertThrows(ProviderException.class, () -> refused.invoke("hi", MODEL));

        assertTrue(timedOut.isTransient());
        assertTrue(timedOut.getMessage().contains("timed out"));
        assertTrue(notConnected.isTransient());
        assertEquals(-1, notConnected.statusCode());
    }
}
