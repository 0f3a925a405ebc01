package com.llmregress.provider;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import static org.junit.jupiter.api.Assertions.assertEquals;

class AnthropicProviderClientTest {

    @Test
    void shouldSendMessagesRequestWithApiKeyHeaders() throws Exception {
        FakeHttp http = FakeHttp.respond(200, """
                {"content":[{"type":"text","text":"Bonjour"}],"usage":{"input_tokens":7,"output_tokens":2}}
                """);
        AnthropicProviderClient client = new AnthropicProviderClient(http.client(), "sk-ant-test", "http://fake-anthropic");

        Completion completion = client.invoke("Translate hello", new ModelConfig("anthropic", "claude-3-5-haiku-latest", 0.0, null));

        assertEquals("Bonjour", completion.text());
        assertEquals(new TokenUsage(7, 2), completion.usage());
        assertEquals("http://fake-anthropic/v1/messages", http.requests.get(0).url().toString());
        assertEquals("sk-ant-test", http.requests.get(0).header("x-api-key"));
        assertEquals("2023-06-01", http.requests.get(0).header("anthropic-version"));
        JsonNode payload = new ObjectMapper().readTree(http.requestBodies.get(0));
        assertEquals(1024, payload.path("max_tokens").asInt());
    }
}
