package com.llmregress.engine;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ProjectInitializer {
    private static final Logger log = LoggerFactory.getLogger(ProjectInitializer.class);

    public static final String TESTS_FILE = "tests.yaml";
    public static final String ENV_EXAMPLE_FILE = ".env.example";

    static final String STARTER_TESTS = """
            version: "1.0"

            defaults:
              provider: "openai"
              model: "gpt-4o-mini"
              temperature: 0.7

            tests:
              - id: "hello-world"
                prompt: "Say hello to {{name}} in one short sentence."
                assertions:
                  - type: "contains"
                    value: "{{name}}"
                  - type: "not-contains"
                    value: "As an AI language model"
                cases:
                  - input:
                      name: "Alice"
                    assert:
                      - type: "latency-max"
                        value: 10000
                      - type: "min-length"
                        value: 10
                      - type: "max-length"
                        value: 500
                  - input:
                      name: "Bob"
            """;

    static final String ENV_TEMPLATE = """
            # API keys for llm-regress. Copy to .env or export them in your shell.

            # required for provider: "openai"
            OPENAI_API_KEY=sk-your-key-here
            # OPENAI_BASE_URL=https://api.openai.com

            # required for provider: "anthropic"
            ANTHROPIC_API_KEY=sk-ant-your-key-here

            # required for provider: "webhook" unless defaults.providerUrl is set
            # WEBHOOK_URL=http://localhost:8080/complete
            """;

    public InitResult initialize(Path directory) throws IOException {
        Files.createDirectories(directory);
        List<Path> created = new ArrayList<>();
        List<Path> skipped = new ArrayList<>();
        writeIfAbsent(directory.resolve(TESTS_FILE), STARTER_TESTS, created, skipped);
        writeIfAbsent(directory.resolve(ENV_EXAMPLE_FILE), ENV_TEMPLATE, created, skipped);
        return new InitResult(created, skipped);
    }

    private static void writeIfAbsent(Path target, String content, List<Path> created, List<Path> skipped) throws IOException {
        if (Files.exists(target)) {
            log.info("init.skip path={} reason=exists", target);
            skipped.add(target);
            return;
        }
        Files.writeString(target, content, StandardCharsets.UTF_8);
        log.info("init.created path={}", target);
        created.add(target);
    }

    public record InitResult(List<Path> created, List<Path> skipped) {
        public InitResult {
            created = List.copyOf(created);
            skipped = List.copyOf(skipped);
        }
    }
}
