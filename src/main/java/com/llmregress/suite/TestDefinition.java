package com.llmregress.suite;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.llmregress.provider.ModelConfig;

public record TestDefinition(
        String id,
        String promptTemplate,
        List<AssertionSpec> defaultAssertions,
        List<InlineCase> inlineCases,
        Path casesFile,
        ModelConfig model) {

    public TestDefinition {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(promptTemplate, "promptTemplate");
        defaultAssertions = defaultAssertions == null ? List.of() : List.copyOf(defaultAssertions);
        inlineCases = inlineCases == null ? List.of() : List.copyOf(inlineCases);
    }

    public boolean hasCasesFile() {
        return casesFile != null;
    }

    public record InlineCase(Map<String, String> bindings, List<AssertionSpec> assertions) {

        public InlineCase {
            bindings = bindings == null ? Map.of() : bindings;
            assertions = assertions == null ? List.of() : List.copyOf(assertions);
        }
    }
}
