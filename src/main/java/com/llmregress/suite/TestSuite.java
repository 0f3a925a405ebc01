package com.llmregress.suite;

import java.nio.file.Path;
import java.util.List;

public record TestSuite(Path source, List<TestDefinition> tests) {

    public TestSuite {
        tests = tests == null ? List.of() : List.copyOf(tests);
    }

    public TestSuite filter(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            return this;
        }
        return new TestSuite(source, tests.stream()
                .filter(test -> test.id().contains(pattern))
                .toList());
    }
}
