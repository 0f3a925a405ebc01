package com.llmregress.expand;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

import com.llmregress.provider.ModelConfig;
import com.llmregress.snapshot.SnapshotKey;
import com.llmregress.suite.AssertionSpec;

public record EvalCase(
        String testId,
        int ordinal,
        Map<String, String> bindings,
        String prompt,
        List<AssertionSpec> assertions,
        ModelConfig model,
        String resolutionError) {

    public EvalCase {
        Objects.requireNonNull(testId, "testId");
        if (ordinal < 0) {
            throw new IllegalArgumentException("ordinal must be >= 0");
        }
        bindings = Collections.unmodifiableMap(new LinkedHashMap<>(bindings == null ? Map.of() : bindings));
        assertions = assertions == null ? List.of() : List.copyOf(assertions);
    }

    public static EvalCase resolved(
            String testId,
            int ordinal,
            Map<String, String> bindings,
            String prompt,
            List<AssertionSpec> assertions,
            ModelConfig model) {
        return new EvalCase(testId, ordinal, bindings, Objects.requireNonNull(prompt, "prompt"), assertions, model, null);
    }

    public static EvalCase unresolved(
            String testId,
            int ordinal,
            Map<String, String> bindings,
            ModelConfig model,
            String resolutionError) {
        return new EvalCase(testId, ordinal, bindings, null, List.of(), model, resolutionError);
    }

    public boolean isResolved() {
        return resolutionError == null;
    }

    public SnapshotKey snapshotKey() {
        return new SnapshotKey(testId, ordinal);
    }

    public String label() {
        if (bindings.isEmpty()) {
            return "case " + ordinal;
        }
        return bindings.entrySet().stream()
                .map(entry -> entry.getKey() + "=" + entry.getValue())
                .collect(Collectors.joining(", "));
    }
}
