package com.llmregress.suite;

import java.util.Objects;

public record AssertionSpec(AssertionKind kind, String value) {

    public AssertionSpec {
        Objects.requireNonNull(kind, "kind");
    }

    public static AssertionSpec of(AssertionKind kind) {
        return new AssertionSpec(kind, null);
    }

    public static AssertionSpec of(AssertionKind kind, String value) {
        return new AssertionSpec(kind, value);
    }

    public AssertionSpec withValue(String resolvedValue) {
        return new AssertionSpec(kind, resolvedValue);
    }

    public boolean isTemplated() {
        return value != null && value.contains("{{");
    }

    public String mergeKey() {
        return kind.keyedByValue() ? kind.wireName() + "=" + value : kind.wireName();
    }

    public String label() {
        return switch (kind) {
            case CONTAINS, NOT_CONTAINS -> kind.wireName() + " \"" + value + "\"";
            case LATENCY_MAX -> kind.wireName() + " " + value + "ms";
            case REGEX -> kind.wireName() + " /" + value + "/";
            case MIN_LENGTH, MAX_LENGTH -> kind.wireName() + " " + value;
            case JSON_VALID, SNAPSHOT -> kind.wireName();
        };
    }
}
