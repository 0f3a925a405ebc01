package com.llmregress.provider;

import java.util.Objects;

public record Completion(String text, TokenUsage usage) {

    public Completion {
        Objects.requireNonNull(text, "text");
        usage = usage == null ? TokenUsage.NONE : usage;
    }
}
