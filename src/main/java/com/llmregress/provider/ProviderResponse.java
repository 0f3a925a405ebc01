package com.llmregress.provider;

import java.time.Duration;
import java.util.Objects;

public record ProviderResponse(String text, TokenUsage usage, Duration latency, double costUsd) {

    public ProviderResponse {
        Objects.requireNonNull(text, "text");
        usage = usage == null ? TokenUsage.NONE : usage;
        latency = latency == null ? Duration.ZERO : latency;
        if (latency.isNegative()) {
            throw new IllegalArgumentException("latency must be >= 0");
        }
    }

    public long latencyMs() {
        return latency.toMillis();
    }
}
