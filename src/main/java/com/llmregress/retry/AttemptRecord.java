package com.llmregress.retry;

import java.time.Duration;

import com.llmregress.provider.TokenUsage;

public record AttemptRecord(int attempt, Duration latency, TokenUsage usage, String error, boolean transientError) {

    public boolean succeeded() {
        return error == null;
    }
}
