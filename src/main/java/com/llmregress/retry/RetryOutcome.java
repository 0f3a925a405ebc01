package com.llmregress.retry;

import java.time.Duration;
import java.util.List;

import com.llmregress.provider.Completion;
import com.llmregress.provider.TokenUsage;

public record RetryOutcome(
        RetryState finalState,
        Completion completion,
        Duration latency,
        List<AttemptRecord> attempts,
        String lastError) {

    public RetryOutcome {
        attempts = List.copyOf(attempts);
        if (!finalState.isTerminal()) {
            throw new IllegalArgumentException("outcome requires a terminal state, got " + finalState);
        }
    }

    public boolean succeeded() {
        return finalState == RetryState.SUCCEEDED;
    }

    public boolean cancelled() {
        return finalState == RetryState.CANCELLED;
    }

    public int attemptCount() {
        return attempts.size();
    }

    public TokenUsage totalUsage() {
        return attempts.stream()
                .map(AttemptRecord::usage)
                .reduce(TokenUsage.NONE, TokenUsage::plus);
    }
}
