package com.llmregress.report;

import java.util.List;
import java.util.Objects;

import com.llmregress.provider.TokenUsage;
import com.llmregress.scheduler.CaseOutcome;
import com.llmregress.scheduler.OutcomeStatus;

public record TestOutcome(
        String testId,
        List<CaseOutcome> cases,
        String loadError,
        double costUsd,
        TokenUsage usage,
        LatencyStats latency) {

    public TestOutcome {
        Objects.requireNonNull(testId, "testId");
        cases = cases == null ? List.of() : List.copyOf(cases);
        usage = usage == null ? TokenUsage.NONE : usage;
        latency = latency == null ? LatencyStats.EMPTY : latency;
    }

    public boolean loadFailed() {
        return loadError != null;
    }

    public int total() {
        return cases.size();
    }

    public int passed() {
        return count(OutcomeStatus.PASSED);
    }

    public int failed() {
        return count(OutcomeStatus.FAILED);
    }

    public int errored() {
        return count(OutcomeStatus.ERRORED);
    }

    public int skipped() {
        return count(OutcomeStatus.SKIPPED);
    }

    public boolean isGreen() {
        return !loadFailed() && failed() == 0 && errored() == 0;
    }

    private int count(OutcomeStatus status) {
        return (int) cases.stream().filter(outcome -> outcome.status() == status).count();
    }
}
