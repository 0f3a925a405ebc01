package com.llmregress.scheduler;

import java.util.List;
import java.util.Objects;

import com.llmregress.assertion.AssertionResult;
import com.llmregress.expand.EvalCase;
import com.llmregress.provider.ProviderResponse;
import com.llmregress.provider.TokenUsage;

public record CaseOutcome(
        EvalCase testCase,
        OutcomeStatus status,
        ProviderResponse response,
        String failureReason,
        List<AssertionResult> assertionResults,
        int attempts,
        TokenUsage usage,
        double costUsd) {

    public CaseOutcome {
        Objects.requireNonNull(testCase, "testCase");
        Objects.requireNonNull(status, "status");
        assertionResults = assertionResults == null ? List.of() : List.copyOf(assertionResults);
        usage = usage == null ? TokenUsage.NONE : usage;
    }

    public static CaseOutcome evaluated(
            EvalCase testCase,
            ProviderResponse response,
            List<AssertionResult> results,
            int attempts,
            TokenUsage usage,
            double costUsd) {
        boolean passed = results.stream().allMatch(AssertionResult::passed);
        return new CaseOutcome(testCase, passed ? OutcomeStatus.PASSED : OutcomeStatus.FAILED,
                response, null, results, attempts, usage, costUsd);
    }

    public static CaseOutcome providerFailed(
            EvalCase testCase,
            String reason,
            int attempts,
            TokenUsage usage,
            double costUsd) {
        return new CaseOutcome(testCase, OutcomeStatus.FAILED, null, reason,
                List.of(AssertionResult.synthetic("provider call", reason)), attempts, usage, costUsd);
    }

    public static CaseOutcome errored(EvalCase testCase, String reason) {
        return new CaseOutcome(testCase, OutcomeStatus.ERRORED, null, reason,
                List.of(AssertionResult.synthetic("case error", reason)), 0, TokenUsage.NONE, 0.0);
    }

    public static CaseOutcome skipped(EvalCase testCase, String reason) {
        return new CaseOutcome(testCase, OutcomeStatus.SKIPPED, null, reason, List.of(), 0, TokenUsage.NONE, 0.0);
    }

    public boolean passed() {
        return status == OutcomeStatus.PASSED;
    }

    public int ordinal() {
        return testCase.ordinal();
    }

    public String testId() {
        return testCase.testId();
    }

    public boolean hasResponse() {
        return response != null;
    }

    public List<AssertionResult> failedAssertions() {
        return assertionResults.stream().filter(result -> !result.passed()).toList();
    }
}
