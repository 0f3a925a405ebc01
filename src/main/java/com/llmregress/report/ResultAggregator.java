package com.llmregress.report;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.llmregress.provider.TokenUsage;
import com.llmregress.scheduler.CaseOutcome;

public class ResultAggregator {

    public TestOutcome aggregate(String testId, List<CaseOutcome> outcomes) {
        List<CaseOutcome> ordered = new ArrayList<>(outcomes);
        ordered.sort(Comparator.comparingInt(CaseOutcome::ordinal));

        Set<Integer> seen = new HashSet<>();
        double cost = 0.0;
        TokenUsage usage = TokenUsage.NONE;
        List<Long> latencies = new ArrayList<>();
        for (CaseOutcome outcome : ordered) {
            if (!testId.equals(outcome.testId())) {
                throw new IllegalArgumentException(
                        "outcome for test '" + outcome.testId() + "' passed to aggregate of '" + testId + "'");
            }
            if (!seen.add(outcome.ordinal())) {
                throw new IllegalArgumentException("duplicate ordinal " + outcome.ordinal() + " in test '" + testId + "'");
            }
            cost += outcome.costUsd();
            usage = usage.plus(outcome.usage());
            if (outcome.hasResponse()) {
                latencies.add(outcome.response().latencyMs());
            }
        }
        return new TestOutcome(testId, ordered, null, cost, usage, LatencyStats.of(latencies));
    }

    public TestOutcome loadFailed(String testId, String error) {
        return new TestOutcome(testId, List.of(), error, 0.0, TokenUsage.NONE, LatencyStats.EMPTY);
    }

    public RunSummary summarize(List<TestOutcome> tests) {
        int total = 0;
        int passed = 0;
        int failed = 0;
        int errored = 0;
        int skipped = 0;
        int loadFailures = 0;
        double cost = 0.0;
        TokenUsage usage = TokenUsage.NONE;
        List<Long> latencies = new ArrayList<>();

        for (TestOutcome test : tests) {
            if (test.loadFailed()) {
                loadFailures++;
            }
            total += test.total();
            passed += test.passed();
            failed += test.failed();
            errored += test.errored();
            skipped += test.skipped();
            cost += test.costUsd();
            usage = usage.plus(test.usage());
            for (CaseOutcome outcome : test.cases()) {
                if (outcome.hasResponse()) {
                    latencies.add(outcome.response().latencyMs());
                }
            }
        }
        return new RunSummary(tests, total, passed, failed, errored, skipped, loadFailures,
                cost, usage, LatencyStats.of(latencies), null);
    }
}
