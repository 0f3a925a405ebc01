package com.llmregress.report;

import java.time.Duration;
import java.util.List;

import com.llmregress.provider.TokenUsage;

public record RunSummary(
        List<TestOutcome> tests,
        int totalCases,
        int passed,
        int failed,
        int errored,
        int skipped,
        int loadFailures,
        double costUsd,
        TokenUsage usage,
        LatencyStats latency,
        Duration wallTime) {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURES = 1;
    public static final int EXIT_USAGE = 2;

    public RunSummary {
        tests = tests == null ? List.of() : List.copyOf(tests);
        usage = usage == null ? TokenUsage.NONE : usage;
        latency = latency == null ? LatencyStats.EMPTY : latency;
        wallTime = wallTime == null ? Duration.ZERO : wallTime;
    }

    public RunSummary withWallTime(Duration elapsed) {
        return new RunSummary(tests, totalCases, passed, failed, errored, skipped, loadFailures, costUsd, usage, latency, elapsed);
    }

    public boolean successful() {
        return failed == 0 && errored == 0 && loadFailures == 0;
    }

    public int exitCode() {
        return successful() ? EXIT_OK : EXIT_FAILURES;
    }
}
