package com.llmregress.report;

import java.io.PrintStream;
import java.util.Locale;

import com.llmregress.assertion.AssertionResult;
import com.llmregress.scheduler.CaseOutcome;

public class ConsoleReport {
    private static final String RULE = "-".repeat(60);

    private final PrintStream out;
    private final boolean verbose;

    public ConsoleReport(PrintStream out, boolean verbose) {
        this.out = out;
        this.verbose = verbose;
    }

    public void print(RunSummary summary) {
        out.println(RULE);
        for (TestOutcome test : summary.tests()) {
            if (test.loadFailed()) {
                out.printf("  ERROR | %s | could not load cases: %s%n", test.testId(), test.loadError());
                continue;
            }
            for (CaseOutcome outcome : test.cases()) {
                printCase(outcome);
            }
        }
        out.println(RULE);
        printTotals(summary);
    }

    private void printCase(CaseOutcome outcome) {
        StringBuilder line = new StringBuilder()
                .append("  ").append(String.format(Locale.ROOT, "%-5s", statusLabel(outcome)))
                .append(" | ").append(outcome.testId())
                .append(" | ").append(outcome.testCase().label());
        if (outcome.hasResponse()) {
            line.append(" | ").append(outcome.response().latencyMs()).append("ms");
        }
        if (outcome.attempts() > 1) {
            line.append(" (").append(outcome.attempts() - 1).append("x retried)");
        }
        if (outcome.usage().totalTokens() > 0) {
            line.append(" | ").append(outcome.usage().totalTokens()).append("tok");
        }
        if (outcome.costUsd() > 0.0) {
            line.append(String.format(Locale.ROOT, " | $%.5f", outcome.costUsd()));
        }
        out.println(line);
        if (outcome.assertionResults().isEmpty() && outcome.failureReason() != null) {
            out.printf("       ! %s%n", outcome.failureReason());
        }

        for (AssertionResult result : outcome.assertionResults()) {
            if (!result.passed()) {
                out.printf("       x %s: %s%n", result.label(), result.detail());
            } else if (verbose) {
                out.printf("       ok %s: %s%n", result.label(), result.detail());
            }
        }
        if (verbose && outcome.hasResponse()) {
            out.printf("       output: %s%n", outcome.response().text());
        }
    }

    private void printTotals(RunSummary summary) {
        out.printf("  %d passed, %d failed, %d errored, %d skipped (%d case(s))%n",
                summary.passed(), summary.failed(), summary.errored(), summary.skipped(), summary.totalCases());
        if (summary.loadFailures() > 0) {
            out.printf("  %d test(s) could not be loaded%n", summary.loadFailures());
        }
        LatencyStats latency = summary.latency();
        if (!latency.isEmpty()) {
            out.printf(Locale.ROOT, "  latency ms: min %d, mean %.1f, p50 %d, p95 %d, max %d%n",
                    latency.minMs(), latency.meanMs(), latency.p50Ms(), latency.p95Ms(), latency.maxMs());
        }
        out.printf(Locale.ROOT, "  tokens: %d in / %d out, cost $%.6f, wall time %dms%n",
                summary.usage().inputTokens(), summary.usage().outputTokens(), summary.costUsd(),
                summary.wallTime().toMillis());
    }

    private static String statusLabel(CaseOutcome outcome) {
        return switch (outcome.status()) {
            case PASSED -> "PASS";
            case FAILED -> "FAIL";
            case ERRORED -> "ERROR";
            case SKIPPED -> "SKIP";
        };
    }
}
