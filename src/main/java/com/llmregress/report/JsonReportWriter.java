package com.llmregress.report;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.llmregress.assertion.AssertionResult;
import com.llmregress.scheduler.CaseOutcome;

public class JsonReportWriter {
    private static final Logger log = LoggerFactory.getLogger(JsonReportWriter.class);

    private final ObjectMapper objectMapper;

    public JsonReportWriter() {
        this(JsonMapper.builder()
                .findAndAddModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .build());
    }

    JsonReportWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void write(RunSummary summary, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), toReport(summary, Instant.now()));
        log.info("report.written path={} tests={}", target, summary.tests().size());
    }

    static RunReport toReport(RunSummary summary, Instant generatedAt) {
        List<TestReport> tests = summary.tests().stream().map(JsonReportWriter::toTestReport).toList();
        return new RunReport(
                generatedAt,
                summary.successful(),
                summary.totalCases(),
                summary.passed(),
                summary.failed(),
                summary.errored(),
                summary.skipped(),
                summary.loadFailures(),
                summary.costUsd(),
                summary.usage().inputTokens(),
                summary.usage().outputTokens(),
                summary.wallTime().toMillis(),
                summary.latency(),
                tests);
    }

    private static TestReport toTestReport(TestOutcome test) {
        return new TestReport(
                test.testId(),
                test.loadError(),
                test.passed(),
                test.failed(),
                test.errored(),
                test.skipped(),
                test.costUsd(),
                test.latency(),
                test.cases().stream().map(JsonReportWriter::toCaseReport).toList());
    }

    private static CaseReport toCaseReport(CaseOutcome outcome) {
        return new CaseReport(
                outcome.ordinal(),
                outcome.status().name(),
                outcome.testCase().bindings(),
                outcome.hasResponse() ? outcome.response().text() : null,
                outcome.hasResponse() ? outcome.response().latencyMs() : null,
                outcome.attempts(),
                outcome.usage().inputTokens(),
                outcome.usage().outputTokens(),
                outcome.costUsd(),
                outcome.failureReason(),
                outcome.assertionResults().stream().map(JsonReportWriter::toAssertionReport).toList());
    }

    private static AssertionReport toAssertionReport(AssertionResult result) {
        return new AssertionReport(result.label(), result.passed(), result.detail());
    }

    public record RunReport(
            Instant generatedAt,
            boolean success,
            int totalCases,
            int passed,
            int failed,
            int errored,
            int skipped,
            int loadFailures,
            double costUsd,
            long inputTokens,
            long outputTokens,
            long wallTimeMs,
            LatencyStats latency,
            List<TestReport> tests) {
    }

    public record TestReport(
            String id,
            String loadError,
            int passed,
            int failed,
            int errored,
            int skipped,
            double costUsd,
            LatencyStats latency,
            List<CaseReport> cases) {
    }

    public record CaseReport(
            int ordinal,
            String status,
            Map<String, String> input,
            String output,
            Long latencyMs,
            int attempts,
            long inputTokens,
            long outputTokens,
            double costUsd,
            String error,
            List<AssertionReport> assertions) {
    }

    public record AssertionReport(String label, boolean passed, String detail) {
    }
}
