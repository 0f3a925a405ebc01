package com.llmregress.engine;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.llmregress.assertion.AssertionEvaluator;
import com.llmregress.expand.CaseExpander;
import com.llmregress.provider.Completion;
import com.llmregress.provider.PriceTable;
import com.llmregress.provider.ProviderClient;
import com.llmregress.provider.TokenUsage;
import com.llmregress.report.ResultAggregator;
import com.llmregress.report.RunSummary;
import com.llmregress.report.TestOutcome;
import com.llmregress.retry.BackoffSchedule;
import com.llmregress.retry.CancellationToken;
import com.llmregress.retry.RetryPolicy;
import com.llmregress.scheduler.CaseExecutor;
import com.llmregress.scheduler.CaseScheduler;
import com.llmregress.scheduler.OutcomeStatus;
import com.llmregress.snapshot.InMemorySnapshotStore;
import com.llmregress.snapshot.SnapshotKey;
import com.llmregress.suite.TestSuite;
import com.llmregress.suite.TestSuiteLoader;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RegressionRunnerTest {

    @TempDir
    Path tempDir;

    private final Set<String> prompts = ConcurrentHashMap.newKeySet();

    @Test
    void shouldRunInlineAndCsvTestsAndGroupOutcomesPerTest() throws Exception {
        Files.writeString(tempDir.resolve("words.csv"), """
                word,expected
                hello,bonjour
                cat,chat
                dog,chien
                """);
        TestSuite suite = load("""
                defaults:
                  provider: webhook
                  model: gpt-4o-mini
                tests:
                  - id: greet
                    prompt: "Say hello to {{name}}"
                    assertions:
                      - type: contains
                        value: "{{name}}"
                    cases:
                      - input: { name: Alice }
                        assert:
                          - type: snapshot
                      - input: { name: Bob }
                      - input: { nickname: Bobby }
                  - id: translate
                    prompt: "Translate {{word}} to French"
                    casesFile: words.csv
                    assertions:
                      - type: contains
                        value: "{{expected}}"
                      - type: max-length
                        value: 40
                """);
        InMemorySnapshotStore snapshots = new InMemorySnapshotStore();

        RunSummary summary = runner(fakeModel(), snapshots).run(suite, 4, CancellationToken.none());

        assertEquals(2, summary.tests().size());
        TestOutcome greet = summary.tests().get(0);
        assertEquals(List.of(OutcomeStatus.PASSED, OutcomeStatus.PASSED, OutcomeStatus.ERRORED),
                greet.cases().stream().map(outcome -> outcome.status()).toList());
        TestOutcome translate = summary.tests().get(1);
        assertEquals(List.of(OutcomeStatus.PASSED, OutcomeStatus.PASSED, OutcomeStatus.FAILED),
                translate.cases().stream().map(outcome -> outcome.status()).toList());
        assertEquals(6, summary.totalCases());
        assertEquals(4, summary.passed());
        assertEquals(RunSummary.EXIT_FAILURES, summary.exitCode());
        assertEquals(5, prompts.size());
        assertEquals(Map.of(new SnapshotKey("greet", 0), "Hello Alice"), snapshots.snapshot());
        assertTrue(summary.costUsd() > 0.0);
    }

    @Test
    void shouldReportMissingCsvAsLoadFailureWithoutStoppingOtherTests() throws Exception {
        TestSuite suite = load("""
                tests:
                  - id: bulk
                    prompt: "Translate {{word}}"
                    casesFile: missing.csv
                    assertions:
                      - type: min-length
                        value: 1
                  - id: greet
                    prompt: "Say hello to {{name}}"
                    cases:
                      - input: { name: Alice }
                        assert:
                          - type: contains
                            value: Alice
                """);

        RunSummary summary = runner(fakeModel(), new InMemorySnapshotStore()).run(suite, 2, CancellationToken.none());

        assertTrue(summary.tests().get(0).loadFailed());
        assertTrue(summary.tests().get(0).loadError().contains("missing.csv"));
        assertEquals(OutcomeStatus.PASSED, summary.tests().get(1).cases().get(0).status());
        assertEquals(1, summary.loadFailures());
        assertEquals(RunSummary.EXIT_FAILURES, summary.exitCode());
    }

    @Test
    void shouldKeepRunningOtherTestsWhenABindingIsNull() throws Exception {
        TestSuite suite = load("""
                tests:
                  - id: a
                    prompt: "Say hello to {{name}}"
                    cases:
                      - input: { name: ~ }
                        assert:
                          - type: contains
                            value: "{{name}}"
                  - id: b
                    prompt: "Say hello to {{name}}"
                    cases:
                      - input: { name: Bob }
                        assert:
                          - type: contains
                            value: Bob
                """);

        RunSummary summary = runner(fakeModel(), new InMemorySnapshotStore()).run(suite, 2, CancellationToken.none());

        assertEquals(OutcomeStatus.ERRORED, summary.tests().get(0).cases().get(0).status());
        assertEquals(OutcomeStatus.PASSED, summary.tests().get(1).cases().get(0).status());
        assertEquals(Set.of("Say hello to Bob"), prompts);
    }

    @Test
    void shouldPassWhenEverythingMatches() throws Exception {
        TestSuite suite = load("""
                tests:
                  - id: greet
                    prompt: "Say hello to {{name}}"
                    cases:
                      - input: { name: Alice }
                        assert:
                          - type: contains
                            value: Alice
                          - type: latency-max
                            value: 60000
                """);

        RunSummary summary = runner(fakeModel(), new InMemorySnapshotStore()).run(suite, 1, CancellationToken.none());

        assertEquals(RunSummary.EXIT_OK, summary.exitCode());
        assertEquals(1, summary.latency().count());
    }

    private ProviderClient fakeModel() {
        return (prompt, model) -> {
            prompts.add(prompt);
            if (prompt.startsWith("Say hello to ")) {
                return new Completion("Hello " + prompt.substring("Say hello to ".length()), new TokenUsage(6, 2));
            }
            Map<String, String> dictionary = Map.of("hello", "bonjour", "cat", "chat", "dog", "chat");
            String word = prompt.split(" ")[1];
            return new Completion("In French: " + dictionary.get(word), new TokenUsage(8, 4));
        };
    }

    private static RegressionRunner runner(ProviderClient provider, InMemorySnapshotStore snapshots) {
        RetryPolicy retry = new RetryPolicy(2, BackoffSchedule.withoutJitter(Duration.ZERO), duration -> {
        }, System::nanoTime);
        CaseExecutor executor = new CaseExecutor(provider, retry, new AssertionEvaluator(snapshots), PriceTable.defaults());
        return new RegressionRunner(new CaseExpander(), new CaseScheduler(executor), new ResultAggregator());
    }

    private TestSuite load(String yaml) throws Exception {
        Path testFile = tempDir.resolve("tests.yaml");
        Files.writeString(testFile, yaml);
        return new TestSuiteLoader().load(testFile);
    }
}
