package com.llmregress.scheduler;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import com.llmregress.assertion.AssertionEvaluator;
import com.llmregress.expand.EvalCase;
import com.llmregress.provider.Completion;
import com.llmregress.provider.ModelConfig;
import com.llmregress.provider.PriceTable;
import com.llmregress.provider.ProviderClient;
import com.llmregress.provider.ProviderTransientException;
import com.llmregress.provider.TokenUsage;
import com.llmregress.retry.BackoffSchedule;
import com.llmregress.retry.CancellationToken;
import com.llmregress.retry.RetryPolicy;
import com.llmregress.snapshot.InMemorySnapshotStore;
import com.llmregress.suite.AssertionKind;
import com.llmregress.suite.AssertionSpec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CaseExecutorTest {
    private static final ModelConfig MODEL = new ModelConfig("openai", "gpt-4o-mini", 0.7, null);
    private static final EvalCase GREET = EvalCase.resolved("greet", 0, Map.of("name", "Alice"), "Say hello to Alice",
            List.of(AssertionSpec.of(AssertionKind.CONTAINS, "Alice"), AssertionSpec.of(AssertionKind.MAX_LENGTH, "5")),
            MODEL);

    @Test
    void shouldEvaluateResponseAndPriceTokens() {
        ProviderClient provider = (prompt, model) -> new Completion("Hello Alice", new TokenUsage(1000, 500));

        CaseOutcome outcome = executor(provider, 1).execute(GREET, CancellationToken.none());

        assertEquals(OutcomeStatus.FAILED, outcome.status());
        assertEquals(2, outcome.assertionResults().size());
        assertTrue(outcome.assertionResults().get(0).passed());
        assertEquals(1, outcome.failedAssertions().size());
        assertEquals(1, outcome.attempts());
        assertEquals(0.00045, outcome.costUsd(), 1e-12);
        assertEquals("Hello Alice", outcome.response().text());
    }

    @Test
    void shouldReportProviderFailureAsFailedCase() {
        AtomicInteger calls = new AtomicInteger();
        ProviderClient provider = (prompt, model) -> {
            calls.incrementAndGet();
            throw new ProviderTransientException("OpenAI API error (503): overloaded", 503, null);
        };

        CaseOutcome outcome = executor(provider, 2).execute(GREET, CancellationToken.none());

        assertEquals(OutcomeStatus.FAILED, outcome.status());
        assertFalse(outcome.hasResponse());
        assertEquals(2, calls.get());
        assertEquals("provider call failed after 2 attempt(s): OpenAI API error (503): overloaded", outcome.failureReason());
        assertEquals("provider call", outcome.assertionResults().get(0).label());
        assertEquals(0.0, outcome.costUsd());
    }

    @Test
    void shouldAttributeAttemptCountAfterRetry() {
        AtomicInteger calls = new AtomicInteger();
        ProviderClient provider = (prompt, model) -> {
            if (calls.incrementAndGet() == 1) {
                throw new ProviderTransientException("timed out");
            }
            return new Completion("Hi Alice", new TokenUsage(10, 2));
        };

        CaseOutcome outcome = executor(provider, 3).execute(GREET, CancellationToken.none());

        assertEquals(OutcomeStatus.PASSED, outcome.status());
        assertEquals(2, outcome.attempts());
        assertEquals(new TokenUsage(10, 2), outcome.usage());
        assertNull(outcome.failureReason());
    }

    private static CaseExecutor executor(ProviderClient provider, int maxAttempts) {
        RetryPolicy retry = new RetryPolicy(maxAttempts, BackoffSchedule.withoutJitter(Duration.ofMillis(1)),
                duration -> {
                }, System::nanoTime);
        return new CaseExecutor(provider, retry, new AssertionEvaluator(new InMemorySnapshotStore()), PriceTable.defaults());
    }
}
