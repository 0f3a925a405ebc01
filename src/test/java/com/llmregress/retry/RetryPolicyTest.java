package com.llmregress.retry;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import org.junit.jupiter.api.Test;

import com.llmregress.provider.Completion;
import com.llmregress.provider.ModelConfig;
import com.llmregress.provider.ProviderClient;
import com.llmregress.provider.ProviderException;
import com.llmregress.provider.ProviderPermanentException;
import com.llmregress.provider.ProviderTransientException;
import com.llmregress.provider.TokenUsage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryPolicyTest {
    private static final ModelConfig MODEL = new ModelConfig("openai", "gpt-4o-mini", 0.7, null);
    private static final Duration BASE = Duration.ofMillis(100);

    private final List<Duration> sleeps = new ArrayList<>();
    private final AtomicLong clock = new AtomicLong();

    @Test
    void shouldSucceedOnThirdAttemptAfterTwoTransientFailures() {
        ScriptedClient client = new ScriptedClient(
                new ProviderTransientException("rate limited", 429, null),
                new ProviderTransientException("server error", 503, null),
                new Completion("Hello Alice", new TokenUsage(12, 3)));

        RetryOutcome outcome = policy(3).call(client, "Say hello", MODEL, CancellationToken.none());

        assertTrue(outcome.succeeded());
        assertEquals(RetryState.SUCCEEDED, outcome.finalState());
        assertEquals(3, outcome.attemptCount());
        assertEquals("Hello Alice", outcome.completion().text());
        assertEquals(Duration.ofMillis(10), outcome.latency());
        assertEquals(new TokenUsage(12, 3), outcome.totalUsage());
        assertEquals(List.of(BASE, BASE.multipliedBy(2)), sleeps);
        assertTrue(outcome.attempts().get(0).transientError());
        assertTrue(outcome.attempts().get(2).succeeded());
    }

    @Test
    void shouldFailWhenAttemptsRunOut() {
        ScriptedClient client = new ScriptedClient(
                new ProviderTransientException("rate limited", 429, null),
                new ProviderTransientException("server error", 503, null),
                new Completion("too late", TokenUsage.NONE));

        RetryOutcome outcome = policy(2).call(client, "Say hello", MODEL, CancellationToken.none());

        assertEquals(RetryState.FAILED, outcome.finalState());
        assertEquals(2, outcome.attemptCount());
        assertEquals("server error", outcome.lastError());
        assertNull(outcome.completion());
        assertEquals(List.of(BASE), sleeps);
        assertEquals(2, client.calls.get());
    }

    @Test
    void shouldNotRetryPermanentFailure() {
        ScriptedClient client = new ScriptedClient(
                new ProviderPermanentException("bad request", 400, null),
                new Completion("unused", TokenUsage.NONE));

        RetryOutcome outcome = policy(4).call(client, "Say hello", MODEL, CancellationToken.none());

        assertEquals(RetryState.FAILED, outcome.finalState());
        assertEquals(1, outcome.attemptCount());
        assertFalse(outcome.attempts().get(0).transientError());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void shouldTreatUnexpectedRuntimeErrorAsPermanent() {
        ProviderClient client = (prompt, model) -> {
            throw new IllegalStateException("boom");
        };

        RetryOutcome outcome = policy(4).call(client, "Say hello", MODEL, CancellationToken.none());

        assertEquals(RetryState.FAILED, outcome.finalState());
        assertEquals("IllegalStateException: boom", outcome.lastError());
    }

    @Test
    void shouldStopRetryingOnceCancelled() {
        CancellationToken cancellation = new CancellationToken();
        ScriptedClient client = new ScriptedClient(
                new ProviderTransientException("rate limited", 429, null),
                new Completion("unused", TokenUsage.NONE));
        RetryPolicy policy = new RetryPolicy(4, BackoffSchedule.withoutJitter(BASE), duration -> {
            sleeps.add(duration);
            cancellation.cancel();
        }, () -> clock.getAndAdd(10_000_000L));

        RetryOutcome outcome = policy.call(client, "Say hello", MODEL, cancellation);

        assertTrue(outcome.cancelled());
        assertEquals(1, outcome.attemptCount());
        assertEquals(1, client.calls.get());
    }

    @Test
    void shouldNotSleepWhenAlreadyCancelled() {
        CancellationToken cancellation = new CancellationToken();
        cancellation.cancel();
        ScriptedClient client = new ScriptedClient(new ProviderTransientException("rate limited", 429, null));

        RetryOutcome outcome = policy(4).call(client, "Say hello", MODEL, cancellation);

        assertTrue(outcome.cancelled());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void shouldRestoreInterruptFlagWhenSleepInterrupted() {
        ScriptedClient client = new ScriptedClient(new ProviderTransientException("rate limited", 429, null));
        RetryPolicy policy = new RetryPolicy(4, BackoffSchedule.withoutJitter(BASE), duration -> {
            throw new InterruptedException("stop");
        }, () -> clock.getAndAdd(10_000_000L));

        try {
            RetryOutcome outcome = policy.call(client, "Say hello", MODEL, CancellationToken.none());

            assertTrue(outcome.cancelled());
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }

    private RetryPolicy policy(int maxAttempts) {
        return new RetryPolicy(maxAttempts, BackoffSchedule.withoutJitter(BASE), sleeps::add,
                () -> clock.getAndAdd(10_000_000L));
    }

    private static final class ScriptedClient implements ProviderClient {
        private final Deque<Object> script = new ArrayDeque<>();
        private final AtomicInteger calls = new AtomicInteger();

        private ScriptedClient(Object... steps) {
            script.addAll(List.of(steps));
        }

        @Override
        public Completion invoke(String prompt, ModelConfig model) throws ProviderException {
            calls.incrementAndGet();
            Object next = script.isEmpty() ? new ProviderTransientException("script exhausted") : script.poll();
            if (next instanceof ProviderException failure) {
                throw failure;
            }
            return (Completion) next;
        }
    }
}
