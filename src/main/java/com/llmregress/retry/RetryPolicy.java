package com.llmregress.retry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.LongSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.llmregress.provider.Completion;
import com.llmregress.provider.ModelConfig;
import com.llmregress.provider.ProviderClient;
import com.llmregress.provider.ProviderException;
import com.llmregress.provider.TokenUsage;

public class RetryPolicy {
    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    private final int maxAttempts;
    private final BackoffSchedule backoff;
    private final Sleeper sleeper;
    private final LongSupplier nanoClock;

    public RetryPolicy(int maxAttempts, Duration baseDelay, double jitterRatio) {
        this(maxAttempts,
                new BackoffSchedule(baseDelay, jitterRatio, () -> ThreadLocalRandom.current().nextDouble()),
                Sleeper.SYSTEM,
                System::nanoTime);
    }

    public RetryPolicy(int maxAttempts, BackoffSchedule backoff, Sleeper sleeper, LongSupplier nanoClock) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.maxAttempts = maxAttempts;
        this.backoff = backoff;
        this.sleeper = sleeper;
        this.nanoClock = nanoClock;
    }

    public RetryOutcome call(ProviderClient client, String prompt, ModelConfig model, CancellationToken cancellation) {
        RetryState state = RetryState.ATTEMPTING;
        List<AttemptRecord> attempts = new ArrayList<>();
        Completion completion = null;
        Duration successLatency = Duration.ZERO;
        String lastError = null;
        int attempt = 0;

        while (!state.isTerminal()) {
            switch (state) {
                case ATTEMPTING -> {
                    attempt++;
                    long start = nanoClock.getAsLong();
                    try {
                        completion = client.invoke(prompt, model);
                        successLatency = Duration.ofNanos(Math.max(0L, nanoClock.getAsLong() - start));
                        attempts.add(new AttemptRecord(attempt, successLatency, completion.usage(), null, false));
                        state = RetryState.SUCCEEDED;
                    } catch (ProviderException e) {
                        Duration latency = Duration.ofNanos(Math.max(0L, nanoClock.getAsLong() - start));
                        lastError = e.getMessage();
                        attempts.add(new AttemptRecord(attempt, latency, TokenUsage.NONE, lastError, e.isTransient()));
                        state = e.isTransient() ? RetryState.TRANSIENT_FAILURE : RetryState.FAILED;
                    } catch (RuntimeException e) {
                        Duration latency = Duration.ofNanos(Math.max(0L, nanoClock.getAsLong() - start));
                        lastError = e.getClass().getSimpleName() + ": " + e.getMessage();
                        attempts.add(new AttemptRecord(attempt, latency, TokenUsage.NONE, lastError, false));
                        state = RetryState.FAILED;
                    }
                }
                case TRANSIENT_FAILURE -> state = backOff(attempt, model, lastError, cancellation);
                default -> throw new IllegalStateException("unexpected retry state " + state);
            }
        }

        if (state == RetryState.FAILED) {
            log.warn("provider.call.failed model={} attempts={} reason={}", model.model(), attempt, lastError);
        }
        return new RetryOutcome(state, state == RetryState.SUCCEEDED ? completion : null, successLatency, attempts, lastError);
    }

    private RetryState backOff(int attemptsMade, ModelConfig model, String lastError, CancellationToken cancellation) {
        if (attemptsMade >= maxAttempts) {
            return RetryState.FAILED;
        }
        if (cancellation.isCancelled()) {
            return RetryState.CANCELLED;
        }
        Duration delay = backoff.delayBefore(attemptsMade + 1);
        log.warn("provider.retry model={} attempt={} maxAttempts={} backoffMs={} reason={}",
                model.model(), attemptsMade, maxAttempts, delay.toMillis(), lastError);
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return RetryState.CANCELLED;
        }
        return cancellation.isCancelled() ? RetryState.CANCELLED : RetryState.ATTEMPTING;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public BackoffSchedule backoff() {
        return backoff;
    }
}
