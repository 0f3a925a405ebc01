package com.llmregress.retry;

import java.time.Duration;
import java.util.function.DoubleSupplier;

public class BackoffSchedule {
    public static final double MAX_JITTER_RATIO = 0.2;
    private static final int MAX_DOUBLINGS = 30;

    private final Duration baseDelay;
    private final double jitterRatio;
    private final DoubleSupplier random;

    public BackoffSchedule(Duration baseDelay, double jitterRatio, DoubleSupplier random) {
        if (baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be >= 0");
        }
        if (jitterRatio < 0.0 || jitterRatio > MAX_JITTER_RATIO) {
            throw new IllegalArgumentException("jitterRatio must be within [0, " + MAX_JITTER_RATIO + "]");
        }
        this.baseDelay = baseDelay;
        this.jitterRatio = jitterRatio;
        this.random = random;
    }

    public static BackoffSchedule withoutJitter(Duration baseDelay) {
        return new BackoffSchedule(baseDelay, 0.0, () -> 0.5);
    }

    public Duration nominalDelayBefore(int attempt) {
        if (attempt < 2) {
            return Duration.ZERO;
        }
        int doublings = Math.min(attempt - 2, MAX_DOUBLINGS);
        return baseDelay.multipliedBy(1L << doublings);
    }

    public Duration delayBefore(int attempt) {
        Duration nominal = nominalDelayBefore(attempt);
        if (jitterRatio == 0.0 || nominal.isZero()) {
            return nominal;
        }
        double factor = 1.0 + jitterRatio * (2.0 * random.getAsDouble() - 1.0);
        return Duration.ofNanos(Math.round(nominal.toNanos() * factor));
    }

    public Duration baseDelay() {
        return baseDelay;
    }

    public double jitterRatio() {
        return jitterRatio;
    }
}
