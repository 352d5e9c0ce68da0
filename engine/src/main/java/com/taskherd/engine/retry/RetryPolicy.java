package com.taskherd.engine.retry;

import com.taskherd.engine.config.TaskherdProperties;

import java.time.Duration;

/**
 * Bounded exponential backoff shared by the worker pool and the result reporter.
 *
 * Attempts are counted from 1. The delay before attempt {@code n + 1} is
 * {@code initialDelay * multiplier^(n - 1)}, capped at {@code maxDelay}.
 */
public record RetryPolicy(
        int      maxAttempts,
        Duration initialDelay,
        double   multiplier,
        Duration maxDelay) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0, got " + multiplier);
        }
    }

    public static RetryPolicy from(TaskherdProperties.Retry cfg) {
        return new RetryPolicy(cfg.maxAttempts(), cfg.initialDelay(), cfg.multiplier(), cfg.maxDelay());
    }

    public static RetryPolicy from(TaskherdProperties.Reporter cfg) {
        return new RetryPolicy(cfg.maxAttempts(), cfg.initialDelay(), cfg.multiplier(), cfg.maxDelay());
    }

    /** Same curve, different bound (plugins may override the attempt limit). */
    public RetryPolicy withMaxAttempts(int attempts) {
        return new RetryPolicy(attempts, initialDelay, multiplier, maxDelay);
    }

    /** True while another attempt is allowed after {@code attemptsMade} attempts. */
    public boolean canRetry(int attemptsMade) {
        return attemptsMade < maxAttempts;
    }

    public Duration delayAfter(int attemptsMade) {
        int exponent = Math.max(0, attemptsMade - 1);
        double millis = initialDelay.toMillis() * Math.pow(multiplier, exponent);
        if (millis >= maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis((long) millis);
    }
}
