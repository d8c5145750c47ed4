// Copyright The Retry Executor Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package io.github.retryexecutor.retry;

import io.github.retryexecutor.DelayCalculator;
import io.github.retryexecutor.validation.ParameterValidator;
import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.IntToDoubleFunction;

/**
 * Factory class for creating common delay calculators.
 *
 * <p>All calculators receive the number of the attempt that just failed (1-based) and are safe for concurrent use.
 */
public final class DelayCalculators {

    private static final double NANOS_PER_SECOND = 1_000_000_000.0;

    private DelayCalculators() {}

    /**
     * Creates a calculator returning a random delay, uniformly distributed in {@code [0, attempt * perAttempt)} with
     * millisecond granularity. {@code randomUpTo(Duration.ofSeconds(10))} is the executor's default.
     *
     * @param perAttempt upper bound of the delay after the first attempt, must be at least 1 millisecond
     * @return DelayCalculator growing linearly with full jitter
     */
    public static DelayCalculator randomUpTo(Duration perAttempt) {
        ParameterValidator.validatePositiveDuration(perAttempt, "perAttempt");
        long perAttemptMillis = perAttempt.toMillis();
        if (perAttemptMillis < 1) {
            throw new IllegalArgumentException("perAttempt must be at least 1 millisecond, got: " + perAttempt);
        }

        return attempt -> Duration.ofMillis(
                ThreadLocalRandom.current().nextLong(Math.max(1, attempt) * perAttemptMillis));
    }

    /** @return a calculator that never waits */
    public static DelayCalculator none() {
        return attempt -> Duration.ZERO;
    }

    /**
     * Creates a calculator returning the same delay after every attempt.
     *
     * @param delay the fixed delay
     * @return DelayCalculator with fixed delay
     */
    public static DelayCalculator fixed(Duration delay) {
        ParameterValidator.validateNonNegativeDuration(delay, "delay");
        return attempt -> delay;
    }

    /**
     * Creates a calculator returning {@code attempt * perAttempt}.
     *
     * @param perAttempt the increment per failed attempt
     * @return DelayCalculator growing linearly
     */
    public static DelayCalculator linear(Duration perAttempt) {
        ParameterValidator.validateNonNegativeDuration(perAttempt, "perAttempt");
        return attempt -> perAttempt.multipliedBy(attempt);
    }

    /**
     * Creates an exponential backoff calculator.
     *
     * <p>The delay calculation follows the formula: baseDelay = min(initialDelay × backoffRate^(attempt - 1), maxDelay),
     * after which the jitter strategy is applied.
     *
     * @param initialDelay delay after the first attempt
     * @param maxDelay maximum delay between attempts
     * @param backoffRate multiplier for exponential backoff
     * @param jitter jitter strategy to apply to delays
     * @return DelayCalculator implementing exponential backoff with jitter
     */
    public static DelayCalculator exponentialBackoff(
            Duration initialDelay, Duration maxDelay, double backoffRate, JitterStrategy jitter) {
        ParameterValidator.validateNonNegativeDuration(initialDelay, "initialDelay");
        ParameterValidator.validateNonNegativeDuration(maxDelay, "maxDelay");
        ParameterValidator.validateNotNull(jitter, "jitter");
        if (maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException(
                    "maxDelay must be >= initialDelay (initial: " + initialDelay + ", max: " + maxDelay + ")");
        }
        if (backoffRate <= 0) {
            throw new IllegalArgumentException("backoffRate must be positive");
        }

        return attempt -> {
            double initialDelaySeconds = initialDelay.toNanos() / NANOS_PER_SECOND;
            double maxDelaySeconds = maxDelay.toNanos() / NANOS_PER_SECOND;

            double baseDelay =
                    Math.min(initialDelaySeconds * Math.pow(backoffRate, Math.max(0, attempt - 1)), maxDelaySeconds);

            double delayWithJitter =
                    switch (jitter) {
                        case NONE -> baseDelay;
                        case FULL -> ThreadLocalRandom.current().nextDouble() * baseDelay;
                        case HALF -> baseDelay / 2 + ThreadLocalRandom.current().nextDouble() * (baseDelay / 2);
                    };

            return toDuration(delayWithJitter);
        };
    }

    /**
     * Adapts a function returning a (possibly fractional) number of seconds.
     *
     * @param secondsForAttempt function from attempt number to seconds
     * @return DelayCalculator with nanosecond precision
     */
    public static DelayCalculator seconds(IntToDoubleFunction secondsForAttempt) {
        ParameterValidator.validateNotNull(secondsForAttempt, "secondsForAttempt");
        return attempt -> toDuration(secondsForAttempt.applyAsDouble(attempt));
    }

    static Duration toDuration(double seconds) {
        return Duration.ofNanos(Math.round(seconds * NANOS_PER_SECOND));
    }
}
