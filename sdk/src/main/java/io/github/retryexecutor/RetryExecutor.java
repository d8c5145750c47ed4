// Copyright The Retry Executor Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package io.github.retryexecutor;

import io.github.retryexecutor.exception.RetryInterruptedException;
import io.github.retryexecutor.logging.LoggerConfig;
import io.github.retryexecutor.logging.RetryLogger;
import io.github.retryexecutor.retry.DelayCalculators;
import io.github.retryexecutor.retry.FailureHandlers;
import io.github.retryexecutor.retry.TemporaryErrorPredicates;
import io.github.retryexecutor.util.ExceptionHelper;
import io.github.retryexecutor.validation.ParameterValidator;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.Callable;
import org.slf4j.Logger;

/**
 * Runs an action and retries it with a delay when it fails, up to a maximum number of attempts.
 *
 * <p>The retry behavior is governed by three policy hooks:
 *
 * <ul>
 *   <li>{@link TemporaryErrorPredicate} decides whether a failure is worth retrying (default: always)
 *   <li>{@link DelayCalculator} computes the wait before the next attempt (default: random, up to {@code attempt * 10}
 *       seconds)
 *   <li>{@link FailureHandler} is notified once before the terminal error is rethrown (default: no-op)
 * </ul>
 *
 * <p>An optional SLF4J logger receives a notice when an attempt is retried, an error for every failed attempt and an
 * info message before sleeping.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * Response response = new RetryExecutor()
 *     .setIsTemporary((e, attempt) -> e instanceof IOException)
 *     .setDelayBeforeNextAttempt(DelayCalculators.linear(Duration.ofSeconds(5)))
 *     .setLogger(LoggerFactory.getLogger("http"))
 *     .execute(() -> client.send(request), 10);
 * }</pre>
 *
 * <p>The executor is configured once and may be reused. Each {@code execute} call works on a snapshot of the hooks
 * taken when it starts and keeps its own attempt counter, so concurrent calls are safe as long as the hooks and the
 * logger are.
 */
public class RetryExecutor {

    private volatile TemporaryErrorPredicate isTemporary;
    private volatile DelayCalculator delayBeforeNextAttempt;
    private volatile FailureHandler onFailure;
    private volatile Logger logger;
    private volatile LoggerConfig loggerConfig = LoggerConfig.defaults();
    private volatile Sleeper sleeper = Sleeper.threadSleep();

    public RetryExecutor() {
        setIsTemporary(TemporaryErrorPredicates.always());
        setDelayBeforeNextAttempt(DelayCalculators.randomUpTo(Duration.ofSeconds(10)));
        setOnFailure(FailureHandlers.noOp());
    }

    /**
     * Executes the action once if it succeeds, and up to {@code maxAttempts} times while it keeps failing with errors
     * the {@link TemporaryErrorPredicate} considers temporary.
     *
     * <p>When no more attempts are made, the {@link FailureHandler} is invoked and the exception of the last attempt is
     * rethrown as is, checked or not. An exception thrown by the failure handler replaces it.
     *
     * @param action the action to perform, receiving the 1-based attempt number
     * @param maxAttempts the maximum number of attempts, at least 1
     * @param <T> the result type
     * @return the result of the first successful attempt
     * @throws IllegalArgumentException if action is null or maxAttempts is not positive
     * @throws RetryInterruptedException if the thread is interrupted while waiting for the next attempt
     */
    public <T> T execute(RetryableAction<T> action, int maxAttempts) {
        ParameterValidator.validateNotNull(action, "action");
        ParameterValidator.validatePositiveInteger(maxAttempts, "maxAttempts");

        var isTemporary = this.isTemporary;
        var delayBeforeNextAttempt = this.delayBeforeNextAttempt;
        var onFailure = this.onFailure;
        var sleeper = this.sleeper;
        var log = new RetryLogger(logger, loggerConfig, maxAttempts);

        int attempt = 0;
        while (true) {
            attempt++;
            if (attempt > 1) {
                log.notice(attempt, "Retrying, attempt #{}", attempt);
            }
            try {
                return action.run(attempt);
            } catch (Exception e) {
                log.error(attempt, e);
                if (attempt < maxAttempts && isTemporary.isTemporary(e, attempt)) {
                    var delay = nonNegative(delayBeforeNextAttempt.delayBeforeNextAttempt(attempt));
                    log.info(attempt, "Sleep {} seconds until next try", formatSeconds(delay));
                    sleep(sleeper, delay, e, attempt);
                    continue;
                }
                try {
                    onFailure.onFailure(e, attempt);
                } catch (Exception replacement) {
                    ExceptionHelper.sneakyThrow(replacement);
                }
                ExceptionHelper.sneakyThrow(e);
            }
        }
    }

    /**
     * Executes an action that does not need the attempt number. See {@link #execute(RetryableAction, int)}.
     *
     * @param action the action to perform
     * @param maxAttempts the maximum number of attempts, at least 1
     * @param <T> the result type
     * @return the result of the first successful attempt
     */
    public <T> T execute(Callable<T> action, int maxAttempts) {
        ParameterValidator.validateNotNull(action, "action");
        return execute(attempt -> action.call(), maxAttempts);
    }

    private static void sleep(Sleeper sleeper, Duration delay, Exception failure, int attempt) {
        if (delay.isZero()) {
            return;
        }
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            var interrupted = new RetryInterruptedException(attempt, e);
            interrupted.addSuppressed(failure);
            throw interrupted;
        }
    }

    private static Duration nonNegative(Duration delay) {
        return delay == null || delay.isNegative() ? Duration.ZERO : delay;
    }

    static String formatSeconds(Duration delay) {
        return String.format(Locale.ROOT, "%.2f", delay.getSeconds() + delay.getNano() / 1_000_000_000.0);
    }

    /** @return the predicate deciding whether a failure is temporary */
    public TemporaryErrorPredicate getIsTemporary() {
        return isTemporary;
    }

    /**
     * Sets the predicate deciding whether a failure is temporary and another attempt should be made.
     *
     * @param isTemporary the predicate, not null
     * @return this executor for method chaining
     */
    public RetryExecutor setIsTemporary(TemporaryErrorPredicate isTemporary) {
        ParameterValidator.validateNotNull(isTemporary, "isTemporary");
        this.isTemporary = isTemporary;
        return this;
    }

    /** @return the calculator of the delay before the next attempt */
    public DelayCalculator getDelayBeforeNextAttempt() {
        return delayBeforeNextAttempt;
    }

    /**
     * Sets the calculator of the delay before the next attempt.
     *
     * @param delayBeforeNextAttempt the calculator, not null
     * @return this executor for method chaining
     */
    public RetryExecutor setDelayBeforeNextAttempt(DelayCalculator delayBeforeNextAttempt) {
        ParameterValidator.validateNotNull(delayBeforeNextAttempt, "delayBeforeNextAttempt");
        this.delayBeforeNextAttempt = delayBeforeNextAttempt;
        return this;
    }

    /** @return the handler invoked before the terminal error is rethrown */
    public FailureHandler getOnFailure() {
        return onFailure;
    }

    /**
     * Sets the handler invoked before the terminal error is rethrown.
     *
     * @param onFailure the handler, not null
     * @return this executor for method chaining
     */
    public RetryExecutor setOnFailure(FailureHandler onFailure) {
        ParameterValidator.validateNotNull(onFailure, "onFailure");
        this.onFailure = onFailure;
        return this;
    }

    /** @return the logger receiving progress messages, or null if logging is disabled */
    public Logger getLogger() {
        return logger;
    }

    /**
     * Sets the logger receiving progress messages.
     *
     * @param logger the logger, or null to disable logging
     * @return this executor for method chaining
     */
    public RetryExecutor setLogger(Logger logger) {
        this.logger = logger;
        return this;
    }

    /** @return the logging configuration (never null) */
    public LoggerConfig getLoggerConfig() {
        return loggerConfig;
    }

    /**
     * Sets the logging configuration.
     *
     * @param loggerConfig the configuration, or null for {@link LoggerConfig#defaults()}
     * @return this executor for method chaining
     */
    public RetryExecutor setLoggerConfig(LoggerConfig loggerConfig) {
        this.loggerConfig = loggerConfig != null ? loggerConfig : LoggerConfig.defaults();
        return this;
    }

    /** @return the sleeper used between attempts */
    public Sleeper getSleeper() {
        return sleeper;
    }

    /**
     * Sets the sleeper used between attempts. Mostly useful for tests that should not wait in real time.
     *
     * @param sleeper the sleeper, not null
     * @return this executor for method chaining
     */
    public RetryExecutor setSleeper(Sleeper sleeper) {
        ParameterValidator.validateNotNull(sleeper, "sleeper");
        this.sleeper = sleeper;
        return this;
    }
}
