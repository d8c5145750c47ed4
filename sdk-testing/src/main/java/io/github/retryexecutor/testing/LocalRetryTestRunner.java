// Copyright The Retry Executor Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package io.github.retryexecutor.testing;

import io.github.retryexecutor.RetryExecutor;
import io.github.retryexecutor.RetryableAction;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs actions through a {@link RetryExecutor} without waiting in real time.
 *
 * <p>The runner installs a {@link RecordingSleeper} on the executor, so every delay computed by the executor's policy
 * is recorded instead of slept. Failures are captured in the returned {@link RetryTestResult} instead of being thrown.
 *
 * <pre>{@code
 * var runner = LocalRetryTestRunner.create(new RetryExecutor().setIsTemporary(myPredicate));
 * var result = runner.run(action, 5);
 * assertEquals(ExecutionStatus.SUCCEEDED, result.getStatus());
 * assertEquals(2, result.getAttempts());
 * }</pre>
 */
public class LocalRetryTestRunner {
    private static final Logger logger = LoggerFactory.getLogger(LocalRetryTestRunner.class);

    private final RetryExecutor executor;
    private final RecordingSleeper sleeper;

    private LocalRetryTestRunner(RetryExecutor executor, RecordingSleeper sleeper) {
        this.executor = executor;
        this.sleeper = sleeper;
    }

    /** Creates a runner around an executor with default policy hooks. */
    public static LocalRetryTestRunner create() {
        return create(new RetryExecutor());
    }

    /**
     * Creates a runner around the given executor. The executor's sleeper is replaced by a {@link RecordingSleeper}.
     *
     * @param executor the configured executor under test
     * @return LocalRetryTestRunner instance
     */
    public static LocalRetryTestRunner create(RetryExecutor executor) {
        var sleeper = new RecordingSleeper();
        executor.setSleeper(sleeper);
        return new LocalRetryTestRunner(executor, sleeper);
    }

    /**
     * Runs the action and captures its outcome.
     *
     * @param action the action to run
     * @param maxAttempts the attempt budget
     * @param <T> the result type
     * @return the outcome, with the number of attempts and the requested waits
     */
    public <T> RetryTestResult<T> run(RetryableAction<T> action, int maxAttempts) {
        sleeper.reset();
        var attempts = new AtomicInteger();
        try {
            T result = executor.execute(
                    attempt -> {
                        attempts.set(attempt);
                        return action.run(attempt);
                    },
                    maxAttempts);
            logger.debug("Action succeeded after {} attempt(s)", attempts.get());
            return new RetryTestResult<>(ExecutionStatus.SUCCEEDED, result, null, attempts.get(), sleeper.getSleeps());
        } catch (Exception e) {
            logger.debug("Action failed after {} attempt(s): {}", attempts.get(), e.toString());
            return new RetryTestResult<>(ExecutionStatus.FAILED, null, e, attempts.get(), sleeper.getSleeps());
        }
    }

    public RetryExecutor getExecutor() {
        return executor;
    }

    public RecordingSleeper getSleeper() {
        return sleeper;
    }
}
