// Copyright The Retry Executor Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package io.github.retryexecutor.retry;

import io.github.retryexecutor.FailureHandler;
import io.github.retryexecutor.exception.RetryFailedException;
import io.github.retryexecutor.util.ExceptionHelper;
import io.github.retryexecutor.validation.ParameterValidator;
import org.slf4j.Logger;

/** Factory class for creating common failure handlers. */
public final class FailureHandlers {

    private static final FailureHandler NO_OP = (error, attempt) -> {};

    private FailureHandlers() {}

    /** @return a handler doing nothing, so that the original error is rethrown; the executor's default */
    public static FailureHandler noOp() {
        return NO_OP;
    }

    /**
     * Creates a handler replacing the terminal error with a {@link RetryFailedException} whose message is the original
     * message followed by {@code " (attempt N)"}, and whose cause is the original error.
     *
     * @return FailureHandler re-wrapping the terminal error
     */
    public static FailureHandler rethrowWithAttempt() {
        return (error, attempt) -> {
            throw new RetryFailedException(error, attempt);
        };
    }

    /**
     * Creates a handler logging the terminal error at error level. The original error is rethrown afterwards.
     *
     * @param logger the logger to report to
     * @return FailureHandler reporting the terminal error
     */
    public static FailureHandler log(Logger logger) {
        ParameterValidator.validateNotNull(logger, "logger");
        return (error, attempt) ->
                logger.error("Giving up after attempt #{}: {}", attempt, ExceptionHelper.summarize(error), error);
    }
}
