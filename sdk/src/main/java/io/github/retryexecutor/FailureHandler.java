// Copyright The Retry Executor Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package io.github.retryexecutor;

/**
 * Callback invoked once when a {@link RetryExecutor} gives up.
 *
 * <p>The handler runs right before the terminal error is rethrown. If the handler throws, its exception is propagated
 * to the caller in place of the original one, which makes this the place to wrap or translate the final failure.
 */
@FunctionalInterface
public interface FailureHandler {

    /**
     * @param error the exception thrown by the last attempt
     * @param attempt the number of the last attempt (1-based)
     * @throws Exception to replace the original error
     */
    void onFailure(Exception error, int attempt) throws Exception;
}
