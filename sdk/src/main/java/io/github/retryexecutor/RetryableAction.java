// Copyright The Retry Executor Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package io.github.retryexecutor;

/**
 * The operation wrapped by a {@link RetryExecutor}.
 *
 * @param <T> the result type
 */
@FunctionalInterface
public interface RetryableAction<T> {

    /**
     * Runs one attempt of the operation.
     *
     * @param attempt the current attempt number (1-based, so the first attempt is 1)
     * @return the result of the operation
     * @throws Exception any failure; whether it is retried is up to the executor's policy hooks
     */
    T run(int attempt) throws Exception;
}
