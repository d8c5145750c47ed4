// Copyright The Retry Executor Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package io.github.retryexecutor;

/**
 * Decides whether a failed attempt is worth retrying.
 *
 * <p>Only consulted while attempts remain, once per failure.
 */
@FunctionalInterface
public interface TemporaryErrorPredicate {

    /**
     * @param error the exception thrown by the action
     * @param attempt the number of the attempt that failed (1-based)
     * @return true to retry after a delay, false to stop and propagate the error
     */
    boolean isTemporary(Exception error, int attempt);
}
