// Copyright The Retry Executor Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package io.github.retryexecutor.exception;

/**
 * Exception thrown when the thread running a retry loop is interrupted while waiting for the next attempt.
 *
 * <p>The interrupt flag of the thread is set again before this exception is thrown. The failure of the attempt that
 * preceded the wait is attached as a suppressed exception.
 */
public class RetryInterruptedException extends RetryExecutionException {

    public RetryInterruptedException(int attempt, InterruptedException cause) {
        super(
                String.format("Interrupted while waiting to retry after attempt %d", attempt),
                cause,
                attempt);
    }
}
