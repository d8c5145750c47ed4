// Copyright The Retry Executor Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package io.github.retryexecutor.exception;

/** Terminal failure of a retried action, re-wrapped with the number of the last attempt. */
public class RetryFailedException extends RetryExecutionException {

    public RetryFailedException(Throwable cause, int attempt) {
        super(formatMessage(cause, attempt), cause, attempt);
    }

    private static String formatMessage(Throwable cause, int attempt) {
        return String.format("%s (attempt %d)", cause.getMessage(), attempt);
    }
}
