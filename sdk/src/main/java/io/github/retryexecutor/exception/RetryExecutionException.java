// Copyright The Retry Executor Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package io.github.retryexecutor.exception;

/** Base class of the exceptions raised by the retry executor itself. */
public class RetryExecutionException extends RuntimeException {
    private final int attempt;

    public RetryExecutionException(String message, Throwable cause, int attempt) {
        super(message, cause);
        this.attempt = attempt;
    }

    public RetryExecutionException(String message, int attempt) {
        super(message);
        this.attempt = attempt;
    }

    /** @return the number of the attempt during or after which this exception was raised (1-based) */
    public int getAttempt() {
        return attempt;
    }
}
