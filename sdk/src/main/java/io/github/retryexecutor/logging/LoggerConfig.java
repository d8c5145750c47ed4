// Copyright The Retry Executor Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package io.github.retryexecutor.logging;

/** Configuration for RetryLogger behavior. */
public record LoggerConfig(boolean logStackTraces) {

    /** Default configuration: failed attempts are logged as a one-line summary. */
    public static LoggerConfig defaults() {
        return new LoggerConfig(false);
    }

    /** Configuration that attaches the exception, and so its stack trace, to the error message of a failed attempt. */
    public static LoggerConfig withStackTraces() {
        return new LoggerConfig(true);
    }
}
