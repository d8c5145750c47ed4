// Copyright The Retry Executor Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package io.github.retryexecutor.retry;

/**
 * Jitter strategy for retry delays to prevent thundering herd problems.
 *
 * <p>Jitter reduces simultaneous retry attempts by spreading retries out over a randomized delay interval, which helps
 * prevent overwhelming services when many clients retry at the same time.
 */
public enum JitterStrategy {

    /** No jitter - use exact calculated delay. */
    NONE,

    /** Full jitter - random delay between 0 and calculated delay. */
    FULL,

    /** Half jitter - random delay between 50% and 100% of calculated delay. */
    HALF
}
