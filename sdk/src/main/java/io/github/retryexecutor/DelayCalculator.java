// Copyright The Retry Executor Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package io.github.retryexecutor;

import java.time.Duration;

/** Computes how long to wait before the next attempt. */
@FunctionalInterface
public interface DelayCalculator {

    /**
     * @param attempt the number of the attempt that just failed (1-based)
     * @return the delay before the next attempt; zero, negative or null means no wait
     */
    Duration delayBeforeNextAttempt(int attempt);
}
