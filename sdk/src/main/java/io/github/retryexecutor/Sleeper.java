// Copyright The Retry Executor Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package io.github.retryexecutor;

import java.time.Duration;

/**
 * Blocks the calling thread between attempts.
 *
 * <p>Implementations must respond to thread interruption by throwing {@link InterruptedException}.
 */
@FunctionalInterface
public interface Sleeper {

    /** Longest wait {@link #threadSleep()} performs; longer durations are capped to it. */
    Duration MAX_THREAD_SLEEP = Duration.ofMillis(Long.MAX_VALUE);

    /**
     * @param duration a positive duration to wait for
     * @throws InterruptedException if the thread is interrupted while waiting
     */
    void sleep(Duration duration) throws InterruptedException;

    /** @return a sleeper backed by {@link Thread#sleep(long, int)} */
    static Sleeper threadSleep() {
        return duration -> {
            var capped = duration.compareTo(MAX_THREAD_SLEEP) > 0 ? MAX_THREAD_SLEEP : duration;
            long millis = capped.toMillis();
            int nanos = capped.minusMillis(millis).getNano();
            Thread.sleep(millis, nanos);
        };
    }
}
