// Copyright The Retry Executor Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package io.github.retryexecutor.examples;

import io.github.retryexecutor.RetryExecutor;
import io.github.retryexecutor.retry.DelayCalculators;
import io.github.retryexecutor.retry.FailureHandlers;
import java.net.ConnectException;
import java.net.http.HttpClient;
import java.net.http.HttpTimeoutException;
import java.nio.channels.UnresolvedAddressException;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Example customizing every hook of the executor.
 *
 * <ul>
 *   <li>Server errors, timeouts and refused connections are retried, but an unknown host is not
 *   <li>The delay grows by 5 seconds per failed attempt
 *   <li>The terminal failure is rethrown with the number of the last attempt in its message
 *   <li>Progress is logged through SLF4J
 * </ul>
 */
public class CustomPolicyExample extends HttpExample {

    private static final Logger logger = LoggerFactory.getLogger(CustomPolicyExample.class);

    public CustomPolicyExample(HttpClient client) {
        super(client, newExecutor());
    }

    static RetryExecutor newExecutor() {
        return new RetryExecutor()
                .setIsTemporary(CustomPolicyExample::isTemporary)
                .setDelayBeforeNextAttempt(DelayCalculators.linear(Duration.ofSeconds(5)))
                .setOnFailure(FailureHandlers.rethrowWithAttempt())
                .setLogger(logger);
    }

    static boolean isTemporary(Exception e, int attempt) {
        if (e instanceof ServerErrorException || e instanceof HttpTimeoutException) {
            return true;
        }
        return e instanceof ConnectException && !isUnknownHost(e);
    }

    private static boolean isUnknownHost(Throwable e) {
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof UnresolvedAddressException) {
                return true;
            }
        }
        return false;
    }

    public static void main(String[] args) {
        run(new CustomPolicyExample(HttpClient.newHttpClient()), args, System.out);
    }
}
