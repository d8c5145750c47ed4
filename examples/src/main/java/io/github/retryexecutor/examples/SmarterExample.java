// Copyright The Retry Executor Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package io.github.retryexecutor.examples;

import io.github.retryexecutor.RetryExecutor;
import io.github.retryexecutor.retry.TemporaryErrorPredicates;
import java.net.ConnectException;
import java.net.http.HttpClient;
import java.net.http.HttpTimeoutException;

/**
 * Example retrying only failures that are likely to go away: server errors, refused connections and timeouts. Any
 * other failure, such as a malformed request, is propagated after the first attempt.
 */
public class SmarterExample extends HttpExample {

    public SmarterExample(HttpClient client) {
        super(client, newExecutor());
    }

    static RetryExecutor newExecutor() {
        return new RetryExecutor()
                .setIsTemporary(TemporaryErrorPredicates.instanceOf(
                        ServerErrorException.class, ConnectException.class, HttpTimeoutException.class));
    }

    public static void main(String[] args) {
        run(new SmarterExample(HttpClient.newHttpClient()), args, System.out);
    }
}
