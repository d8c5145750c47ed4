// Copyright The Retry Executor Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package io.github.retryexecutor.examples;

import io.github.retryexecutor.RetryExecutor;
import java.net.http.HttpClient;

/**
 * Example using the executor's defaults: every failure is retried, up to 10 attempts, with a random delay of up to
 * {@code attempt * 10} seconds between them.
 */
public class SimplestExample extends HttpExample {

    public SimplestExample(HttpClient client) {
        super(client, newExecutor());
    }

    static RetryExecutor newExecutor() {
        return new RetryExecutor();
    }

    public static void main(String[] args) {
        run(new SimplestExample(HttpClient.newHttpClient()), args, System.out);
    }
}
