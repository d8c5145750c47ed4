// Copyright The Retry Executor Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package io.github.retryexecutor.examples;

import io.github.retryexecutor.RetryExecutor;
import java.io.IOException;
import java.io.PrintStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

/**
 * Base class of the examples: a GET request whose sending is wrapped by a {@link RetryExecutor}.
 *
 * <p>Subclasses pass in the executor configured with their retry policy.
 */
public abstract class HttpExample {
    static final String DEFAULT_URL = "https://example.com";

    private final HttpClient client;
    private final RetryExecutor executor;

    protected HttpExample(HttpClient client, RetryExecutor executor) {
        this.client = client;
        this.executor = executor;
    }

    /** @return the maximum number of attempts per request */
    protected int maxAttempts() {
        return 10;
    }

    /**
     * Fetches the body of the given URI, retrying according to the example's policy.
     *
     * @param uri the resource to fetch
     * @return the response body
     */
    public String fetch(URI uri) {
        var request = HttpRequest.newBuilder(uri).GET().build();
        return executor.execute(() -> send(request), maxAttempts()).body();
    }

    /**
     * Sends the request once. Server errors are turned into {@link ServerErrorException} so that the retry policy can
     * tell them apart from client errors, which are returned as is.
     */
    protected HttpResponse<String> send(HttpRequest request) throws IOException {
        try {
            var response = client.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() >= 500) {
                throw new ServerErrorException(response.statusCode(), request.uri());
            }
            return response;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Request interrupted", e);
        }
    }

    public RetryExecutor getExecutor() {
        return executor;
    }

    static URI targetUri(String[] args) {
        return URI.create(args.length > 0 ? args[0] : DEFAULT_URL);
    }

    /** Fetches the URL given on the command line and prints the body, or the error that ended the retries. */
    static void run(HttpExample example, String[] args, PrintStream out) {
        try {
            out.println(example.fetch(targetUri(args)));
        } catch (Exception e) {
            out.println();
            out.println("Exiting due to an error: " + e.getMessage());
        }
    }
}
