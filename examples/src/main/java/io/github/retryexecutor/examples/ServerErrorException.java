// Copyright The Retry Executor Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package io.github.retryexecutor.examples;

import java.io.IOException;
import java.net.URI;

/** Thrown by the examples when a server answers with a 5xx status code. */
public class ServerErrorException extends IOException {
    private final int statusCode;

    public ServerErrorException(int statusCode, URI uri) {
        super(String.format("Server error: %d returned by %s", statusCode, uri));
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
