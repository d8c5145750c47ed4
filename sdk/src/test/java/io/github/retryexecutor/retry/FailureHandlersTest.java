// Copyright The Retry Executor Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package io.github.retryexecutor.retry;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import io.github.retryexecutor.RetryExecutor;
import io.github.retryexecutor.exception.RetryFailedException;
import java.io.IOException;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;

class FailureHandlersTest {

    @Test
    void testNoOpDoesNotThrow() {
        assertDoesNotThrow(() -> FailureHandlers.noOp().onFailure(new IOException("ignored"), 3));
    }

    @Test
    void testRethrowWithAttempt() {
        var original = new IOException("Server error");

        var exception = assertThrows(
                RetryFailedException.class, () -> FailureHandlers.rethrowWithAttempt().onFailure(original, 10));

        assertEquals("Server error (attempt 10)", exception.getMessage());
        assertEquals(10, exception.getAttempt());
        assertSame(original, exception.getCause());
    }

    @Test
    void testRethrowWithAttemptThroughExecutor() {
        var original = new IOException("Service unavailable");
        var executor = new RetryExecutor()
                .setDelayBeforeNextAttempt(DelayCalculators.none())
                .setOnFailure(FailureHandlers.rethrowWithAttempt());

        var exception = assertThrows(RetryFailedException.class, () -> executor.execute(attempt -> {
            throw original;
        }, 3));

        assertEquals("Service unavailable (attempt 3)", exception.getMessage());
        assertSame(original, exception.getCause());
    }

    @Test
    void testLogHandler() throws Exception {
        var logger = mock(Logger.class);
        var failure = new IOException("gone");

        FailureHandlers.log(logger).onFailure(failure, 4);

        verify(logger).error(eq("Giving up after attempt #{}: {}"), eq(4), eq("java.io.IOException: gone"), same(failure));
    }

    @Test
    void testLogHandlerRequiresLogger() {
        assertThrows(IllegalArgumentException.class, () -> FailureHandlers.log(null));
    }
}
