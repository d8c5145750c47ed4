// Copyright The Retry Executor Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package io.github.retryexecutor.examples;

import static io.github.retryexecutor.examples.HttpExampleTestSupport.response;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import io.github.retryexecutor.testing.RecordingSleeper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SimplestExampleTest {

    private static final URI URI_UNDER_TEST = URI.create("https://example.com");

    private HttpClient client;
    private RecordingSleeper sleeper;
    private SimplestExample example;

    @BeforeEach
    void setUp() {
        client = mock(HttpClient.class);
        sleeper = new RecordingSleeper();
        example = new SimplestExample(client);
        example.getExecutor().setSleeper(sleeper);
    }

    @Test
    void testReturnsBodyOnFirstSuccess() throws Exception {
        var ok = response(200, "<html>hello</html>");
        doReturn(ok).when(client).send(any(), any());

        assertEquals("<html>hello</html>", example.fetch(URI_UNDER_TEST));
        verify(client, times(1)).send(any(), any());
        assertTrue(sleeper.getSleeps().isEmpty());
    }

    @Test
    void testRetriesAnyFailure() throws Exception {
        var unavailable = response(503, "unavailable");
        var recovered = response(200, "recovered");
        doThrow(new IOException("Connection reset"))
                .doReturn(unavailable)
                .doReturn(recovered)
                .when(client)
                .send(any(), any());

        assertEquals("recovered", example.fetch(URI_UNDER_TEST));
        verify(client, times(3)).send(any(), any());
    }

    @Test
    void testGivesUpAfterTenAttempts() throws Exception {
        var failure = new IOException("Network is unreachable");
        doThrow(failure).when(client).send(any(), any());

        var thrown = assertThrows(IOException.class, () -> example.fetch(URI_UNDER_TEST));

        assertSame(failure, thrown);
        verify(client, times(10)).send(any(), any());
    }
}
