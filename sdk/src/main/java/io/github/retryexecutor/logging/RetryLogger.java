// Copyright The Retry Executor Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package io.github.retryexecutor.logging;

import io.github.retryexecutor.util.ExceptionHelper;
import org.slf4j.Logger;
import org.slf4j.MDC;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

/**
 * Logger wrapper used by a single retry loop. Adds the attempt number to log entries via MDC and turns every call into
 * a no-op when no delegate logger is configured.
 *
 * <p>SLF4J has no notice level; notices are logged at info level with the {@link #NOTICE} marker.
 */
public class RetryLogger {
    public static final Marker NOTICE = MarkerFactory.getMarker("NOTICE");

    static final String MDC_ATTEMPT = "retryAttempt";
    static final String MDC_MAX_ATTEMPTS = "retryMaxAttempts";

    private final Logger delegate;
    private final LoggerConfig config;
    private final int maxAttempts;

    public RetryLogger(Logger delegate, LoggerConfig config, int maxAttempts) {
        this.delegate = delegate;
        this.config = config != null ? config : LoggerConfig.defaults();
        this.maxAttempts = maxAttempts;
    }

    public void notice(int attempt, String format, Object arg) {
        log(attempt, () -> delegate.info(NOTICE, format, arg));
    }

    public void info(int attempt, String format, Object arg) {
        log(attempt, () -> delegate.info(format, arg));
    }

    /** Logs a failed attempt as {@code "Got <exception class>: <message>"}. */
    public void error(int attempt, Exception failure) {
        var message = "Got " + ExceptionHelper.summarize(failure);
        if (config.logStackTraces()) {
            log(attempt, () -> delegate.error(message, failure));
        } else {
            log(attempt, () -> delegate.error(message));
        }
    }

    public boolean isEnabled() {
        return delegate != null;
    }

    private void log(int attempt, Runnable logAction) {
        if (delegate == null) {
            return;
        }

        try {
            MDC.put(MDC_ATTEMPT, String.valueOf(attempt));
            MDC.put(MDC_MAX_ATTEMPTS, String.valueOf(maxAttempts));

            logAction.run();
        } finally {
            MDC.remove(MDC_ATTEMPT);
            MDC.remove(MDC_MAX_ATTEMPTS);
        }
    }
}
