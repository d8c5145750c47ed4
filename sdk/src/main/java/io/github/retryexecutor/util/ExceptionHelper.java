// Copyright The Retry Executor Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package io.github.retryexecutor.util;

/** Utility class for handling exceptions */
public final class ExceptionHelper {

    private ExceptionHelper() {}

    /**
     * Throws any exception as if it were unchecked using type erasure. This preserves the original exception type and
     * stack trace.
     *
     * @param exception the exception to throw
     * @param <T> the exception type (erased at runtime)
     * @throws T the exception as an unchecked exception
     */
    @SuppressWarnings("unchecked")
    public static <T extends Throwable> void sneakyThrow(Throwable exception) throws T {
        throw (T) exception;
    }

    /**
     * one-line description of a throwable
     *
     * @param throwable the throwable to describe
     * @return the class name and message, e.g. {@code "java.io.IOException: Connection reset"}
     */
    public static String summarize(Throwable throwable) {
        return throwable.getClass().getName() + ": " + throwable.getMessage();
    }
}
