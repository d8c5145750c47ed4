// Copyright The Retry Executor Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package io.github.retryexecutor.retry;

import io.github.retryexecutor.TemporaryErrorPredicate;
import io.github.retryexecutor.validation.ParameterValidator;
import java.util.List;

/** Factory class for creating common temporary-error predicates. */
public final class TemporaryErrorPredicates {

    private static final TemporaryErrorPredicate ALWAYS = (error, attempt) -> true;
    private static final TemporaryErrorPredicate NEVER = (error, attempt) -> false;

    private TemporaryErrorPredicates() {}

    /** @return a predicate treating every failure as temporary; the executor's default */
    public static TemporaryErrorPredicate always() {
        return ALWAYS;
    }

    /** @return a predicate treating every failure as permanent, so that nothing is retried */
    public static TemporaryErrorPredicate never() {
        return NEVER;
    }

    /**
     * Creates a predicate matching failures that are instances of any of the given types.
     *
     * @param types the exception types considered temporary
     * @return TemporaryErrorPredicate matching by type
     */
    @SafeVarargs
    public static TemporaryErrorPredicate instanceOf(Class<? extends Exception>... types) {
        ParameterValidator.validateNotNull(types, "types");
        var typeList = List.of(types);
        return (error, attempt) -> typeList.stream().anyMatch(type -> type.isInstance(error));
    }

    /**
     * Creates a predicate matching failures whose message does not contain the given text. A failure without message
     * matches.
     *
     * @param text the text marking a permanent failure
     * @return TemporaryErrorPredicate inspecting the message
     */
    public static TemporaryErrorPredicate messageNotContaining(String text) {
        ParameterValidator.validateNotNull(text, "text");
        return (error, attempt) -> error.getMessage() == null || !error.getMessage().contains(text);
    }

    public static TemporaryErrorPredicate not(TemporaryErrorPredicate predicate) {
        ParameterValidator.validateNotNull(predicate, "predicate");
        return (error, attempt) -> !predicate.isTemporary(error, attempt);
    }

    public static TemporaryErrorPredicate and(TemporaryErrorPredicate first, TemporaryErrorPredicate second) {
        ParameterValidator.validateNotNull(first, "first");
        ParameterValidator.validateNotNull(second, "second");
        return (error, attempt) -> first.isTemporary(error, attempt) && second.isTemporary(error, attempt);
    }

    public static TemporaryErrorPredicate or(TemporaryErrorPredicate first, TemporaryErrorPredicate second) {
        ParameterValidator.validateNotNull(first, "first");
        ParameterValidator.validateNotNull(second, "second");
        return (error, attempt) -> first.isTemporary(error, attempt) || second.isTemporary(error, attempt);
    }
}
