// Copyright The Retry Executor Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package io.github.retryexecutor.validation;

import java.time.Duration;

/**
 * Utility class for validating input parameters of the retry executor.
 *
 * <p>Provides common validation methods to ensure consistent error messages and validation logic across the SDK.
 */
public final class ParameterValidator {

    private ParameterValidator() {
        // Utility class - prevent instantiation
    }

    /**
     * Validates that a required argument is present.
     *
     * @param value the value to validate
     * @param parameterName the name of the parameter (for error messages)
     * @throws IllegalArgumentException if value is null
     */
    public static void validateNotNull(Object value, String parameterName) {
        if (value == null) {
            throw new IllegalArgumentException(parameterName + " cannot be null");
        }
    }

    /**
     * Validates that an integer value is positive (greater than 0).
     *
     * @param value the value to validate
     * @param parameterName the name of the parameter (for error messages)
     * @throws IllegalArgumentException if value is null or not positive
     */
    public static void validatePositiveInteger(Integer value, String parameterName) {
        validateNotNull(value, parameterName);
        if (value <= 0) {
            throw new IllegalArgumentException(parameterName + " must be positive, got: " + value);
        }
    }

    /**
     * Validates that a duration is present and not negative.
     *
     * @param duration the duration to validate
     * @param parameterName the name of the parameter (for error messages)
     * @throws IllegalArgumentException if duration is null or negative
     */
    public static void validateNonNegativeDuration(Duration duration, String parameterName) {
        validateNotNull(duration, parameterName);
        if (duration.isNegative()) {
            throw new IllegalArgumentException(parameterName + " cannot be negative, got: " + duration);
        }
    }

    /**
     * Validates that a duration is present and strictly positive.
     *
     * @param duration the duration to validate
     * @param parameterName the name of the parameter (for error messages)
     * @throws IllegalArgumentException if duration is null, zero or negative
     */
    public static void validatePositiveDuration(Duration duration, String parameterName) {
        validateNotNull(duration, parameterName);
        if (duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException(parameterName + " must be positive, got: " + duration);
        }
    }
}
