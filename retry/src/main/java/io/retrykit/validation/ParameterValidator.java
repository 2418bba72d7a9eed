// Copyright The RetryKit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package io.retrykit.validation;

import java.time.Duration;

/**
 * Utility class for validating input parameters of the retry builders.
 *
 * <p>Provides common validation methods to ensure consistent error messages and validation logic across the library.
 */
public final class ParameterValidator {

    private ParameterValidator() {
        // Utility class - prevent instantiation
    }

    /**
     * Validates that a duration is present and not negative.
     *
     * @param duration the duration to validate
     * @param parameterName the name of the parameter (for error messages)
     * @throws IllegalArgumentException if duration is null or negative
     */
    public static void validateDuration(Duration duration, String parameterName) {
        if (duration == null) {
            throw new IllegalArgumentException(parameterName + " cannot be null");
        }
        if (duration.isNegative()) {
            throw new IllegalArgumentException(parameterName + " cannot be negative, got: " + duration);
        }
    }

    /**
     * Validates that an integer value is zero or greater.
     *
     * @param value the value to validate
     * @param parameterName the name of the parameter (for error messages)
     * @throws IllegalArgumentException if value is negative
     */
    public static void validateNonNegativeInteger(int value, String parameterName) {
        if (value < 0) {
            throw new IllegalArgumentException(parameterName + " cannot be negative, got: " + value);
        }
    }

    /**
     * Validates that a name is present and not blank.
     *
     * @param value the value to validate
     * @param parameterName the name of the parameter (for error messages)
     * @throws IllegalArgumentException if value is null or blank
     */
    public static void validateName(String value, String parameterName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(parameterName + " cannot be null or blank");
        }
    }
}
