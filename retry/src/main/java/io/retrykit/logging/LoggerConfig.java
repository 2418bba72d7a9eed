// Copyright The RetryKit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package io.retrykit.logging;

/** Configuration for RetryLogger behavior. */
public record LoggerConfig(boolean attemptContextInMdc) {

    /** Default configuration: publish the retry name and attempt number in the MDC while an attempt runs. */
    public static LoggerConfig defaults() {
        return new LoggerConfig(true);
    }

    /** Configuration that leaves the MDC untouched. */
    public static LoggerConfig withoutAttemptContext() {
        return new LoggerConfig(false);
    }
}
