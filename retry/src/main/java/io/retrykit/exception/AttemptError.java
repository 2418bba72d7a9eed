// Copyright The RetryKit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package io.retrykit.exception;

import java.time.Instant;
import java.util.Objects;

/**
 * A failure of a single attempt, stamped with the time the retry driver recorded it.
 *
 * @param timestamp when the failure was recorded
 * @param error the exception thrown by the attempt
 */
public record AttemptError(Instant timestamp, Throwable error) {

    public AttemptError {
        Objects.requireNonNull(timestamp, "timestamp cannot be null");
        Objects.requireNonNull(error, "error cannot be null");
    }

    @Override
    public String toString() {
        return String.format("Error at %s: %s", timestamp, error);
    }
}
