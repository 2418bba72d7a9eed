// Copyright The RetryKit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package io.retrykit.exception;

import java.time.Instant;

/** Cause recorded on a {@code RetryContext} whose deadline has passed, or would pass before the next attempt. */
public class DeadlineExceededException extends RetryException {
    private final Instant deadline;

    public DeadlineExceededException(Instant deadline) {
        super("deadline exceeded: " + deadline);
        this.deadline = deadline;
    }

    public Instant getDeadline() {
        return deadline;
    }
}
