// Copyright The RetryKit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package io.retrykit.exception;

/** Raised when every allowed attempt failed with an error the filter allowed to retry. */
public class RetryExhaustedException extends RetryFailedException {
    public RetryExhaustedException(AttemptErrors attemptErrors) {
        super(formatMessage(attemptErrors), attemptErrors);
    }
}
