// Copyright The RetryKit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package io.retrykit.exception;

/**
 * Raised when a retry loop stops early because its deadline would be exceeded or its context was cancelled. The
 * attempt failures recorded up to that point are kept; the cause that stopped the loop is available from
 * {@link #getAbortCause()} and is also attached as a suppressed exception.
 */
public class RetryAbortedException extends RetryFailedException {
    private final Throwable abortCause;
    private final AbortReason reason;

    public RetryAbortedException(AttemptErrors attemptErrors, Throwable abortCause) {
        super(formatMessage(attemptErrors, abortCause), attemptErrors);
        this.abortCause = abortCause;
        this.reason = AbortReason.of(abortCause);
        if (abortCause != null) {
            addSuppressed(abortCause);
        }
    }

    public Throwable getAbortCause() {
        return abortCause;
    }

    public AbortReason getReason() {
        return reason;
    }

    public boolean isDeadlineExceeded() {
        return reason == AbortReason.DEADLINE_EXCEEDED;
    }

    private static String formatMessage(AttemptErrors attemptErrors, Throwable abortCause) {
        return String.format(
                "retry aborted (%s: %s), %s", AbortReason.of(abortCause), abortCause, formatMessage(attemptErrors));
    }
}
