// Copyright The RetryKit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package io.retrykit.exception;

/** Why a retry loop stopped before using all of its attempts. */
public enum AbortReason {

    /** The deadline passed, or the next wait would have overrun it. */
    DEADLINE_EXCEEDED,

    /** The context was cancelled, or the sleeping thread was interrupted. */
    CANCELLED;

    /**
     * Classifies the cause recorded on a context.
     *
     * @param cause the cause that ended the loop
     * @return DEADLINE_EXCEEDED for a {@link DeadlineExceededException}, CANCELLED otherwise
     */
    public static AbortReason of(Throwable cause) {
        return cause instanceof DeadlineExceededException ? DEADLINE_EXCEEDED : CANCELLED;
    }
}
