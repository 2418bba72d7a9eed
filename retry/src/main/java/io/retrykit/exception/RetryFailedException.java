// Copyright The RetryKit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package io.retrykit.exception;

import io.retrykit.util.ExceptionHelper;
import java.util.Optional;

/**
 * Raised when a retry loop ends without a successful attempt. Carries every recorded attempt failure in attempt order.
 *
 * <p>{@link #getCause()} is the most recent attempt failure, or null when no attempt ran. Use {@link #matches} and
 * {@link #find} to detect a specific failure buried among earlier attempts.
 */
public abstract class RetryFailedException extends RetryException {
    private final AttemptErrors attemptErrors;

    protected RetryFailedException(String message, AttemptErrors attemptErrors) {
        super(message, attemptErrors.latest().map(AttemptError::error).orElse(null));
        this.attemptErrors = attemptErrors;
    }

    public AttemptErrors getAttemptErrors() {
        return attemptErrors;
    }

    /**
     * Checks whether this exception or any recorded attempt failure is, or was caused by, the target.
     *
     * @param target the exception to look for
     * @return true if found
     */
    public boolean matches(Throwable target) {
        return ExceptionHelper.isOrCausedBy(this, target);
    }

    /**
     * Checks whether this exception or any recorded attempt failure is, or was caused by, an exception of the given
     * type.
     *
     * @param type the type to look for
     * @return true if found
     */
    public boolean matches(Class<? extends Throwable> type) {
        return find(type).isPresent();
    }

    /**
     * Finds the first exception of the given type among this exception and the recorded attempt failures.
     *
     * @param type the type to look for
     * @param <T> the type to look for
     * @return the matching exception, if any
     */
    public <T extends Throwable> Optional<T> find(Class<T> type) {
        return ExceptionHelper.findInChain(this, type);
    }

    static String formatMessage(AttemptErrors attemptErrors) {
        return "errors retrying: " + attemptErrors;
    }
}
