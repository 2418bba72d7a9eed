// Copyright The RetryKit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package io.retrykit;

import java.util.List;

/**
 * Decides whether a failed attempt may be retried. A rejected failure ends the retry loop immediately and is rethrown
 * to the caller as-is.
 */
@FunctionalInterface
public interface RetryFilter {

    /**
     * @param error the exception thrown by the attempt
     * @return true to keep retrying, false to stop and rethrow the error
     */
    boolean shouldRetry(Throwable error);

    /** @return a filter that retries every failure */
    static RetryFilter always() {
        return error -> true;
    }

    /**
     * Creates a filter that retries only failures of the given types (or their subtypes).
     *
     * @param types the retryable exception types
     * @return the filter
     */
    @SafeVarargs
    static RetryFilter retryOn(Class<? extends Throwable>... types) {
        var retryable = List.of(types);
        return error -> retryable.stream().anyMatch(type -> type.isInstance(error));
    }

    /**
     * Creates a filter that retries every failure except those of the given types (or their subtypes).
     *
     * @param types the non-retryable exception types
     * @return the filter
     */
    @SafeVarargs
    static RetryFilter neverRetryOn(Class<? extends Throwable>... types) {
        var fatal = List.of(types);
        return error -> fatal.stream().noneMatch(type -> type.isInstance(error));
    }
}
