// Copyright The RetryKit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package io.retrykit;

/**
 * An operation producing a value that may fail and is safe to invoke again.
 *
 * @param <T> the type of the produced value
 */
@FunctionalInterface
public interface RetryableCall<T> {

    /**
     * Performs one attempt.
     *
     * @param context the context of the retry loop, to observe cancellation and deadline
     * @return the value of a successful attempt
     * @throws Exception if the attempt failed
     */
    T call(RetryContext context) throws Exception;
}
