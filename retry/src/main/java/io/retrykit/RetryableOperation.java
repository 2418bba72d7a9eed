// Copyright The RetryKit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package io.retrykit;

/** An operation that may fail and is safe to invoke again. */
@FunctionalInterface
public interface RetryableOperation {

    /**
     * Performs one attempt.
     *
     * @param context the context of the retry loop, to observe cancellation and deadline
     * @throws Exception if the attempt failed
     */
    void run(RetryContext context) throws Exception;
}
