// Copyright The RetryKit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package io.retrykit;

import io.retrykit.backoff.Backoff;

/**
 * Shortcuts for one-off retry loops on the system clock.
 *
 * <p>The given backoff is copied and rewound before use; its own step counter is never touched.
 */
public final class Retries {

    private Retries() {}

    /**
     * Invokes the operation at most {@code steps} times, waiting between failures according to the backoff.
     *
     * @param context the cancellation and deadline handle, passed to every attempt
     * @param backoff the backoff parameters
     * @param steps the maximum number of attempts
     * @param operation the operation to attempt
     * @throws Exception see {@link RetryExecutor#run}
     */
    public static void run(RetryContext context, Backoff backoff, int steps, RetryableOperation operation)
            throws Exception {
        executor(backoff, steps).run(context, operation);
    }

    /**
     * Invokes the operation at most {@code steps} times, returning the value of the first successful attempt.
     *
     * @param context the cancellation and deadline handle, passed to every attempt
     * @param backoff the backoff parameters
     * @param steps the maximum number of attempts
     * @param call the operation to attempt
     * @param <T> the type of the produced value
     * @return the value of the successful attempt
     * @throws Exception see {@link RetryExecutor#call}
     */
    public static <T> T call(RetryContext context, Backoff backoff, int steps, RetryableCall<T> call)
            throws Exception {
        return executor(backoff, steps).call(context, call);
    }

    private static RetryExecutor executor(Backoff backoff, int steps) {
        var fresh = backoff.copy();
        fresh.reset();
        return new RetryExecutor(RetryPolicy.builder().backoff(fresh).maxSteps(steps).build());
    }
}
