// Copyright The RetryKit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package io.retrykit.examples;

import io.retrykit.RetryContext;
import io.retrykit.RetryExecutor;
import io.retrykit.RetryFilter;
import io.retrykit.RetryPolicy;
import io.retrykit.RetryableCall;
import io.retrykit.exception.RetryAbortedException;
import io.retrykit.exception.RetryExhaustedException;
import java.net.SocketTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Example demonstrating how callers tell the outcomes of a retry loop apart.
 *
 * <p>This example shows how to handle:
 * <ul>
 *   <li>{@link AccessDeniedException} - rejected by the filter and rethrown as-is on its first occurrence
 *   <li>{@link RetryExhaustedException} - every attempt failed; earlier failures stay searchable
 *   <li>{@link RetryAbortedException} - the deadline or a cancellation stopped the loop
 * </ul>
 */
public class ErrorHandlingExample {

    private static final Logger logger = LoggerFactory.getLogger(ErrorHandlingExample.class);

    /** Outcome reported to the caller. */
    public enum Outcome {
        SUCCEEDED,
        DENIED,
        TIMED_OUT_ON_SOME_ATTEMPT,
        GAVE_UP,
        ABORTED_BY_DEADLINE,
        CANCELLED
    }

    /** Failure that retrying cannot fix. */
    public static class AccessDeniedException extends RuntimeException {
        public AccessDeniedException(String message) {
            super(message);
        }
    }

    private final RetryExecutor executor;

    public ErrorHandlingExample(RetryPolicy policy) {
        this.executor = new RetryExecutor(
                policy.toBuilder().filter(RetryFilter.neverRetryOn(AccessDeniedException.class)).build());
    }

    public Outcome fetch(RetryContext context, RetryableCall<String> call) throws Exception {
        try {
            var body = executor.call(context, call);
            logger.info("Fetched {} characters", body.length());
            return Outcome.SUCCEEDED;
        } catch (AccessDeniedException e) {
            logger.warn("Access denied, not retrying: {}", e.getMessage());
            return Outcome.DENIED;
        } catch (RetryExhaustedException e) {
            // getCause() is only the last failure, matches() searches all of them
            if (e.matches(SocketTimeoutException.class)) {
                logger.warn("Gave up after {} attempts, at least one timed out", e.getAttemptErrors().size());
                return Outcome.TIMED_OUT_ON_SOME_ATTEMPT;
            }
            logger.warn("Gave up after {} attempts", e.getAttemptErrors().size());
            return Outcome.GAVE_UP;
        } catch (RetryAbortedException e) {
            logger.warn("Stopped early ({}) after {} attempts", e.getReason(), e.getAttemptErrors().size());
            return e.isDeadlineExceeded() ? Outcome.ABORTED_BY_DEADLINE : Outcome.CANCELLED;
        }
    }
}
