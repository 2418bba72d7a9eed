// Copyright The RetryKit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package io.retrykit;

import io.retrykit.exception.AttemptError;
import io.retrykit.exception.AttemptErrors;
import io.retrykit.exception.DeadlineExceededException;
import io.retrykit.exception.RetryAbortedException;
import io.retrykit.exception.RetryExhaustedException;
import io.retrykit.logging.RetryLogger;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.LoggerFactory;

/**
 * Runs an operation under a {@link RetryPolicy}, waiting between failed attempts according to the policy's backoff.
 *
 * <p>Each call to {@link #run} or {@link #call} is synchronous: the operation and the waits run on the calling thread.
 * The executor itself holds no per-call state, so one instance may serve concurrent callers.
 *
 * <p>Outcomes:
 *
 * <ul>
 *   <li>the first successful attempt ends the loop normally
 *   <li>a failure rejected by the policy's filter is rethrown as-is; earlier failures are discarded
 *   <li>a {@link RetryAbortedException} when the context's deadline cannot fit the next wait, or the context is
 *       cancelled while waiting
 *   <li>a {@link RetryExhaustedException} once {@code maxSteps} attempts have failed
 * </ul>
 *
 * A wait follows every recorded failure, including the last one. An {@link IllegalStateException} from an invalid
 * backoff ({@code minBackoff > maxBackoff}) propagates unchanged.
 */
public class RetryExecutor {
    private final RetryPolicy policy;
    private final RetryLogger logger;

    public RetryExecutor(RetryPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy cannot be null");
        this.logger = new RetryLogger(
                LoggerFactory.getLogger(RetryExecutor.class), policy.name(), policy.loggerConfig());
    }

    public RetryPolicy getPolicy() {
        return policy;
    }

    /**
     * Invokes the operation until it succeeds, the filter rejects a failure, the attempts run out, or the context
     * stops the loop.
     *
     * @param context the cancellation and deadline handle, passed to every attempt
     * @param operation the operation to attempt
     * @throws RetryExhaustedException if all attempts failed
     * @throws RetryAbortedException if the deadline or a cancellation stopped the loop early
     * @throws Exception the failure of the last attempt, as thrown, if the filter rejected it
     */
    public void run(RetryContext context, RetryableOperation operation) throws Exception {
        Objects.requireNonNull(context, "context cannot be null");
        Objects.requireNonNull(operation, "operation cannot be null");

        var backoff = policy.backoff();
        backoff.reset();
        var clock = policy.clock();
        var maxSteps = policy.maxSteps();
        List<AttemptError> errors = new ArrayList<>();

        for (int step = 0; step < maxSteps; step++) {
            var attempt = step + 1;
            var failure = attempt(context, operation, attempt);
            if (failure == null) {
                logger.succeeded(attempt);
                return;
            }
            if (!policy.filter().shouldRetry(failure)) {
                logger.notRetryable(attempt, failure);
                throw failure;
            }
            errors.add(new AttemptError(clock.now(), failure));

            var wait = backoff.next();
            logger.attemptFailed(attempt, maxSteps, wait, failure);

            var deadline = context.deadline();
            if (deadline.isPresent() && exceedsDeadline(wait, deadline.get())) {
                throw aborted(errors, deadlineCause(context, deadline.get()));
            }
            if (!clock.sleepFor(context, wait)) {
                throw aborted(errors, sleepCause(context));
            }
        }

        var exhausted = new RetryExhaustedException(new AttemptErrors(errors));
        logger.exhausted(maxSteps, exhausted);
        throw exhausted;
    }

    /**
     * Same as {@link #run}, returning the value produced by the first successful attempt.
     *
     * @param context the cancellation and deadline handle, passed to every attempt
     * @param call the operation to attempt
     * @param <T> the type of the produced value
     * @return the value of the successful attempt
     * @throws RetryExhaustedException if all attempts failed
     * @throws RetryAbortedException if the deadline or a cancellation stopped the loop early
     * @throws Exception the failure of the last attempt, as thrown, if the filter rejected it
     */
    public <T> T call(RetryContext context, RetryableCall<T> call) throws Exception {
        Objects.requireNonNull(call, "call cannot be null");
        var result = new AtomicReference<T>();
        run(context, ctx -> result.set(call.call(ctx)));
        return result.get();
    }

    private Exception attempt(RetryContext context, RetryableOperation operation, int attempt) {
        try (var scope = logger.enterAttempt(attempt)) {
            operation.run(context);
            return null;
        } catch (InterruptedException e) {
            // keep the interrupt visible to the following sleep
            Thread.currentThread().interrupt();
            return e;
        } catch (Exception e) {
            return e;
        }
    }

    private boolean exceedsDeadline(Duration wait, Instant deadline) {
        return wait.compareTo(policy.clock().until(deadline)) > 0;
    }

    private static Throwable deadlineCause(RetryContext context, Instant deadline) {
        var cause = context.cause();
        return cause != null ? cause : new DeadlineExceededException(deadline);
    }

    private static Throwable sleepCause(RetryContext context) {
        var cause = context.cause();
        return cause != null ? cause : new CancellationException("sleep interrupted");
    }

    private RetryAbortedException aborted(List<AttemptError> errors, Throwable cause) {
        var aborted = new RetryAbortedException(new AttemptErrors(errors), cause);
        logger.aborted(errors.size(), aborted);
        return aborted;
    }
}
