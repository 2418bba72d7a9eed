// Copyright The RetryKit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package io.retrykit;

import io.retrykit.clock.RetryClock;
import io.retrykit.exception.DeadlineExceededException;
import io.retrykit.validation.ParameterValidator;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Cancellation and deadline handle threaded through a retry loop: the driver hands it to every attempt and to every
 * sleep, and stops as soon as it is done.
 *
 * <p>A context is done once it has been cancelled or has expired. The first cause recorded wins and stays available
 * from {@link #cause()}. A deadline is enforced by the clock that sleeps on the context and by the driver's check
 * before each sleep; only {@link #withTimeout(Duration)} additionally expires the context on its own in wall-clock
 * time.
 *
 * <p>Contexts are thread-safe and may be shared by concurrent retry loops.
 */
public final class RetryContext {
    private final Instant deadline;
    private final CompletableFuture<Throwable> done = new CompletableFuture<>();

    private RetryContext(Instant deadline) {
        this.deadline = deadline;
    }

    /** @return a context without a deadline that is done only once cancelled */
    public static RetryContext create() {
        return new RetryContext(null);
    }

    /**
     * Creates a context whose deadline is enforced against whichever clock sleeps on it.
     *
     * @param deadline the instant after which no further sleep may end
     * @return a new context
     */
    public static RetryContext withDeadline(Instant deadline) {
        Objects.requireNonNull(deadline, "deadline cannot be null");
        return new RetryContext(deadline);
    }

    /**
     * Creates a context whose deadline is the given clock's current time plus the timeout.
     *
     * @param clock the clock to read the current time from
     * @param timeout the time budget
     * @return a new context
     */
    public static RetryContext withTimeout(RetryClock clock, Duration timeout) {
        Objects.requireNonNull(clock, "clock cannot be null");
        ParameterValidator.validateDuration(timeout, "timeout");
        return new RetryContext(clock.now().plus(timeout));
    }

    /**
     * Creates a wall-clock context that expires on its own once the timeout has elapsed, so operations blocking on
     * {@link #await(Duration)} or {@link #whenDone()} observe the deadline too.
     *
     * @param timeout the time budget
     * @return a new context
     */
    public static RetryContext withTimeout(Duration timeout) {
        var context = withTimeout(RetryClock.system(), timeout);
        context.done.completeOnTimeout(
                new DeadlineExceededException(context.deadline), timeout.toNanos(), TimeUnit.NANOSECONDS);
        return context;
    }

    /** @return the deadline, if this context has one */
    public Optional<Instant> deadline() {
        return Optional.ofNullable(deadline);
    }

    /**
     * Cancels this context with a {@link CancellationException} as cause.
     *
     * @return true if this call made the context done
     */
    public boolean cancel() {
        return cancel(new CancellationException("retry context cancelled"));
    }

    /**
     * Cancels this context with the given cause.
     *
     * @param cause why the context was cancelled
     * @return true if this call made the context done, false if it was already done
     */
    public boolean cancel(Throwable cause) {
        Objects.requireNonNull(cause, "cause cannot be null");
        return done.complete(cause);
    }

    /**
     * Marks this context as expired with a {@link DeadlineExceededException} as cause.
     *
     * @return true if this call made the context done
     */
    public boolean expire() {
        return cancel(new DeadlineExceededException(deadline));
    }

    /** @return true once the context has been cancelled or has expired */
    public boolean isDone() {
        return done.isDone();
    }

    /** @return why the context is done, or null while it is not */
    public Throwable cause() {
        return done.getNow(null);
    }

    /**
     * Blocks until the context is done or the timeout elapses.
     *
     * @param timeout the longest time to block
     * @return true if the context is done
     * @throws InterruptedException if the calling thread is interrupted while blocked
     */
    public boolean await(Duration timeout) throws InterruptedException {
        if (done.isDone()) {
            return true;
        }
        try {
            done.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            // done is only ever completed normally
            throw new IllegalStateException("retry context completed exceptionally", e.getCause());
        }
    }

    /** @return a stage completed with the cause once this context is done */
    public CompletionStage<Throwable> whenDone() {
        return done.minimalCompletionStage();
    }

    @Override
    public String toString() {
        return String.format("RetryContext{deadline=%s, cause=%s}", deadline, cause());
    }
}
