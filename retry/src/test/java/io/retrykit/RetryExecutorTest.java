// Copyright The RetryKit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package io.retrykit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import io.retrykit.backoff.Backoff;
import io.retrykit.clock.RetryClock;
import io.retrykit.exception.AbortReason;
import io.retrykit.exception.DeadlineExceededException;
import io.retrykit.exception.RetryAbortedException;
import io.retrykit.exception.RetryExhaustedException;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RetryExecutorTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    private RetryClock clock;
    private AtomicInteger calls;

    @BeforeEach
    void setUp() {
        clock = mock(RetryClock.class);
        when(clock.now()).thenReturn(NOW);
        when(clock.sleepFor(any(), any())).thenReturn(true);
        calls = new AtomicInteger();
    }

    private RetryPolicy.Builder policy(int maxSteps) {
        return RetryPolicy.builder()
                .maxSteps(maxSteps)
                .clock(clock)
                .backoff(Backoff.builder()
                        .minBackoff(Duration.ofMillis(10))
                        .maxBackoff(Duration.ofSeconds(1))
                        .randomSource(() -> 0.5)
                        .build());
    }

    private RetryableOperation failing() {
        return ctx -> {
            throw new IOException("failure " + calls.incrementAndGet());
        };
    }

    private RetryableOperation failingTimes(int failures) {
        return ctx -> {
            if (calls.incrementAndGet() <= failures) {
                throw new IOException("failure " + calls.get());
            }
        };
    }

    @Test
    void testSucceedsOnFirstAttempt() throws Exception {
        new RetryExecutor(policy(18).build()).run(RetryContext.create(), failingTimes(0));

        assertEquals(1, calls.get());
        verify(clock, never()).sleepFor(any(), any());
    }

    @Test
    void testRetriesUntilSuccess() throws Exception {
        var context = RetryContext.create();

        new RetryExecutor(policy(18).build()).run(context, failingTimes(1));

        assertEquals(2, calls.get());
        // 10ms floor jittered up by half of 10%
        verify(clock).sleepFor(context, Duration.ofNanos(10_500_000));
    }

    @Test
    void testExhaustsAllAttempts() {
        var executor = new RetryExecutor(policy(8).build());

        var exception = assertThrows(RetryExhaustedException.class, () -> executor.run(RetryContext.create(), failing()));

        assertEquals(8, calls.get());
        assertEquals(8, exception.getAttemptErrors().size());
        for (int i = 0; i < 8; i++) {
            var attemptError = exception.getAttemptErrors().get(i);
            assertEquals(NOW, attemptError.timestamp());
            assertEquals("failure " + (i + 1), attemptError.error().getMessage());
        }
        assertEquals("failure 8", exception.getCause().getMessage());
        assertTrue(exception.getMessage().startsWith("errors retrying: [Error at 2026-01-01T00:00:00Z: "
                + "java.io.IOException: failure 1, Error at"));
        // a wait follows every failure, the last one included
        verify(clock, times(8)).sleepFor(any(), any());
    }

    @Test
    void testZeroStepsNeverInvokesOperation() {
        var executor = new RetryExecutor(policy(0).build());

        var exception = assertThrows(RetryExhaustedException.class, () -> executor.run(RetryContext.create(), failing()));

        assertEquals(0, calls.get());
        assertTrue(exception.getAttemptErrors().isEmpty());
        assertNull(exception.getCause());
    }

    @Test
    void testFilterRejectionRethrowsRawError() {
        var fatal = new IllegalArgumentException("bad credentials");
        var executor = new RetryExecutor(policy(18)
                .filter(RetryFilter.neverRetryOn(IllegalArgumentException.class))
                .build());

        var thrown = assertThrows(IllegalArgumentException.class, () -> executor.run(RetryContext.create(), ctx -> {
            if (calls.incrementAndGet() < 3) {
                throw new IOException("transient");
            }
            throw fatal;
        }));

        assertSame(fatal, thrown);
        assertEquals(3, calls.get());
        assertEquals(0, thrown.getSuppressed().length);
        verify(clock, times(2)).sleepFor(any(), any());
    }

    @Test
    void testFilterRejectionOnFirstAttemptSkipsAggregation() {
        var executor = new RetryExecutor(policy(18).filter(error -> false).build());

        var thrown = assertThrows(IOException.class, () -> executor.run(RetryContext.create(), failing()));

        assertEquals("failure 1", thrown.getMessage());
        assertEquals(1, calls.get());
        verify(clock, never()).now();
        verify(clock, never()).sleepFor(any(), any());
    }

    @Test
    void testAbortsBeforeSleepingPastDeadline() {
        var deadline = NOW.plusSeconds(1);
        var context = RetryContext.withDeadline(deadline);
        when(clock.until(deadline))
                .thenReturn(Duration.ofSeconds(1), Duration.ofMillis(996), Duration.ofMillis(956), Duration.ofMillis(556));
        var executor = new RetryExecutor(policy(80)
                .backoff(Backoff.builder()
                        .minBackoff(Duration.ofMillis(3))
                        .maxBackoff(Duration.ofSeconds(1))
                        .jitter(0.01)
                        .expFactor(10)
                        .build())
                .build());

        var exception = assertThrows(RetryAbortedException.class, () -> executor.run(context, failing()));

        assertEquals(4, calls.get());
        assertEquals(4, exception.getAttemptErrors().size());
        assertEquals(AbortReason.DEADLINE_EXCEEDED, exception.getReason());
        assertTrue(exception.isDeadlineExceeded());
        var cause = assertInstanceOf(DeadlineExceededException.class, exception.getAbortCause());
        assertEquals(deadline, cause.getDeadline());
        verify(clock, times(3)).sleepFor(eq(context), any());
        // the deadline has not actually passed
        assertFalse(context.isDone());
    }

    @Test
    void testFirstWaitAlreadyBeyondDeadline() {
        var deadline = NOW.plusMillis(5);
        var context = RetryContext.withDeadline(deadline);
        when(clock.until(deadline)).thenReturn(Duration.ofMillis(5));

        var exception = assertThrows(
                RetryAbortedException.class, () -> new RetryExecutor(policy(18).build()).run(context, failing()));

        assertEquals(1, exception.getAttemptErrors().size());
        assertEquals(AbortReason.DEADLINE_EXCEEDED, exception.getReason());
        verify(clock, never()).sleepFor(any(), any());
    }

    @Test
    void testCancellationDuringSleepAborts() {
        var context = RetryContext.create();
        when(clock.sleepFor(any(), any())).thenAnswer(invocation -> {
            context.cancel();
            return false;
        });

        var exception = assertThrows(
                RetryAbortedException.class, () -> new RetryExecutor(policy(18).build()).run(context, failing()));

        assertEquals(1, calls.get());
        assertEquals(1, exception.getAttemptErrors().size());
        assertEquals(AbortReason.CANCELLED, exception.getReason());
        assertSame(context.cause(), exception.getAbortCause());
        assertInstanceOf(CancellationException.class, exception.getAbortCause());
        assertSame(exception.getAbortCause(), exception.getSuppressed()[0]);
    }

    @Test
    void testExpiryDuringSleepAbortsWithDeadlineReason() {
        var context = RetryContext.create();
        when(clock.sleepFor(any(), any())).thenAnswer(invocation -> {
            context.expire();
            return false;
        });

        var exception = assertThrows(
                RetryAbortedException.class, () -> new RetryExecutor(policy(18).build()).run(context, failing()));

        assertEquals(AbortReason.DEADLINE_EXCEEDED, exception.getReason());
    }

    @Test
    void testSleepCutShortWithoutContextCause() {
        when(clock.sleepFor(any(), any())).thenReturn(true, true, false);

        var exception = assertThrows(
                RetryAbortedException.class,
                () -> new RetryExecutor(policy(18).build()).run(RetryContext.create(), failing()));

        assertEquals(3, exception.getAttemptErrors().size());
        assertEquals(AbortReason.CANCELLED, exception.getReason());
        assertEquals("sleep interrupted", exception.getAbortCause().getMessage());
    }

    @Test
    void testInterruptedOperationRestoresInterruptFlag() {
        when(clock.sleepFor(any(), any())).thenAnswer(invocation -> !Thread.currentThread().isInterrupted());

        try {
            var exception = assertThrows(
                    RetryAbortedException.class,
                    () -> new RetryExecutor(policy(18).build()).run(RetryContext.create(), ctx -> {
                        calls.incrementAndGet();
                        throw new InterruptedException("stop");
                    }));

            assertEquals(1, calls.get());
            assertInstanceOf(InterruptedException.class, exception.getCause());
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void testInvalidBackoffPropagates() {
        var executor = new RetryExecutor(policy(18)
                .backoff(Backoff.builder()
                        .minBackoff(Duration.ofSeconds(2))
                        .maxBackoff(Duration.ofSeconds(1))
                        .build())
                .build());

        assertThrows(IllegalStateException.class, () -> executor.run(RetryContext.create(), failing()));
        assertEquals(1, calls.get());
    }

    @Test
    void testOperationReceivesTheCallersContext() throws Exception {
        var context = RetryContext.create();
        List<RetryContext> seen = new ArrayList<>();

        new RetryExecutor(policy(5).build()).run(context, ctx -> {
            seen.add(ctx);
            if (seen.size() < 3) {
                throw new IOException("again");
            }
        });

        assertEquals(List.of(context, context, context), seen);
        verify(clock, times(2)).sleepFor(same(context), any());
    }

    @Test
    void testCallReturnsValueOfSuccessfulAttempt() throws Exception {
        var result = new RetryExecutor(policy(18).build()).call(RetryContext.create(), ctx -> {
            if (calls.incrementAndGet() < 3) {
                throw new IOException("not yet");
            }
            return "value-" + calls.get();
        });

        assertEquals("value-3", result);
    }

    @Test
    void testPolicyReuseStartsEachRunFromFirstStep() throws Exception {
        var policy = policy(18).build();
        var executor = new RetryExecutor(policy);
        var context = RetryContext.create();

        executor.run(context, failingTimes(1));
        calls.set(0);
        executor.run(context, failingTimes(1));

        verify(clock, times(2)).sleepFor(context, Duration.ofNanos(10_500_000));
        assertEquals(0, policy.backoff().getStep());
    }

    @Test
    void testRequiresContextAndOperation() {
        var executor = new RetryExecutor(policy(1).build());

        assertThrows(NullPointerException.class, () -> executor.run(null, failing()));
        assertThrows(NullPointerException.class, () -> executor.run(RetryContext.create(), null));
        assertThrows(NullPointerException.class, () -> new RetryExecutor(null));
    }
}
