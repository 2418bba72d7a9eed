// Copyright The RetryKit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package io.retrykit.clock;

import io.retrykit.RetryContext;
import java.time.Duration;
import java.time.Instant;

/** {@link RetryClock} backed by the system time. Sleeps block the calling thread. */
public final class SystemClock implements RetryClock {
    static final SystemClock INSTANCE = new SystemClock();

    private SystemClock() {}

    @Override
    public Instant now() {
        return Instant.now();
    }

    @Override
    public boolean sleepFor(RetryContext context, Duration duration) {
        if (context.isDone()) {
            return false;
        }
        if (duration.isZero() || duration.isNegative()) {
            return true;
        }

        var wait = duration;
        var deadlineFirst = false;
        var deadline = context.deadline();
        if (deadline.isPresent()) {
            var remaining = until(deadline.get());
            if (remaining.compareTo(duration) < 0) {
                wait = remaining.isNegative() ? Duration.ZERO : remaining;
                deadlineFirst = true;
            }
        }

        try {
            if (context.await(wait)) {
                return false;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }

        if (deadlineFirst) {
            context.expire();
            return false;
        }
        return true;
    }

    @Override
    public String toString() {
        return "SystemClock";
    }
}
