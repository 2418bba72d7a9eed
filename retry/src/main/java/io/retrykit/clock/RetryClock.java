// Copyright The RetryKit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package io.retrykit.clock;

import io.retrykit.RetryContext;
import java.time.Duration;
import java.time.Instant;

/**
 * Time source used by the retry driver to timestamp failures, to measure the time left before a deadline and to wait
 * between attempts.
 *
 * <p>Implementations hold no per-loop state and may be shared by any number of concurrent retry loops.
 */
public interface RetryClock {

    /** @return the current instant */
    Instant now();

    /**
     * Sleeps for the given duration unless the context becomes done first.
     *
     * <p>Returns false without sleeping when the context is already done. An implementation that observes the
     * context's deadline passing while sleeping expires the context before returning false. A thread interrupt also
     * ends the sleep early, with the interrupt flag left set.
     *
     * @param context the context whose cancellation interrupts the sleep
     * @param duration how long to sleep
     * @return true if the full duration elapsed, false if the sleep was cut short
     */
    boolean sleepFor(RetryContext context, Duration duration);

    /**
     * Computes the time left until the given instant, negative once it has passed.
     *
     * @param deadline the instant to measure against
     * @return the remaining time
     */
    default Duration until(Instant deadline) {
        return Duration.between(now(), deadline);
    }

    /** @return the clock backed by the system time */
    static RetryClock system() {
        return SystemClock.INSTANCE;
    }
}
