// Copyright The RetryKit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package io.retrykit.examples;

import io.retrykit.RetryContext;
import io.retrykit.RetryExecutor;
import io.retrykit.RetryPolicy;
import io.retrykit.RetryableOperation;
import io.retrykit.backoff.Backoff;
import io.retrykit.clock.RetryClock;
import io.retrykit.exception.RetryAbortedException;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Example bounding a retry loop by a time budget rather than only by an attempt count.
 *
 * <p>The loop stops as soon as the next wait would end after the deadline, without sleeping through it.
 */
public class DeadlineExample {

    private static final Logger logger = LoggerFactory.getLogger(DeadlineExample.class);

    private final RetryClock clock;
    private final RetryPolicy policy;

    public DeadlineExample(RetryClock clock) {
        this.clock = clock;
        this.policy = RetryPolicy.builder()
                .name("publish-event")
                .maxSteps(100)
                .clock(clock)
                .backoff(Backoff.builder()
                        .minBackoff(Duration.ofMillis(3))
                        .maxBackoff(Duration.ofSeconds(1))
                        .jitter(0.01)
                        .expFactor(10)
                        .build())
                .build();
    }

    /**
     * Publishes within the given time budget.
     *
     * @return the number of failed attempts if the budget ran out, 0 on success
     */
    public int publishWithin(Duration budget, RetryableOperation publish) throws Exception {
        var context = RetryContext.withTimeout(clock, budget);
        try {
            new RetryExecutor(policy).run(context, publish);
            return 0;
        } catch (RetryAbortedException e) {
            logger.info("Budget of {} exhausted: {}", budget, e.getAbortCause().getMessage());
            return e.getAttemptErrors().size();
        }
    }

    public static void main(String[] args) throws Exception {
        var failed = new DeadlineExample(RetryClock.system()).publishWithin(Duration.ofSeconds(1), ctx -> {
            throw new IllegalStateException("broker unavailable");
        });
        logger.info("Gave up after {} failed attempts", failed);
    }
}
