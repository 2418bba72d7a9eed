// Copyright The RetryKit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package io.retrykit.backoff;

import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Source of uniformly distributed random values used to jitter backoff intervals.
 *
 * <p>The default source draws from {@link ThreadLocalRandom}, so independent retry loops running on different threads
 * never contend on shared state. A seeded source makes the jitter sequence reproducible.
 */
@FunctionalInterface
public interface RandomSource {

    /** @return the next value, uniformly distributed on {@code [0.0, 1.0)} */
    double nextDouble();

    /** @return a source backed by the calling thread's {@link ThreadLocalRandom} */
    static RandomSource threadLocal() {
        return () -> ThreadLocalRandom.current().nextDouble();
    }

    /**
     * Creates a reproducible source. The returned source is thread-safe but sequences drawn concurrently from it
     * interleave in an unspecified order.
     *
     * @param seed the seed
     * @return a seeded source
     */
    static RandomSource seeded(long seed) {
        var random = new Random(seed);
        return random::nextDouble;
    }
}
