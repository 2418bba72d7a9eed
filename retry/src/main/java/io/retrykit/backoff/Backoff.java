// Copyright The RetryKit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package io.retrykit.backoff;

import io.retrykit.validation.ParameterValidator;
import java.time.Duration;
import java.util.Objects;

/**
 * Generator of jittered, exponentially growing wait intervals bounded by {@code [minBackoff, maxBackoff]}.
 *
 * <p>The interval for the n-th retry is {@code minBackoff * expFactor^n}, capped at {@code maxBackoff}, then jittered
 * by a random fraction of itself:
 *
 * <ul>
 *   <li>when the interval sits at the cap, the jitter only pulls it down, within {@code [-jitter, 0]}
 *   <li>when the interval sits at the floor, the jitter only pushes it up, within {@code [0, jitter]}
 *   <li>otherwise the jitter is symmetric, within {@code [-jitter, jitter]}
 * </ul>
 *
 * The result is clamped back into {@code [minBackoff, maxBackoff]}.
 *
 * <p>{@code jitter} is expected on {@code (0, 1)} and {@code expFactor} above 1. Neither is validated: a factor of 1 or
 * less makes the sequence stay at (or shrink towards) the floor, and a jitter outside {@code (0, 1)} produces
 * unusually wide or inverted swings, which the final clamp still keeps inside the bounds.
 *
 * <p>Instances carry a mutable step counter and are <b>not</b> thread-safe. Use {@link #copy()} to give every
 * independent retry loop its own generator.
 */
public final class Backoff {

    public static final Duration DEFAULT_MIN_BACKOFF = Duration.ofMillis(1);
    public static final Duration DEFAULT_MAX_BACKOFF = Duration.ofMinutes(1);
    public static final double DEFAULT_JITTER = 0.1;
    public static final double DEFAULT_EXP_FACTOR = 1.2;

    private final Duration minBackoff;
    private final Duration maxBackoff;
    private final double jitter;
    private final double expFactor;
    private final RandomSource randomSource;
    private int step;

    private Backoff(Builder builder) {
        this.minBackoff = builder.minBackoff;
        this.maxBackoff = builder.maxBackoff;
        this.jitter = builder.jitter;
        this.expFactor = builder.expFactor;
        this.randomSource = builder.randomSource;
        this.step = 0;
    }

    private Backoff(Backoff other) {
        this.minBackoff = other.minBackoff;
        this.maxBackoff = other.maxBackoff;
        this.jitter = other.jitter;
        this.expFactor = other.expFactor;
        this.randomSource = other.randomSource;
        this.step = other.step;
    }

    /**
     * Creates a backoff with reasonable defaults: 1ms floor, 1 minute cap, 10% jitter and a growth factor of 1.2.
     *
     * @return a fresh backoff at step 0
     */
    public static Backoff defaults() {
        return builder().build();
    }

    /**
     * Creates a new builder initialized with the default parameters.
     *
     * @return a new Builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a builder initialized with this backoff's parameters. The step counter is not carried over.
     *
     * @return a new Builder instance
     */
    public Builder toBuilder() {
        return new Builder()
                .minBackoff(minBackoff)
                .maxBackoff(maxBackoff)
                .jitter(jitter)
                .expFactor(expFactor)
                .randomSource(randomSource);
    }

    /**
     * Copies every parameter and the current step counter. Advancing or resetting the copy never affects this
     * instance.
     *
     * @return an independent copy
     */
    public Backoff copy() {
        return new Backoff(this);
    }

    /** Rewinds the step counter to 0, leaving the parameters untouched. */
    public void reset() {
        step = 0;
    }

    /**
     * Returns the next interval in the sequence and advances the step counter.
     *
     * @return the interval for the current step
     * @throws IllegalStateException if {@code minBackoff > maxBackoff}
     */
    public Duration next() {
        var backoff = backoffFor(step);
        step++;
        return backoff;
    }

    /**
     * Computes the interval for the n-th retry. Depends only on {@code n} and the parameters (plus fresh randomness),
     * never on the step counter.
     *
     * @param n the zero-based retry index
     * @return a duration within {@code [minBackoff, maxBackoff]}
     * @throws IllegalStateException if {@code minBackoff > maxBackoff}
     */
    public Duration backoffFor(int n) {
        if (minBackoff.compareTo(maxBackoff) > 0) {
            throw new IllegalStateException(
                    String.format("minBackoff (%s) > maxBackoff (%s)", minBackoff, maxBackoff));
        }
        long minNanos = minBackoff.toNanos();
        long maxNanos = maxBackoff.toNanos();

        double expMul = Math.pow(expFactor, n);
        // NaN (e.g. a NaN factor) truncates to 0 and lands on the floor below
        long backoffNanos = (long) Math.min(Math.max(minNanos * expMul, 0), maxNanos);

        double jitterFraction;
        if (backoffNanos >= maxNanos) {
            backoffNanos = maxNanos;
            jitterFraction = jitterDown();
        } else if (backoffNanos <= minNanos) {
            backoffNanos = minNanos;
            jitterFraction = jitterUp();
        } else {
            jitterFraction = jitterEither();
        }

        backoffNanos += (long) (jitterFraction * backoffNanos);

        if (backoffNanos > maxNanos) {
            return maxBackoff;
        } else if (backoffNanos < minNanos) {
            return minBackoff;
        }
        return Duration.ofNanos(backoffNanos);
    }

    // [-jitter, jitter)
    private double jitterEither() {
        return jitter * (randomSource.nextDouble() - 0.5) * 2;
    }

    // (-jitter, 0]
    private double jitterDown() {
        return -jitter * randomSource.nextDouble();
    }

    // [0, jitter)
    private double jitterUp() {
        return jitter * randomSource.nextDouble();
    }

    /** @return the shortest interval this backoff produces */
    public Duration getMinBackoff() {
        return minBackoff;
    }

    /** @return the longest interval this backoff produces */
    public Duration getMaxBackoff() {
        return maxBackoff;
    }

    /** @return the maximum jitter fraction */
    public double getJitter() {
        return jitter;
    }

    /** @return the per-step growth multiplier */
    public double getExpFactor() {
        return expFactor;
    }

    /** @return the randomness used for jitter */
    public RandomSource getRandomSource() {
        return randomSource;
    }

    /** @return the index of the interval the next call to {@link #next()} returns */
    public int getStep() {
        return step;
    }

    @Override
    public String toString() {
        return String.format(
                "Backoff{minBackoff=%s, maxBackoff=%s, jitter=%s, expFactor=%s, step=%d}",
                minBackoff, maxBackoff, jitter, expFactor, step);
    }

    /** Builder for creating Backoff instances. */
    public static final class Builder {
        private Duration minBackoff = DEFAULT_MIN_BACKOFF;
        private Duration maxBackoff = DEFAULT_MAX_BACKOFF;
        private double jitter = DEFAULT_JITTER;
        private double expFactor = DEFAULT_EXP_FACTOR;
        private RandomSource randomSource = RandomSource.threadLocal();

        private Builder() {}

        /**
         * Sets the shortest interval. Must not exceed the longest interval when values are generated.
         *
         * @param minBackoff the floor, not negative
         * @return this builder for method chaining
         */
        public Builder minBackoff(Duration minBackoff) {
            ParameterValidator.validateDuration(minBackoff, "minBackoff");
            this.minBackoff = minBackoff;
            return this;
        }

        /**
         * Sets the longest interval. When equal to the floor, the interval is constant.
         *
         * @param maxBackoff the cap, not negative
         * @return this builder for method chaining
         */
        public Builder maxBackoff(Duration maxBackoff) {
            ParameterValidator.validateDuration(maxBackoff, "maxBackoff");
            this.maxBackoff = maxBackoff;
            return this;
        }

        /**
         * Sets the maximum fraction of an interval that may be added or subtracted at random.
         *
         * @param jitter the jitter fraction, expected on (0, 1)
         * @return this builder for method chaining
         */
        public Builder jitter(double jitter) {
            this.jitter = jitter;
            return this;
        }

        /**
         * Sets the multiplier applied to the interval per step.
         *
         * @param expFactor the growth factor, expected above 1
         * @return this builder for method chaining
         */
        public Builder expFactor(double expFactor) {
            this.expFactor = expFactor;
            return this;
        }

        /**
         * Sets the randomness used for jitter.
         *
         * @param randomSource the source of uniform values on [0, 1)
         * @return this builder for method chaining
         */
        public Builder randomSource(RandomSource randomSource) {
            this.randomSource = Objects.requireNonNull(randomSource, "randomSource cannot be null");
            return this;
        }

        /**
         * Builds the Backoff instance.
         *
         * @return a new Backoff at step 0
         */
        public Backoff build() {
            return new Backoff(this);
        }
    }
}
