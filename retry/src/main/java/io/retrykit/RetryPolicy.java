// Copyright The RetryKit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package io.retrykit;

import io.retrykit.backoff.Backoff;
import io.retrykit.clock.RetryClock;
import io.retrykit.logging.LoggerConfig;
import io.retrykit.validation.ParameterValidator;
import java.util.Objects;

/**
 * Configuration of a retry loop: the backoff template, the retry filter, the attempt budget and the clock.
 *
 * <p>A policy is immutable and may be reused by any number of retry loops, sequentially or concurrently. Every loop
 * works on its own copy of the backoff template, rewound to step 0, so loops never observe each other.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * var policy = RetryPolicy.builder()
 *     .maxSteps(5)
 *     .backoff(Backoff.builder()
 *         .minBackoff(Duration.ofMillis(100))
 *         .maxBackoff(Duration.ofSeconds(10))
 *         .build())
 *     .filter(RetryFilter.neverRetryOn(AuthenticationException.class))
 *     .build();
 *
 * new RetryExecutor(policy).run(RetryContext.withTimeout(Duration.ofSeconds(30)), ctx -> client.send(request));
 * }</pre>
 */
public final class RetryPolicy {
    public static final String DEFAULT_NAME = "retry";

    private final Backoff backoff;
    private final RetryFilter filter;
    private final int maxSteps;
    private final RetryClock clock;
    private final String name;
    private final LoggerConfig loggerConfig;

    private RetryPolicy(Builder builder) {
        this.backoff = builder.backoff != null ? builder.backoff.copy() : Backoff.defaults();
        this.filter = builder.filter != null ? builder.filter : RetryFilter.always();
        this.maxSteps = builder.maxSteps;
        this.clock = builder.clock != null ? builder.clock : RetryClock.system();
        this.name = builder.name != null ? builder.name : DEFAULT_NAME;
        this.loggerConfig = builder.loggerConfig != null ? builder.loggerConfig : LoggerConfig.defaults();
    }

    /**
     * Creates a policy with default backoff, filter and clock.
     *
     * @param maxSteps the maximum number of attempts
     * @return the policy
     */
    public static RetryPolicy withMaxSteps(int maxSteps) {
        return builder().maxSteps(maxSteps).build();
    }

    /**
     * Creates a new builder for RetryPolicy.
     *
     * @return Builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /** @return a builder initialized with this policy's settings */
    public Builder toBuilder() {
        return new Builder()
                .backoff(backoff)
                .filter(filter)
                .maxSteps(maxSteps)
                .clock(clock)
                .name(name)
                .loggerConfig(loggerConfig);
    }

    /**
     * Gets a fresh copy of the backoff template. Callers may advance it freely.
     *
     * @return a copy of the backoff template
     */
    public Backoff backoff() {
        return backoff.copy();
    }

    /** @return the retry filter, never null */
    public RetryFilter filter() {
        return filter;
    }

    /** @return the maximum number of attempts; 0 means the operation is never invoked */
    public int maxSteps() {
        return maxSteps;
    }

    /** @return the clock, never null */
    public RetryClock clock() {
        return clock;
    }

    /** @return the name used in log entries and MDC */
    public String name() {
        return name;
    }

    /** @return the logger configuration, never null */
    public LoggerConfig loggerConfig() {
        return loggerConfig;
    }

    @Override
    public String toString() {
        return String.format("RetryPolicy{name=%s, maxSteps=%d, backoff=%s, clock=%s}", name, maxSteps, backoff, clock);
    }

    /** Builder for RetryPolicy. Every setting except {@code maxSteps} has a default. */
    public static final class Builder {
        private Backoff backoff;
        private RetryFilter filter;
        private Integer maxSteps;
        private RetryClock clock;
        private String name;
        private LoggerConfig loggerConfig;

        private Builder() {}

        /**
         * Sets the backoff template. The policy keeps its own copy, so later changes to the given instance's step
         * counter are not observed.
         *
         * @param backoff the backoff template
         * @return this builder
         */
        public Builder backoff(Backoff backoff) {
            this.backoff = Objects.requireNonNull(backoff, "backoff cannot be null");
            return this;
        }

        /**
         * Sets the retry filter. Defaults to retrying every failure.
         *
         * @param filter the retry filter
         * @return this builder
         */
        public Builder filter(RetryFilter filter) {
            this.filter = Objects.requireNonNull(filter, "filter cannot be null");
            return this;
        }

        /**
         * Sets the maximum number of attempts.
         *
         * @param maxSteps the attempt budget, 0 or more
         * @return this builder
         * @throws IllegalArgumentException if maxSteps is negative
         */
        public Builder maxSteps(int maxSteps) {
            ParameterValidator.validateNonNegativeInteger(maxSteps, "maxSteps");
            this.maxSteps = maxSteps;
            return this;
        }

        /**
         * Sets the clock used for timestamps, deadline checks and sleeps. Defaults to the system clock.
         *
         * @param clock the clock
         * @return this builder
         */
        public Builder clock(RetryClock clock) {
            this.clock = Objects.requireNonNull(clock, "clock cannot be null");
            return this;
        }

        /**
         * Sets the name reported in log entries and MDC. Defaults to {@value RetryPolicy#DEFAULT_NAME}.
         *
         * @param name the name
         * @return this builder
         */
        public Builder name(String name) {
            ParameterValidator.validateName(name, "name");
            this.name = name;
            return this;
        }

        /**
         * Sets the logger configuration.
         *
         * @param loggerConfig the logger configuration
         * @return this builder
         */
        public Builder loggerConfig(LoggerConfig loggerConfig) {
            this.loggerConfig = Objects.requireNonNull(loggerConfig, "loggerConfig cannot be null");
            return this;
        }

        /**
         * Builds the RetryPolicy instance.
         *
         * @return the policy
         * @throws IllegalStateException if maxSteps was not set
         */
        public RetryPolicy build() {
            if (maxSteps == null) {
                throw new IllegalStateException("maxSteps must be set");
            }
            return new RetryPolicy(this);
        }
    }
}
