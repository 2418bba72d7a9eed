// Copyright The RetryKit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package io.retrykit.logging;

import io.retrykit.exception.RetryFailedException;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Logger wrapper used by the retry driver. Reports attempt outcomes and publishes the retry name and attempt number
 * via MDC while an attempt runs, so that log entries written by the retried operation carry them too.
 */
public class RetryLogger {
    static final String MDC_RETRY_NAME = "retryName";
    static final String MDC_RETRY_ATTEMPT = "retryAttempt";

    private final Logger delegate;
    private final String retryName;
    private final LoggerConfig config;

    public RetryLogger(Logger delegate, String retryName, LoggerConfig config) {
        this.delegate = delegate;
        this.retryName = retryName;
        this.config = config;
    }

    /**
     * Publishes the attempt context until the returned scope is closed. Values already present under the same MDC
     * keys, e.g. from an enclosing retry loop, are restored on close.
     *
     * @param attempt the one-based attempt number
     * @return the scope to close once the attempt returns
     */
    public AttemptScope enterAttempt(int attempt) {
        if (!config.attemptContextInMdc()) {
            return () -> {};
        }
        var previousName = MDC.get(MDC_RETRY_NAME);
        var previousAttempt = MDC.get(MDC_RETRY_ATTEMPT);
        MDC.put(MDC_RETRY_NAME, retryName);
        MDC.put(MDC_RETRY_ATTEMPT, String.valueOf(attempt));
        return () -> {
            restore(MDC_RETRY_NAME, previousName);
            restore(MDC_RETRY_ATTEMPT, previousAttempt);
        };
    }

    public void attemptFailed(int attempt, int maxSteps, Duration nextWait, Throwable error) {
        delegate.debug(
                "[{}] attempt {}/{} failed, retrying in {}: {}",
                retryName,
                attempt,
                maxSteps,
                nextWait,
                describe(error));
    }

    public void succeeded(int attempt) {
        delegate.debug("[{}] attempt {} succeeded", retryName, attempt);
    }

    public void notRetryable(int attempt, Throwable error) {
        delegate.debug("[{}] attempt {} failed with a non-retryable error: {}", retryName, attempt, describe(error));
    }

    public void exhausted(int maxSteps, RetryFailedException exception) {
        delegate.info(
                "[{}] giving up after {} attempts, last error: {}", retryName, maxSteps, describe(exception.getCause()));
    }

    public void aborted(int attempts, RetryFailedException exception) {
        delegate.info("[{}] aborted after {} attempts: {}", retryName, attempts, exception.getMessage());
    }

    // a trailing Throwable would be taken as the log entry's exception instead of filling the placeholder
    private static String describe(Throwable error) {
        return String.valueOf(error);
    }

    private static void restore(String key, String previous) {
        if (previous == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, previous);
        }
    }

    /** Scope of an attempt's MDC context. */
    @FunctionalInterface
    public interface AttemptScope extends AutoCloseable {
        @Override
        void close();
    }
}
