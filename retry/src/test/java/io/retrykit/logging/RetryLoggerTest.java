// Copyright The RetryKit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package io.retrykit.logging;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import io.retrykit.exception.AttemptError;
import io.retrykit.exception.AttemptErrors;
import io.retrykit.exception.RetryExhaustedException;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.MDC;

class RetryLoggerTest {

    private static final String RETRY_NAME = "fetch-order";

    private Logger mockLogger;

    @BeforeEach
    void setUp() {
        mockLogger = mock(Logger.class);
        MDC.clear();
    }

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    void publishesAttemptContextWhileScopeIsOpen() {
        var logger = new RetryLogger(mockLogger, RETRY_NAME, LoggerConfig.defaults());

        try (var scope = logger.enterAttempt(3)) {
            assertEquals(RETRY_NAME, MDC.get(RetryLogger.MDC_RETRY_NAME));
            assertEquals("3", MDC.get(RetryLogger.MDC_RETRY_ATTEMPT));
        }

        assertNull(MDC.get(RetryLogger.MDC_RETRY_NAME));
        assertNull(MDC.get(RetryLogger.MDC_RETRY_ATTEMPT));
    }

    @Test
    void restoresEnclosingAttemptContext() {
        var outer = new RetryLogger(mockLogger, "outer", LoggerConfig.defaults());
        var inner = new RetryLogger(mockLogger, "inner", LoggerConfig.defaults());

        try (var outerScope = outer.enterAttempt(2)) {
            try (var innerScope = inner.enterAttempt(5)) {
                assertEquals("inner", MDC.get(RetryLogger.MDC_RETRY_NAME));
                assertEquals("5", MDC.get(RetryLogger.MDC_RETRY_ATTEMPT));
            }
            assertEquals("outer", MDC.get(RetryLogger.MDC_RETRY_NAME));
            assertEquals("2", MDC.get(RetryLogger.MDC_RETRY_ATTEMPT));
        }
    }

    @Test
    void leavesMdcUntouchedWhenDisabled() {
        var logger = new RetryLogger(mockLogger, RETRY_NAME, LoggerConfig.withoutAttemptContext());
        MDC.put(RetryLogger.MDC_RETRY_NAME, "caller");

        try (var scope = logger.enterAttempt(1)) {
            assertEquals("caller", MDC.get(RetryLogger.MDC_RETRY_NAME));
            assertNull(MDC.get(RetryLogger.MDC_RETRY_ATTEMPT));
        }

        assertEquals("caller", MDC.get(RetryLogger.MDC_RETRY_NAME));
    }

    @Test
    void logsFailedAttemptAtDebugWithoutStackTrace() {
        var logger = new RetryLogger(mockLogger, RETRY_NAME, LoggerConfig.defaults());
        var error = new IOException("connection reset");

        logger.attemptFailed(2, 5, Duration.ofMillis(120), error);

        verify(mockLogger)
                .debug(
                        "[{}] attempt {}/{} failed, retrying in {}: {}",
                        RETRY_NAME,
                        2,
                        5,
                        Duration.ofMillis(120),
                        "java.io.IOException: connection reset");
    }

    @Test
    void logsSuccessAtDebug() {
        var logger = new RetryLogger(mockLogger, RETRY_NAME, LoggerConfig.defaults());

        logger.succeeded(4);

        verify(mockLogger).debug("[{}] attempt {} succeeded", RETRY_NAME, 4);
        verifyNoMoreInteractions(mockLogger);
    }

    @Test
    void logsExhaustionAtInfoWithLastError() {
        var logger = new RetryLogger(mockLogger, RETRY_NAME, LoggerConfig.defaults());
        var last = new IOException("still down");
        var exception = new RetryExhaustedException(new AttemptErrors(List.of(
                new AttemptError(Instant.EPOCH, new IOException("down")), new AttemptError(Instant.EPOCH, last))));

        logger.exhausted(2, exception);

        verify(mockLogger)
                .info("[{}] giving up after {} attempts, last error: {}", RETRY_NAME, 2, "java.io.IOException: still down");
    }

    @Test
    void logsNonRetryableErrorAsText() {
        var logger = new RetryLogger(mockLogger, RETRY_NAME, LoggerConfig.defaults());

        logger.notRetryable(1, new SecurityException("forbidden"));

        verify(mockLogger)
                .debug(
                        "[{}] attempt {} failed with a non-retryable error: {}",
                        RETRY_NAME,
                        1,
                        "java.lang.SecurityException: forbidden");
    }

    @Test
    void logsExhaustionWithoutAttempts() {
        var logger = new RetryLogger(mockLogger, RETRY_NAME, LoggerConfig.defaults());

        logger.exhausted(0, new RetryExhaustedException(AttemptErrors.empty()));

        verify(mockLogger).info("[{}] giving up after {} attempts, last error: {}", RETRY_NAME, 0, "null");
    }
}
