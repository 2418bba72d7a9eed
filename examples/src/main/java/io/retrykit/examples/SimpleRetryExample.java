// Copyright The RetryKit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package io.retrykit.examples;

import io.retrykit.RetryContext;
import io.retrykit.RetryExecutor;
import io.retrykit.RetryPolicy;
import io.retrykit.backoff.Backoff;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Simple example retrying a flaky inventory lookup with exponential backoff.
 *
 * <p>This example shows:
 *
 * <ul>
 *   <li>Building a reusable {@link RetryPolicy}
 *   <li>Returning a value from the first successful attempt
 *   <li>Log entries of the retried call carrying the retry name and attempt number via MDC
 * </ul>
 */
public class SimpleRetryExample {

    private static final Logger logger = LoggerFactory.getLogger(SimpleRetryExample.class);

    /** Remote inventory service, failing now and then. */
    @FunctionalInterface
    public interface InventoryClient {
        int stockLevel(String sku) throws IOException;
    }

    private final RetryExecutor executor;
    private final InventoryClient client;

    public SimpleRetryExample(RetryPolicy policy, InventoryClient client) {
        this.executor = new RetryExecutor(policy);
        this.client = client;
    }

    public static RetryPolicy defaultPolicy() {
        return RetryPolicy.builder()
                .name("inventory-lookup")
                .maxSteps(5)
                .backoff(Backoff.builder()
                        .minBackoff(Duration.ofMillis(100))
                        .maxBackoff(Duration.ofSeconds(5))
                        .expFactor(2.0)
                        .build())
                .build();
    }

    public int lookupStock(RetryContext context, String sku) throws Exception {
        int stock = executor.call(context, ctx -> client.stockLevel(sku));
        logger.info("Stock level for {}: {}", sku, stock);
        return stock;
    }

    public static void main(String[] args) throws Exception {
        var calls = new AtomicInteger();
        var example = new SimpleRetryExample(defaultPolicy(), sku -> {
            // Fail the first two lookups
            if (calls.incrementAndGet() <= 2) {
                logger.warn("Inventory service unavailable");
                throw new IOException("503 Service Unavailable");
            }
            return 42;
        });

        example.lookupStock(RetryContext.withTimeout(Duration.ofSeconds(30)), "SKU-1234");
    }
}
