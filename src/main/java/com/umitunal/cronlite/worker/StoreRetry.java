package com.umitunal.cronlite.worker;

import com.umitunal.cronlite.core.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Retries store calls that fail with {@link StoreUnavailableException}, doubling the pause
 * between attempts. Other exceptions pass straight through.
 */
public class StoreRetry {
    private static final Logger log = LoggerFactory.getLogger(StoreRetry.class);

    private final int maxAttempts;
    private final Duration initialBackoff;

    public StoreRetry(int maxAttempts, Duration initialBackoff) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;
        this.initialBackoff = initialBackoff;
    }

    public static StoreRetry none() {
        return new StoreRetry(1, Duration.ZERO);
    }

    public <T> T call(String operation, Supplier<T> action) {
        long backoffMs = initialBackoff.toMillis();
        for (int attempt = 1; ; attempt++) {
            try {
                return action.get();
            } catch (StoreUnavailableException e) {
                if (attempt >= maxAttempts) {
                    log.error("Store operation '{}' failed after {} attempts", operation, attempt, e);
                    throw e;
                }
                log.warn("Store operation '{}' failed (attempt {}/{}), retrying in {}ms: {}",
                        operation, attempt, maxAttempts, backoffMs, e.getMessage());
                pause(backoffMs, e);
                backoffMs *= 2;
            }
        }
    }

    public void run(String operation, Runnable action) {
        call(operation, () -> {
            action.run();
            return null;
        });
    }

    private static void pause(long millis, StoreUnavailableException cause) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw cause;
        }
    }
}
