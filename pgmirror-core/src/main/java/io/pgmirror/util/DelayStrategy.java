/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.util;

import java.time.Duration;

/**
 * Encapsulates the logic of deciding whether to pause the calling thread, and for how long.
 * Used by loops that poll for work and should back off when none is found.
 */
@FunctionalInterface
public interface DelayStrategy {

    /**
     * Attempt to sleep when the specified criteria is met.
     *
     * @param criteria {@code true} if this method should sleep, or {@code false} if there is no need to sleep
     * @return {@code true} if this invocation caused the thread to sleep, or {@code false} if this method did not sleep
     */
    boolean sleepWhen(boolean criteria);

    static DelayStrategy none() {
        return (criteria) -> false;
    }

    static DelayStrategy constant(Duration delay) {
        long delayInMilliseconds = delay.toMillis();
        return (criteria) -> {
            if (!criteria) {
                return false;
            }
            try {
                Thread.sleep(delayInMilliseconds);
            }
            catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return true;
        };
    }

    /**
     * Create a strategy whose delay doubles on every consecutive miss, starting at {@code initialDelay}
     * and never exceeding {@code maxDelay}. A call with {@code false} criteria resets it.
     *
     * @param initialDelay the first delay; must be positive
     * @param maxDelay the upper bound; must be greater than the initial delay
     * @return the strategy; never null
     */
    static DelayStrategy exponential(Duration initialDelay, Duration maxDelay) {
        final long initialDelayInMilliseconds = initialDelay.toMillis();
        final long maxDelayInMilliseconds = maxDelay.toMillis();
        if (initialDelayInMilliseconds <= 0) {
            throw new IllegalArgumentException("Initial delay must be positive");
        }
        if (initialDelayInMilliseconds >= maxDelayInMilliseconds) {
            throw new IllegalArgumentException("Maximum delay must be greater than initial delay");
        }
        return new DelayStrategy() {
            private long previousDelay = 0;

            @Override
            public boolean sleepWhen(boolean criteria) {
                if (!criteria) {
                    previousDelay = 0;
                    return false;
                }
                if (previousDelay == 0) {
                    previousDelay = initialDelayInMilliseconds;
                }
                else {
                    previousDelay = Math.min(previousDelay * 2, maxDelayInMilliseconds);
                }
                try {
                    Thread.sleep(previousDelay);
                }
                catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return true;
            }
        };
    }
}
