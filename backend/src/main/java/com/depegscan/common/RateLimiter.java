package com.depegscan.common;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Global request pacer. Guarantees a minimum interval between two permits regardless of
 * how many threads ask for them.
 */
public class RateLimiter {

    private final long minIntervalNanos;
    private final AtomicLong nextFreeAtNanos = new AtomicLong(0);

    private RateLimiter(long minIntervalNanos) {
        this.minIntervalNanos = minIntervalNanos;
    }

    /**
     * Limiter that spaces permits by at least {@code delayMs}. Zero disables pacing.
     */
    public static RateLimiter withMinInterval(long delayMs) {
        if (delayMs < 0) {
            throw new IllegalArgumentException("delayMs must not be negative");
        }
        return new RateLimiter(delayMs * 1_000_000L);
    }

    /**
     * Blocks until a permit is available, then returns.
     */
    public void acquire() {
        long now;
        long next;
        do {
            now = System.nanoTime();
            next = nextFreeAtNanos.get();
            if (now >= next) {
                if (nextFreeAtNanos.compareAndSet(next, now + minIntervalNanos)) {
                    return;
                }
            } else {
                long sleepNanos = next - now;
                try {
                    Thread.sleep(sleepNanos / 1_000_000, (int) (sleepNanos % 1_000_000));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("Rate limiter interrupted", e);
                }
            }
        } while (true);
    }

    public long getMinIntervalMs() {
        return minIntervalNanos / 1_000_000;
    }
}
