package com.tradesim.feed;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with full jitter.
 *
 * <p>The delay for attempt {@code n} (0-based) is uniform in {@code [0, min(cap, base * 2^n)]}.
 * Full jitter spreads reconnects of many adapters that dropped at the same moment.
 */
public class ReconnectBackoff {

    private final long baseMs;
    private final long capMs;
    private final DoubleSupplier random;

    public ReconnectBackoff(Duration base, Duration cap) {
        this(base, cap, () -> ThreadLocalRandom.current().nextDouble());
    }

    /** @param random supplier of values in [0, 1), replaceable for tests */
    public ReconnectBackoff(Duration base, Duration cap, DoubleSupplier random) {
        if (base.isNegative() || base.isZero() || cap.compareTo(base) < 0) {
            throw new IllegalArgumentException("Backoff needs 0 < base <= cap, got " + base + " / " + cap);
        }
        this.baseMs = base.toMillis();
        this.capMs = cap.toMillis();
        this.random = random;
    }

    /** Upper bound of the delay for the given attempt, before jitter. */
    public long ceilingMs(int attempt) {
        // 2^30 * base already exceeds any sane cap; clamp the shift to avoid overflow
        int shift = Math.min(Math.max(attempt, 0), 30);
        long exponential = baseMs << shift;
        return exponential <= 0 ? capMs : Math.min(capMs, exponential);
    }

    public Duration nextDelay(int attempt) {
        return Duration.ofMillis((long) (random.getAsDouble() * ceilingMs(attempt)));
    }
}
