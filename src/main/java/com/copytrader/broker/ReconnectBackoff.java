package com.copytrader.broker;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Reconnect delay policy for the socket loop.
 *
 * <p>After a session that reached a healthy state the delay resets to the base; after a
 * session that never did, it doubles up to the max. Each wait adds a random fraction of
 * up to {@code jitter} on top. Not thread-safe; owned by the ingestion thread.
 */
public class ReconnectBackoff {

    private final Duration base;
    private final Duration max;
    private final double jitter;
    private final DoubleSupplier random;

    private Duration current;

    public ReconnectBackoff(Duration base, Duration max, double jitter) {
        this(base, max, jitter, () -> ThreadLocalRandom.current().nextDouble());
    }

    /** @param random source of uniform values in [0, 1) */
    public ReconnectBackoff(Duration base, Duration max, double jitter, DoubleSupplier random) {
        this.base = base;
        this.max = max;
        this.jitter = jitter;
        this.random = random;
        this.current = base;
    }

    /** Advances the policy and returns the un-jittered delay before the next attempt. */
    public Duration nextDelay(boolean hadHealth) {
        if (hadHealth) {
            current = base;
        } else {
            Duration doubled = current.multipliedBy(2);
            current = doubled.compareTo(max) > 0 ? max : doubled;
        }
        return current;
    }

    /** {@code delay * (1 + U(0, jitter))}. */
    public Duration withJitter(Duration delay) {
        double factor = 1.0 + random.getAsDouble() * jitter;
        return Duration.ofNanos((long) (delay.toNanos() * factor));
    }

    public Duration getCurrent() {
        return current;
    }
}
