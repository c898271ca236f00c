package com.copytrader.recovery;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.springframework.stereotype.Component;

/**
 * Process-wide stop flag shared by the socket loop and the execution worker.
 *
 * <p>Waits go through {@link #awaitStop(Duration)} so a sleeping thread wakes as soon as
 * shutdown is requested rather than at the end of its pause.
 */
@Component
public class ShutdownSignal {

    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final CountDownLatch stopLatch = new CountDownLatch(1);

    /** Sets the flag. Returns true only for the call that actually flipped it. */
    public boolean requestStop() {
        if (stopRequested.compareAndSet(false, true)) {
            stopLatch.countDown();
            return true;
        }
        return false;
    }

    public boolean isStopRequested() {
        return stopRequested.get();
    }

    /**
     * Sleeps for up to {@code timeout}, returning early when stop is requested.
     *
     * @return true if stop was requested before or during the wait
     */
    public boolean awaitStop(Duration timeout) {
        if (timeout.isNegative() || timeout.isZero()) {
            return isStopRequested();
        }
        try {
            return stopLatch.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return isStopRequested();
        }
    }
}
