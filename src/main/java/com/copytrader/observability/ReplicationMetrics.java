package com.copytrader.observability;

import com.copytrader.domain.enums.SkipReason;
import com.copytrader.oms.TopUpQueue;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Service;

/**
 * Micrometer meters for the replication pipeline:
 * <ul>
 *   <li><b>topup.enqueued</b> (counter): jobs handed to the execution worker</li>
 *   <li><b>topup.skipped</b> (counter, tag {@code reason}): events or jobs not acted on</li>
 *   <li><b>orders.placed</b> / <b>orders.failed</b> (counters): submission outcomes</li>
 *   <li><b>ws.reconnects</b> (counter): socket sessions that ended while running</li>
 *   <li><b>topup.queue.depth</b> (gauge): pending jobs</li>
 *   <li><b>ws.session.healthy</b> (gauge 0/1): authenticated socket session alive</li>
 * </ul>
 */
@Service
public class ReplicationMetrics {

    private final MeterRegistry meterRegistry;

    private final Counter enqueuedCounter;
    private final Counter ordersPlacedCounter;
    private final Counter ordersFailedCounter;
    private final Counter reconnectCounter;

    private final AtomicInteger sessionHealthy = new AtomicInteger(0);

    public ReplicationMetrics(MeterRegistry meterRegistry, TopUpQueue topUpQueue) {
        this.meterRegistry = meterRegistry;

        this.enqueuedCounter = Counter.builder("topup.enqueued")
                .description("Top-up jobs accepted into the execution queue")
                .register(meterRegistry);

        this.ordersPlacedCounter = Counter.builder("orders.placed")
                .description("Top-up orders accepted by the exchange")
                .register(meterRegistry);

        this.ordersFailedCounter = Counter.builder("orders.failed")
                .description("Top-up orders rejected or not delivered")
                .register(meterRegistry);

        this.reconnectCounter = Counter.builder("ws.reconnects")
                .description("Socket sessions that ended and were re-established")
                .register(meterRegistry);

        meterRegistry.gauge("topup.queue.depth", topUpQueue, TopUpQueue::size);
        meterRegistry.gauge("ws.session.healthy", sessionHealthy);
    }

    public void recordEnqueued() {
        enqueuedCounter.increment();
    }

    public void recordSkipped(SkipReason reason) {
        meterRegistry.counter("topup.skipped", "reason", reason.getCode()).increment();
    }

    public void recordOrderPlaced() {
        ordersPlacedCounter.increment();
    }

    public void recordOrderFailed() {
        ordersFailedCounter.increment();
    }

    public void recordReconnect() {
        reconnectCounter.increment();
    }

    public void setSessionHealthy(boolean healthy) {
        sessionHealthy.set(healthy ? 1 : 0);
    }
}
