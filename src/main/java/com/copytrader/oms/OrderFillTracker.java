package com.copytrader.oms;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import org.springframework.stereotype.Component;

/**
 * Last cumulative filled size seen per order, used to turn order updates into fill deltas.
 *
 * <p>Entries are removed when an order reaches a terminal state. Orders that never report
 * one expire after {@value #IDLE_EXPIRY_HOURS} hours without updates.
 */
@Component
public class OrderFillTracker {

    static final long IDLE_EXPIRY_HOURS = 24;

    /** Caffeine cache: key = order id, value = cumulative filled contracts. */
    private final Cache<String, Long> cumulativeByOrder;

    public OrderFillTracker() {
        this.cumulativeByOrder = Caffeine.newBuilder()
                .expireAfterAccess(Duration.ofHours(IDLE_EXPIRY_HOURS))
                .build();
    }

    /** Previously recorded cumulative size, or 0 for an order not seen before. */
    public long previous(String orderId) {
        Long cumulative = cumulativeByOrder.getIfPresent(orderId);
        return cumulative != null ? cumulative : 0L;
    }

    public void record(String orderId, long cumulative) {
        cumulativeByOrder.put(orderId, cumulative);
    }

    public void remove(String orderId) {
        cumulativeByOrder.invalidate(orderId);
    }

    public boolean isTracked(String orderId) {
        return cumulativeByOrder.getIfPresent(orderId) != null;
    }

    public long trackedCount() {
        return cumulativeByOrder.estimatedSize();
    }
}
