package com.copytrader.risk;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Per-symbol running total of contracts replicated this session.
 *
 * <p>Read by the ingestion thread at admission time and by the execution worker just
 * before submission; written only by the worker after the exchange accepted an order.
 * Totals only ever grow: venue-side cancellations of an accepted top-up are not credited
 * back. Events without a symbol are not constrained by the ledger.
 */
@Component
public class CapLedger {

    private static final Logger log = LoggerFactory.getLogger(CapLedger.class);

    private final ConcurrentHashMap<String, AtomicLong> usedBySymbol = new ConcurrentHashMap<>();

    private final TopUpLimits topUpLimits;

    public CapLedger(TopUpLimits topUpLimits) {
        this.topUpLimits = topUpLimits;
    }

    /**
     * Returns true when adding {@code addSize} contracts keeps the symbol at or below its cap.
     * A null symbol is always admitted.
     */
    public boolean admits(String symbol, long addSize) {
        if (symbol == null) {
            return true;
        }
        return used(symbol) + addSize <= topUpLimits.getMaxTopUpPerSymbol();
    }

    /** Adds an accepted top-up to the symbol's total. No-op for a null symbol or non-positive size. */
    public void record(String symbol, long size) {
        if (symbol == null || size <= 0) {
            return;
        }
        long total = usedBySymbol.computeIfAbsent(symbol, k -> new AtomicLong()).addAndGet(size);
        log.debug("Cap ledger: symbol={}, added={}, total={}", symbol, size, total);
    }

    public long used(String symbol) {
        AtomicLong used = usedBySymbol.get(symbol);
        return used != null ? used.get() : 0L;
    }

    public long getMaxPerSymbol() {
        return topUpLimits.getMaxTopUpPerSymbol();
    }

    /** Sorted copy of all non-zero totals. */
    public Map<String, Long> snapshot() {
        Map<String, Long> copy = new TreeMap<>();
        usedBySymbol.forEach((symbol, used) -> copy.put(symbol, used.get()));
        return copy;
    }
}
