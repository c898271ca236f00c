package com.copytrader.domain.enums;

/** Identifier namespaces tracked independently by the dedup store. */
public enum DedupSpace {
    FILL_ID,
    TRADE_ID
}
