package com.copytrader.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Side of a fill or order as reported on the exchange's private channels.
 *
 * <p>UNKNOWN is carried through ingestion so the execution worker can reject the job
 * with an audit record instead of silently dropping the fill.
 */
@Getter
@RequiredArgsConstructor
public enum OrderSide {
    BUY("buy"),
    SELL("sell"),
    UNKNOWN("unknown");

    /** Value sent in the {@code side} field of an order request. */
    private final String wireValue;

    /** Normalizes free text by its first letter: "b..." is BUY, "s..." is SELL. */
    public static OrderSide fromText(String text) {
        if (text == null || text.isBlank()) {
            return UNKNOWN;
        }
        char first = Character.toLowerCase(text.strip().charAt(0));
        if (first == 'b') {
            return BUY;
        }
        if (first == 's') {
            return SELL;
        }
        return UNKNOWN;
    }

    public boolean isTradable() {
        return this != UNKNOWN;
    }
}
