package com.copytrader.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Order type for top-up orders. Maps to the exchange's {@code order_type} field. */
@Getter
@RequiredArgsConstructor
public enum OrderType {
    MARKET_ORDER("market_order"),
    LIMIT_ORDER("limit_order");

    private final String wireValue;
}
