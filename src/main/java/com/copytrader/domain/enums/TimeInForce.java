package com.copytrader.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Time-in-force for top-up orders.
 * IOC = immediate-or-cancel, FOK = fill-or-kill, GTC = good-till-cancelled.
 */
@Getter
@RequiredArgsConstructor
public enum TimeInForce {
    GTC("gtc"),
    IOC("ioc"),
    FOK("fok");

    private final String wireValue;
}
