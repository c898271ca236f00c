package com.copytrader.domain.enums;

/** Classification of a socket frame after parsing. */
public enum InboundFrameType {
    AUTH_SUCCESS,
    HEARTBEAT,
    TRADE_FILLS,
    ORDER_UPDATES,
    OTHER,
    MALFORMED
}
