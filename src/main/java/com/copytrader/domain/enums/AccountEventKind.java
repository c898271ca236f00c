package com.copytrader.domain.enums;

/** Which private channel an {@link com.copytrader.domain.model.AccountEvent} came from. */
public enum AccountEventKind {
    TRADE_FILL,
    ORDER_UPDATE
}
