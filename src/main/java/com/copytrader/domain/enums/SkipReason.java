package com.copytrader.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Why an event or job was not acted on. The {@code code} is written to the audit log
 * and used as the {@code reason} metric tag, so existing codes must not be renamed.
 */
@Getter
@RequiredArgsConstructor
public enum SkipReason {
    PARSE_ERROR("parse_error"),
    DUP_FILL_ID("dup_fill_id"),
    DUP_TRADE_ID("dup_trade_id"),
    DUP_FILL_ID_ORDER("dup_fill_id_order"),
    OWN_FILL("own_fill"),
    OWN_ORDER_UPDATE("own_order_update"),
    MISSING_ORDER_ID("missing_order_id"),
    SYMBOL_NOT_ALLOWED("symbol_not_allowed"),
    MISSING_OR_INVALID_QTY("missing_or_invalid_qty"),
    MISSING_OR_INVALID_CUM("missing_or_invalid_cum"),
    NO_NEW_FILL_DELTA("no_new_fill_delta"),
    ZERO_TOPUP("zero_topup"),
    SYMBOL_CAP_EXCEEDED("symbol_cap_exceeded"),
    QUEUE_FULL("queue_full"),
    INVALID_JOB("invalid_job"),
    SYMBOL_CAP_EXCEEDED_WORKER("symbol_cap_exceeded_worker"),
    MISSING_LIMIT_PRICE("missing_limit_price");

    private final String code;
}
