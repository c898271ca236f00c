package com.copytrader.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    SIGNING_ERROR("SIGNING_ERROR"),
    BROKER_ERROR("BROKER_ERROR");

    private final String code;
}
