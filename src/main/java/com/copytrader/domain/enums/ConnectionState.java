package com.copytrader.domain.enums;

/**
 * Lifecycle of one socket session.
 *
 * <p>DISCONNECTED -> CONNECTING -> AUTHENTICATING -> ACTIVE -> CLOSING -> DISCONNECTED,
 * repeated by the reconnect loop until shutdown.
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    AUTHENTICATING,
    ACTIVE,
    CLOSING
}
