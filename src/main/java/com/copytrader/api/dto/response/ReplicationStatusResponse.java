package com.copytrader.api.dto.response;

import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * Point-in-time view of the replication pipeline, returned by GET /api/status.
 */
@Getter
@Builder
public class ReplicationStatusResponse {

    /** Socket session state: DISCONNECTED, CONNECTING, AUTHENTICATING, ACTIVE or CLOSING. */
    private final String connectionState;

    /** True while an authenticated session is open. */
    private final boolean healthy;

    private final int queueDepth;

    private final int queueCapacity;

    private final int dedupFillIds;

    private final int dedupTradeIds;

    /** Orders with a cumulative fill size still being tracked. */
    private final long trackedOrders;

    /** Contracts replicated this session, per symbol. */
    private final Map<String, Long> capUsage;

    private final long maxTopUpPerSymbol;

    private final double multiplier;

    private final boolean dryRun;

    private final boolean shutdownRequested;
}
