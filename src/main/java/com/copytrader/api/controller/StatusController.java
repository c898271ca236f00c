package com.copytrader.api.controller;

import com.copytrader.api.dto.response.ReplicationStatusResponse;
import com.copytrader.broker.DeltaConnectionManager;
import com.copytrader.config.ReplicationConfig;
import com.copytrader.domain.enums.DedupSpace;
import com.copytrader.domain.model.DecisionRecord;
import com.copytrader.observability.DecisionLogger;
import com.copytrader.oms.DedupStore;
import com.copytrader.oms.OrderFillTracker;
import com.copytrader.oms.TopUpQueue;
import com.copytrader.recovery.ShutdownSignal;
import com.copytrader.risk.CapLedger;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only operational endpoints.
 *
 * <ul>
 *   <li>GET /api/status -- connection, queue, dedup and cap ledger state</li>
 *   <li>GET /api/status/decisions?limit=N -- most recent audit records, newest first</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/status")
public class StatusController {

    static final int MAX_DECISIONS = 1000;

    private final DeltaConnectionManager connectionManager;
    private final TopUpQueue topUpQueue;
    private final DedupStore dedupStore;
    private final OrderFillTracker orderFillTracker;
    private final CapLedger capLedger;
    private final ReplicationConfig replicationConfig;
    private final DecisionLogger decisionLogger;
    private final ShutdownSignal shutdownSignal;

    public StatusController(
            DeltaConnectionManager connectionManager,
            TopUpQueue topUpQueue,
            DedupStore dedupStore,
            OrderFillTracker orderFillTracker,
            CapLedger capLedger,
            ReplicationConfig replicationConfig,
            DecisionLogger decisionLogger,
            ShutdownSignal shutdownSignal) {
        this.connectionManager = connectionManager;
        this.topUpQueue = topUpQueue;
        this.dedupStore = dedupStore;
        this.orderFillTracker = orderFillTracker;
        this.capLedger = capLedger;
        this.replicationConfig = replicationConfig;
        this.decisionLogger = decisionLogger;
        this.shutdownSignal = shutdownSignal;
    }

    @GetMapping
    public ResponseEntity<ReplicationStatusResponse> status() {
        ReplicationStatusResponse response = ReplicationStatusResponse.builder()
                .connectionState(connectionManager.getState().name())
                .healthy(connectionManager.isHealthy())
                .queueDepth(topUpQueue.size())
                .queueCapacity(topUpQueue.getCapacity())
                .dedupFillIds(dedupStore.size(DedupSpace.FILL_ID))
                .dedupTradeIds(dedupStore.size(DedupSpace.TRADE_ID))
                .trackedOrders(orderFillTracker.trackedCount())
                .capUsage(capLedger.snapshot())
                .maxTopUpPerSymbol(capLedger.getMaxPerSymbol())
                .multiplier(replicationConfig.getMultiplier())
                .dryRun(replicationConfig.isDryRun())
                .shutdownRequested(shutdownSignal.isStopRequested())
                .build();
        return ResponseEntity.ok(response);
    }

    @GetMapping("/decisions")
    public ResponseEntity<List<DecisionRecord>> recentDecisions(@RequestParam(defaultValue = "50") int limit) {
        int bounded = Math.max(0, Math.min(limit, MAX_DECISIONS));
        return ResponseEntity.ok(decisionLogger.getRecentDecisions(bounded));
    }
}
