package com.copytrader.core.engine;

import com.copytrader.config.ReplicationConfig;
import com.copytrader.domain.enums.DedupSpace;
import com.copytrader.domain.enums.SkipReason;
import com.copytrader.domain.model.AccountEvent;
import com.copytrader.domain.model.ReplicationDecision;
import com.copytrader.domain.model.TopUpJob;
import com.copytrader.observability.DecisionLogger;
import com.copytrader.observability.ReplicationMetrics;
import com.copytrader.oms.ClientOrderIdGenerator;
import com.copytrader.oms.DedupStore;
import com.copytrader.oms.OrderFillTracker;
import com.copytrader.oms.TopUpQueue;
import com.copytrader.risk.CapLedger;
import com.copytrader.risk.TopUpLimits;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Decides whether an account event should be replicated and, if so, how large the top-up is.
 *
 * <p>Checks run in a fixed order and stop at the first failure:
 * <ol>
 *   <li>Dedup: fill id, then trade id (trade fills) or fill id (order updates)</li>
 *   <li>Self-origin: client order id or text carrying the self-tag prefix</li>
 *   <li>Order id presence (order updates only)</li>
 *   <li>Symbol allow-list</li>
 *   <li>Quantity: the fill size, or the cumulative delta for order updates</li>
 *   <li>Sizing: {@code round((multiplier - 1) * qty)} clamped to the per-trade max</li>
 *   <li>Per-symbol cap against the ledger</li>
 * </ol>
 *
 * <p>Only ever called from the socket ingestion thread. Dedup entries are recorded as
 * soon as they are seen, so an event rejected by a later check is still not re-evaluated
 * when redelivered.
 */
@Service
public class ReplicationDecisionEngine {

    private static final Logger log = LoggerFactory.getLogger(ReplicationDecisionEngine.class);

    private final DedupStore dedupStore;
    private final OrderFillTracker orderFillTracker;
    private final CapLedger capLedger;
    private final TopUpLimits topUpLimits;
    private final ReplicationConfig replicationConfig;
    private final ClientOrderIdGenerator clientOrderIdGenerator;
    private final TopUpQueue topUpQueue;
    private final DecisionLogger decisionLogger;
    private final ReplicationMetrics replicationMetrics;

    private final Set<String> allowedSymbols;

    public ReplicationDecisionEngine(
            DedupStore dedupStore,
            OrderFillTracker orderFillTracker,
            CapLedger capLedger,
            TopUpLimits topUpLimits,
            ReplicationConfig replicationConfig,
            ClientOrderIdGenerator clientOrderIdGenerator,
            TopUpQueue topUpQueue,
            DecisionLogger decisionLogger,
            ReplicationMetrics replicationMetrics) {
        this.dedupStore = dedupStore;
        this.orderFillTracker = orderFillTracker;
        this.capLedger = capLedger;
        this.topUpLimits = topUpLimits;
        this.replicationConfig = replicationConfig;
        this.clientOrderIdGenerator = clientOrderIdGenerator;
        this.topUpQueue = topUpQueue;
        this.decisionLogger = decisionLogger;
        this.replicationMetrics = replicationMetrics;
        this.allowedSymbols = replicationConfig.allowedSymbols();
    }

    /**
     * Evaluates the event, records the decision and enqueues the resulting job.
     * A job that does not fit in the queue is dropped with a {@code queue_full} skip.
     */
    public ReplicationDecision process(AccountEvent event) {
        ReplicationDecision decision = decide(event);
        if (!decision.isAdmitted()) {
            skip(decision.getSkipReason(), decision.getContext());
            return decision;
        }

        TopUpJob job = decision.getJob();
        if (!topUpQueue.offer(job)) {
            log.error(
                    "Top-up queue full (capacity={}), dropping job: auditId={}, symbol={}, size={}",
                    topUpQueue.getCapacity(),
                    job.getAuditId(),
                    job.getSymbol(),
                    job.getSize());
            ReplicationDecision dropped = ReplicationDecision.skipped(SkipReason.QUEUE_FULL, job.toContext());
            skip(SkipReason.QUEUE_FULL, dropped.getContext());
            return dropped;
        }

        replicationMetrics.recordEnqueued();
        decisionLogger.action("enqueue_topup", job.toContext());
        return decision;
    }

    /** Runs the admission checks without enqueueing anything. */
    public ReplicationDecision decide(AccountEvent event) {
        return event.isTradeFill() ? decideTradeFill(event) : decideOrderUpdate(event);
    }

    /**
     * Top-up size for a fill of {@code quantity} contracts. Rounds half to even and clamps
     * the result to {@code [0, maxPerTrade]}; a multiplier of 1.0 or less always yields 0.
     */
    public static long computeTopUpSize(double multiplier, long quantity, long maxPerTrade) {
        if (multiplier <= 1.0) {
            return 0L;
        }
        double raw = Math.rint((multiplier - 1.0) * quantity);
        if (raw <= 0) {
            return 0L;
        }
        return (long) Math.min(raw, (double) maxPerTrade);
    }

    // ---- Trade fills ----

    private ReplicationDecision decideTradeFill(AccountEvent event) {
        String fillId = event.getFillId();
        if (fillId != null && dedupStore.checkAndRecord(DedupSpace.FILL_ID, fillId)) {
            return ReplicationDecision.skipped(SkipReason.DUP_FILL_ID, context("fill_id", fillId));
        }

        String tradeId = event.getTradeId();
        String auditId = tradeId != null ? tradeId : "ut_" + shortHex();
        if (tradeId != null && dedupStore.checkAndRecord(DedupSpace.TRADE_ID, tradeId)) {
            return ReplicationDecision.skipped(SkipReason.DUP_TRADE_ID, context("audit_id", auditId));
        }

        if (clientOrderIdGenerator.isSelfTagged(event.getClientOrderId(), event.getText())) {
            Map<String, Object> ctx = context("audit_id", auditId);
            ctx.put("client_order_id", event.getClientOrderId());
            return ReplicationDecision.skipped(SkipReason.OWN_FILL, ctx);
        }

        if (!isSymbolAllowed(event.getSymbol())) {
            return symbolNotAllowed(auditId, event.getSymbol());
        }

        Long quantity = event.getQuantity();
        if (quantity == null || quantity <= 0) {
            return ReplicationDecision.skipped(SkipReason.MISSING_OR_INVALID_QTY, context("audit_id", auditId));
        }

        long add = computeTopUpSize(replicationConfig.getMultiplier(), quantity, topUpLimits.getMaxTopUpPerTrade());
        if (add <= 0) {
            Map<String, Object> ctx = context("audit_id", auditId);
            ctx.put("qty", quantity);
            ctx.put("multiplier", replicationConfig.getMultiplier());
            return ReplicationDecision.skipped(SkipReason.ZERO_TOPUP, ctx);
        }

        return admitIfWithinCap(auditId, event, add);
    }

    // ---- Order updates ----

    private ReplicationDecision decideOrderUpdate(AccountEvent event) {
        String fillId = event.getFillId();
        if (fillId != null && dedupStore.checkAndRecord(DedupSpace.FILL_ID, fillId)) {
            return ReplicationDecision.skipped(SkipReason.DUP_FILL_ID_ORDER, context("fill_id", fillId));
        }

        if (clientOrderIdGenerator.isSelfTagged(event.getClientOrderId(), event.getText())) {
            return ReplicationDecision.skipped(
                    SkipReason.OWN_ORDER_UPDATE, context("client_order_id", event.getClientOrderId()));
        }

        String orderId = event.getOrderId();
        if (orderId == null) {
            return ReplicationDecision.skipped(SkipReason.MISSING_ORDER_ID, new LinkedHashMap<>());
        }
        String auditId = "ord_" + orderId;

        try {
            if (!isSymbolAllowed(event.getSymbol())) {
                return symbolNotAllowed(auditId, event.getSymbol());
            }

            Long cumulative = event.getCumulativeFilled();
            if (cumulative == null) {
                return ReplicationDecision.skipped(SkipReason.MISSING_OR_INVALID_CUM, context("audit_id", auditId));
            }

            long previous = orderFillTracker.previous(orderId);
            orderFillTracker.record(orderId, cumulative);
            if (cumulative <= previous) {
                Map<String, Object> ctx = context("audit_id", auditId);
                ctx.put("cum", cumulative);
                ctx.put("prev", previous);
                return ReplicationDecision.skipped(SkipReason.NO_NEW_FILL_DELTA, ctx);
            }

            long delta = cumulative - previous;
            long add = computeTopUpSize(replicationConfig.getMultiplier(), delta, topUpLimits.getMaxTopUpPerTrade());
            if (add <= 0) {
                Map<String, Object> ctx = context("audit_id", auditId);
                ctx.put("delta", delta);
                return ReplicationDecision.skipped(SkipReason.ZERO_TOPUP, ctx);
            }

            return admitIfWithinCap(auditId, event, add);
        } finally {
            if (event.isTerminal()) {
                orderFillTracker.remove(orderId);
            }
        }
    }

    // ---- Shared checks ----

    private ReplicationDecision admitIfWithinCap(String auditId, AccountEvent event, long add) {
        String symbol = event.getSymbol();
        if (!capLedger.admits(symbol, add)) {
            Map<String, Object> ctx = context("audit_id", auditId);
            ctx.put("symbol", symbol);
            ctx.put("add", add);
            return ReplicationDecision.skipped(SkipReason.SYMBOL_CAP_EXCEEDED, ctx);
        }

        TopUpJob job = TopUpJob.builder()
                .auditId(auditId)
                .symbol(symbol)
                .productId(event.getProductId())
                .side(event.getSide())
                .size(add)
                .priceHint(event.getPrice())
                .build();
        return ReplicationDecision.admitted(job);
    }

    private boolean isSymbolAllowed(String symbol) {
        if (allowedSymbols.contains(ReplicationConfig.ALL_SYMBOLS)) {
            return true;
        }
        return symbol != null && allowedSymbols.contains(symbol);
    }

    private ReplicationDecision symbolNotAllowed(String auditId, String symbol) {
        Map<String, Object> ctx = context("audit_id", auditId);
        ctx.put("symbol", symbol);
        return ReplicationDecision.skipped(SkipReason.SYMBOL_NOT_ALLOWED, ctx);
    }

    private void skip(SkipReason reason, Map<String, Object> context) {
        replicationMetrics.recordSkipped(reason);
        decisionLogger.skip(reason, context);
        log.debug("Skip {}: {}", reason.getCode(), context);
    }

    private static Map<String, Object> context(String key, Object value) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put(key, value);
        return ctx;
    }

    private static String shortHex() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }
}
