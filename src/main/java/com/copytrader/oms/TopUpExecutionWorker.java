package com.copytrader.oms;

import com.copytrader.broker.DeltaOrderClient;
import com.copytrader.domain.enums.SkipReason;
import com.copytrader.domain.model.OrderSubmitResult;
import com.copytrader.domain.model.TopUpJob;
import com.copytrader.observability.DecisionLogger;
import com.copytrader.observability.ReplicationMetrics;
import com.copytrader.recovery.ShutdownSignal;
import com.copytrader.risk.CapLedger;
import com.fasterxml.jackson.databind.node.TextNode;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Single consumer thread that drains the {@link TopUpQueue} and submits orders through
 * {@link DeltaOrderClient}.
 *
 * <p>Each job is re-validated (positive size, BUY or SELL) and re-checked against the
 * per-symbol cap, since other jobs for the same symbol may have been accepted since it was
 * admitted. The ledger is only credited after the exchange returns 200. Failed jobs are
 * not retried; the worker pauses briefly (waking early on shutdown) and moves on.
 *
 * <p>The thread exits when it dequeues the stop sentinel or when shutdown is requested.
 */
@Component
public class TopUpExecutionWorker implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(TopUpExecutionWorker.class);

    static final int FAILURE_PAUSE_SLICES = 5;

    private final TopUpQueue topUpQueue;
    private final DeltaOrderClient deltaOrderClient;
    private final CapLedger capLedger;
    private final ShutdownSignal shutdownSignal;
    private final DecisionLogger decisionLogger;
    private final ReplicationMetrics replicationMetrics;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile Thread workerThread;

    public TopUpExecutionWorker(
            TopUpQueue topUpQueue,
            DeltaOrderClient deltaOrderClient,
            CapLedger capLedger,
            ShutdownSignal shutdownSignal,
            DecisionLogger decisionLogger,
            ReplicationMetrics replicationMetrics) {
        this.topUpQueue = topUpQueue;
        this.deltaOrderClient = deltaOrderClient;
        this.capLedger = capLedger;
        this.shutdownSignal = shutdownSignal;
        this.decisionLogger = decisionLogger;
        this.replicationMetrics = replicationMetrics;
    }

    @Override
    public void start() {
        if (running.compareAndSet(false, true)) {
            workerThread = new Thread(this::processLoop, "topup-execution-worker");
            workerThread.setDaemon(true);
            workerThread.start();
            log.info("TopUpExecutionWorker started");
        }
    }

    /** Shutdown is driven by {@link com.copytrader.recovery.ShutdownCoordinator}; this only marks the bean stopped. */
    @Override
    public void stop() {
        running.set(false);
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        // Start before the socket so admitted jobs are drained from the first fill
        return 0;
    }

    /**
     * Waits for the worker thread to finish.
     *
     * @return true if the thread is no longer alive
     */
    public boolean join(Duration timeout) {
        Thread thread = workerThread;
        if (thread == null) {
            return true;
        }
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return !thread.isAlive();
    }

    private void processLoop() {
        while (!shutdownSignal.isStopRequested()) {
            TopUpJob job;
            try {
                job = topUpQueue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.info("TopUpExecutionWorker interrupted, exiting");
                break;
            }
            if (job == null) {
                break;
            }
            try {
                processJob(job);
            } catch (Exception e) {
                log.error("Unexpected error processing top-up {}: {}", job.getAuditId(), e.getMessage(), e);
            }
        }
        running.set(false);
        log.info("TopUpExecutionWorker stopped");
    }

    /**
     * Validates, cap-checks and submits one job.
     *
     * @return the submission result, or null if the job was rejected before submission
     */
    public OrderSubmitResult processJob(TopUpJob job) {
        Map<String, Object> context = job.toContext();
        decisionLogger.action("dequeue_topup", context);

        if (job.getSize() <= 0 || job.getSide() == null || !job.getSide().isTradable()) {
            skip(SkipReason.INVALID_JOB, context);
            return null;
        }
        if (!capLedger.admits(job.getSymbol(), job.getSize())) {
            Map<String, Object> capContext = job.toContext();
            capContext.put("add", job.getSize());
            skip(SkipReason.SYMBOL_CAP_EXCEEDED_WORKER, capContext);
            return null;
        }

        OrderSubmitResult result;
        try {
            result = deltaOrderClient.submit(job);
        } catch (RuntimeException e) {
            log.error("Top-up submission failed: auditId={}, error={}", job.getAuditId(), e.getMessage(), e);
            result = new OrderSubmitResult(OrderSubmitResult.TRANSPORT_FAILURE, TextNode.valueOf(String.valueOf(e.getMessage())));
        }

        Map<String, Object> resultContext = job.toContext();
        resultContext.put("status", result.getStatus());
        resultContext.put("resp", result.getBody());
        decisionLogger.action("order_result", resultContext);

        if (result.isSuccess()) {
            capLedger.record(job.getSymbol(), job.getSize());
            replicationMetrics.recordOrderPlaced();
        } else {
            replicationMetrics.recordOrderFailed();
            pauseAfterFailure();
        }
        return result;
    }

    private void pauseAfterFailure() {
        for (int i = 0; i < FAILURE_PAUSE_SLICES; i++) {
            long millis = (long) (250 + ThreadLocalRandom.current().nextDouble() * 750);
            if (shutdownSignal.awaitStop(Duration.ofMillis(millis))) {
                return;
            }
        }
    }

    private void skip(SkipReason reason, Map<String, Object> context) {
        replicationMetrics.recordSkipped(reason);
        decisionLogger.skip(reason, context);
    }
}
