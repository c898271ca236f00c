package com.copytrader.recovery;

import com.copytrader.broker.DeltaConnectionManager;
import com.copytrader.observability.DecisionLogger;
import com.copytrader.oms.TopUpExecutionWorker;
import com.copytrader.oms.TopUpQueue;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;

/**
 * Orderly, idempotent shutdown of the replication pipeline.
 *
 * <p>Implements {@link SmartLifecycle} with a high phase value so it stops BEFORE the
 * socket loop and the execution worker. The JVM shutdown hook Spring Boot installs
 * (SIGINT/SIGTERM) therefore runs this sequence first:
 * <ol>
 *   <li>Set the shared stop flag, waking any thread sleeping on it</li>
 *   <li>Post the stop sentinel to the top-up queue so the worker leaves its blocking take</li>
 *   <li>Close the active socket with a normal closure</li>
 *   <li>Wait up to {@code copytrader.shutdown.worker-join-timeout} for the worker to exit</li>
 * </ol>
 *
 * <p>An order already being submitted is allowed to finish. Pending jobs are not drained.
 */
@Service
public class ShutdownCoordinator implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(ShutdownCoordinator.class);

    private final ShutdownSignal shutdownSignal;
    private final TopUpQueue topUpQueue;
    private final DeltaConnectionManager connectionManager;
    private final TopUpExecutionWorker executionWorker;
    private final DecisionLogger decisionLogger;
    private final Duration workerJoinTimeout;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean terminated = new AtomicBoolean(false);

    public ShutdownCoordinator(
            ShutdownSignal shutdownSignal,
            TopUpQueue topUpQueue,
            DeltaConnectionManager connectionManager,
            TopUpExecutionWorker executionWorker,
            DecisionLogger decisionLogger,
            @Value("${copytrader.shutdown.worker-join-timeout:5s}") Duration workerJoinTimeout) {
        this.shutdownSignal = shutdownSignal;
        this.topUpQueue = topUpQueue;
        this.connectionManager = connectionManager;
        this.executionWorker = executionWorker;
        this.decisionLogger = decisionLogger;
        this.workerJoinTimeout = workerJoinTimeout;
    }

    @Override
    public void start() {
        running.set(true);
        log.info("ShutdownCoordinator started");
    }

    @Override
    public void stop() {
        try {
            shutdown("lifecycle_stop");
            awaitTermination();
        } catch (Exception e) {
            log.error("Error during shutdown", e);
        } finally {
            running.set(false);
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        // Higher phase stops first
        return Integer.MAX_VALUE - 1;
    }

    /**
     * Signals every component to stop. Only the first call has any effect.
     *
     * @return true if this call initiated shutdown
     */
    public boolean shutdown(String reason) {
        if (!shutdownSignal.requestStop()) {
            return false;
        }
        log.info("Shutdown initiated: reason={}", reason);
        decisionLogger.action("shutdown_start", Map.of("reason", reason));

        topUpQueue.signalStop();

        try {
            connectionManager.closeActiveSession();
        } catch (RuntimeException e) {
            log.warn("ws_close_failed: {}", e.getMessage());
        }

        decisionLogger.action("shutdown_signal_sent", Map.of());
        return true;
    }

    /**
     * Waits for the execution worker to exit. Logs {@code shutdown_done} once.
     *
     * @return true if the worker exited within the timeout
     */
    public boolean awaitTermination() {
        boolean workerExited = executionWorker.join(workerJoinTimeout);
        if (!workerExited) {
            log.warn("Execution worker still running after {}", workerJoinTimeout);
        }
        if (terminated.compareAndSet(false, true)) {
            decisionLogger.action("shutdown_done", Map.of("worker_exited", workerExited));
            log.info("Shutdown complete");
        }
        return workerExited;
    }

    public boolean isShutdownRequested() {
        return shutdownSignal.isStopRequested();
    }
}
