package com.copytrader.broker;

import com.copytrader.config.DeltaConfig;
import com.copytrader.domain.enums.ConnectionState;
import com.copytrader.domain.enums.InboundFrameType;
import com.copytrader.observability.DecisionLogger;
import com.copytrader.observability.ReplicationMetrics;
import com.copytrader.recovery.ShutdownSignal;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Owns the private WebSocket session to Delta Exchange and keeps it alive.
 *
 * <p>Session lifecycle, repeated until shutdown:
 * <ol>
 *   <li>CONNECTING -- open the socket to {@code delta.ws-url}</li>
 *   <li>AUTHENTICATING -- on open, send the signed auth frame</li>
 *   <li>ACTIVE -- on the Authenticated reply, subscribe {@code orders}, {@code positions}
 *       and {@code user_trades} and enable heartbeats</li>
 *   <li>DISCONNECTED -- on close or failure, wait per {@link ReconnectBackoff} and retry</li>
 * </ol>
 *
 * <p>A session counts as healthy once it authenticated and kept receiving traffic. A
 * healthy session resets the backoff to its base; a session that never got healthy
 * doubles it. Frames are delivered one at a time on OkHttp's reader thread and handed to
 * {@link DeltaFrameRouter}; the loop itself runs on the {@code delta-ws-ingestion} thread.
 */
@Component
public class DeltaConnectionManager implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(DeltaConnectionManager.class);

    static final int NORMAL_CLOSURE = 1000;

    private static final long NEVER = Long.MIN_VALUE;

    private final OkHttpClient socketClient;
    private final DeltaConfig deltaConfig;
    private final DeltaSocketFrames socketFrames;
    private final DeltaFrameRouter frameRouter;
    private final ShutdownSignal shutdownSignal;
    private final DecisionLogger decisionLogger;
    private final ReplicationMetrics replicationMetrics;
    private final ReconnectBackoff reconnectBackoff;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.DISCONNECTED);
    private final AtomicLong lastHealthyAtNanos = new AtomicLong(NEVER);

    private volatile SocketSession activeSession;
    private Thread loopThread;

    public DeltaConnectionManager(
            @Qualifier("deltaSocketClient") OkHttpClient socketClient,
            DeltaConfig deltaConfig,
            DeltaSocketFrames socketFrames,
            DeltaFrameRouter frameRouter,
            ShutdownSignal shutdownSignal,
            DecisionLogger decisionLogger,
            ReplicationMetrics replicationMetrics) {
        this.socketClient = socketClient;
        this.deltaConfig = deltaConfig;
        this.socketFrames = socketFrames;
        this.frameRouter = frameRouter;
        this.shutdownSignal = shutdownSignal;
        this.decisionLogger = decisionLogger;
        this.replicationMetrics = replicationMetrics;
        DeltaConfig.Reconnect reconnect = deltaConfig.getReconnect();
        this.reconnectBackoff = new ReconnectBackoff(
                reconnect.getBackoffBase(), reconnect.getBackoffMax(), reconnect.getBackoffJitter());
    }

    @Override
    public void start() {
        if (running.compareAndSet(false, true)) {
            loopThread = new Thread(this::runLoop, "delta-ws-ingestion");
            loopThread.setDaemon(true);
            loopThread.start();
            log.info("DeltaConnectionManager started: url={}", deltaConfig.getWsUrl());
        }
    }

    @Override
    public void stop() {
        if (running.compareAndSet(true, false)) {
            closeActiveSession();
            log.info("DeltaConnectionManager stopped");
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public boolean isAutoStartup() {
        return deltaConfig.isEnabled();
    }

    @Override
    public int getPhase() {
        // After the execution worker, so jobs admitted on the first frames are drained
        return 10;
    }

    public ConnectionState getState() {
        return state.get();
    }

    /** True while an authenticated session is open. */
    public boolean isHealthy() {
        SocketSession session = activeSession;
        return state.get() == ConnectionState.ACTIVE && session != null && session.authenticated;
    }

    /**
     * Closes the current socket with a normal closure and releases the loop waiting on it.
     * Safe to call from any thread and when no session is open.
     */
    public void closeActiveSession() {
        SocketSession session = activeSession;
        if (session == null) {
            return;
        }
        state.set(ConnectionState.CLOSING);
        try {
            session.socket.close(NORMAL_CLOSURE, "shutdown");
        } catch (RuntimeException e) {
            log.warn("Socket close failed: {}", e.getMessage());
            session.socket.cancel();
        }
        session.markClosed();
    }

    // ---- Session loop ----

    private void runLoop() {
        while (running.get() && !shutdownSignal.isStopRequested()) {
            SocketSession session = openSession();
            try {
                session.closed.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                session.socket.cancel();
                break;
            } finally {
                activeSession = null;
                state.set(ConnectionState.DISCONNECTED);
                replicationMetrics.setSessionHealthy(false);
            }

            if (shutdownSignal.isStopRequested() || !running.get()) {
                break;
            }

            long lastHealthy = lastHealthyAtNanos.get();
            boolean hadHealth = lastHealthy != NEVER && lastHealthy - session.startedAtNanos >= 0;
            Duration wait = reconnectBackoff.withJitter(reconnectBackoff.nextDelay(hadHealth));

            replicationMetrics.recordReconnect();
            Map<String, Object> context = new LinkedHashMap<>();
            context.put("seconds", wait.toMillis() / 1000.0);
            context.put("had_health", hadHealth);
            decisionLogger.action("reconnect_wait", context);
            log.info("Reconnecting in {} ms (hadHealth={})", wait.toMillis(), hadHealth);

            shutdownSignal.awaitStop(wait);
        }
        state.set(ConnectionState.DISCONNECTED);
        log.info("Socket loop exited");
    }

    private SocketSession openSession() {
        state.set(ConnectionState.CONNECTING);
        SocketSession session = new SocketSession(System.nanoTime());
        Request request = new Request.Builder().url(deltaConfig.getWsUrl()).build();
        session.socket = socketClient.newWebSocket(request, new SessionListener(session));
        activeSession = session;
        if (shutdownSignal.isStopRequested()) {
            closeActiveSession();
        }
        return session;
    }

    private void markHealthy() {
        lastHealthyAtNanos.set(System.nanoTime());
    }

    private void onAuthenticated(WebSocket webSocket, SocketSession session) {
        markHealthy();
        session.authenticated = true;
        for (String channel : DeltaSocketFrames.PRIVATE_CHANNELS) {
            webSocket.send(socketFrames.subscribe(channel, List.of("all")));
            decisionLogger.action("subscribe", Map.of("channel", channel));
        }
        if (deltaConfig.isHeartbeatEnabled()) {
            webSocket.send(socketFrames.enableHeartbeat());
        }
        state.set(ConnectionState.ACTIVE);
        replicationMetrics.setSessionHealthy(true);
        log.info("Authenticated. Subscribed to {}", DeltaSocketFrames.PRIVATE_CHANNELS);
    }

    /** One connection attempt. {@code closed} is released exactly when the socket is done. */
    private static final class SocketSession {

        private final long startedAtNanos;
        private final CountDownLatch closed = new CountDownLatch(1);
        private volatile WebSocket socket;
        private volatile boolean authenticated;

        private SocketSession(long startedAtNanos) {
            this.startedAtNanos = startedAtNanos;
        }

        private void markClosed() {
            closed.countDown();
        }
    }

    private final class SessionListener extends WebSocketListener {

        private final SocketSession session;

        private SessionListener(SocketSession session) {
            this.session = session;
        }

        @Override
        public void onOpen(WebSocket webSocket, Response response) {
            log.info("Socket opened: {}", deltaConfig.getWsUrl());
            if (isCurrent()) {
                state.set(ConnectionState.AUTHENTICATING);
            }
            try {
                webSocket.send(socketFrames.auth());
                decisionLogger.action("auth_send", Map.of());
            } catch (RuntimeException e) {
                log.error("Failed to send auth frame: {}", e.getMessage(), e);
                webSocket.close(NORMAL_CLOSURE, "auth_failed");
                session.markClosed();
            }
        }

        @Override
        public void onMessage(WebSocket webSocket, String text) {
            try {
                InboundFrameType type = frameRouter.route(text);
                switch (type) {
                    case AUTH_SUCCESS -> onAuthenticated(webSocket, session);
                    case HEARTBEAT -> markHealthy();
                    case TRADE_FILLS, ORDER_UPDATES, OTHER -> {
                        if (session.authenticated) {
                            markHealthy();
                        }
                    }
                    default -> {
                        // malformed frames do not count as liveness
                    }
                }
            } catch (RuntimeException e) {
                log.error("Error handling socket frame: {}", e.getMessage(), e);
            }
        }

        @Override
        public void onClosing(WebSocket webSocket, int code, String reason) {
            if (isCurrent()) {
                state.set(ConnectionState.CLOSING);
            }
            webSocket.close(code, reason);
        }

        @Override
        public void onClosed(WebSocket webSocket, int code, String reason) {
            log.info("Socket closed code={} reason={}", code, reason);
            session.markClosed();
        }

        @Override
        public void onFailure(WebSocket webSocket, Throwable t, Response response) {
            log.warn("Socket error: {}", t.getMessage());
            session.markClosed();
        }

        /** Callbacks of a session the loop already left must not touch the shared state. */
        private boolean isCurrent() {
            return activeSession == session;
        }
    }
}
