package com.copytrader.unit.observability;

import static org.assertj.core.api.Assertions.assertThat;

import com.copytrader.config.ReplicationConfig;
import com.copytrader.domain.enums.DecisionKind;
import com.copytrader.domain.enums.SkipReason;
import com.copytrader.domain.model.DecisionRecord;
import com.copytrader.observability.DecisionLogger;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for DecisionLogger: ring buffer behaviour, verbose suppression and the JSON line
 * written to the audit file.
 */
class DecisionLoggerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ReplicationConfig config;
    private DecisionLogger decisionLogger;

    @BeforeEach
    void setUp() {
        config = new ReplicationConfig();
        decisionLogger = new DecisionLogger(
                objectMapper, config, Clock.fixed(Instant.parse("2025-01-01T03:45:00.123Z"), ZoneOffset.UTC));
    }

    @Nested
    @DisplayName("Ring buffer")
    class RingBuffer {

        @Test
        @DisplayName("Returns records newest first")
        void newestFirst() {
            decisionLogger.action("first", Map.of());
            decisionLogger.skip(SkipReason.OWN_FILL, Map.of("audit_id", "T1"));

            List<DecisionRecord> recent = decisionLogger.getRecentDecisions(10);

            assertThat(recent).extracting(DecisionRecord::getName).containsExactly("own_fill", "first");
            assertThat(recent.get(0).getKind()).isEqualTo(DecisionKind.SKIP);
            assertThat(recent.get(1).getKind()).isEqualTo(DecisionKind.ACTION);
        }

        @Test
        @DisplayName("Keeps only the last 1000 records")
        void bounded() {
            for (int i = 0; i < 1_050; i++) {
                decisionLogger.action("a" + i, Map.of());
            }

            assertThat(decisionLogger.getBufferSize()).isEqualTo(1_000);
            assertThat(decisionLogger.getRecentDecisions(1).get(0).getName()).isEqualTo("a1049");
        }

        @Test
        @DisplayName("Count matches the retained records under concurrent writers")
        void boundedConcurrently() throws Exception {
            ExecutorService writers = Executors.newFixedThreadPool(4);
            try {
                List<Future<?>> futures = new ArrayList<>();
                for (int t = 0; t < 4; t++) {
                    futures.add(writers.submit(() -> {
                        for (int i = 0; i < 600; i++) {
                            decisionLogger.action("w" + i, Map.of());
                        }
                    }));
                }
                for (Future<?> future : futures) {
                    future.get(10, TimeUnit.SECONDS);
                }
            } finally {
                writers.shutdownNow();
            }

            assertThat(decisionLogger.getBufferSize()).isEqualTo(1_000);
            assertThat(decisionLogger.getRecentDecisions(5_000)).hasSize(1_000);
        }

        @Test
        @DisplayName("Skips are suppressed when verbose decisions are off, actions are not")
        void verboseOff() {
            config.setVerboseDecisions(false);

            decisionLogger.skip(SkipReason.ZERO_TOPUP, Map.of());
            decisionLogger.action("enqueue_topup", Map.of());

            assertThat(decisionLogger.getRecentDecisions(10))
                    .extracting(DecisionRecord::getName)
                    .containsExactly("enqueue_topup");
        }

        @Test
        @DisplayName("Null context becomes an empty map")
        void nullContext() {
            decisionLogger.action("auth_send", null);

            assertThat(decisionLogger.getRecentDecisions(1).get(0).getContext()).isEmpty();
        }
    }

    @Nested
    @DisplayName("JSON line")
    class JsonLine {

        @Test
        @DisplayName("Skip line carries ts in IST, type and reason-first data")
        void skipLine() throws Exception {
            Map<String, Object> context = new LinkedHashMap<>();
            context.put("audit_id", "T1");
            context.put("client_order_id", "BOTMULT_a");
            decisionLogger.skip(SkipReason.OWN_FILL, context);

            String line = decisionLogger.toJsonLine(decisionLogger.getRecentDecisions(1).get(0));

            assertThat(line).startsWith("{\"ts\":\"2025-01-01T09:15:00.123+05:30\",\"type\":\"skip\",\"data\":{\"reason\"");
            JsonNode node = objectMapper.readTree(line);
            assertThat(node.path("data").path("reason").asText()).isEqualTo("own_fill");
            assertThat(node.path("data").path("audit_id").asText()).isEqualTo("T1");
            assertThat(node.path("data").path("client_order_id").asText()).isEqualTo("BOTMULT_a");
        }

        @Test
        @DisplayName("Action line uses the action key")
        void actionLine() throws Exception {
            decisionLogger.action("order_result", Map.of("status", 200));

            JsonNode node = objectMapper.readTree(decisionLogger.toJsonLine(decisionLogger.getRecentDecisions(1).get(0)));

            assertThat(node.path("type").asText()).isEqualTo("action");
            assertThat(node.path("data").path("action").asText()).isEqualTo("order_result");
            assertThat(node.path("data").path("status").asInt()).isEqualTo(200);
        }

        @Test
        @DisplayName("Nested JSON values are embedded, not stringified")
        void nestedJson() throws Exception {
            decisionLogger.action("order_submit", Map.of("resp", objectMapper.readTree("{\"success\":true}")));

            JsonNode node = objectMapper.readTree(decisionLogger.toJsonLine(decisionLogger.getRecentDecisions(1).get(0)));

            assertThat(node.path("data").path("resp").path("success").asBoolean()).isTrue();
        }
    }
}
