package com.copytrader.unit.broker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.copytrader.broker.DeltaFrameRouter;
import com.copytrader.broker.mapper.AccountEventMapper;
import com.copytrader.config.ReplicationConfig;
import com.copytrader.core.engine.ReplicationDecisionEngine;
import com.copytrader.domain.enums.AccountEventKind;
import com.copytrader.domain.enums.InboundFrameType;
import com.copytrader.domain.model.AccountEvent;
import com.copytrader.observability.DecisionLogger;
import com.copytrader.observability.ReplicationMetrics;
import com.copytrader.oms.TopUpQueue;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for DeltaFrameRouter: frame classification, payload extraction and
 * per-event error isolation.
 */
@ExtendWith(MockitoExtension.class)
class DeltaFrameRouterTest {

    @Mock
    private ReplicationDecisionEngine replicationDecisionEngine;

    private DecisionLogger decisionLogger;
    private SimpleMeterRegistry meterRegistry;
    private DeltaFrameRouter router;

    @BeforeEach
    void setUp() {
        ReplicationConfig config = new ReplicationConfig();
        ObjectMapper objectMapper = new ObjectMapper();
        decisionLogger = new DecisionLogger(objectMapper, config, Clock.systemUTC());
        meterRegistry = new SimpleMeterRegistry();
        router = new DeltaFrameRouter(
                objectMapper,
                new AccountEventMapper(),
                replicationDecisionEngine,
                decisionLogger,
                new ReplicationMetrics(meterRegistry, new TopUpQueue(config)));
    }

    @Nested
    @DisplayName("Control frames")
    class ControlFrames {

        @Test
        @DisplayName("Authenticated success frame is AUTH_SUCCESS")
        void authSuccess() {
            assertThat(router.route("{\"type\":\"success\",\"message\":\"Authenticated\"}"))
                    .isEqualTo(InboundFrameType.AUTH_SUCCESS);
        }

        @Test
        @DisplayName("Other success frames are OTHER")
        void otherSuccess() {
            assertThat(router.route("{\"type\":\"success\",\"message\":\"Subscribed\"}"))
                    .isEqualTo(InboundFrameType.OTHER);
        }

        @Test
        @DisplayName("Heartbeat frame is HEARTBEAT")
        void heartbeat() {
            assertThat(router.route("{\"type\":\"heartbeat\"}")).isEqualTo(InboundFrameType.HEARTBEAT);
        }

        @Test
        @DisplayName("Positions and error frames are never replicated")
        void positionsIgnored() {
            assertThat(router.route("{\"type\":\"positions\",\"size\":10,\"symbol\":\"BTCUSD\"}"))
                    .isEqualTo(InboundFrameType.OTHER);
            assertThat(router.route("{\"type\":\"error\",\"message\":\"bad\"}")).isEqualTo(InboundFrameType.OTHER);
            verify(replicationDecisionEngine, never()).process(any());
        }
    }

    @Nested
    @DisplayName("Malformed frames")
    class Malformed {

        @Test
        @DisplayName("Unparseable text is skipped as parse_error")
        void unparseable() {
            assertThat(router.route("{not json")).isEqualTo(InboundFrameType.MALFORMED);

            assertThat(decisionLogger.getRecentDecisions(1).get(0).getName()).isEqualTo("parse_error");
            assertThat(meterRegistry.counter("topup.skipped", "reason", "parse_error").count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("JSON that is not an object is malformed")
        void notAnObject() {
            assertThat(router.route("[1,2,3]")).isEqualTo(InboundFrameType.MALFORMED);
            verify(replicationDecisionEngine, never()).process(any());
        }
    }

    @Nested
    @DisplayName("Data frames")
    class DataFrames {

        @Test
        @DisplayName("Flat user_trades frame is itself the fill")
        void flatTradeFrame() {
            InboundFrameType type = router.route(
                    "{\"type\":\"user_trades\",\"symbol\":\"btcusd\",\"side\":\"buy\",\"size\":10,\"id\":\"T1\"}");

            assertThat(type).isEqualTo(InboundFrameType.TRADE_FILLS);
            ArgumentCaptor<AccountEvent> captor = ArgumentCaptor.forClass(AccountEvent.class);
            verify(replicationDecisionEngine).process(captor.capture());
            AccountEvent event = captor.getValue();
            assertThat(event.getKind()).isEqualTo(AccountEventKind.TRADE_FILL);
            assertThat(event.getSymbol()).isEqualTo("BTCUSD");
            assertThat(event.getQuantity()).isEqualTo(10L);
            assertThat(event.getTradeId()).isEqualTo("T1");
        }

        @Test
        @DisplayName("Array payload yields one event per element")
        void arrayPayload() {
            router.route("{\"type\":\"usertrades\",\"data\":[{\"size\":1,\"side\":\"buy\"},{\"size\":2,\"side\":\"sell\"}]}");

            verify(replicationDecisionEngine, times(2)).process(any());
        }

        @Test
        @DisplayName("Empty payload falls through to the next candidate key")
        void emptyPayloadSkipped() {
            router.route("{\"type\":\"orders\",\"payload\":[],\"orders\":[{\"id\":\"O1\",\"filled_size\":5}]}");

            ArgumentCaptor<AccountEvent> captor = ArgumentCaptor.forClass(AccountEvent.class);
            verify(replicationDecisionEngine).process(captor.capture());
            assertThat(captor.getValue().getOrderId()).isEqualTo("O1");
            assertThat(captor.getValue().getKind()).isEqualTo(AccountEventKind.ORDER_UPDATE);
        }

        @Test
        @DisplayName("A failing event does not stop the rest of the frame")
        void failureIsolated() {
            doThrow(new IllegalStateException("boom"))
                    .doReturn(null)
                    .when(replicationDecisionEngine)
                    .process(any());

            InboundFrameType type = router.route(
                    "{\"type\":\"orders\",\"payload\":[{\"id\":\"O1\"},\"not-an-object\",{\"id\":\"O2\"}]}");

            assertThat(type).isEqualTo(InboundFrameType.ORDER_UPDATES);
            ArgumentCaptor<AccountEvent> captor = ArgumentCaptor.forClass(AccountEvent.class);
            verify(replicationDecisionEngine, times(2)).process(captor.capture());
            List<AccountEvent> events = captor.getAllValues();
            assertThat(events).extracting(AccountEvent::getOrderId).containsExactly("O1", "O2");
        }
    }
}
