package com.copytrader.broker;

import com.copytrader.broker.mapper.AccountEventMapper;
import com.copytrader.core.engine.ReplicationDecisionEngine;
import com.copytrader.domain.enums.InboundFrameType;
import com.copytrader.domain.enums.SkipReason;
import com.copytrader.domain.model.AccountEvent;
import com.copytrader.observability.DecisionLogger;
import com.copytrader.observability.ReplicationMetrics;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Classifies inbound socket frames and feeds fills and order updates to the
 * {@link ReplicationDecisionEngine}.
 *
 * <p>Frame handling by {@code type}:
 * <ul>
 *   <li>{@code success} with message {@code Authenticated} -- returned as AUTH_SUCCESS</li>
 *   <li>{@code heartbeat} -- liveness only</li>
 *   <li>{@code user_trades} / {@code usertrades} -- each payload object becomes a trade fill</li>
 *   <li>{@code orders} -- each payload object becomes an order update</li>
 *   <li>anything else (positions, acks, errors) -- logged, never replicated</li>
 * </ul>
 *
 * <p>Nothing thrown while mapping or deciding escapes this class; a bad event is logged and
 * the remaining events of the frame are still processed.
 */
@Component
public class DeltaFrameRouter {

    private static final Logger log = LoggerFactory.getLogger(DeltaFrameRouter.class);

    private static final int MAX_LOGGED_FRAME_CHARS = 512;

    private final ObjectMapper objectMapper;
    private final AccountEventMapper accountEventMapper;
    private final ReplicationDecisionEngine replicationDecisionEngine;
    private final DecisionLogger decisionLogger;
    private final ReplicationMetrics replicationMetrics;

    public DeltaFrameRouter(
            ObjectMapper objectMapper,
            AccountEventMapper accountEventMapper,
            ReplicationDecisionEngine replicationDecisionEngine,
            DecisionLogger decisionLogger,
            ReplicationMetrics replicationMetrics) {
        this.objectMapper = objectMapper;
        this.accountEventMapper = accountEventMapper;
        this.replicationDecisionEngine = replicationDecisionEngine;
        this.decisionLogger = decisionLogger;
        this.replicationMetrics = replicationMetrics;
    }

    public InboundFrameType route(String text) {
        JsonNode frame;
        try {
            frame = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            return malformed(text, e.getOriginalMessage());
        }
        if (frame == null || !frame.isObject()) {
            return malformed(text, "not a JSON object");
        }

        String type = frame.path("type").asText("");
        switch (type) {
            case "success":
                if ("Authenticated".equals(frame.path("message").asText())) {
                    return InboundFrameType.AUTH_SUCCESS;
                }
                log.debug("Socket success frame: {}", abbreviate(text));
                return InboundFrameType.OTHER;
            case "heartbeat":
                return InboundFrameType.HEARTBEAT;
            case "user_trades":
            case "usertrades":
                dispatch(payload(frame, "payload", "data", "trades", "usertrades"), accountEventMapper::toTradeFill);
                return InboundFrameType.TRADE_FILLS;
            case "orders":
                dispatch(payload(frame, "payload", "data", "orders"), accountEventMapper::toOrderUpdate);
                return InboundFrameType.ORDER_UPDATES;
            case "error":
                log.warn("Socket error frame: {}", abbreviate(text));
                return InboundFrameType.OTHER;
            default:
                log.debug("Socket frame type={} ignored: {}", type, abbreviate(text));
                return InboundFrameType.OTHER;
        }
    }

    private void dispatch(JsonNode payload, Function<JsonNode, AccountEvent> mapper) {
        if (payload.isArray()) {
            for (JsonNode element : payload) {
                handle(element, mapper);
            }
        } else {
            handle(payload, mapper);
        }
    }

    private void handle(JsonNode node, Function<JsonNode, AccountEvent> mapper) {
        if (!node.isObject()) {
            return;
        }
        try {
            replicationDecisionEngine.process(mapper.apply(node));
        } catch (Exception e) {
            log.error("Failed to process account event {}: {}", abbreviate(node.toString()), e.getMessage(), e);
        }
    }

    /** First non-empty candidate field, or the frame itself. */
    private static JsonNode payload(JsonNode frame, String... keys) {
        for (String key : keys) {
            JsonNode value = frame.get(key);
            if (value == null || value.isNull()) {
                continue;
            }
            if (value.isContainerNode() && value.isEmpty()) {
                continue;
            }
            return value;
        }
        return frame;
    }

    private InboundFrameType malformed(String text, String error) {
        log.warn("Dropping unparseable socket frame: {} ({})", abbreviate(text), error);
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("error", error);
        context.put("raw", abbreviate(text));
        replicationMetrics.recordSkipped(SkipReason.PARSE_ERROR);
        decisionLogger.skip(SkipReason.PARSE_ERROR, context);
        return InboundFrameType.MALFORMED;
    }

    private static String abbreviate(String text) {
        if (text == null || text.length() <= MAX_LOGGED_FRAME_CHARS) {
            return text;
        }
        return text.substring(0, MAX_LOGGED_FRAME_CHARS) + "...";
    }
}
