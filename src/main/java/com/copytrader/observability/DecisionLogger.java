package com.copytrader.observability;

import com.copytrader.config.ReplicationConfig;
import com.copytrader.domain.enums.DecisionKind;
import com.copytrader.domain.enums.SkipReason;
import com.copytrader.domain.model.DecisionRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Audit trail of every replication decision.
 *
 * <p>Each skip and action becomes a {@link DecisionRecord} that is:
 * <ul>
 *   <li>written as one JSON line to the {@code DECISIONS} logger, which logback-spring.xml
 *       routes to a daily {@code delta_ws_events_<date>.jsonl} file</li>
 *   <li>kept in a ring buffer of the last {@value #RING_BUFFER_SIZE} records for the status API</li>
 * </ul>
 *
 * <p>Line format: {@code {"ts":"2025-01-01T09:15:00.123+05:30","type":"skip","data":{"reason":"own_fill",...}}}.
 * Timestamps are in {@value #AUDIT_ZONE} with millisecond precision.
 *
 * <p>Skip records are suppressed when {@code copytrader.replication.verbose-decisions=false};
 * actions are always written.
 */
@Service
public class DecisionLogger {

    private static final Logger logger = LoggerFactory.getLogger(DecisionLogger.class);

    /** Dedicated audit stream; see logback-spring.xml. */
    private static final Logger decisions = LoggerFactory.getLogger("DECISIONS");

    static final int RING_BUFFER_SIZE = 1000;

    static final String AUDIT_ZONE = "Asia/Kolkata";

    private static final DateTimeFormatter TS_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSXXX");

    private final ObjectMapper objectMapper;
    private final ReplicationConfig replicationConfig;
    private final Clock clock;

    private final ConcurrentLinkedDeque<DecisionRecord> ringBuffer = new ConcurrentLinkedDeque<>();

    /** Tracks the deque length; {@link ConcurrentLinkedDeque#size()} is a full traversal. */
    private final AtomicInteger ringBufferCount = new AtomicInteger();

    public DecisionLogger(ObjectMapper objectMapper, ReplicationConfig replicationConfig, Clock clock) {
        this.objectMapper = objectMapper;
        this.replicationConfig = replicationConfig;
        this.clock = clock;
    }

    public void skip(SkipReason reason, Map<String, Object> context) {
        if (!replicationConfig.isVerboseDecisions()) {
            return;
        }
        write(DecisionKind.SKIP, reason.getCode(), context);
    }

    public void action(String action, Map<String, Object> context) {
        write(DecisionKind.ACTION, action, context);
    }

    // ---- Ring buffer queries ----

    /** Most recent records, newest first. */
    public List<DecisionRecord> getRecentDecisions(int count) {
        return ringBuffer.stream().limit(count).toList();
    }

    public int getBufferSize() {
        return ringBufferCount.get();
    }

    // ---- Internal ----

    private void write(DecisionKind kind, String name, Map<String, Object> context) {
        DecisionRecord decisionRecord = DecisionRecord.builder()
                .timestamp(OffsetDateTime.now(clock.withZone(ZoneId.of(AUDIT_ZONE))))
                .kind(kind)
                .name(name)
                .context(context != null ? context : Map.of())
                .build();

        ringBuffer.addFirst(decisionRecord);
        if (ringBufferCount.incrementAndGet() > RING_BUFFER_SIZE && ringBuffer.pollLast() != null) {
            ringBufferCount.decrementAndGet();
        }

        decisions.info(toJsonLine(decisionRecord));
    }

    public String toJsonLine(DecisionRecord decisionRecord) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(decisionRecord.getKind() == DecisionKind.SKIP ? "reason" : "action", decisionRecord.getName());
        data.putAll(decisionRecord.getContext());

        Map<String, Object> line = new LinkedHashMap<>();
        line.put("ts", TS_FORMAT.format(decisionRecord.getTimestamp()));
        line.put("type", decisionRecord.getKind().getWireValue());
        line.put("data", data);
        try {
            return objectMapper.writeValueAsString(line);
        } catch (JsonProcessingException e) {
            // Audit must never break the trading path
            logger.error("Failed to serialize decision record {}: {}", decisionRecord.getName(), e.getMessage());
            return line.toString();
        }
    }
}
