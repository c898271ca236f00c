package com.copytrader.domain.model;

import com.copytrader.domain.enums.DecisionKind;
import java.time.OffsetDateTime;
import java.util.Map;
import lombok.Builder;
import lombok.Data;

/**
 * Structured audit entry for every skip and action taken by the replication pipeline.
 *
 * <p>Serialized as one JSON line: {@code {"ts": ..., "type": "skip"|"action", "data": {...}}}
 * where {@code data} carries {@code reason} (skips) or {@code action} (actions) followed
 * by the context map.
 */
@Data
@Builder
public class DecisionRecord {

    private OffsetDateTime timestamp;

    private DecisionKind kind;

    /** Skip reason code or action name. */
    private String name;

    private Map<String, Object> context;
}
