package com.copytrader.domain.model;

import com.copytrader.domain.enums.SkipReason;
import java.util.Map;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Result of evaluating one account event: either an admitted job or a skip with context. */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public class ReplicationDecision {

    private final TopUpJob job;

    private final SkipReason skipReason;

    private final Map<String, Object> context;

    public static ReplicationDecision admitted(TopUpJob job) {
        return new ReplicationDecision(job, null, job.toContext());
    }

    public static ReplicationDecision skipped(SkipReason reason, Map<String, Object> context) {
        return new ReplicationDecision(null, reason, context);
    }

    public boolean isAdmitted() {
        return job != null;
    }
}
