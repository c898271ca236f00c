package com.copytrader.oms;

import com.copytrader.config.ReplicationConfig;
import com.copytrader.domain.enums.DedupSpace;
import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Remembers fill ids and trade ids already handled so redelivered events are ignored.
 *
 * <p>Each {@link DedupSpace} has its own {@link ExpiringIdSet} sized and timed from
 * {@code copytrader.replication.dedup.*}. Entries live for the configured TTL (24h by
 * default); when a set reaches capacity, its oldest entry is evicted first.
 */
@Component
public class DedupStore {

    private static final Logger log = LoggerFactory.getLogger(DedupStore.class);

    private final Map<DedupSpace, ExpiringIdSet> spaces = new EnumMap<>(DedupSpace.class);

    public DedupStore(ReplicationConfig replicationConfig, Clock clock) {
        ReplicationConfig.Dedup dedup = replicationConfig.getDedup();
        spaces.put(
                DedupSpace.FILL_ID,
                new ExpiringIdSet("fill_id", dedup.getFillIdTtl(), dedup.getFillIdMax(), clock));
        spaces.put(
                DedupSpace.TRADE_ID,
                new ExpiringIdSet("trade_id", dedup.getTradeIdTtl(), dedup.getTradeIdMax(), clock));
        log.info(
                "DedupStore initialized: fillId(ttl={}, max={}), tradeId(ttl={}, max={})",
                dedup.getFillIdTtl(),
                dedup.getFillIdMax(),
                dedup.getTradeIdTtl(),
                dedup.getTradeIdMax());
    }

    /**
     * Records the id in the given space.
     *
     * @return true if the id was already present (the caller should skip the event)
     */
    public boolean checkAndRecord(DedupSpace space, String id) {
        return spaces.get(space).checkAndRecord(id);
    }

    public boolean contains(DedupSpace space, String id) {
        return spaces.get(space).contains(id);
    }

    public int size(DedupSpace space) {
        return spaces.get(space).size();
    }
}
