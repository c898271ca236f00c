package com.copytrader.unit.oms;

import static org.assertj.core.api.Assertions.assertThat;

import com.copytrader.config.ReplicationConfig;
import com.copytrader.domain.enums.DedupSpace;
import com.copytrader.oms.DedupStore;
import com.copytrader.unit.MutableClock;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DedupStoreTest {

    private MutableClock clock;
    private DedupStore dedupStore;

    @BeforeEach
    void setUp() {
        ReplicationConfig config = new ReplicationConfig();
        config.getDedup().setFillIdTtl(Duration.ofMinutes(10));
        config.getDedup().setFillIdMax(2);
        config.getDedup().setTradeIdTtl(Duration.ofHours(1));
        config.getDedup().setTradeIdMax(100);
        clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        dedupStore = new DedupStore(config, clock);
    }

    @Test
    @DisplayName("Fill ids and trade ids are tracked in separate spaces")
    void spacesAreIndependent() {
        assertThat(dedupStore.checkAndRecord(DedupSpace.FILL_ID, "42")).isFalse();

        assertThat(dedupStore.checkAndRecord(DedupSpace.TRADE_ID, "42")).isFalse();
        assertThat(dedupStore.checkAndRecord(DedupSpace.FILL_ID, "42")).isTrue();
        assertThat(dedupStore.checkAndRecord(DedupSpace.TRADE_ID, "42")).isTrue();
    }

    @Test
    @DisplayName("Each space uses its own TTL")
    void perSpaceTtl() {
        dedupStore.checkAndRecord(DedupSpace.FILL_ID, "f");
        dedupStore.checkAndRecord(DedupSpace.TRADE_ID, "t");

        clock.advance(Duration.ofMinutes(15));

        assertThat(dedupStore.contains(DedupSpace.FILL_ID, "f")).isFalse();
        assertThat(dedupStore.contains(DedupSpace.TRADE_ID, "t")).isTrue();
    }

    @Test
    @DisplayName("Each space uses its own capacity")
    void perSpaceCapacity() {
        dedupStore.checkAndRecord(DedupSpace.FILL_ID, "f1");
        dedupStore.checkAndRecord(DedupSpace.FILL_ID, "f2");
        dedupStore.checkAndRecord(DedupSpace.FILL_ID, "f3");

        assertThat(dedupStore.size(DedupSpace.FILL_ID)).isEqualTo(2);
        assertThat(dedupStore.contains(DedupSpace.FILL_ID, "f1")).isFalse();
    }
}
