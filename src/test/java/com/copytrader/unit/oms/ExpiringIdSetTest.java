package com.copytrader.unit.oms;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.copytrader.oms.ExpiringIdSet;
import com.copytrader.unit.MutableClock;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ExpiringIdSetTest {

    private MutableClock clock;
    private ExpiringIdSet idSet;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        idSet = new ExpiringIdSet("test", Duration.ofHours(24), 3, clock);
    }

    @Nested
    @DisplayName("Membership")
    class Membership {

        @Test
        @DisplayName("First sighting is new, second is a duplicate")
        void secondSightingIsDuplicate() {
            assertThat(idSet.checkAndRecord("f1")).isFalse();
            assertThat(idSet.checkAndRecord("f1")).isTrue();
            assertThat(idSet.checkAndRecord("f1")).isTrue();
            assertThat(idSet.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("Distinct ids do not collide")
        void distinctIds() {
            assertThat(idSet.checkAndRecord("a")).isFalse();
            assertThat(idSet.checkAndRecord("b")).isFalse();
            assertThat(idSet.contains("a")).isTrue();
            assertThat(idSet.contains("c")).isFalse();
        }
    }

    @Nested
    @DisplayName("Time-to-live")
    class TimeToLive {

        @Test
        @DisplayName("Entry is forgotten once its TTL has elapsed")
        void expiresAfterTtl() {
            idSet.checkAndRecord("f1");

            clock.advance(Duration.ofHours(24));

            assertThat(idSet.contains("f1")).isFalse();
            assertThat(idSet.checkAndRecord("f1")).isFalse();
        }

        @Test
        @DisplayName("Entry is still present just before expiry")
        void presentBeforeExpiry() {
            idSet.checkAndRecord("f1");

            clock.advance(Duration.ofHours(24).minusMillis(1));

            assertThat(idSet.checkAndRecord("f1")).isTrue();
        }

        @Test
        @DisplayName("A duplicate sighting refreshes the expiry")
        void duplicateRefreshesExpiry() {
            idSet.checkAndRecord("f1");
            clock.advance(Duration.ofHours(20));
            idSet.checkAndRecord("f1");

            clock.advance(Duration.ofHours(20));

            assertThat(idSet.contains("f1")).isTrue();
        }

        @Test
        @DisplayName("Expired entries are purged from the size count")
        void sizeExcludesExpired() {
            idSet.checkAndRecord("a");
            clock.advance(Duration.ofHours(1));
            idSet.checkAndRecord("b");

            clock.advance(Duration.ofHours(23).plusMinutes(30));

            assertThat(idSet.size()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Capacity")
    class Capacity {

        @Test
        @DisplayName("Oldest inserted entry is evicted first when full")
        void evictsOldestFirst() {
            idSet.checkAndRecord("a");
            idSet.checkAndRecord("b");
            idSet.checkAndRecord("c");

            idSet.checkAndRecord("d");

            assertThat(idSet.size()).isEqualTo(3);
            assertThat(idSet.contains("a")).isFalse();
            assertThat(idSet.contains("b")).isTrue();
            assertThat(idSet.contains("d")).isTrue();
        }

        @Test
        @DisplayName("Re-sighting an entry moves it to the back of the eviction order")
        void resightingDefersEviction() {
            idSet.checkAndRecord("a");
            idSet.checkAndRecord("b");
            idSet.checkAndRecord("c");
            idSet.checkAndRecord("a");

            idSet.checkAndRecord("d");

            assertThat(idSet.contains("a")).isTrue();
            assertThat(idSet.contains("b")).isFalse();
        }

        @Test
        @DisplayName("Capacity below one is rejected")
        void rejectsZeroCapacity() {
            assertThatThrownBy(() -> new ExpiringIdSet("bad", Duration.ofSeconds(1), 0, clock))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
