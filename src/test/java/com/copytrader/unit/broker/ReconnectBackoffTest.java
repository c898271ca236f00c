package com.copytrader.unit.broker;

import static org.assertj.core.api.Assertions.assertThat;

import com.copytrader.broker.ReconnectBackoff;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ReconnectBackoffTest {

    @Test
    @DisplayName("Unhealthy sessions double the delay up to the max")
    void doublesToMax() {
        ReconnectBackoff backoff = new ReconnectBackoff(Duration.ofSeconds(1), Duration.ofSeconds(5), 0.0);

        assertThat(backoff.nextDelay(false)).isEqualTo(Duration.ofSeconds(2));
        assertThat(backoff.nextDelay(false)).isEqualTo(Duration.ofSeconds(4));
        assertThat(backoff.nextDelay(false)).isEqualTo(Duration.ofSeconds(5));
        assertThat(backoff.nextDelay(false)).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("A healthy session resets the delay to the base")
    void healthyResets() {
        ReconnectBackoff backoff = new ReconnectBackoff(Duration.ofSeconds(1), Duration.ofSeconds(60), 0.0);
        backoff.nextDelay(false);
        backoff.nextDelay(false);

        assertThat(backoff.nextDelay(true)).isEqualTo(Duration.ofSeconds(1));
        assertThat(backoff.getCurrent()).isEqualTo(Duration.ofSeconds(1));
    }

    @Test
    @DisplayName("Jitter adds up to the configured fraction")
    void jitterBounds() {
        ReconnectBackoff low = new ReconnectBackoff(Duration.ofSeconds(1), Duration.ofSeconds(60), 0.4, () -> 0.0);
        ReconnectBackoff high = new ReconnectBackoff(Duration.ofSeconds(1), Duration.ofSeconds(60), 0.4, () -> 0.5);

        assertThat(low.withJitter(Duration.ofSeconds(10))).isEqualTo(Duration.ofSeconds(10));
        assertThat(high.withJitter(Duration.ofSeconds(10))).isBetween(Duration.ofMillis(11_999), Duration.ofMillis(12_001));
    }
}
