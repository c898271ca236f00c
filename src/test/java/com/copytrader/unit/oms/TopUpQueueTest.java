package com.copytrader.unit.oms;

import static org.assertj.core.api.Assertions.assertThat;

import com.copytrader.config.ReplicationConfig;
import com.copytrader.domain.enums.OrderSide;
import com.copytrader.domain.model.TopUpJob;
import com.copytrader.oms.TopUpQueue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TopUpQueueTest {

    private TopUpQueue queue;

    @BeforeEach
    void setUp() {
        ReplicationConfig config = new ReplicationConfig();
        config.setQueueCapacity(2);
        queue = new TopUpQueue(config);
    }

    private TopUpJob job(String auditId) {
        return TopUpJob.builder().auditId(auditId).symbol("BTCUSD").side(OrderSide.BUY).size(1).build();
    }

    @Test
    @DisplayName("Jobs come out in FIFO order")
    void fifoOrder() throws InterruptedException {
        queue.offer(job("a"));
        queue.offer(job("b"));

        assertThat(queue.take().getAuditId()).isEqualTo("a");
        assertThat(queue.take().getAuditId()).isEqualTo("b");
    }

    @Test
    @DisplayName("Offer to a full queue is refused without blocking")
    void dropsWhenFull() {
        assertThat(queue.offer(job("a"))).isTrue();
        assertThat(queue.offer(job("b"))).isTrue();

        assertThat(queue.offer(job("c"))).isFalse();
        assertThat(queue.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("Stop sentinel makes take return null after pending jobs")
    void sentinelEndsTake() throws InterruptedException {
        queue.offer(job("a"));
        queue.signalStop();

        assertThat(queue.take().getAuditId()).isEqualTo("a");
        assertThat(queue.take()).isNull();
    }

    @Test
    @DisplayName("Stop sentinel is delivered even when the queue is full")
    void sentinelFitsInFullQueue() throws InterruptedException {
        queue.offer(job("a"));
        queue.offer(job("b"));

        queue.signalStop();

        assertThat(queue.take().getAuditId()).isEqualTo("b");
        assertThat(queue.take()).isNull();
    }
}
