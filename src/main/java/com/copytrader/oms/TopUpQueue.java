package com.copytrader.oms;

import com.copytrader.config.ReplicationConfig;
import com.copytrader.domain.model.TopUpJob;
import java.util.concurrent.LinkedBlockingQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Bounded FIFO hand-off between the socket ingestion thread and the execution worker.
 *
 * <p>Producers never block: {@link #offer(TopUpJob)} returns false when the queue is full
 * and the caller drops the job. The consumer blocks in {@link #take()}, which returns null
 * once the stop sentinel posted by {@link #signalStop()} is reached.
 */
@Component
public class TopUpQueue {

    private static final Logger log = LoggerFactory.getLogger(TopUpQueue.class);

    /** Identity-compared marker telling the consumer to exit. */
    private static final TopUpJob STOP = TopUpJob.builder().auditId("__stop__").build();

    private final LinkedBlockingQueue<TopUpJob> queue;
    private final int capacity;

    public TopUpQueue(ReplicationConfig replicationConfig) {
        this.capacity = replicationConfig.getQueueCapacity();
        this.queue = new LinkedBlockingQueue<>(capacity);
    }

    /** Non-blocking enqueue. Returns false if the queue is at capacity. */
    public boolean offer(TopUpJob job) {
        boolean accepted = queue.offer(job);
        if (accepted) {
            log.debug("Top-up enqueued: auditId={}, queueSize={}", job.getAuditId(), queue.size());
        }
        return accepted;
    }

    /**
     * Blocks until a job is available.
     *
     * @return the next job, or null when the stop sentinel was dequeued
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public TopUpJob take() throws InterruptedException {
        TopUpJob job = queue.take();
        return job == STOP ? null : job;
    }

    /**
     * Posts the stop sentinel. If the queue is full the oldest pending job is discarded
     * to make room, so the consumer is always woken.
     */
    public void signalStop() {
        while (!queue.offer(STOP)) {
            TopUpJob dropped = queue.poll();
            if (dropped != null) {
                log.warn("Queue full at shutdown, discarding pending top-up: auditId={}", dropped.getAuditId());
            }
        }
    }

    public int size() {
        return queue.size();
    }

    public int getCapacity() {
        return capacity;
    }
}
