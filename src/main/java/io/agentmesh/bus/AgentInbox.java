package io.agentmesh.bus;

import io.agentmesh.model.AgentMessage;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

public final class AgentInbox {
    private final BlockingQueue<AgentMessage> queue;
    private final AtomicLong dropped;

    public AgentInbox(int capacity) {
        this.queue = new LinkedBlockingQueue<>(Math.max(1, capacity));
        this.dropped = new AtomicLong(0L);
    }

    boolean offer(AgentMessage message) {
        boolean accepted = queue.offer(message);
        if (!accepted) {
            dropped.incrementAndGet();
        }
        return accepted;
    }

    public AgentMessage poll(Duration timeout) throws InterruptedException {
        return queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public int size() {
        return queue.size();
    }

    public long droppedCount() {
        return dropped.get();
    }
}
