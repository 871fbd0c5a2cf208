package io.agentmesh.runtime;

import io.agentmesh.model.AgentSnapshot;
import io.agentmesh.model.AgentStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.atomic.AtomicReference;

public final class AgentDescriptor {
    private final String agentId;
    private final String name;
    private final String description;
    private final Set<String> capabilities;
    private final AtomicReference<AgentStatus> status;
    private volatile long tasksCompleted;
    private volatile long tasksFailed;
    private volatile double averageResponseTime;
    private volatile Instant lastHeartbeat;

    AgentDescriptor(String agentId, String name, String description) {
        this.agentId = agentId;
        this.name = name == null || name.isBlank() ? agentId : name;
        this.description = description == null ? "" : description;
        this.capabilities = new CopyOnWriteArraySet<>();
        this.status = new AtomicReference<>(AgentStatus.INITIALIZING);
        this.lastHeartbeat = Instant.now();
    }

    public String agentId() {
        return agentId;
    }

    public AgentStatus status() {
        return status.get();
    }

    public long tasksCompleted() {
        return tasksCompleted;
    }

    public long tasksFailed() {
        return tasksFailed;
    }

    public double averageResponseTime() {
        return averageResponseTime;
    }

    public Instant lastHeartbeat() {
        return lastHeartbeat;
    }

    public boolean hasCapability(String capability) {
        return capabilities.contains(capability);
    }

    public AgentSnapshot snapshot() {
        return new AgentSnapshot(
                agentId,
                name,
                description,
                status.get(),
                new ArrayList<>(capabilities),
                tasksCompleted,
                tasksFailed,
                averageResponseTime,
                lastHeartbeat
        );
    }

    boolean addCapability(String capability) {
        return capabilities.add(capability);
    }

    /**
     * SHUTDOWN is terminal: later transitions are ignored.
     */
    void markStatus(AgentStatus next) {
        status.updateAndGet(current -> current == AgentStatus.SHUTDOWN ? current : next);
    }

    void retire() {
        status.set(AgentStatus.SHUTDOWN);
    }

    void recordSuccess(double elapsedSeconds) {
        long n = tasksCompleted + 1;
        averageResponseTime = (averageResponseTime * (n - 1) + elapsedSeconds) / n;
        tasksCompleted = n;
    }

    void recordFailure() {
        tasksFailed = tasksFailed + 1;
    }

    void markHeartbeat(Instant at) {
        lastHeartbeat = at;
    }
}
