package io.agentmesh.model;

import java.time.Instant;
import java.util.List;

public record AgentSnapshot(
        String agentId,
        String name,
        String description,
        AgentStatus status,
        List<String> capabilities,
        long tasksCompleted,
        long tasksFailed,
        double averageResponseTime,
        Instant lastHeartbeat
) {
    public AgentSnapshot {
        capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
    }

    public boolean hasCapability(String capability) {
        return capabilities.contains(capability);
    }
}
