package io.agentmesh.audit;

import io.agentmesh.model.AgentMessage;

import java.util.List;

public final class NoopMessageAuditTrail implements MessageAuditTrail {
    @Override
    public void record(AgentMessage message) {
    }

    @Override
    public List<AuditRecord> recent(int limit) {
        return List.of();
    }
}
