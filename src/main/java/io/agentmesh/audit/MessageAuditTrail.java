package io.agentmesh.audit;

import io.agentmesh.model.AgentMessage;

import java.util.List;

/**
 * Append-only record of every message handed to the bus. Implementations must be safe
 * for concurrent writers and must never interleave partial records.
 */
public interface MessageAuditTrail {
    void record(AgentMessage message);

    /**
     * Most recent records, newest last. Operator tooling only; the bus never reads back.
     */
    List<AuditRecord> recent(int limit);
}
