package io.agentmesh.audit;

import io.agentmesh.model.AgentMessage;
import io.agentmesh.util.Jsons;

public record AuditRecord(
        String id,
        String sender,
        String recipient,
        String kind,
        String payload,
        int priority,
        String timestamp,
        String correlationId,
        String expiresAt,
        boolean processed
) {
    public static AuditRecord of(AgentMessage message) {
        return new AuditRecord(
                message.id(),
                message.sender(),
                message.recipient(),
                message.kind().wireName(),
                payloadJson(message),
                message.priority(),
                message.timestamp().toString(),
                message.correlationId(),
                message.expiresAt() == null ? null : message.expiresAt().toString(),
                false
        );
    }

    private static String payloadJson(AgentMessage message) {
        try {
            return Jsons.toCompactJson(message.payload());
        } catch (RuntimeException e) {
            throw new AuditException("Failed to serialize payload of message: " + message.id(), e);
        }
    }
}
