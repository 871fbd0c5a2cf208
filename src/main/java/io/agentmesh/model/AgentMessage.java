package io.agentmesh.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record AgentMessage(
        String id,
        String sender,
        String recipient,
        MessageKind kind,
        Map<String, Object> payload,
        int priority,
        Instant timestamp,
        String correlationId,
        Instant expiresAt
) {
    public static final int MIN_PRIORITY = 1;
    public static final int MAX_PRIORITY = 10;
    public static final int DEFAULT_PRIORITY = 5;

    public AgentMessage {
        if (kind == null) {
            throw new IllegalArgumentException("message kind cannot be null");
        }
        if (sender == null || sender.isBlank()) {
            throw new IllegalArgumentException("message sender cannot be empty");
        }
        if (recipient == null || recipient.isBlank()) {
            throw new IllegalArgumentException("message recipient cannot be empty");
        }
        if (priority < MIN_PRIORITY || priority > MAX_PRIORITY) {
            throw new IllegalArgumentException("priority must be within 1..10: " + priority);
        }
        id = id == null || id.isBlank() ? MessageIds.newMessageId(kind) : id;
        timestamp = timestamp == null ? Instant.now() : timestamp;
        payload = payload == null || payload.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        correlationId = correlationId == null || correlationId.isBlank() ? null : correlationId;
    }

    public static Builder builder(MessageKind kind) {
        return new Builder(kind);
    }

    public boolean isBroadcast() {
        return Addresses.BROADCAST.equals(recipient);
    }

    /**
     * Builds a RESPONSE addressed to this message's sender, carrying its correlation id.
     */
    public AgentMessage reply(String fromAgent, Map<String, Object> responsePayload) {
        return builder(MessageKind.RESPONSE)
                .sender(fromAgent)
                .recipient(sender)
                .payload(responsePayload)
                .priority(priority)
                .correlationId(correlationId)
                .build();
    }

    public static final class Builder {
        private final MessageKind kind;
        private String id;
        private String sender = Addresses.SYSTEM;
        private String recipient;
        private Map<String, Object> payload = Map.of();
        private int priority = DEFAULT_PRIORITY;
        private Instant timestamp;
        private String correlationId;
        private Instant expiresAt;

        private Builder(MessageKind kind) {
            this.kind = kind;
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder sender(String sender) {
            this.sender = sender;
            return this;
        }

        public Builder recipient(String recipient) {
            this.recipient = recipient;
            return this;
        }

        public Builder payload(Map<String, Object> payload) {
            this.payload = payload;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Builder expiresAt(Instant expiresAt) {
            this.expiresAt = expiresAt;
            return this;
        }

        public AgentMessage build() {
            return new AgentMessage(id, sender, recipient, kind, payload, priority, timestamp, correlationId, expiresAt);
        }
    }
}
