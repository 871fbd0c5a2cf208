package io.agentmesh.model;

public enum MessageKind {
    COMMAND("command", "cmd"),
    QUERY("query", "q"),
    RESPONSE("response", "resp"),
    ALERT("alert", "alert"),
    BROADCAST("broadcast", "bc"),
    HEARTBEAT("heartbeat", "hb");

    private final String wireName;
    private final String idPrefix;

    MessageKind(String wireName, String idPrefix) {
        this.wireName = wireName;
        this.idPrefix = idPrefix;
    }

    public String wireName() {
        return wireName;
    }

    public String idPrefix() {
        return idPrefix;
    }

    public boolean expectsReply() {
        return this == COMMAND || this == QUERY;
    }

    public static MessageKind fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Message kind cannot be empty");
        }
        for (MessageKind value : values()) {
            if (value.name().equalsIgnoreCase(raw) || value.wireName.equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown message kind: " + raw);
    }
}
