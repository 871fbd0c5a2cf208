package io.agentmesh.config;

public enum AuditMode {
    SQLITE,
    JSONL,
    NONE;

    public static AuditMode fromString(String raw, AuditMode fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        for (AuditMode value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown audit mode: " + raw);
    }
}
