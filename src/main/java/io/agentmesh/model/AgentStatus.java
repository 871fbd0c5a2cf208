package io.agentmesh.model;

public enum AgentStatus {
    INITIALIZING,
    ACTIVE,
    BUSY,
    IDLE,
    ERROR,
    SHUTDOWN;

    public String wireName() {
        return name().toLowerCase();
    }
}
