package io.agentmesh.bus;

public final class DuplicateAgentException extends Exception {
    private final String agentId;

    public DuplicateAgentException(String agentId) {
        super("Agent already registered: " + agentId);
        this.agentId = agentId;
    }

    public String agentId() {
        return agentId;
    }
}
