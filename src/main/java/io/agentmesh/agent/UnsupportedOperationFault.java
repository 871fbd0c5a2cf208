package io.agentmesh.agent;

public final class UnsupportedOperationFault extends Exception {
    private final String operation;

    public UnsupportedOperationFault(String agentId, String operation) {
        super("Agent " + agentId + " does not support operation: " + operation);
        this.operation = operation;
    }

    public String operation() {
        return operation;
    }
}
