package io.agentmesh.runtime;

public final class AgentLifecycleException extends Exception {
    private final String agentId;
    private final String phase;

    public AgentLifecycleException(String agentId, String phase, Throwable cause) {
        super("Agent " + agentId + " failed during " + phase + ": " + describe(cause), cause);
        this.agentId = agentId;
        this.phase = phase;
    }

    public String agentId() {
        return agentId;
    }

    public String phase() {
        return phase;
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown";
        }
        return cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
    }
}
