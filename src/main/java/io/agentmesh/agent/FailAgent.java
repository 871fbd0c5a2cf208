package io.agentmesh.agent;

import io.agentmesh.model.AgentMessage;

import java.util.Optional;
import java.util.Set;

public final class FailAgent implements Agent {
    private final String id;

    public FailAgent() {
        this("fail");
    }

    public FailAgent(String id) {
        this.id = id;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public Set<String> capabilities() {
        return Set.of("fail");
    }

    @Override
    public void initialize() {
    }

    @Override
    public Optional<AgentMessage> handle(AgentMessage message) {
        if (!message.kind().expectsReply()) {
            return Optional.empty();
        }
        throw new IllegalStateException("intentional failure from fail agent");
    }

    @Override
    public void shutdown() {
    }
}
