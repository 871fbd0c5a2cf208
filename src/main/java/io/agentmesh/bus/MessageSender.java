package io.agentmesh.bus;

import io.agentmesh.model.AgentMessage;

@FunctionalInterface
public interface MessageSender {
    void send(AgentMessage message);
}
