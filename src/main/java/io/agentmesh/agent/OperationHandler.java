package io.agentmesh.agent;

import io.agentmesh.model.AgentMessage;

import java.util.Map;

@FunctionalInterface
public interface OperationHandler {
    /**
     * Returns the RESPONSE payload; an empty map still produces a reply.
     */
    Map<String, Object> apply(AgentMessage message, Map<String, Object> arguments) throws Exception;
}
