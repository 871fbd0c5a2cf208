package io.agentmesh.agent;

import io.agentmesh.model.AgentMessage;

import java.util.Optional;
import java.util.Set;

/**
 * Domain behavior hosted by an {@link io.agentmesh.runtime.AgentRuntime}.
 *
 * <p>{@link #handle(AgentMessage)} is invoked from a single thread, one message at a time,
 * and must not wait without bound.
 */
public interface Agent {
    String id();

    default String name() {
        return id();
    }

    default String description() {
        return "";
    }

    default Set<String> capabilities() {
        return Set.of();
    }

    void initialize() throws Exception;

    Optional<AgentMessage> handle(AgentMessage message) throws Exception;

    void shutdown() throws Exception;
}
