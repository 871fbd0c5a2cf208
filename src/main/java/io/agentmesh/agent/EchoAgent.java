package io.agentmesh.agent;

import io.agentmesh.model.AgentMessage;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

public final class EchoAgent extends DispatchingAgent<EchoAgent.Operation> {
    public enum Operation {
        ECHO,
        PING
    }

    private final Set<String> capabilities;

    public EchoAgent() {
        this("echo", Set.of("echo"));
    }

    public EchoAgent(String id, Set<String> capabilities) {
        super(id);
        this.capabilities = capabilities == null ? Set.of() : Set.copyOf(capabilities);
    }

    @Override
    public String name() {
        return "Echo";
    }

    @Override
    public String description() {
        return "Answers every command or query with the arguments it received";
    }

    @Override
    public Set<String> capabilities() {
        return capabilities;
    }

    @Override
    protected OperationTable<Operation> buildOperations() {
        return OperationTable.builder(Operation.class)
                .on(Operation.ECHO, this::echo)
                .on(Operation.PING, (message, arguments) -> Map.of("pong", Instant.now().toString()))
                .build();
    }

    private Map<String, Object> echo(AgentMessage message, Map<String, Object> arguments) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("agent", id());
        out.put("timestamp", Instant.now().toString());
        out.put("message_id", message.id());
        out.put("sender", message.sender());
        out.put("received", arguments);
        return out;
    }
}
