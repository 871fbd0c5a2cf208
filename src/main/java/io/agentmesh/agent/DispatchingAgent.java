package io.agentmesh.agent;

import io.agentmesh.model.AgentMessage;
import io.agentmesh.model.MessageKind;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

public abstract class DispatchingAgent<E extends Enum<E>> implements Agent {
    public static final String COMMAND_KEY = "command";
    public static final String PARAMETERS_KEY = "parameters";
    public static final String QUERY_TYPE_KEY = "query_type";

    private final String id;
    private volatile OperationTable<E> table;

    protected DispatchingAgent(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("agent id cannot be empty");
        }
        this.id = id;
    }

    @Override
    public String id() {
        return id;
    }

    protected abstract OperationTable<E> buildOperations();

    @Override
    public void initialize() throws Exception {
        operations();
    }

    @Override
    public void shutdown() throws Exception {
    }

    @Override
    public Optional<AgentMessage> handle(AgentMessage message) throws Exception {
        if (message.kind() == MessageKind.COMMAND) {
            String name = stringValue(message.payload().get(COMMAND_KEY));
            return Optional.of(dispatch(message, name, parameters(message.payload().get(PARAMETERS_KEY))));
        }
        if (message.kind() == MessageKind.QUERY) {
            String name = stringValue(message.payload().get(QUERY_TYPE_KEY));
            Map<String, Object> arguments = new LinkedHashMap<>(message.payload());
            arguments.remove(QUERY_TYPE_KEY);
            return Optional.of(dispatch(message, name, arguments));
        }
        return onNotification(message);
    }

    protected Optional<AgentMessage> onNotification(AgentMessage message) throws Exception {
        return Optional.empty();
    }

    protected final OperationTable<E> operations() {
        OperationTable<E> current = table;
        if (current == null) {
            synchronized (this) {
                current = table;
                if (current == null) {
                    current = buildOperations();
                    table = current;
                }
            }
        }
        return current;
    }

    private AgentMessage dispatch(AgentMessage message, String name, Map<String, Object> arguments) throws Exception {
        E operation = operations().resolve(name)
                .orElseThrow(() -> new UnsupportedOperationFault(id, name));
        Map<String, Object> result = operations().dispatch(operation, message, arguments);
        Map<String, Object> reply = new LinkedHashMap<>();
        reply.put("status", "ok");
        reply.put("operation", OperationTable.wireName(operation));
        reply.putAll(result);
        return message.reply(id, reply);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> parameters(Object raw) {
        if (raw instanceof Map<?, ?> map) {
            return new LinkedHashMap<>((Map<String, Object>) map);
        }
        return new LinkedHashMap<>();
    }

    private static String stringValue(Object raw) {
        return raw == null ? null : raw.toString();
    }
}
