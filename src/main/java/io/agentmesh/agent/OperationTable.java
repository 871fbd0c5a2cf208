package io.agentmesh.agent;

import io.agentmesh.model.AgentMessage;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public final class OperationTable<E extends Enum<E>> {
    private final Class<E> type;
    private final Map<E, OperationHandler> handlers;

    private OperationTable(Class<E> type, Map<E, OperationHandler> handlers) {
        this.type = type;
        this.handlers = Collections.unmodifiableMap(new EnumMap<>(handlers));
    }

    public static <E extends Enum<E>> Builder<E> builder(Class<E> type) {
        return new Builder<>(type);
    }

    public Optional<E> resolve(String wireName) {
        if (wireName == null || wireName.isBlank()) {
            return Optional.empty();
        }
        String normalized = wireName.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (E constant : type.getEnumConstants()) {
            if (constant.name().equals(normalized) && handlers.containsKey(constant)) {
                return Optional.of(constant);
            }
        }
        return Optional.empty();
    }

    public Map<String, Object> dispatch(E operation, AgentMessage message, Map<String, Object> arguments) throws Exception {
        OperationHandler handler = handlers.get(operation);
        if (handler == null) {
            throw new IllegalStateException("No handler registered for " + operation);
        }
        Map<String, Object> result = handler.apply(message, arguments);
        return result == null ? Map.of() : result;
    }

    public Set<E> operations() {
        return handlers.keySet();
    }

    public static String wireName(Enum<?> operation) {
        return operation.name().toLowerCase(Locale.ROOT);
    }

    public static final class Builder<E extends Enum<E>> {
        private final Class<E> type;
        private final Map<E, OperationHandler> handlers;

        private Builder(Class<E> type) {
            this.type = type;
            this.handlers = new EnumMap<>(type);
        }

        public Builder<E> on(E operation, OperationHandler handler) {
            if (handlers.putIfAbsent(operation, handler) != null) {
                throw new IllegalArgumentException("Handler already registered for " + operation);
            }
            return this;
        }

        public OperationTable<E> build() {
            return new OperationTable<>(type, handlers);
        }
    }
}
