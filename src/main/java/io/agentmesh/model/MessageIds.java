package io.agentmesh.model;

import java.util.UUID;

public final class MessageIds {
    private MessageIds() {
    }

    public static String newMessageId(MessageKind kind) {
        return kind.idPrefix() + "_" + hex();
    }

    public static String newCorrelationId() {
        return "query_" + hex();
    }

    private static String hex() {
        return UUID.randomUUID().toString().replace("-", "");
    }
}
