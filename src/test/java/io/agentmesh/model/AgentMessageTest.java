package io.agentmesh.model;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

final class AgentMessageTest {

    @Test
    void generatesIdTimestampAndDefaultPriority() {
        AgentMessage message = AgentMessage.builder(MessageKind.COMMAND)
                .recipient("echo")
                .payload(Map.of("command", "ping"))
                .build();

        Assertions.assertTrue(message.id().startsWith("cmd_"));
        Assertions.assertEquals(Addresses.SYSTEM, message.sender());
        Assertions.assertEquals(AgentMessage.DEFAULT_PRIORITY, message.priority());
        Assertions.assertNotNull(message.timestamp());
        Assertions.assertNull(message.correlationId());
        Assertions.assertNull(message.expiresAt());
    }

    @Test
    void generatedIdsAreUnique() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 10_000; i++) {
            ids.add(AgentMessage.builder(MessageKind.HEARTBEAT).recipient(Addresses.BROADCAST).build().id());
        }
        Assertions.assertEquals(10_000, ids.size());
    }

    @Test
    void rejectsPriorityOutsideOneToTen() {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> AgentMessage.builder(MessageKind.ALERT).recipient("a").priority(0).build());
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> AgentMessage.builder(MessageKind.ALERT).recipient("a").priority(11).build());
        Assertions.assertEquals(10, AgentMessage.builder(MessageKind.ALERT).recipient("a").priority(10).build().priority());
    }

    @Test
    void payloadIsDetachedFromCallerMap() {
        Map<String, Object> payload = new HashMap<>();
        payload.put("k", "v");
        AgentMessage message = AgentMessage.builder(MessageKind.BROADCAST).recipient(Addresses.BROADCAST).payload(payload).build();
        payload.put("k", "changed");

        Assertions.assertEquals("v", message.payload().get("k"));
        Assertions.assertThrows(UnsupportedOperationException.class, () -> message.payload().put("x", 1));
    }

    @Test
    void replyTargetsOriginalSenderWithSameCorrelationId() {
        AgentMessage query = AgentMessage.builder(MessageKind.QUERY)
                .sender("planner")
                .recipient("echo")
                .correlationId("query_abc")
                .priority(8)
                .expiresAt(Instant.now().minusSeconds(60))
                .build();

        AgentMessage reply = query.reply("echo", Map.of("status", "ok"));

        Assertions.assertEquals(MessageKind.RESPONSE, reply.kind());
        Assertions.assertEquals("echo", reply.sender());
        Assertions.assertEquals("planner", reply.recipient());
        Assertions.assertEquals("query_abc", reply.correlationId());
        Assertions.assertEquals(8, reply.priority());
    }

    @Test
    void kindParsesWireAndEnumNames() {
        Assertions.assertEquals(MessageKind.ALERT, MessageKind.fromString("alert"));
        Assertions.assertEquals(MessageKind.BROADCAST, MessageKind.fromString("BROADCAST"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> MessageKind.fromString("gossip"));
        Assertions.assertTrue(MessageKind.QUERY.expectsReply());
        Assertions.assertFalse(MessageKind.HEARTBEAT.expectsReply());
    }
}
