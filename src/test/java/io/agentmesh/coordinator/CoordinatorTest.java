package io.agentmesh.coordinator;

import io.agentmesh.TestSupport;
import io.agentmesh.agent.Agent;
import io.agentmesh.agent.EchoAgent;
import io.agentmesh.bus.DuplicateAgentException;
import io.agentmesh.bus.MessageBus;
import io.agentmesh.model.AgentMessage;
import io.agentmesh.model.AgentSnapshot;
import io.agentmesh.model.AgentStatus;
import io.agentmesh.model.MessageKind;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

final class CoordinatorTest {
    private static final Duration WAIT = Duration.ofSeconds(5);

    @Test
    void findsAgentsByCapability() throws Exception {
        Coordinator coordinator = newCoordinator();
        coordinator.registerAndTrack(TestSupport.ScriptedAgent.silent("a", "echo"));
        coordinator.registerAndTrack(TestSupport.ScriptedAgent.silent("b", "echo", "translate"));

        Assertions.assertEquals(List.of("b"), coordinator.agentsWithCapability("translate"));
        Assertions.assertEquals(List.of("a", "b"), coordinator.agentsWithCapability("echo"));
        Assertions.assertEquals(List.of(), coordinator.agentsWithCapability("summarize"));

        coordinator.runtime("a").orElseThrow().addCapability("translate");
        Assertions.assertEquals(List.of("a", "b"), coordinator.agentsWithCapability("translate"));
    }

    @Test
    void distributesToTheLeastLoadedCandidate() throws Exception {
        Coordinator coordinator = newCoordinator();
        TestSupport.ScriptedAgent x = TestSupport.ScriptedAgent.silent("x", "work");
        TestSupport.ScriptedAgent y = TestSupport.ScriptedAgent.silent("y", "work");
        TestSupport.ScriptedAgent z = TestSupport.ScriptedAgent.silent("z", "work");
        coordinator.registerAndTrack(x);
        coordinator.registerAndTrack(y);
        coordinator.registerAndTrack(z);
        Assertions.assertTrue(coordinator.startAll().allSucceeded());
        try {
            sendWarmups(coordinator, "x", 3);
            sendWarmups(coordinator, "y", 1);
            sendWarmups(coordinator, "z", 5);
            TestSupport.awaitCondition("warm-up processed", WAIT, () -> completed(coordinator, "x") == 3
                    && completed(coordinator, "y") == 1 && completed(coordinator, "z") == 5);

            Optional<String> chosen = coordinator.distributeTask("summarize", Map.of("doc", "d1"), "work");

            Assertions.assertEquals(Optional.of("y"), chosen);
            TestSupport.awaitCondition("task delivered", WAIT, () -> y.received().size() == 2);
            AgentMessage task = y.received().get(1);
            Assertions.assertEquals(MessageKind.COMMAND, task.kind());
            Assertions.assertEquals("summarize", task.payload().get("command"));
            Assertions.assertEquals(Map.of("doc", "d1"), task.payload().get("parameters"));
        } finally {
            coordinator.stopAll();
        }
    }

    @Test
    void tiesGoToTheEarliestRegisteredAgent() throws Exception {
        Coordinator coordinator = newCoordinator();
        coordinator.registerAndTrack(TestSupport.ScriptedAgent.silent("first", "work"));
        coordinator.registerAndTrack(TestSupport.ScriptedAgent.silent("second", "work"));

        Assertions.assertEquals(Optional.of("first"), coordinator.distributeTask("job", Map.of(), "work"));
        Assertions.assertEquals(Optional.of("first"), coordinator.distributeTask("job", Map.of(), null));
    }

    @Test
    void distributeWithoutCandidatesSendsNothing() throws Exception {
        TestSupport.RecordingAuditTrail audit = new TestSupport.RecordingAuditTrail();
        Coordinator coordinator = new Coordinator(new MessageBus(audit), TestSupport.fastSettings());
        coordinator.registerAndTrack(TestSupport.ScriptedAgent.silent("a", "echo"));

        Assertions.assertTrue(coordinator.distributeTask("job", Map.of(), "nonexistent").isEmpty());
        Assertions.assertTrue(audit.recorded().isEmpty());
    }

    @Test
    void sendCommandToUnknownAgentReturnsFalse() throws Exception {
        TestSupport.RecordingAuditTrail audit = new TestSupport.RecordingAuditTrail();
        Coordinator coordinator = new Coordinator(new MessageBus(audit), TestSupport.fastSettings());
        coordinator.registerAndTrack(TestSupport.ScriptedAgent.silent("a"));

        Assertions.assertFalse(coordinator.sendCommand("ghost", "echo", Map.of()));
        Assertions.assertTrue(audit.recorded().isEmpty());
        Assertions.assertTrue(coordinator.sendCommand("a", "echo", null));
        Assertions.assertEquals(1, audit.recorded().size());
        Assertions.assertEquals(Map.of(), audit.recorded().get(0).payload().get("parameters"));
    }

    @Test
    void queryToGhostTimesOutWithoutLeakingWaiters() throws Exception {
        Coordinator coordinator = newCoordinator();
        int baseline = coordinator.bus().pendingQueryCount();

        Optional<Map<String, Object>> answer = coordinator.query("ghost", "ping", Map.of(), Duration.ofMillis(50));

        Assertions.assertTrue(answer.isEmpty());
        Assertions.assertEquals(baseline, coordinator.bus().pendingQueryCount());
    }

    @Test
    void queryRoundTripThroughARunningAgent() throws Exception {
        Coordinator coordinator = newCoordinator();
        coordinator.registerAndTrack(new EchoAgent("echo", Set.of("echo")));
        coordinator.startAll();
        try {
            Optional<Map<String, Object>> answer = coordinator.query("echo", "ping", Map.of(), WAIT);

            Assertions.assertTrue(answer.isPresent());
            Assertions.assertEquals("ok", answer.get().get("status"));
            Assertions.assertEquals("ping", answer.get().get("operation"));
        } finally {
            coordinator.stopAll();
        }
    }

    @Test
    void startAllIsBestEffort() throws Exception {
        Coordinator coordinator = newCoordinator();
        coordinator.registerAndTrack(TestSupport.ScriptedAgent.silent("good-1"));
        coordinator.registerAndTrack(new FailingInitAgent("bad"));
        coordinator.registerAndTrack(TestSupport.ScriptedAgent.silent("good-2"));
        try {
            LifecycleReport report = coordinator.startAll();

            Assertions.assertFalse(report.allSucceeded());
            Assertions.assertEquals(List.of("good-1", "good-2"), report.succeeded());
            Assertions.assertEquals(Set.of("bad"), report.failures().keySet());
            Assertions.assertEquals(AgentStatus.ERROR, coordinator.statusSnapshot().get("bad").status());
            Assertions.assertTrue(coordinator.runtime("good-2").orElseThrow().isRunning());
        } finally {
            coordinator.stopAll();
        }
    }

    @Test
    void stopAllRetiresAndUnregisters() throws Exception {
        Coordinator coordinator = newCoordinator();
        TestSupport.ScriptedAgent agent = TestSupport.ScriptedAgent.silent("a");
        coordinator.registerAndTrack(agent);
        coordinator.startAll();

        LifecycleReport report = coordinator.stopAll();

        Assertions.assertTrue(report.allSucceeded());
        Assertions.assertEquals(1, agent.shutdownCalls());
        Assertions.assertFalse(coordinator.bus().isRegistered("a"));
        Assertions.assertEquals(AgentStatus.SHUTDOWN, coordinator.statusSnapshot().get("a").status());
        Assertions.assertFalse(coordinator.sendCommand("a", "echo", Map.of()));
        Assertions.assertThrows(DuplicateAgentException.class,
                () -> coordinator.registerAndTrack(TestSupport.ScriptedAgent.silent("a")));
        Assertions.assertTrue(coordinator.stopAll().allSucceeded());
    }

    @Test
    void distributeSkipsStoppedAgents() throws Exception {
        TestSupport.RecordingAuditTrail audit = new TestSupport.RecordingAuditTrail();
        Coordinator coordinator = new Coordinator(new MessageBus(audit), TestSupport.fastSettings());
        coordinator.registerAndTrack(TestSupport.ScriptedAgent.silent("a", "work"));
        coordinator.startAll();
        coordinator.stopAll();

        Assertions.assertTrue(coordinator.distributeTask("job", Map.of(), "work").isEmpty());
        Assertions.assertTrue(coordinator.distributeTask("job", Map.of(), null).isEmpty());
        Assertions.assertTrue(audit.recorded().isEmpty());
    }

    @Test
    void distributeFallsBackToARegisteredAgentWhenTheIdlestIsRetired() throws Exception {
        Coordinator coordinator = newCoordinator();
        coordinator.registerAndTrack(TestSupport.ScriptedAgent.silent("retired", "work"));
        coordinator.registerAndTrack(TestSupport.ScriptedAgent.silent("live", "work"));
        coordinator.bus().unregister("retired");

        Assertions.assertEquals(Optional.of("live"), coordinator.distributeTask("job", Map.of(), "work"));
    }

    @Test
    void duplicateRegistrationKeepsTheFirstAgent() throws Exception {
        Coordinator coordinator = newCoordinator();
        coordinator.registerAndTrack(TestSupport.ScriptedAgent.silent("a", "first"));

        Assertions.assertThrows(DuplicateAgentException.class,
                () -> coordinator.registerAndTrack(TestSupport.ScriptedAgent.silent("a", "second")));
        Assertions.assertEquals(List.of("first"), coordinator.statusSnapshot().get("a").capabilities());
    }

    @Test
    void statusSnapshotIsADetachedCopy() throws Exception {
        Coordinator coordinator = newCoordinator();
        coordinator.registerAndTrack(TestSupport.ScriptedAgent.silent("a", "echo"));
        Map<String, AgentSnapshot> before = coordinator.statusSnapshot();

        coordinator.runtime("a").orElseThrow().addCapability("translate");
        coordinator.registerAndTrack(TestSupport.ScriptedAgent.silent("b"));

        Assertions.assertEquals(Set.of("a"), before.keySet());
        Assertions.assertEquals(List.of("echo"), before.get("a").capabilities());
        Assertions.assertThrows(UnsupportedOperationException.class, () -> before.remove("a"));
        Assertions.assertThrows(UnsupportedOperationException.class, () -> before.get("a").capabilities().add("x"));
    }

    @Test
    void broadcastAcceptsOnlyBroadcastKinds() throws Exception {
        TestSupport.RecordingAuditTrail audit = new TestSupport.RecordingAuditTrail();
        Coordinator coordinator = new Coordinator(new MessageBus(audit), TestSupport.fastSettings());
        coordinator.registerAndTrack(TestSupport.ScriptedAgent.silent("a"));

        String id = coordinator.broadcast(MessageKind.ALERT, Map.of("level", "high"), 9);

        Assertions.assertTrue(id.startsWith("alert_"));
        Assertions.assertEquals(9, audit.recorded().get(0).priority());
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> coordinator.broadcast(MessageKind.COMMAND, Map.of(), 5));
    }

    private static Coordinator newCoordinator() {
        return new Coordinator(new MessageBus(new TestSupport.RecordingAuditTrail()), TestSupport.fastSettings());
    }

    private static void sendWarmups(Coordinator coordinator, String agentId, int count) {
        for (int i = 0; i < count; i++) {
            Assertions.assertTrue(coordinator.sendCommand(agentId, "warmup", Map.of()));
        }
    }

    private static long completed(Coordinator coordinator, String agentId) {
        return coordinator.statusSnapshot().get(agentId).tasksCompleted();
    }

    private static final class FailingInitAgent implements Agent {
        private final String id;

        FailingInitAgent(String id) {
            this.id = id;
        }

        @Override
        public String id() {
            return id;
        }

        @Override
        public void initialize() {
            throw new IllegalStateException("cannot initialize " + id);
        }

        @Override
        public Optional<AgentMessage> handle(AgentMessage message) {
            return Optional.empty();
        }

        @Override
        public void shutdown() {
        }
    }
}
