package io.agentmesh;

import io.agentmesh.agent.Agent;
import io.agentmesh.audit.AuditRecord;
import io.agentmesh.audit.MessageAuditTrail;
import io.agentmesh.config.AuditMode;
import io.agentmesh.config.MeshSettings;
import io.agentmesh.model.AgentMessage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BooleanSupplier;
import java.util.stream.Stream;

public final class TestSupport {
    private TestSupport() {
    }

    public static MeshSettings fastSettings() {
        return MeshSettings.defaults()
                .withPollIntervalMs(20L)
                .withHeartbeatIntervalMs(60_000L)
                .withAuditMode(AuditMode.NONE);
    }

    public static void awaitCondition(String description, Duration timeout, BooleanSupplier condition)
            throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("Timed out waiting for: " + description);
            }
            Thread.sleep(5L);
        }
    }

    public static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }

    @FunctionalInterface
    public interface Handler {
        Optional<AgentMessage> handle(AgentMessage message) throws Exception;
    }

    /**
     * Agent whose behavior is supplied by the test; records every message it sees.
     */
    public static final class ScriptedAgent implements Agent {
        private final String id;
        private final Set<String> capabilities;
        private final Handler handler;
        private final List<AgentMessage> received = new CopyOnWriteArrayList<>();
        private volatile int initializeCalls;
        private volatile int shutdownCalls;

        public ScriptedAgent(String id, Set<String> capabilities, Handler handler) {
            this.id = id;
            this.capabilities = capabilities;
            this.handler = handler;
        }

        public static ScriptedAgent silent(String id, String... capabilities) {
            return new ScriptedAgent(id, Set.of(capabilities), message -> Optional.empty());
        }

        @Override
        public String id() {
            return id;
        }

        @Override
        public Set<String> capabilities() {
            return capabilities;
        }

        @Override
        public void initialize() throws Exception {
            initializeCalls++;
        }

        @Override
        public Optional<AgentMessage> handle(AgentMessage message) throws Exception {
            received.add(message);
            return handler.handle(message);
        }

        @Override
        public void shutdown() throws Exception {
            shutdownCalls++;
        }

        public List<AgentMessage> received() {
            return received;
        }

        public int initializeCalls() {
            return initializeCalls;
        }

        public int shutdownCalls() {
            return shutdownCalls;
        }
    }

    public static final class RecordingAuditTrail implements MessageAuditTrail {
        private final List<AgentMessage> recorded = new CopyOnWriteArrayList<>();

        @Override
        public void record(AgentMessage message) {
            recorded.add(message);
        }

        @Override
        public List<AuditRecord> recent(int limit) {
            List<AuditRecord> out = new ArrayList<>();
            int from = Math.max(0, recorded.size() - limit);
            for (AgentMessage message : recorded.subList(from, recorded.size())) {
                out.add(AuditRecord.of(message));
            }
            return out;
        }

        public List<AgentMessage> recorded() {
            return recorded;
        }
    }
}
