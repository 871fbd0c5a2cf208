package io.agentmesh.cli;

import io.agentmesh.agent.Agent;
import io.agentmesh.agent.EchoAgent;
import io.agentmesh.agent.FailAgent;
import io.agentmesh.config.AgentMeshConfig;
import io.agentmesh.coordinator.AgentMesh;
import io.agentmesh.coordinator.Coordinator;
import io.agentmesh.coordinator.LifecycleReport;
import io.agentmesh.model.MessageKind;
import io.agentmesh.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

@Command(
        name = "agentmesh",
        mixinStandardHelpOptions = true,
        description = "AgentMesh in-process coordination runtime CLI",
        subcommands = {
                AgentMeshCommand.InitCommand.class,
                AgentMeshCommand.RunCommand.class,
                AgentMeshCommand.SendCommandCommand.class,
                AgentMeshCommand.DistributeCommand.class,
                AgentMeshCommand.QueryCommand.class,
                AgentMeshCommand.BroadcastCommand.class,
                AgentMeshCommand.StatusCommand.class,
                AgentMeshCommand.AuditTailCommand.class
        }
)
public final class AgentMeshCommand implements Runnable {
    @Option(names = {"--root"}, description = "Runtime data root directory", defaultValue = "data")
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | run | send-command | distribute | query | broadcast | status | audit-tail");
    }

    AgentMesh mesh() throws Exception {
        return AgentMesh.open(AgentMeshConfig.fromRoot(root)).withAgents(builtInAgents());
    }

    static List<Agent> builtInAgents() {
        return List.of(
                new EchoAgent("echo", Set.of("echo")),
                new EchoAgent("relay", Set.of("echo", "relay")),
                new FailAgent("fail")
        );
    }

    static Map<String, Object> parseJsonObject(String raw) {
        return Jsons.toMap(raw);
    }

    static void pause(long millis) throws InterruptedException {
        if (millis > 0) {
            Thread.sleep(millis);
        }
    }

    @Command(name = "init", description = "Initialize the data root and audit storage")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        AgentMeshCommand parent;

        @Override
        public Integer call() {
            AgentMesh mesh = AgentMesh.open(AgentMeshConfig.fromRoot(parent.root));
            System.out.println("Initialized AgentMesh at: " + mesh.config().rootDir());
            return 0;
        }
    }

    @Command(name = "run", description = "Start the built-in agents and keep them running")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        AgentMeshCommand parent;

        @Option(names = {"--duration-ms"}, defaultValue = "0",
                description = "Stop after this many ms; 0 runs until the process is interrupted")
        long durationMs;

        @Override
        public Integer call() throws Exception {
            try (AgentMesh mesh = parent.mesh()) {
                Coordinator coordinator = mesh.coordinator();
                LifecycleReport started = coordinator.startAll();
                System.out.println(Jsons.toJson(started));
                CountDownLatch shutdown = new CountDownLatch(1);
                Runtime.getRuntime().addShutdownHook(new Thread(shutdown::countDown, "agentmesh-shutdown-hook"));
                if (durationMs > 0) {
                    shutdown.await(durationMs, TimeUnit.MILLISECONDS);
                } else {
                    shutdown.await();
                }
                System.out.println(Jsons.toJson(coordinator.statusSnapshot()));
                return started.allSucceeded() ? 0 : 1;
            }
        }
    }

    @Command(name = "send-command", description = "Send a command to one agent")
    static final class SendCommandCommand implements Callable<Integer> {
        @ParentCommand
        AgentMeshCommand parent;

        @Parameters(index = "0", description = "Target agent id")
        String agentId;

        @Parameters(index = "1", description = "Command name, e.g. echo")
        String command;

        @Option(names = {"--params"}, defaultValue = "{}", description = "Command parameters as a JSON object")
        String params;

        @Option(names = {"--wait-ms"}, defaultValue = "500", description = "Time to let the agent process before reporting")
        long waitMs;

        @Override
        public Integer call() throws Exception {
            try (AgentMesh mesh = parent.mesh()) {
                Coordinator coordinator = mesh.coordinator();
                coordinator.startAll();
                boolean sent = coordinator.sendCommand(agentId, command, parseJsonObject(params));
                pause(waitMs);
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("sent", sent);
                out.put("agent", coordinator.statusSnapshot().get(agentId));
                System.out.println(Jsons.toJson(out));
                return sent ? 0 : 1;
            }
        }
    }

    @Command(name = "distribute", description = "Assign a task to the least-loaded capable agent")
    static final class DistributeCommand implements Callable<Integer> {
        @ParentCommand
        AgentMeshCommand parent;

        @Parameters(index = "0", description = "Task kind, sent as the command name")
        String taskKind;

        @Option(names = {"--capability"}, description = "Required capability")
        String capability;

        @Option(names = {"--data"}, defaultValue = "{}", description = "Task data as a JSON object")
        String data;

        @Option(names = {"--wait-ms"}, defaultValue = "500", description = "Time to let the agent process before reporting")
        long waitMs;

        @Override
        public Integer call() throws Exception {
            try (AgentMesh mesh = parent.mesh()) {
                Coordinator coordinator = mesh.coordinator();
                coordinator.startAll();
                Optional<String> chosen = coordinator.distributeTask(taskKind, parseJsonObject(data), capability);
                pause(waitMs);
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("assigned", chosen.orElse(null));
                out.put("agents", coordinator.statusSnapshot());
                System.out.println(Jsons.toJson(out));
                return chosen.isPresent() ? 0 : 1;
            }
        }
    }

    @Command(name = "query", description = "Query one agent and wait for its response")
    static final class QueryCommand implements Callable<Integer> {
        @ParentCommand
        AgentMeshCommand parent;

        @Parameters(index = "0", description = "Target agent id")
        String agentId;

        @Parameters(index = "1", description = "Query type, e.g. ping")
        String queryType;

        @Option(names = {"--payload"}, defaultValue = "{}", description = "Query arguments as a JSON object")
        String payload;

        @Option(names = {"--timeout-ms"}, defaultValue = "5000", description = "Response timeout")
        long timeoutMs;

        @Override
        public Integer call() throws Exception {
            try (AgentMesh mesh = parent.mesh()) {
                Coordinator coordinator = mesh.coordinator();
                coordinator.startAll();
                Optional<Map<String, Object>> response = coordinator.query(
                        agentId, queryType, parseJsonObject(payload), Duration.ofMillis(timeoutMs));
                if (response.isEmpty()) {
                    System.out.println(Jsons.toJson(Map.of("error", "no answer")));
                    return 1;
                }
                System.out.println(Jsons.toJson(response.get()));
                return 0;
            }
        }
    }

    @Command(name = "broadcast", description = "Broadcast a system message to every agent")
    static final class BroadcastCommand implements Callable<Integer> {
        @ParentCommand
        AgentMeshCommand parent;

        @Option(names = {"--kind"}, defaultValue = "broadcast", description = "broadcast | alert")
        String kind;

        @Option(names = {"--payload"}, defaultValue = "{}", description = "Payload as a JSON object")
        String payload;

        @Option(names = {"--priority"}, defaultValue = "5", description = "Advisory priority 1..10")
        int priority;

        @Override
        public Integer call() throws Exception {
            try (AgentMesh mesh = parent.mesh()) {
                Coordinator coordinator = mesh.coordinator();
                coordinator.startAll();
                String messageId = coordinator.broadcast(
                        MessageKind.fromString(kind), parseJsonObject(payload), priority);
                System.out.println(Jsons.toJson(Map.of("message_id", messageId)));
                return 0;
            }
        }
    }

    @Command(name = "status", description = "Start the built-in agents and print their status snapshot")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        AgentMeshCommand parent;

        @Override
        public Integer call() throws Exception {
            try (AgentMesh mesh = parent.mesh()) {
                Coordinator coordinator = mesh.coordinator();
                coordinator.startAll();
                System.out.println(Jsons.toJson(coordinator.statusSnapshot()));
                return 0;
            }
        }
    }

    @Command(name = "audit-tail", description = "Show the most recent audited messages")
    static final class AuditTailCommand implements Callable<Integer> {
        @ParentCommand
        AgentMeshCommand parent;

        @Option(names = {"--lines"}, defaultValue = "20", description = "Number of records")
        int lines;

        @Override
        public Integer call() {
            AgentMesh mesh = AgentMesh.open(AgentMeshConfig.fromRoot(parent.root));
            System.out.println(Jsons.toJson(mesh.auditTrail().recent(lines)));
            return 0;
        }
    }
}
