package io.agentmesh.coordinator;

import io.agentmesh.agent.Agent;
import io.agentmesh.agent.DispatchingAgent;
import io.agentmesh.bus.AgentInbox;
import io.agentmesh.bus.DuplicateAgentException;
import io.agentmesh.bus.MessageBus;
import io.agentmesh.bus.MessageSender;
import io.agentmesh.config.MeshSettings;
import io.agentmesh.model.Addresses;
import io.agentmesh.model.AgentMessage;
import io.agentmesh.model.AgentSnapshot;
import io.agentmesh.model.MessageKind;
import io.agentmesh.runtime.AgentLifecycleException;
import io.agentmesh.runtime.AgentRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class Coordinator {
    private static final Logger log = LoggerFactory.getLogger(Coordinator.class);

    private final MessageBus bus;
    private final MeshSettings settings;
    private final Map<String, AgentRuntime> runtimes;

    public Coordinator(MessageBus bus, MeshSettings settings) {
        this.bus = bus;
        this.settings = settings;
        this.runtimes = new LinkedHashMap<>();
    }

    public MessageBus bus() {
        return bus;
    }

    public AgentRuntime registerAndTrack(Agent agent) throws DuplicateAgentException {
        synchronized (runtimes) {
            if (runtimes.containsKey(agent.id())) {
                throw new DuplicateAgentException(agent.id());
            }
            AgentInbox inbox = new AgentInbox(settings.inboxCapacity());
            MessageSender sender = bus.register(agent.id(), inbox);
            AgentRuntime runtime = new AgentRuntime(agent, inbox, sender, settings);
            runtimes.put(agent.id(), runtime);
            return runtime;
        }
    }

    public Optional<AgentRuntime> runtime(String agentId) {
        synchronized (runtimes) {
            return Optional.ofNullable(runtimes.get(agentId));
        }
    }

    public LifecycleReport startAll() {
        List<String> succeeded = new ArrayList<>();
        Map<String, String> failures = new LinkedHashMap<>();
        for (AgentRuntime runtime : trackedRuntimes()) {
            try {
                runtime.start();
                succeeded.add(runtime.agentId());
            } catch (AgentLifecycleException | IllegalStateException e) {
                failures.put(runtime.agentId(), e.getMessage());
                log.error("Failed to start agent {}: {}", runtime.agentId(), e.getMessage());
            }
        }
        log.info("Started {} agent(s), {} failure(s)", succeeded.size(), failures.size());
        return new LifecycleReport("start", succeeded, failures);
    }

    public LifecycleReport stopAll() {
        List<String> succeeded = new ArrayList<>();
        Map<String, String> failures = new LinkedHashMap<>();
        for (AgentRuntime runtime : trackedRuntimes()) {
            try {
                runtime.stop();
                succeeded.add(runtime.agentId());
            } catch (AgentLifecycleException e) {
                failures.put(runtime.agentId(), e.getMessage());
                log.error("Failed to stop agent {} cleanly: {}", runtime.agentId(), e.getMessage());
            } finally {
                bus.unregister(runtime.agentId());
            }
        }
        log.info("Stopped {} agent(s), {} failure(s)", succeeded.size(), failures.size());
        return new LifecycleReport("stop", succeeded, failures);
    }

    /**
     * Sends a BROADCAST or ALERT from the system identity to every registered agent.
     *
     * @return the id of the sent message
     */
    public String broadcast(MessageKind kind, Map<String, Object> payload, int priority) {
        if (kind != MessageKind.BROADCAST && kind != MessageKind.ALERT) {
            throw new IllegalArgumentException("broadcast kind must be BROADCAST or ALERT: " + kind);
        }
        AgentMessage message = AgentMessage.builder(kind)
                .sender(Addresses.SYSTEM)
                .recipient(Addresses.BROADCAST)
                .payload(payload)
                .priority(priority)
                .build();
        bus.send(message);
        return message.id();
    }

    /**
     * Returns whether the command was handed to a registered agent. Execution is not awaited.
     */
    public boolean sendCommand(String targetAgent, String command, Map<String, Object> parameters) {
        if (!bus.isRegistered(targetAgent)) {
            log.warn("Command {} not sent, agent {} is not registered", command, targetAgent);
            return false;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(DispatchingAgent.COMMAND_KEY, command);
        payload.put(DispatchingAgent.PARAMETERS_KEY, parameters == null ? Map.of() : parameters);
        bus.send(AgentMessage.builder(MessageKind.COMMAND)
                .sender(Addresses.SYSTEM)
                .recipient(targetAgent)
                .payload(payload)
                .build());
        return true;
    }

    public Optional<Map<String, Object>> query(
            String targetAgent,
            String queryType,
            Map<String, Object> payload,
            Duration timeout
    ) {
        return bus.query(targetAgent, queryType, payload, timeout == null ? settings.queryTimeout() : timeout);
    }

    public List<String> agentsWithCapability(String capability) {
        List<String> out = new ArrayList<>();
        for (AgentRuntime runtime : trackedRuntimes()) {
            if (runtime.descriptor().hasCapability(capability)) {
                out.add(runtime.agentId());
            }
        }
        return out;
    }

    /**
     * Sends the task as a command to the registered candidate with the fewest completed tasks.
     * Busy state, queued work and priority are not considered.
     *
     * @return the chosen agent id, or empty when no agent qualifies
     */
    public Optional<String> distributeTask(String taskKind, Map<String, Object> taskData, String requiredCapability) {
        List<AgentRuntime> candidates = new ArrayList<>();
        for (AgentRuntime runtime : trackedRuntimes()) {
            if (!bus.isRegistered(runtime.agentId())) {
                continue;
            }
            if (requiredCapability == null || runtime.descriptor().hasCapability(requiredCapability)) {
                candidates.add(runtime);
            }
        }
        if (candidates.isEmpty()) {
            log.warn("No agents available for task type {} (capability {})", taskKind, requiredCapability);
            return Optional.empty();
        }
        AgentRuntime best = candidates.get(0);
        long bestCompleted = best.descriptor().tasksCompleted();
        for (AgentRuntime candidate : candidates.subList(1, candidates.size())) {
            long completed = candidate.descriptor().tasksCompleted();
            if (completed < bestCompleted) {
                best = candidate;
                bestCompleted = completed;
            }
        }
        if (!sendCommand(best.agentId(), taskKind, taskData)) {
            return Optional.empty();
        }
        log.debug("Task {} assigned to {} (completed={})", taskKind, best.agentId(), bestCompleted);
        return Optional.of(best.agentId());
    }

    public Map<String, AgentSnapshot> statusSnapshot() {
        Map<String, AgentSnapshot> out = new LinkedHashMap<>();
        for (AgentRuntime runtime : trackedRuntimes()) {
            out.put(runtime.agentId(), runtime.snapshot());
        }
        return Collections.unmodifiableMap(out);
    }

    private List<AgentRuntime> trackedRuntimes() {
        synchronized (runtimes) {
            return new ArrayList<>(runtimes.values());
        }
    }
}
