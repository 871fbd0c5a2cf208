package io.agentmesh.runtime;

import io.agentmesh.agent.Agent;
import io.agentmesh.bus.AgentInbox;
import io.agentmesh.bus.MessageSender;
import io.agentmesh.config.MeshSettings;
import io.agentmesh.model.Addresses;
import io.agentmesh.model.AgentMessage;
import io.agentmesh.model.AgentSnapshot;
import io.agentmesh.model.AgentStatus;
import io.agentmesh.model.MessageKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.LongSupplier;

public final class AgentRuntime {
    private static final Logger log = LoggerFactory.getLogger(AgentRuntime.class);

    private final Agent agent;
    private final AgentInbox inbox;
    private final MessageSender sender;
    private final Duration pollInterval;
    private final Duration heartbeatInterval;
    private final Duration stopTimeout;
    private final LongSupplier nanoTicker;
    private final AgentDescriptor descriptor;
    private final AtomicBoolean started;
    private final AtomicBoolean stopped;
    private volatile boolean running;
    private volatile ExecutorService loopExecutor;
    private volatile ScheduledExecutorService heartbeatExecutor;

    public AgentRuntime(Agent agent, AgentInbox inbox, MessageSender sender, MeshSettings settings) {
        this(agent, inbox, sender, settings, System::nanoTime);
    }

    AgentRuntime(Agent agent, AgentInbox inbox, MessageSender sender, MeshSettings settings, LongSupplier nanoTicker) {
        this.agent = agent;
        this.inbox = inbox;
        this.sender = sender;
        this.pollInterval = settings.pollInterval();
        this.heartbeatInterval = settings.heartbeatInterval();
        this.stopTimeout = settings.stopTimeout();
        this.nanoTicker = nanoTicker;
        this.descriptor = new AgentDescriptor(agent.id(), agent.name(), agent.description());
        this.started = new AtomicBoolean(false);
        this.stopped = new AtomicBoolean(false);
        for (String capability : agent.capabilities()) {
            descriptor.addCapability(capability);
        }
    }

    public String agentId() {
        return descriptor.agentId();
    }

    public AgentDescriptor descriptor() {
        return descriptor;
    }

    public AgentSnapshot snapshot() {
        return descriptor.snapshot();
    }

    public AgentInbox inbox() {
        return inbox;
    }

    public boolean isRunning() {
        return running;
    }

    public void addCapability(String capability) {
        if (capability == null || capability.isBlank()) {
            throw new IllegalArgumentException("capability name cannot be empty");
        }
        if (descriptor.addCapability(capability)) {
            log.info("Agent {} added capability {}", agentId(), capability);
        }
    }

    public synchronized void start() throws AgentLifecycleException {
        if (stopped.get()) {
            throw new IllegalStateException("Agent runtime already retired: " + agentId());
        }
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Agent runtime already started: " + agentId());
        }
        try {
            agent.initialize();
        } catch (Exception e) {
            descriptor.markStatus(AgentStatus.ERROR);
            log.error("Agent {} failed to initialize", agentId(), e);
            throw new AgentLifecycleException(agentId(), "initialize", e);
        }
        descriptor.markStatus(AgentStatus.ACTIVE);
        running = true;
        loopExecutor = Executors.newSingleThreadExecutor(daemonThreads("agent-" + agentId() + "-loop"));
        heartbeatExecutor = Executors.newSingleThreadScheduledExecutor(daemonThreads("agent-" + agentId() + "-heartbeat"));
        loopExecutor.execute(this::processLoop);
        long intervalMs = heartbeatInterval.toMillis();
        heartbeatExecutor.scheduleAtFixedRate(this::heartbeatTick, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Agent {} ({}) started", agentId(), descriptor.snapshot().name());
    }

    // Shares the start() monitor, so a stop issued during initialize() waits for it to return.
    public synchronized void stop() throws AgentLifecycleException {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        running = false;
        if (heartbeatExecutor != null) {
            heartbeatExecutor.shutdown();
        }
        if (loopExecutor != null) {
            loopExecutor.shutdown();
            try {
                if (!loopExecutor.awaitTermination(stopTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Agent {} still finishing a message after {} ms, not waiting further",
                            agentId(), stopTimeout.toMillis());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        Exception failure = null;
        if (started.get()) {
            try {
                agent.shutdown();
            } catch (Exception e) {
                failure = e;
                log.error("Agent {} failed during shutdown", agentId(), e);
            }
        }
        descriptor.retire();
        log.info("Agent {} stopped (completed={}, failed={})",
                agentId(), descriptor.tasksCompleted(), descriptor.tasksFailed());
        if (failure != null) {
            throw new AgentLifecycleException(agentId(), "shutdown", failure);
        }
    }

    private void processLoop() {
        while (running) {
            AgentMessage message;
            try {
                message = inbox.poll(pollInterval);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (message != null) {
                process(message);
            }
        }
        log.debug("Processing loop for {} exited", agentId());
    }

    void process(AgentMessage message) {
        long startedAt = nanoTicker.getAsLong();
        descriptor.markStatus(AgentStatus.BUSY);
        try {
            Optional<AgentMessage> reply = agent.handle(message);
            if (reply != null && reply.isPresent()) {
                sender.send(reply.get());
            }
            double elapsedSeconds = (nanoTicker.getAsLong() - startedAt) / 1_000_000_000.0d;
            descriptor.recordSuccess(elapsedSeconds);
            descriptor.markStatus(AgentStatus.IDLE);
        } catch (Exception e) {
            descriptor.recordFailure();
            descriptor.markStatus(AgentStatus.ERROR);
            log.error("Agent {} failed processing {} {} from {}",
                    agentId(), message.kind().wireName(), message.id(), message.sender(), e);
            replyWithError(message, e);
        }
    }

    private void replyWithError(AgentMessage message, Exception fault) {
        if (!message.kind().expectsReply()) {
            return;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("status", "error");
        payload.put("error", fault.getMessage() == null ? fault.getClass().getSimpleName() : fault.getMessage());
        payload.put("error_type", fault.getClass().getSimpleName());
        payload.put("agent_id", agentId());
        payload.put("message_id", message.id());
        try {
            sender.send(message.reply(agentId(), payload));
        } catch (RuntimeException sendFailure) {
            log.error("Agent {} could not deliver error response for {}", agentId(), message.id(), sendFailure);
        }
    }

    private void heartbeatTick() {
        if (!running) {
            return;
        }
        try {
            AgentSnapshot current = descriptor.snapshot();
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("status", current.status().wireName());
            payload.put("tasks_completed", current.tasksCompleted());
            payload.put("tasks_failed", current.tasksFailed());
            payload.put("average_response_time", current.averageResponseTime());
            payload.put("capabilities", current.capabilities());
            sender.send(AgentMessage.builder(MessageKind.HEARTBEAT)
                    .sender(agentId())
                    .recipient(Addresses.BROADCAST)
                    .payload(payload)
                    .build());
            descriptor.markHeartbeat(Instant.now());
        } catch (RuntimeException e) {
            log.error("Heartbeat from agent {} failed", agentId(), e);
        }
    }

    private static ThreadFactory daemonThreads(String name) {
        return runnable -> {
            Thread thread = new Thread(runnable, name);
            thread.setDaemon(true);
            return thread;
        };
    }
}
