package io.agentmesh.bus;

import io.agentmesh.audit.MessageAuditTrail;
import io.agentmesh.model.Addresses;
import io.agentmesh.model.AgentMessage;
import io.agentmesh.model.MessageIds;
import io.agentmesh.model.MessageKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

public final class MessageBus {
    private static final Logger log = LoggerFactory.getLogger(MessageBus.class);

    private final MessageAuditTrail auditTrail;
    private final Map<String, AgentInbox> inboxes;
    private final Map<String, CompletableFuture<AgentMessage>> pendingQueries;
    private final AtomicLong unknownRecipientTotal;
    private final AtomicLong droppedDeliveryTotal;

    public MessageBus(MessageAuditTrail auditTrail) {
        this.auditTrail = auditTrail;
        this.inboxes = new ConcurrentHashMap<>();
        this.pendingQueries = new ConcurrentHashMap<>();
        this.unknownRecipientTotal = new AtomicLong(0L);
        this.droppedDeliveryTotal = new AtomicLong(0L);
    }

    public MessageSender register(String agentId, AgentInbox inbox) throws DuplicateAgentException {
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("agent id cannot be empty");
        }
        if (Addresses.isReserved(agentId)) {
            throw new IllegalArgumentException("agent id is reserved: " + agentId);
        }
        if (inbox == null) {
            throw new IllegalArgumentException("inbox cannot be null: " + agentId);
        }
        if (inboxes.putIfAbsent(agentId, inbox) != null) {
            log.warn("Duplicate registration rejected for agent {}", agentId);
            throw new DuplicateAgentException(agentId);
        }
        log.info("Registered agent {}", agentId);
        return message -> {
            if (!agentId.equals(message.sender())) {
                throw new IllegalArgumentException(
                        "agent " + agentId + " cannot send as " + message.sender());
            }
            send(message);
        };
    }

    public void unregister(String agentId) {
        if (inboxes.remove(agentId) != null) {
            log.info("Unregistered agent {}", agentId);
        }
    }

    public boolean isRegistered(String agentId) {
        return agentId != null && inboxes.containsKey(agentId);
    }

    public Set<String> registeredAgents() {
        return new TreeSet<>(inboxes.keySet());
    }

    public void send(AgentMessage message) {
        auditTrail.record(message);

        if (message.kind() == MessageKind.RESPONSE && message.correlationId() != null) {
            CompletableFuture<AgentMessage> waiter = pendingQueries.remove(message.correlationId());
            if (waiter != null) {
                waiter.complete(message);
                log.debug("Resolved query {} with response {} from {}",
                        message.correlationId(), message.id(), message.sender());
                return;
            }
        }

        if (message.isBroadcast()) {
            for (Map.Entry<String, AgentInbox> entry : inboxes.entrySet()) {
                if (!entry.getKey().equals(message.sender())) {
                    deliver(entry.getKey(), entry.getValue(), message);
                }
            }
            return;
        }

        AgentInbox inbox = inboxes.get(message.recipient());
        if (inbox != null) {
            deliver(message.recipient(), inbox, message);
            return;
        }
        if (Addresses.SYSTEM.equals(message.recipient())) {
            log.debug("No waiter for {} {} addressed to system, dropped",
                    message.kind().wireName(), message.id());
            return;
        }
        unknownRecipientTotal.incrementAndGet();
        log.warn("Unknown recipient {} for {} {} from {}",
                message.recipient(), message.kind().wireName(), message.id(), message.sender());
    }

    public Optional<Map<String, Object>> query(String targetAgent, Map<String, Object> payload, Duration timeout) {
        return query(targetAgent, null, payload, timeout);
    }

    /**
     * Sends a QUERY from the system identity and waits for the correlated RESPONSE.
     *
     * @return the response payload, or empty when nothing matched within {@code timeout}
     */
    public Optional<Map<String, Object>> query(
            String targetAgent,
            String queryType,
            Map<String, Object> payload,
            Duration timeout
    ) {
        String correlationId = MessageIds.newCorrelationId();
        Map<String, Object> body = new LinkedHashMap<>();
        if (queryType != null) {
            body.put("query_type", queryType);
        }
        if (payload != null) {
            body.putAll(payload);
        }
        AgentMessage query = AgentMessage.builder(MessageKind.QUERY)
                .sender(Addresses.SYSTEM)
                .recipient(targetAgent)
                .payload(body)
                .correlationId(correlationId)
                .build();

        CompletableFuture<AgentMessage> waiter = new CompletableFuture<>();
        pendingQueries.put(correlationId, waiter);
        try {
            send(query);
            AgentMessage response = waiter.get(Math.max(0L, timeout.toMillis()), TimeUnit.MILLISECONDS);
            return Optional.of(response.payload());
        } catch (TimeoutException e) {
            log.warn("Query {} to {} timed out after {} ms", correlationId, targetAgent, timeout.toMillis());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Query {} to {} interrupted", correlationId, targetAgent);
            return Optional.empty();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Query waiter failed: " + correlationId, e.getCause());
        } finally {
            pendingQueries.remove(correlationId, waiter);
        }
    }

    public int pendingQueryCount() {
        return pendingQueries.size();
    }

    public long unknownRecipientTotal() {
        return unknownRecipientTotal.get();
    }

    public long droppedDeliveryTotal() {
        return droppedDeliveryTotal.get();
    }

    private void deliver(String agentId, AgentInbox inbox, AgentMessage message) {
        if (inbox.offer(message)) {
            log.debug("Queued {} {} for {}", message.kind().wireName(), message.id(), agentId);
            return;
        }
        droppedDeliveryTotal.incrementAndGet();
        log.warn("Inbox full for agent {}, dropped {} {}", agentId, message.kind().wireName(), message.id());
    }
}
