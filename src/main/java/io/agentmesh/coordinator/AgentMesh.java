package io.agentmesh.coordinator;

import io.agentmesh.agent.Agent;
import io.agentmesh.audit.MessageAuditTrail;
import io.agentmesh.audit.MessageAuditTrails;
import io.agentmesh.bus.DuplicateAgentException;
import io.agentmesh.bus.MessageBus;
import io.agentmesh.config.AgentMeshConfig;
import io.agentmesh.config.MeshSettings;

import java.util.List;

public final class AgentMesh implements AutoCloseable {
    private final AgentMeshConfig config;
    private final MeshSettings settings;
    private final MessageAuditTrail auditTrail;
    private final MessageBus bus;
    private final Coordinator coordinator;

    private AgentMesh(AgentMeshConfig config, MeshSettings settings, MessageAuditTrail auditTrail) {
        this.config = config;
        this.settings = settings;
        this.auditTrail = auditTrail;
        this.bus = new MessageBus(auditTrail);
        this.coordinator = new Coordinator(bus, settings);
    }

    public static AgentMesh open(AgentMeshConfig config) {
        return open(config, MeshSettings.load(config));
    }

    public static AgentMesh open(AgentMeshConfig config, MeshSettings settings) {
        return new AgentMesh(config, settings, MessageAuditTrails.open(config, settings));
    }

    public AgentMesh withAgents(List<? extends Agent> agents) throws DuplicateAgentException {
        for (Agent agent : agents) {
            coordinator.registerAndTrack(agent);
        }
        return this;
    }

    public AgentMeshConfig config() {
        return config;
    }

    public MeshSettings settings() {
        return settings;
    }

    public MessageAuditTrail auditTrail() {
        return auditTrail;
    }

    public MessageBus bus() {
        return bus;
    }

    public Coordinator coordinator() {
        return coordinator;
    }

    @Override
    public void close() {
        coordinator.stopAll();
    }
}
