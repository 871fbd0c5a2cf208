package io.agentmesh.audit;

import io.agentmesh.config.AgentMeshConfig;
import io.agentmesh.config.MeshSettings;
import io.agentmesh.storage.Database;

public final class MessageAuditTrails {
    private MessageAuditTrails() {
    }

    public static MessageAuditTrail open(AgentMeshConfig config, MeshSettings settings) {
        return switch (settings.auditMode()) {
            case SQLITE -> {
                Database database = new Database(config);
                database.init();
                yield new SqliteMessageAuditTrail(database);
            }
            case JSONL -> new JsonlMessageAuditTrail(config.auditJournalFile());
            case NONE -> new NoopMessageAuditTrail();
        };
    }
}
