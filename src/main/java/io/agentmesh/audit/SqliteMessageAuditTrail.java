package io.agentmesh.audit;

import io.agentmesh.model.AgentMessage;
import io.agentmesh.storage.Database;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class SqliteMessageAuditTrail implements MessageAuditTrail {
    private static final String INSERT_SQL =
            "INSERT INTO messages(id,sender,recipient,message_type,payload,priority,timestamp,correlation_id,expires_at,processed) VALUES(?,?,?,?,?,?,?,?,?,?)";

    private final Database database;

    public SqliteMessageAuditTrail(Database database) {
        this.database = database;
    }

    @Override
    public synchronized void record(AgentMessage message) {
        AuditRecord row = AuditRecord.of(message);
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(INSERT_SQL)) {
            ps.setString(1, row.id());
            ps.setString(2, row.sender());
            ps.setString(3, row.recipient());
            ps.setString(4, row.kind());
            ps.setString(5, row.payload());
            ps.setInt(6, row.priority());
            ps.setString(7, row.timestamp());
            ps.setString(8, row.correlationId());
            ps.setString(9, row.expiresAt());
            ps.setBoolean(10, row.processed());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new AuditException("Failed to persist message: " + message.id(), e);
        }
    }

    @Override
    public List<AuditRecord> recent(int limit) {
        String sql = """
                SELECT id,sender,recipient,message_type,payload,priority,timestamp,correlation_id,expires_at,processed
                FROM messages
                ORDER BY rowid DESC
                LIMIT ?
                """;
        List<AuditRecord> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new AuditRecord(
                            rs.getString("id"),
                            rs.getString("sender"),
                            rs.getString("recipient"),
                            rs.getString("message_type"),
                            rs.getString("payload"),
                            rs.getInt("priority"),
                            rs.getString("timestamp"),
                            rs.getString("correlation_id"),
                            rs.getString("expires_at"),
                            rs.getBoolean("processed")
                    ));
                }
            }
        } catch (SQLException e) {
            throw new AuditException("Failed to read audit trail", e);
        }
        Collections.reverse(out);
        return out;
    }
}
