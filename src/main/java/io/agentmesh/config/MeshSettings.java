package io.agentmesh.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.agentmesh.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

public record MeshSettings(
        long pollIntervalMs,
        long heartbeatIntervalMs,
        int inboxCapacity,
        long queryTimeoutMs,
        long stopTimeoutMs,
        AuditMode auditMode
) {
    public static final long DEFAULT_POLL_INTERVAL_MS = 1_000L;
    public static final long DEFAULT_HEARTBEAT_INTERVAL_MS = 30_000L;
    public static final int DEFAULT_INBOX_CAPACITY = 10_000;
    public static final long DEFAULT_QUERY_TIMEOUT_MS = 30_000L;
    public static final long DEFAULT_STOP_TIMEOUT_MS = 5_000L;

    public static MeshSettings defaults() {
        return new MeshSettings(
                DEFAULT_POLL_INTERVAL_MS,
                DEFAULT_HEARTBEAT_INTERVAL_MS,
                DEFAULT_INBOX_CAPACITY,
                DEFAULT_QUERY_TIMEOUT_MS,
                DEFAULT_STOP_TIMEOUT_MS,
                AuditMode.SQLITE
        );
    }

    public static MeshSettings load(AgentMeshConfig config) {
        return load(config.settingsFile());
    }

    public static MeshSettings load(Path settingsFile) {
        MeshSettings defaults = defaults();
        if (settingsFile == null || !Files.isRegularFile(settingsFile)) {
            return defaults;
        }
        try {
            SettingsFile file = Jsons.mapper().readValue(settingsFile.toFile(), SettingsFile.class);
            return fromFile(file, defaults);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read settings file: " + settingsFile, e);
        }
    }

    static MeshSettings fromFile(SettingsFile file, MeshSettings defaults) {
        if (file == null) {
            return defaults;
        }
        return new MeshSettings(
                sanitizeLong(file.pollIntervalMs(), defaults.pollIntervalMs(), 10L),
                sanitizeLong(file.heartbeatIntervalMs(), defaults.heartbeatIntervalMs(), 10L),
                sanitizeInt(file.inboxCapacity(), defaults.inboxCapacity(), 1),
                sanitizeLong(file.queryTimeoutMs(), defaults.queryTimeoutMs(), 1L),
                sanitizeLong(file.stopTimeoutMs(), defaults.stopTimeoutMs(), 0L),
                AuditMode.fromString(file.auditMode(), defaults.auditMode())
        );
    }

    public MeshSettings withPollIntervalMs(long value) {
        return new MeshSettings(value, heartbeatIntervalMs, inboxCapacity, queryTimeoutMs, stopTimeoutMs, auditMode);
    }

    public MeshSettings withHeartbeatIntervalMs(long value) {
        return new MeshSettings(pollIntervalMs, value, inboxCapacity, queryTimeoutMs, stopTimeoutMs, auditMode);
    }

    public MeshSettings withInboxCapacity(int value) {
        return new MeshSettings(pollIntervalMs, heartbeatIntervalMs, value, queryTimeoutMs, stopTimeoutMs, auditMode);
    }

    public MeshSettings withAuditMode(AuditMode value) {
        return new MeshSettings(pollIntervalMs, heartbeatIntervalMs, inboxCapacity, queryTimeoutMs, stopTimeoutMs, value);
    }

    public Duration pollInterval() {
        return Duration.ofMillis(pollIntervalMs);
    }

    public Duration heartbeatInterval() {
        return Duration.ofMillis(heartbeatIntervalMs);
    }

    public Duration queryTimeout() {
        return Duration.ofMillis(queryTimeoutMs);
    }

    public Duration stopTimeout() {
        return Duration.ofMillis(stopTimeoutMs);
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SettingsFile(
            Long pollIntervalMs,
            Long heartbeatIntervalMs,
            Integer inboxCapacity,
            Long queryTimeoutMs,
            Long stopTimeoutMs,
            String auditMode
    ) {
    }
}
