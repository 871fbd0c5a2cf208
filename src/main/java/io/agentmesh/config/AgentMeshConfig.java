package io.agentmesh.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class AgentMeshConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String SETTINGS_FILE = "agentmesh-settings.json";

    private final Path rootDir;

    public AgentMeshConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static AgentMeshConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new AgentMeshConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve("agentmesh.db");
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditJournalFile() {
        return auditRoot().resolve("messages.jsonl");
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }
}
