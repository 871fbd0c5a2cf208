package io.agentmesh.coordinator;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record LifecycleReport(String action, List<String> succeeded, Map<String, String> failures) {
    public LifecycleReport {
        succeeded = List.copyOf(succeeded);
        failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }

    public boolean allSucceeded() {
        return failures.isEmpty();
    }
}
