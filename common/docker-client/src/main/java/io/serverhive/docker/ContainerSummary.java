package io.serverhive.docker;

import java.util.List;
import java.util.Map;

public record ContainerSummary(String id, List<String> names, String state, Map<String, String> labels) {

    public ContainerSummary {
        names = names == null ? List.of() : List.copyOf(names);
        labels = labels == null ? Map.of() : Map.copyOf(labels);
    }

    public boolean isRunning() {
        return "running".equalsIgnoreCase(state);
    }
}
