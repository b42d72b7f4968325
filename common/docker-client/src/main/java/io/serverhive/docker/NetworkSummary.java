package io.serverhive.docker;

import java.util.Map;

public record NetworkSummary(String id, String name, String driver, Map<String, String> labels) {

    public NetworkSummary {
        labels = labels == null ? Map.of() : Map.copyOf(labels);
    }
}
