package io.serverhive.docker;

import java.util.Map;

public record SwarmNodeInfo(
    String id,
    String hostname,
    String address,
    String role,
    String availability,
    String state,
    long nanoCpus,
    long memoryBytes,
    Map<String, String> labels) {

    public SwarmNodeInfo {
        labels = labels == null ? Map.of() : Map.copyOf(labels);
    }
}
