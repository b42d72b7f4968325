package io.serverhive.gameserver.domain;

import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Inventory entry for a cluster node as last synchronised from the engine.
 */
public record NodeMetadata(
    String id,
    String hostname,
    String ip,
    String role,
    String availability,
    String status,
    double totalCpu,
    long totalMemory,
    double usedCpu,
    long usedMemory,
    int maxGameServers,
    Map<String, String> labels,
    Instant updatedAt) {

    public static final String API_URL_LABEL = "api_url";

    public NodeMetadata {
        Objects.requireNonNull(id, "id");
        labels = labels == null ? Map.of() : Map.copyOf(labels);
    }

    public boolean isSchedulable() {
        return "active".equals(lower(availability)) && "ready".equals(lower(status));
    }

    public String apiUrl() {
        String url = labels.get(API_URL_LABEL);
        return url == null || url.isBlank() ? null : url;
    }

    private static String lower(String value) {
        return value == null ? null : value.toLowerCase(Locale.ROOT);
    }
}
