package io.serverhive.gameserver.domain;

import java.util.Objects;

/**
 * A node that can host game servers.
 *
 * @param ip     address players and peers reach the node on, {@code null} when unknown
 * @param apiUrl base URL of the node's own orchestrator, {@code null} when not advertised
 */
public record NodeCandidate(String id, String hostname, String ip, String apiUrl) {

    public NodeCandidate {
        Objects.requireNonNull(id, "id");
    }

    public boolean sameNode(NodeCandidate other) {
        return other != null && id.equals(other.id());
    }
}
