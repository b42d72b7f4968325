package io.serverhive.gameserver.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Where the container of a game server lives. Only {@link LocationStatus#RUNNING} rows may be used to route
 * player traffic.
 */
public record GameServerLocation(
    String id,
    String gameServerId,
    String nodeId,
    String nodeHostname,
    String nodeIp,
    String containerId,
    LocationStatus status,
    int port,
    Instant createdAt,
    Instant updatedAt) {

    public GameServerLocation {
        Objects.requireNonNull(gameServerId, "gameServerId");
        Objects.requireNonNull(nodeId, "nodeId");
        Objects.requireNonNull(containerId, "containerId");
        Objects.requireNonNull(status, "status");
        if (id == null) {
            id = idFor(gameServerId, containerId);
        }
    }

    public static String idFor(String gameServerId, String containerId) {
        String shortId = containerId.length() > 12 ? containerId.substring(0, 12) : containerId;
        return "loc-gs-" + gameServerId + "-" + shortId;
    }

    public static GameServerLocation created(String gameServerId, NodeCandidate node, String containerId, int port) {
        return new GameServerLocation(null, gameServerId, node.id(), node.hostname(), node.ip(), containerId,
            LocationStatus.CREATED, port, null, null);
    }

    public boolean isAuthoritative() {
        return status == LocationStatus.RUNNING;
    }
}
