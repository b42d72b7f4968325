package io.serverhive.gameserver.domain;

import java.util.List;
import java.util.Optional;

/**
 * Placement rows keyed by container id.
 */
public interface LocationTracker {

    void upsert(GameServerLocation location);

    /**
     * @param nodeIp replaces the recorded node IP when non-null
     */
    void updateStatus(String containerId, LocationStatus status, String nodeIp);

    void deleteByContainerId(String containerId);

    /**
     * Newest first.
     */
    List<GameServerLocation> findByGameServerId(String gameServerId);

    Optional<GameServerLocation> findRunningByGameServerId(String gameServerId);
}
