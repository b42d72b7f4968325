package io.serverhive.gameserver.domain;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Persistent game-server aggregate. Reads may be served from a cache; writes invalidate it once committed.
 * Mutations of a server that does not exist (or was soft-deleted) throw {@link GameServerNotFoundException}.
 */
public interface GameServerStore {

    Optional<GameServer> findById(String id);

    GameServer create(GameServer gameServer);

    void updateStatus(String id, GameServerStatus status);

    void updateContainerInfo(String id, String containerId, String containerName);

    void clearContainerInfo(String id);

    /**
     * Marks the server {@link GameServerStatus#RUNNING} and stamps its last start.
     */
    void markStarted(String id, Instant startedAt);

    List<GameServer> findByStatuses(Collection<GameServerStatus> statuses);
}
