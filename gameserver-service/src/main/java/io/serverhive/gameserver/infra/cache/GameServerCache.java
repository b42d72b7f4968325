package io.serverhive.gameserver.infra.cache;

import io.serverhive.gameserver.domain.GameServer;
import java.util.Optional;

/**
 * Read-through side cache for game servers. Entries are filled by reads and evicted by writes.
 */
public interface GameServerCache {

    Optional<GameServer> get(String id);

    void put(GameServer gameServer);

    void evict(String id);
}
