package io.serverhive.gameserver.infra.cache;

import io.serverhive.gameserver.domain.GameServer;
import java.util.Optional;

public class NoopGameServerCache implements GameServerCache {

    @Override
    public Optional<GameServer> get(String id) {
        return Optional.empty();
    }

    @Override
    public void put(GameServer gameServer) {
    }

    @Override
    public void evict(String id) {
    }
}
