package io.serverhive.gameserver.app;

import io.serverhive.gameserver.domain.GameServer;
import io.serverhive.gameserver.domain.GameServerNotFoundException;
import io.serverhive.gameserver.domain.GameServerStatus;
import io.serverhive.gameserver.domain.GameServerStore;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

class InMemoryGameServerStore implements GameServerStore {

    private final Map<String, GameServer> servers = new ConcurrentHashMap<>();
    final List<GameServerStatus> history = new ArrayList<>();

    GameServer get(String id) {
        return servers.get(id);
    }

    @Override
    public Optional<GameServer> findById(String id) {
        return Optional.ofNullable(servers.get(id));
    }

    @Override
    public GameServer create(GameServer gameServer) {
        servers.put(gameServer.id(), gameServer);
        return gameServer;
    }

    @Override
    public void updateStatus(String id, GameServerStatus status) {
        synchronized (history) {
            history.add(status);
        }
        mutate(id, gs -> copy(gs, gs.containerId(), gs.containerName(), status, gs.lastStartedAt()));
    }

    @Override
    public void updateContainerInfo(String id, String containerId, String containerName) {
        mutate(id, gs -> copy(gs, containerId, containerName, gs.status(), gs.lastStartedAt()));
    }

    @Override
    public void clearContainerInfo(String id) {
        mutate(id, gs -> copy(gs, null, null, gs.status(), gs.lastStartedAt()));
    }

    @Override
    public void markStarted(String id, Instant startedAt) {
        mutate(id, gs -> copy(gs, gs.containerId(), gs.containerName(), GameServerStatus.RUNNING, startedAt));
    }

    @Override
    public List<GameServer> findByStatuses(Collection<GameServerStatus> statuses) {
        return servers.values().stream().filter(gs -> statuses.contains(gs.status())).toList();
    }

    private void mutate(String id, UnaryOperator<GameServer> change) {
        if (servers.computeIfPresent(id, (key, gs) -> change.apply(gs)) == null) {
            throw new GameServerNotFoundException(id);
        }
    }

    private static GameServer copy(GameServer gs, String containerId, String containerName, GameServerStatus status,
                                   Instant lastStartedAt) {
        return new GameServer(gs.id(), gs.image(), gs.port(), gs.envVars(), gs.memoryBytes(), gs.cpuCores(),
            gs.startCommand(), containerId, containerName, status, lastStartedAt, gs.createdAt(), Instant.now());
    }
}
