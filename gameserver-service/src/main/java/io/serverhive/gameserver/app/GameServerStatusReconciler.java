package io.serverhive.gameserver.app;

import io.serverhive.docker.ContainerNotFoundException;
import io.serverhive.docker.ContainerRuntimeGateway;
import io.serverhive.docker.ContainerState;
import io.serverhive.gameserver.domain.GameServer;
import io.serverhive.gameserver.domain.GameServerLocation;
import io.serverhive.gameserver.domain.GameServerLocks;
import io.serverhive.gameserver.domain.GameServerStatus;
import io.serverhive.gameserver.domain.GameServerStore;
import io.serverhive.gameserver.domain.LocationStatus;
import io.serverhive.gameserver.domain.LocationTracker;
import io.serverhive.gameserver.domain.NodeDirectory;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Periodically aligns the status of active game servers hosted on this node with their containers, catching
 * crashes and out-of-band removals that happen between lifecycle calls.
 */
public class GameServerStatusReconciler {

    static final long OOM_KILLED_EXIT_CODE = 137L;

    private static final Logger log = LoggerFactory.getLogger(GameServerStatusReconciler.class);
    private static final EnumSet<GameServerStatus> WATCHED = EnumSet.of(
        GameServerStatus.STARTING, GameServerStatus.RUNNING, GameServerStatus.RESTARTING, GameServerStatus.STOPPING);

    private final ContainerRuntimeGateway runtime;
    private final GameServerStore store;
    private final LocationTracker locations;
    private final NodeDirectory nodes;
    private final GameServerLocks locks;

    public GameServerStatusReconciler(ContainerRuntimeGateway runtime,
                                      GameServerStore store,
                                      LocationTracker locations,
                                      NodeDirectory nodes,
                                      GameServerLocks locks) {
        this.runtime = Objects.requireNonNull(runtime, "runtime");
        this.store = Objects.requireNonNull(store, "store");
        this.locations = Objects.requireNonNull(locations, "locations");
        this.nodes = Objects.requireNonNull(nodes, "nodes");
        this.locks = Objects.requireNonNull(locks, "locks");
    }

    @Scheduled(
        initialDelayString = "${serverhive.gameservers.reconciler.initial-delay:PT10S}",
        fixedDelayString = "${serverhive.gameservers.reconciler.interval:PT30S}")
    public void scheduledReconcile() {
        try {
            int changed = reconcile();
            if (changed > 0) {
                log.info("status reconcile updated {} game server(s)", changed);
            }
        } catch (Exception ex) {
            log.warn("Game server status reconcile failed: {}", ex.getMessage());
        }
    }

    /**
     * @return number of game servers whose status was changed
     */
    public int reconcile() {
        String localNodeId = nodes.localNode().id();
        int changed = 0;
        for (GameServer candidate : store.findByStatuses(WATCHED)) {
            if (!candidate.hasContainer() || !hostedLocally(candidate.id(), localNodeId)) {
                continue;
            }
            try {
                Boolean updated = locks.withLock(candidate.id(), () -> reconcileOne(candidate.id()));
                if (Boolean.TRUE.equals(updated)) {
                    changed++;
                }
            } catch (RuntimeException ex) {
                log.warn("Failed to reconcile game server {}: {}", candidate.id(), ex.getMessage());
            }
        }
        return changed;
    }

    private boolean hostedLocally(String gameServerId, String localNodeId) {
        List<GameServerLocation> pinned = locations.findByGameServerId(gameServerId);
        return pinned.isEmpty() || localNodeId.equals(pinned.get(0).nodeId());
    }

    private boolean reconcileOne(String id) {
        GameServer gameServer = store.findById(id).orElse(null);
        if (gameServer == null || !gameServer.hasContainer() || !gameServer.status().isActive()) {
            return false;
        }
        String containerId = gameServer.containerId();
        ContainerState state;
        try {
            state = runtime.inspect(containerId);
        } catch (ContainerNotFoundException ex) {
            log.warn("container {} of game server {} disappeared; marking stopped", containerId, id);
            return apply(gameServer, GameServerStatus.STOPPED, LocationStatus.STOPPED);
        }
        if (state.running()) {
            return apply(gameServer, GameServerStatus.RUNNING, LocationStatus.RUNNING);
        }
        if (state.exitCode() == 0) {
            log.info("game server {} exited cleanly", id);
            return apply(gameServer, GameServerStatus.STOPPED, LocationStatus.STOPPED);
        }
        if (state.exitCode() == OOM_KILLED_EXIT_CODE) {
            log.warn("game server {} was killed with exit code 137, likely out of memory", id);
        } else {
            log.warn("game server {} exited with code {}", id, state.exitCode());
        }
        return apply(gameServer, GameServerStatus.FAILED, LocationStatus.FAILED);
    }

    private boolean apply(GameServer gameServer, GameServerStatus status, LocationStatus locationStatus) {
        if (gameServer.status() == status) {
            return false;
        }
        store.updateStatus(gameServer.id(), status);
        try {
            locations.updateStatus(gameServer.containerId(), locationStatus, null);
        } catch (RuntimeException ex) {
            log.warn("Failed to set location of container {} to {}: {}", gameServer.containerId(),
                locationStatus.value(), ex.getMessage());
        }
        return true;
    }
}
