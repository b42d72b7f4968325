package io.serverhive.gameserver.app;

import static org.assertj.core.api.Assertions.assertThat;

import io.serverhive.gameserver.config.TestGameServerProperties;
import io.serverhive.gameserver.domain.GameServer;
import io.serverhive.gameserver.domain.GameServerConfig;
import io.serverhive.gameserver.domain.GameServerLocation;
import io.serverhive.gameserver.domain.GameServerStatus;
import io.serverhive.gameserver.domain.LocationStatus;
import io.serverhive.gameserver.domain.NodeCandidate;
import io.serverhive.gameserver.domain.NodeDirectory;
import io.serverhive.gameserver.infra.lock.InMemoryGameServerLocks;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class GameServerStatusReconcilerTest {

    private final NodeCandidate local = new NodeCandidate("node-a", "host-a", "10.0.0.1", null);
    private final NodeCandidate remote = new NodeCandidate("node-b", "host-b", "10.0.0.2", null);

    FakeContainerRuntime runtime;
    InMemoryGameServerStore store;
    InMemoryLocationTracker locations;
    GameServerStatusReconciler reconciler;

    @BeforeEach
    void setUp() {
        runtime = new FakeContainerRuntime();
        store = new InMemoryGameServerStore();
        locations = new InMemoryLocationTracker();
        NodeDirectory nodes = new NodeDirectory() {
            @Override
            public NodeCandidate localNode() {
                return local;
            }

            @Override
            public Optional<NodeCandidate> findNode(String nodeId) {
                return Optional.empty();
            }
        };
        reconciler = new GameServerStatusReconciler(runtime, store, locations, nodes, new InMemoryGameServerLocks());
    }

    @Test
    void crashedContainerIsMarkedFailed() {
        String containerId = running("gs-1", local);
        runtime.exit(containerId, 1);

        int changed = reconciler.reconcile();

        assertThat(changed).isEqualTo(1);
        assertThat(store.get("gs-1").status()).isEqualTo(GameServerStatus.FAILED);
        assertThat(locations.get(containerId).status()).isEqualTo(LocationStatus.FAILED);
    }

    @Test
    void outOfMemoryKillIsMarkedFailed() {
        String containerId = running("gs-1", local);
        runtime.exit(containerId, 137);

        reconciler.reconcile();

        assertThat(store.get("gs-1").status()).isEqualTo(GameServerStatus.FAILED);
    }

    @Test
    void cleanExitIsMarkedStopped() {
        String containerId = running("gs-1", local);
        runtime.exit(containerId, 0);

        reconciler.reconcile();

        assertThat(store.get("gs-1").status()).isEqualTo(GameServerStatus.STOPPED);
        assertThat(locations.get(containerId).status()).isEqualTo(LocationStatus.STOPPED);
    }

    @Test
    void vanishedContainerIsMarkedStopped() {
        String containerId = running("gs-1", local);
        runtime.vanish(containerId);

        reconciler.reconcile();

        assertThat(store.get("gs-1").status()).isEqualTo(GameServerStatus.STOPPED);
    }

    @Test
    void runningContainerIsLeftAlone() {
        running("gs-1", local);

        assertThat(reconciler.reconcile()).isZero();
        assertThat(store.get("gs-1").status()).isEqualTo(GameServerStatus.RUNNING);
    }

    @Test
    void serversHostedElsewhereAreSkipped() {
        String containerId = running("gs-1", remote);
        runtime.exit(containerId, 1);

        assertThat(reconciler.reconcile()).isZero();
        assertThat(store.get("gs-1").status()).isEqualTo(GameServerStatus.RUNNING);
    }

    private String running(String id, NodeCandidate node) {
        GameServerConfig config = new GameServerConfig(id, "itzg/minecraft-server", 25565, Map.of(), 0, 1.0, null);
        store.create(GameServer.newServer(config));
        runtime.networks.put("serverhive-network", "net-1");
        String containerId = runtime.create(new ContainerProvisioner(runtime,
            TestGameServerProperties.create(Path.of("/tmp")))
            .containerSpec(config, node, "/tmp/gameserver-" + id + "-data"));
        runtime.start(containerId);
        store.updateContainerInfo(id, containerId, "gameserver-" + id);
        store.markStarted(id, Instant.now());
        locations.upsert(GameServerLocation.created(id, node, containerId, 25565));
        locations.updateStatus(containerId, LocationStatus.RUNNING, node.ip());
        return containerId;
    }
}
