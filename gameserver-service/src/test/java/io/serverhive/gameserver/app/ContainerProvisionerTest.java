package io.serverhive.gameserver.app;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.serverhive.docker.ContainerSpec;
import io.serverhive.gameserver.config.TestGameServerProperties;
import io.serverhive.gameserver.domain.GameServerConfig;
import io.serverhive.gameserver.domain.NodeCandidate;
import io.serverhive.gameserver.domain.OwnershipViolationException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ContainerProvisionerTest {

    @TempDir
    Path volumes;

    FakeContainerRuntime runtime;
    ContainerProvisioner provisioner;

    @BeforeEach
    void setUp() {
        runtime = new FakeContainerRuntime();
        provisioner = new ContainerProvisioner(runtime, TestGameServerProperties.create(volumes));
    }

    @Test
    void environmentBindsToAllInterfacesUnlessCallerOverrides() {
        GameServerConfig config = new GameServerConfig("gs-1", "img", 27015,
            Map.of("SERVER_IP", "127.0.0.1", "SERVER_PORT", "1"), 0, 0, null);

        Map<String, String> env = ContainerProvisioner.environment(config);

        assertThat(env)
            .containsEntry("SERVER_PORT", "27015")
            .containsEntry("SERVER_IP", "127.0.0.1")
            .containsEntry("HOST", "0.0.0.0")
            .containsEntry("BIND_IP", "0.0.0.0")
            .containsEntry("SERVER_MAX_PLAYERS", "20");
    }

    @Test
    void containerSpecCarriesLimitsMountAndLabels() {
        GameServerConfig config = new GameServerConfig("gs-1", "img", 27015, Map.of(), 1L << 30, 1.5, "./run.sh");
        NodeCandidate node = new NodeCandidate("node-a", "host-a", null, null);

        ContainerSpec spec = provisioner.containerSpec(config, node, "/srv/gs-1");

        assertThat(spec.name()).isEqualTo("gameserver-gs-1");
        assertThat(spec.cpuShares()).isEqualTo(1536);
        assertThat(spec.memoryBytes()).isEqualTo(1L << 30);
        assertThat(spec.bindMount()).isEqualTo("/srv/gs-1:/data");
        assertThat(spec.startCommand()).isEqualTo("./run.sh");
        assertThat(spec.labels())
            .containsEntry("io.serverhive.managed", "true")
            .containsEntry("io.serverhive.resource_type", "gameserver")
            .containsEntry("io.serverhive.node_hostname", "host-a");
    }

    @Test
    void ensureNetworkCreatesOnlyOnce() {
        provisioner.ensureNetwork();
        String id = runtime.networks.get("serverhive-network");

        provisioner.ensureNetwork();

        assertThat(runtime.networks).hasSize(1).containsEntry("serverhive-network", id);
    }

    @Test
    void ensureVolumeIsIdempotent() {
        String first = provisioner.ensureVolume("gs-1");
        String second = provisioner.ensureVolume("gs-1");

        assertThat(first).isEqualTo(second).isEqualTo(volumes.resolve("gameserver-gs-1-data").toString());
        assertThat(Files.isDirectory(Path.of(first))).isTrue();
    }

    @Test
    void ensureImagePullsOnlyMissingImages() {
        runtime.images.add("present:1");

        provisioner.ensureImage("present:1");
        provisioner.ensureImage("missing:2");

        assertThat(runtime.pulled).containsExactly("missing:2");
    }

    @Test
    void removeByNameRemovesManagedContainer() {
        FakeContainerRuntime.Container managed =
            runtime.addForeign("gameserver-gs-1", true, Map.of("io.serverhive.managed", "true"));

        assertThat(provisioner.removeContainerByName("gs-1", "gameserver-gs-1")).contains(managed.id);
        assertThat(runtime.containers).isEmpty();
    }

    @Test
    void removeByNameRefusesUnmanagedContainer() {
        runtime.addForeign("gameserver-gs-1", true, Map.of("io.serverhive.managed", "false"));

        assertThatThrownBy(() -> provisioner.removeContainerByName("gs-1", "gameserver-gs-1"))
            .isInstanceOf(OwnershipViolationException.class)
            .hasMessageContaining("not managed");
        assertThat(runtime.containers).hasSize(1);
    }

    @Test
    void removeByNameOfMissingContainerIsEmpty() {
        assertThat(provisioner.removeContainerByName("gs-1", "gameserver-gs-1")).isEmpty();
    }
}
