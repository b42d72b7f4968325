package io.serverhive.gameserver.app;

import io.serverhive.docker.ContainerNotFoundException;
import io.serverhive.docker.ContainerRuntimeException;
import io.serverhive.docker.ContainerRuntimeGateway;
import io.serverhive.docker.ContainerSpec;
import io.serverhive.docker.ContainerState;
import io.serverhive.gameserver.config.GameServerProperties;
import io.serverhive.gameserver.domain.GameServerConfig;
import io.serverhive.gameserver.domain.GameServerOperationException;
import io.serverhive.gameserver.domain.NodeCandidate;
import io.serverhive.gameserver.domain.OwnershipViolationException;
import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Idempotent provisioning of what a game-server container needs (network, data directory, image) and the
 * container spec itself.
 */
public class ContainerProvisioner {

    public static final String CONTAINER_DATA_PATH = "/data";
    static final String DEFAULT_MAX_PLAYERS = "20";
    static final String BIND_ALL = "0.0.0.0";

    private static final Logger log = LoggerFactory.getLogger(ContainerProvisioner.class);
    private static final Set<PosixFilePermission> VOLUME_PERMISSIONS = PosixFilePermissions.fromString("rwxr-xr-x");

    private final ContainerRuntimeGateway runtime;
    private final GameServerProperties.Docker docker;
    private final GameServerProperties.Runtime timeouts;

    public ContainerProvisioner(ContainerRuntimeGateway runtime, GameServerProperties properties) {
        this.runtime = Objects.requireNonNull(runtime, "runtime");
        Objects.requireNonNull(properties, "properties");
        this.docker = properties.getDocker();
        this.timeouts = properties.getRuntime();
    }

    public static String containerName(String gameServerId) {
        return "gameserver-" + gameServerId;
    }

    public String volumePath(String gameServerId) {
        return docker.getVolumeRoot() + "/gameserver-" + gameServerId + "-data";
    }

    public boolean isManaged(ContainerState state) {
        return state.hasLabel(docker.getManagedLabel(), "true");
    }

    /**
     * Creates the shared bridge network unless a network of that name already exists.
     */
    public void ensureNetwork() {
        String name = docker.getNetworkName();
        if (!runtime.listNetworks(name).isEmpty()) {
            log.debug("network {} already exists", name);
            return;
        }
        String id = runtime.createNetwork(name, "bridge", Map.of(docker.getManagedLabel(), "true"));
        log.info("created network {} ({})", name, id);
    }

    /**
     * Creates the host directory bind-mounted as the server's data directory and returns its path.
     */
    public String ensureVolume(String gameServerId) {
        Path path = Path.of(volumePath(gameServerId));
        try {
            if (Files.isDirectory(path)) {
                return path.toString();
            }
            if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
                Files.createDirectories(path, PosixFilePermissions.asFileAttribute(VOLUME_PERMISSIONS));
            } else {
                Files.createDirectories(path);
            }
            log.info("created data directory {} for game server {}", path, gameServerId);
            return path.toString();
        } catch (IOException ex) {
            throw new GameServerOperationException(gameServerId,
                "failed to create data directory " + path + ": " + ex.getMessage(), ex);
        }
    }

    /**
     * Pulls {@code image} unless it is already present. The pull is bounded by the configured pull timeout
     * only, never by the caller.
     */
    public void ensureImage(String image) {
        if (runtime.imageExists(image)) {
            return;
        }
        log.info("pulling image {} (timeout {})", image, timeouts.getPullTimeout());
        runtime.pullImage(image, timeouts.getPullTimeout());
        log.info("pulled image {}", image);
    }

    /**
     * Removes the container called {@code name} if it exists and carries the ownership label.
     *
     * @return the id of the removed container
     * @throws OwnershipViolationException when a container of that name exists without the label
     */
    public Optional<String> removeContainerByName(String gameServerId, String name) {
        ContainerState state;
        try {
            state = runtime.inspect(name);
        } catch (ContainerNotFoundException e) {
            return Optional.empty();
        }
        if (!isManaged(state)) {
            throw new OwnershipViolationException(gameServerId, "container " + name);
        }
        if (state.running()) {
            try {
                runtime.stop(state.id(), timeouts.getStopTimeout());
            } catch (ContainerRuntimeException ex) {
                log.warn("Failed to stop container {} before removal: {}", name, ex.getMessage());
            }
        }
        try {
            runtime.remove(state.id(), true);
        } catch (ContainerNotFoundException e) {
            log.debug("container {} already removed", name);
        }
        log.info("removed existing container {} ({})", name, state.id());
        return Optional.of(state.id());
    }

    public ContainerSpec containerSpec(GameServerConfig config, NodeCandidate node, String hostDataPath) {
        return new ContainerSpec(
            containerName(config.id()),
            config.image(),
            environment(config),
            labels(config.id(), node),
            config.port(),
            hostDataPath,
            CONTAINER_DATA_PATH,
            config.memoryBytes(),
            config.cpuShares(),
            docker.getNetworkName(),
            config.startCommand());
    }

    static Map<String, String> environment(GameServerConfig config) {
        Map<String, String> env = new LinkedHashMap<>(config.envVars());
        env.put("SERVER_PORT", Integer.toString(config.port()));
        env.putIfAbsent("SERVER_MAX_PLAYERS", DEFAULT_MAX_PLAYERS);
        env.putIfAbsent("SERVER_IP", BIND_ALL);
        env.putIfAbsent("HOST", BIND_ALL);
        env.putIfAbsent("BIND_IP", BIND_ALL);
        return env;
    }

    Map<String, String> labels(String gameServerId, NodeCandidate node) {
        Map<String, String> labels = new LinkedHashMap<>();
        labels.put(docker.getManagedLabel(), "true");
        labels.put(docker.label("resource_type"), "gameserver");
        labels.put(docker.label("gameserver_id"), gameServerId);
        labels.put(docker.label("node_id"), node.id());
        if (node.hostname() != null) {
            labels.put(docker.label("node_hostname"), node.hostname());
        }
        labels.put(docker.label("metrics"), "true");
        return labels;
    }
}
