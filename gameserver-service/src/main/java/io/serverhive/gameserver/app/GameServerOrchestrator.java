package io.serverhive.gameserver.app;

import io.serverhive.docker.ContainerNotFoundException;
import io.serverhive.docker.ContainerRuntimeException;
import io.serverhive.docker.ContainerRuntimeGateway;
import io.serverhive.docker.ContainerState;
import io.serverhive.docker.LogOptions;
import io.serverhive.docker.LogSink;
import io.serverhive.docker.NetworkNotFoundException;
import io.serverhive.gameserver.config.GameServerProperties;
import io.serverhive.gameserver.domain.GameServer;
import io.serverhive.gameserver.domain.GameServerConfig;
import io.serverhive.gameserver.domain.GameServerCrashedException;
import io.serverhive.gameserver.domain.GameServerLocation;
import io.serverhive.gameserver.domain.GameServerLocks;
import io.serverhive.gameserver.domain.GameServerNotFoundException;
import io.serverhive.gameserver.domain.GameServerOperationException;
import io.serverhive.gameserver.domain.GameServerStatus;
import io.serverhive.gameserver.domain.GameServerStore;
import io.serverhive.gameserver.domain.LocationStatus;
import io.serverhive.gameserver.domain.LocationTracker;
import io.serverhive.gameserver.domain.NodeCandidate;
import io.serverhive.gameserver.domain.NodeDirectory;
import io.serverhive.gameserver.domain.NodePlacementSelector;
import io.serverhive.gameserver.domain.OwnershipViolationException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives game-server containers through their lifecycle and keeps the persisted aggregate and its location
 * rows in line with what the engine reports.
 * <p>
 * Every public lifecycle operation first decides whether the server belongs to another node and, if so,
 * forwards it there. Otherwise it runs under the per-id lock; the {@code *Locally} variants skip the
 * forwarding decision and are what a peer's forwarded request ends up calling.
 * <p>
 * Status writes that record an outcome are part of the operation and fail it. Intermediate status writes and
 * location bookkeeping are best effort: they are logged and never mask the container result.
 */
public class GameServerOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(GameServerOrchestrator.class);

    private final ContainerRuntimeGateway runtime;
    private final GameServerStore store;
    private final LocationTracker locations;
    private final NodePlacementSelector placement;
    private final NodeDirectory nodes;
    private final GameServerLocks locks;
    private final NodeForwarder forwarder;
    private final ContainerProvisioner provisioner;
    private final LifecycleMetrics metrics;
    private final GameServerProperties.Runtime timeouts;
    private final Clock clock;

    public GameServerOrchestrator(ContainerRuntimeGateway runtime,
                                  GameServerStore store,
                                  LocationTracker locations,
                                  NodePlacementSelector placement,
                                  NodeDirectory nodes,
                                  GameServerLocks locks,
                                  NodeForwarder forwarder,
                                  ContainerProvisioner provisioner,
                                  LifecycleMetrics metrics,
                                  GameServerProperties properties,
                                  Clock clock) {
        this.runtime = Objects.requireNonNull(runtime, "runtime");
        this.store = Objects.requireNonNull(store, "store");
        this.locations = Objects.requireNonNull(locations, "locations");
        this.placement = Objects.requireNonNull(placement, "placement");
        this.nodes = Objects.requireNonNull(nodes, "nodes");
        this.locks = Objects.requireNonNull(locks, "locks");
        this.forwarder = Objects.requireNonNull(forwarder, "forwarder");
        this.provisioner = Objects.requireNonNull(provisioner, "provisioner");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.timeouts = Objects.requireNonNull(properties, "properties").getRuntime();
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Creates (or recreates) the container of an existing game server and leaves it {@link GameServerStatus#CREATED}.
     *
     * @return the new container id, or {@code null} when creation was forwarded to another node
     */
    public String createGameServer(GameServerConfig config) {
        Objects.requireNonNull(config, "config");
        String id = config.id();
        ensureNetwork(id);
        NodeCandidate target;
        try {
            target = placement.selectNode();
        } catch (RuntimeException ex) {
            metrics.failure("create");
            throw new GameServerOperationException(id, "failed to select node: " + ex.getMessage(), ex);
        }
        NodeCandidate local = nodes.localNode();
        if (!target.sameNode(local)) {
            if (forwarder.canForward(target)) {
                log.info("forwarding creation of game server {} to node {}", id, target.id());
                forwarder.forward(target, RemoteOperation.CREATE, id, null);
                metrics.forwarded("create");
                return null;
            }
            log.warn("no API URL resolvable for node {}; creating game server {} on local node {}",
                target.id(), id, local.id());
        }
        return locks.withLock(id, () -> doCreate(config, local));
    }

    /**
     * Creates the container of a persisted game server on this node, without placement or forwarding.
     */
    public String createLocally(String id) {
        return locks.withLock(id, () -> {
            GameServer gameServer = load(id);
            ensureNetwork(id);
            return doCreate(gameServer.toConfig(), nodes.localNode());
        });
    }

    private String doCreate(GameServerConfig config, NodeCandidate node) {
        String id = config.id();
        String name = ContainerProvisioner.containerName(id);
        try {
            provisioner.removeContainerByName(id, name).ifPresent(this::forgetLocation);
        } catch (OwnershipViolationException ex) {
            log.error("container {} exists but is not managed by serverhive; leaving it in place", name);
        } catch (ContainerRuntimeException ex) {
            log.warn("Failed to remove existing container {}: {}", name, ex.getMessage());
        }

        try {
            provisioner.ensureImage(config.image());
        } catch (ContainerRuntimeException ex) {
            markFailed(id, null);
            metrics.failure("create");
            throw new GameServerOperationException(id,
                "failed to pull image " + config.image() + ": " + ex.getMessage(), ex);
        }
        String volumePath = provisioner.ensureVolume(id);

        String containerId;
        try {
            containerId = runtime.create(provisioner.containerSpec(config, node, volumePath));
        } catch (ContainerRuntimeException ex) {
            markFailed(id, null);
            metrics.failure("create");
            throw new GameServerOperationException(id, "failed to create container: " + ex.getMessage(), ex);
        }
        log.info("created container {} ({}) for game server {} on node {}", name, containerId, id, node.id());

        try {
            locations.upsert(GameServerLocation.created(id, node, containerId, config.port()));
        } catch (RuntimeException ex) {
            log.warn("Failed to record location of game server {}: {}", id, ex.getMessage());
        }
        persist(id, "record container", () -> store.updateContainerInfo(id, containerId, name));
        persist(id, "mark created", () -> store.updateStatus(id, GameServerStatus.CREATED));
        metrics.success("create");
        return containerId;
    }

    public void startGameServer(String id) {
        if (forwardIfRemote(id, RemoteOperation.START, null)) {
            return;
        }
        startLocally(id);
    }

    public void startLocally(String id) {
        locks.withLock(id, () -> doStart(id));
    }

    private void doStart(String id) {
        GameServer gameServer = load(id);
        setStatus(id, GameServerStatus.STARTING);

        String containerId = gameServer.containerId();
        if (!gameServer.hasContainer()) {
            log.info("game server {} has no container; creating one", id);
            containerId = recreate(gameServer);
        }

        ContainerState state;
        try {
            state = runtime.inspect(containerId);
        } catch (ContainerNotFoundException ex) {
            log.warn("container {} of game server {} vanished; recreating", containerId, id);
            forgetLocation(containerId);
            containerId = recreate(gameServer);
            metrics.recovered("container-missing");
            state = inspectOrFail(id, containerId);
        } catch (ContainerRuntimeException ex) {
            throw fail(id, containerId, "start", "failed to inspect container", ex);
        }

        if (state.running()) {
            log.info("container {} of game server {} already running", containerId, id);
            markRunning(id, containerId);
            metrics.success("start");
            return;
        }

        containerId = startContainer(gameServer, containerId);
        sleep(timeouts.getStartGrace());

        ContainerState after = inspectOrFail(id, containerId);
        if (!after.running()) {
            String logTail = captureLogs(containerId);
            log.warn("game server {} exited immediately with code {}; last output:\n{}", id, after.exitCode(), logTail);
            persist(id, "mark stopped", () -> store.updateStatus(id, GameServerStatus.STOPPED));
            updateLocation(containerId, LocationStatus.STOPPED, null);
            metrics.crashed();
            throw new GameServerCrashedException(id, after.exitCode(), logTail);
        }
        markRunning(id, containerId);
        metrics.success("start");
        log.info("game server {} running in container {}", id, containerId);
    }

    /**
     * Starts the container, recreating it once when its network has gone missing.
     *
     * @return id of the container that was started
     */
    private String startContainer(GameServer gameServer, String containerId) {
        String id = gameServer.id();
        try {
            runtime.start(containerId);
            return containerId;
        } catch (NetworkNotFoundException ex) {
            log.warn("network of container {} for game server {} is gone; recreating container", containerId, id);
        } catch (ContainerRuntimeException ex) {
            throw fail(id, containerId, "start", "failed to start container", ex);
        }

        try {
            provisioner.removeContainerByName(id, ContainerProvisioner.containerName(id));
        } catch (ContainerRuntimeException ex) {
            log.warn("Failed to remove container {} of game server {}: {}", containerId, id, ex.getMessage());
        }
        forgetLocation(containerId);
        persist(id, "clear container", () -> store.clearContainerInfo(id));
        String recreated = recreate(gameServer);
        metrics.recovered("network-missing");
        try {
            runtime.start(recreated);
            return recreated;
        } catch (ContainerRuntimeException retry) {
            throw fail(id, recreated, "start", "failed to start recreated container", retry);
        }
    }

    /**
     * Runs the create flow from the persisted spec, network included, and restores
     * {@link GameServerStatus#STARTING}, which creation overwrites.
     */
    private String recreate(GameServer gameServer) {
        ensureNetwork(gameServer.id());
        String containerId = doCreate(gameServer.toConfig(), nodes.localNode());
        setStatus(gameServer.id(), GameServerStatus.STARTING);
        return containerId;
    }

    public void stopGameServer(String id) {
        if (forwardIfRemote(id, RemoteOperation.STOP, null)) {
            return;
        }
        stopLocally(id);
    }

    public void stopLocally(String id) {
        locks.withLock(id, () -> doStop(id));
    }

    private void doStop(String id) {
        GameServer gameServer = load(id);
        String containerId = requireContainer(gameServer);
        setStatus(id, GameServerStatus.STOPPING);
        try {
            ContainerState state = runtime.inspect(containerId);
            if (state.running()) {
                log.info("stopping game server {} (container {}, grace {})", id, containerId,
                    timeouts.getStopTimeout());
                runtime.stop(containerId, timeouts.getStopTimeout());
            }
        } catch (ContainerNotFoundException ex) {
            log.info("container {} of game server {} no longer exists; treating as stopped", containerId, id);
        } catch (ContainerRuntimeException ex) {
            setStatus(id, gameServer.status());
            metrics.failure("stop");
            throw new GameServerOperationException(id, "failed to stop container: " + ex.getMessage(), ex);
        }
        updateLocation(containerId, LocationStatus.STOPPED, null);
        persist(id, "mark stopped", () -> store.updateStatus(id, GameServerStatus.STOPPED));
        metrics.success("stop");
    }

    public void restartGameServer(String id) {
        if (forwardIfRemote(id, RemoteOperation.RESTART, null)) {
            return;
        }
        restartLocally(id);
    }

    public void restartLocally(String id) {
        locks.withLock(id, () -> doRestart(id));
    }

    private void doRestart(String id) {
        GameServer gameServer = load(id);
        if (!gameServer.hasContainer()) {
            doStart(id);
            return;
        }
        String containerId = gameServer.containerId();
        ContainerState state;
        try {
            state = runtime.inspect(containerId);
        } catch (ContainerRuntimeException ex) {
            log.info("cannot inspect container {} of game server {}; restarting as start", containerId, id);
            doStart(id);
            return;
        }
        if (!state.running()) {
            doStart(id);
            return;
        }

        setStatus(id, GameServerStatus.RESTARTING);
        try {
            runtime.restart(containerId, timeouts.getRestartTimeout());
            markRunning(id, containerId);
            metrics.success("restart");
            return;
        } catch (ContainerRuntimeException ex) {
            log.warn("in-place restart of game server {} failed: {}; trying stop and start", id, ex.getMessage());
        }
        try {
            runtime.stop(containerId, timeouts.getStopTimeout());
            runtime.start(containerId);
            markRunning(id, containerId);
            metrics.success("restart");
            return;
        } catch (ContainerRuntimeException ex) {
            log.warn("stop and start of game server {} failed: {}; running full start", id, ex.getMessage());
        }
        doStart(id);
    }

    public void deleteGameServer(String id) {
        if (forwardIfRemote(id, RemoteOperation.DELETE, null)) {
            return;
        }
        deleteLocally(id);
    }

    public void deleteLocally(String id) {
        locks.withLock(id, () -> doDelete(id));
    }

    private void doDelete(String id) {
        GameServer gameServer = load(id);
        if (!gameServer.hasContainer()) {
            return;
        }
        String containerId = gameServer.containerId();
        ContainerState state = null;
        try {
            state = runtime.inspect(containerId);
        } catch (ContainerNotFoundException ex) {
            log.info("container {} of game server {} already gone", containerId, id);
        } catch (ContainerRuntimeException ex) {
            metrics.failure("delete");
            throw new GameServerOperationException(id, "failed to inspect container: " + ex.getMessage(), ex);
        }

        if (state != null) {
            if (!provisioner.isManaged(state)) {
                metrics.failure("delete");
                throw new OwnershipViolationException(id, "container " + containerId);
            }
            setStatus(id, GameServerStatus.DELETING);
            if (state.running()) {
                try {
                    runtime.stop(containerId, timeouts.getStopTimeout());
                } catch (ContainerRuntimeException ex) {
                    log.warn("Failed to stop container {} before removal: {}", containerId, ex.getMessage());
                }
            }
            try {
                runtime.remove(containerId, true);
            } catch (ContainerRuntimeException ex) {
                log.warn("Failed to remove container {} of game server {}: {}", containerId, id, ex.getMessage());
            }
        }
        forgetLocation(containerId);
        persist(id, "clear container", () -> store.clearContainerInfo(id));
        metrics.success("delete");
        log.info("deleted container {} of game server {}", containerId, id);
    }

    /**
     * Streams container logs to {@code sink}. Runs outside the per-id lock since following may take as long as
     * the container lives.
     */
    public void getGameServerLogs(String id, LogOptions options, LogSink sink) {
        Optional<NodeCandidate> remote = remoteNodeOf(id);
        if (remote.isPresent()) {
            throw new GameServerOperationException(id,
                "game server " + id + " is hosted on node " + remote.get().id() + "; fetch its logs there");
        }
        GameServer gameServer = load(id);
        String containerId = requireContainer(gameServer);
        try {
            runtime.inspect(containerId);
            runtime.logs(containerId, options, sink);
        } catch (ContainerNotFoundException ex) {
            throw new GameServerOperationException(id, "container " + containerId + " not found", ex);
        } catch (ContainerRuntimeException ex) {
            throw new GameServerOperationException(id, "failed to read logs: " + ex.getMessage(), ex);
        }
    }

    /**
     * Writes {@code command} followed by a newline to the console of a running game server.
     */
    public void sendCommand(String id, String command) {
        if (command == null || command.isBlank()) {
            throw new IllegalArgumentException("command must not be blank");
        }
        if (forwardIfRemote(id, RemoteOperation.COMMAND, command)) {
            return;
        }
        sendCommandLocally(id, command);
    }

    public void sendCommandLocally(String id, String command) {
        if (command == null || command.isBlank()) {
            throw new IllegalArgumentException("command must not be blank");
        }
        locks.withLock(id, () -> {
            GameServer gameServer = load(id);
            String containerId = requireContainer(gameServer);
            try {
                if (!runtime.inspect(containerId).running()) {
                    throw new GameServerOperationException(id, "game server " + id + " is not running");
                }
                runtime.attachStdin(containerId, (command + "\n").getBytes(StandardCharsets.UTF_8),
                    timeouts.getAttachTimeout());
            } catch (ContainerNotFoundException ex) {
                throw new GameServerOperationException(id, "container " + containerId + " not found", ex);
            } catch (ContainerRuntimeException ex) {
                metrics.failure("command");
                throw new GameServerOperationException(id, "failed to send command: " + ex.getMessage(), ex);
            }
            log.debug("sent command to game server {}", id);
        });
    }

    private boolean forwardIfRemote(String id, RemoteOperation operation, String command) {
        Optional<NodeCandidate> remote = remoteNodeOf(id);
        if (remote.isEmpty()) {
            return false;
        }
        NodeCandidate node = remote.get();
        log.info("forwarding {} of game server {} to node {}", operation.pathSegment(), id, node.id());
        forwarder.forward(node, operation, id, command);
        metrics.forwarded(operation.pathSegment());
        return true;
    }

    /**
     * The node the newest location row pins this server to, when that is another node that can be reached.
     */
    private Optional<NodeCandidate> remoteNodeOf(String id) {
        List<GameServerLocation> pinned;
        try {
            pinned = locations.findByGameServerId(id);
        } catch (RuntimeException ex) {
            log.warn("Failed to read location of game server {}: {}", id, ex.getMessage());
            return Optional.empty();
        }
        if (pinned.isEmpty()) {
            return Optional.empty();
        }
        String nodeId = pinned.get(0).nodeId();
        NodeCandidate local = nodes.localNode();
        if (local.id().equals(nodeId)) {
            return Optional.empty();
        }
        Optional<NodeCandidate> node = nodes.findNode(nodeId);
        if (node.isEmpty() || !forwarder.canForward(node.get())) {
            log.warn("game server {} is pinned to node {} which cannot be reached; acting locally", id, nodeId);
            return Optional.empty();
        }
        return node;
    }

    private GameServer load(String id) {
        return store.findById(id).orElseThrow(() -> new GameServerNotFoundException(id));
    }

    private String requireContainer(GameServer gameServer) {
        if (!gameServer.hasContainer()) {
            throw new GameServerOperationException(gameServer.id(),
                "game server " + gameServer.id() + " has no container");
        }
        return gameServer.containerId();
    }

    private void ensureNetwork(String id) {
        try {
            provisioner.ensureNetwork();
        } catch (ContainerRuntimeException ex) {
            throw new GameServerOperationException(id, "failed to ensure network: " + ex.getMessage(), ex);
        }
    }

    private ContainerState inspectOrFail(String id, String containerId) {
        try {
            return runtime.inspect(containerId);
        } catch (ContainerRuntimeException ex) {
            throw fail(id, containerId, "start", "failed to inspect container", ex);
        }
    }

    private GameServerOperationException fail(String id, String containerId, String operation, String message,
                                              ContainerRuntimeException cause) {
        markFailed(id, containerId);
        metrics.failure(operation);
        return new GameServerOperationException(id, message + ": " + cause.getMessage(), cause);
    }

    private void markRunning(String id, String containerId) {
        updateLocation(containerId, LocationStatus.RUNNING, nodes.localNode().ip());
        persist(id, "mark running", () -> store.markStarted(id, clock.instant()));
    }

    private void markFailed(String id, String containerId) {
        setStatus(id, GameServerStatus.FAILED);
        if (containerId != null) {
            updateLocation(containerId, LocationStatus.FAILED, null);
        }
    }

    private void setStatus(String id, GameServerStatus status) {
        try {
            store.updateStatus(id, status);
        } catch (RuntimeException ex) {
            log.warn("Failed to set status of game server {} to {}: {}", id, status, ex.getMessage());
        }
    }

    private void updateLocation(String containerId, LocationStatus status, String nodeIp) {
        try {
            locations.updateStatus(containerId, status, nodeIp);
        } catch (RuntimeException ex) {
            log.warn("Failed to set location of container {} to {}: {}", containerId, status.value(), ex.getMessage());
        }
    }

    private void forgetLocation(String containerId) {
        try {
            locations.deleteByContainerId(containerId);
        } catch (RuntimeException ex) {
            log.warn("Failed to delete location of container {}: {}", containerId, ex.getMessage());
        }
    }

    private void persist(String id, String action, Runnable write) {
        try {
            write.run();
        } catch (GameServerOperationException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new GameServerOperationException(id, "failed to " + action + ": " + ex.getMessage(), ex);
        }
    }

    private String captureLogs(String containerId) {
        try {
            return runtime.tailLogs(containerId, timeouts.getCrashLogLines());
        } catch (RuntimeException ex) {
            log.warn("Failed to read logs of container {}: {}", containerId, ex.getMessage());
            return "";
        }
    }

    private static void sleep(Duration duration) {
        if (duration.isZero() || duration.isNegative()) {
            return;
        }
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
