package io.serverhive.gameserver.infra.placement;

import io.serverhive.docker.ContainerRuntimeGateway;
import io.serverhive.docker.EngineInfo;
import io.serverhive.docker.SwarmNodeInfo;
import io.serverhive.gameserver.config.GameServerProperties;
import io.serverhive.gameserver.domain.NodeCandidate;
import io.serverhive.gameserver.domain.NodeDirectory;
import io.serverhive.gameserver.domain.NodeMetadata;
import io.serverhive.gameserver.infra.jdbc.JdbcNodeMetadataRepository;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps {@code node_metadata} in step with the engine: the local engine as a single node, or every swarm node
 * when swarm placement is enabled and this engine is a manager.
 */
public class DockerNodeInventory implements NodeDirectory {

    private static final Logger log = LoggerFactory.getLogger(DockerNodeInventory.class);
    private static final double NANO_CPUS = 1_000_000_000d;

    private final ContainerRuntimeGateway runtime;
    private final JdbcNodeMetadataRepository repository;
    private final GameServerProperties.Node nodeProperties;
    private final GameServerProperties.Placement placement;
    private volatile NodeCandidate localNode;

    public DockerNodeInventory(ContainerRuntimeGateway runtime,
                               JdbcNodeMetadataRepository repository,
                               GameServerProperties properties) {
        this.runtime = Objects.requireNonNull(runtime, "runtime");
        this.repository = Objects.requireNonNull(repository, "repository");
        Objects.requireNonNull(properties, "properties");
        this.nodeProperties = properties.getNode();
        this.placement = properties.getPlacement();
    }

    @Override
    public NodeCandidate localNode() {
        NodeCandidate node = localNode;
        if (node == null) {
            synchronized (this) {
                if (localNode == null) {
                    localNode = resolveLocalNode(runtime.info());
                    log.info("local node is {} ({})", localNode.id(), localNode.hostname());
                }
                node = localNode;
            }
        }
        return node;
    }

    @Override
    public Optional<NodeCandidate> findNode(String nodeId) {
        NodeCandidate local = localNode();
        if (local.id().equals(nodeId)) {
            return Optional.of(local);
        }
        return repository.findById(nodeId)
            .map(node -> new NodeCandidate(node.id(), node.hostname(), node.ip(), node.apiUrl()));
    }

    /**
     * Registers the nodes visible from this engine and refreshes their usage figures.
     */
    public void sync() {
        EngineInfo info = runtime.info();
        int max = placement.getMaxGameServersPerNode();
        if (placement.isSwarmEnabled() && info.swarmManager()) {
            for (SwarmNodeInfo node : runtime.listSwarmNodes()) {
                repository.upsert(new NodeMetadata(node.id(), node.hostname(), node.address(), node.role(),
                    node.availability(), node.state(), node.nanoCpus() / NANO_CPUS, node.memoryBytes(), 0, 0, max,
                    node.labels(), null));
            }
        } else {
            NodeCandidate local = localNode();
            repository.upsert(new NodeMetadata(local.id(), local.hostname(), local.ip(), "manager", "active",
                "ready", info.cpus(), info.memoryBytes(), 0, 0, max, Map.of(), null));
        }
        repository.refreshUsage();
    }

    private NodeCandidate resolveLocalNode(EngineInfo info) {
        String id = nodeProperties.getId();
        if (id == null) {
            id = placement.isSwarmEnabled() && info.inSwarm() ? info.swarmNodeId() : "local-" + info.name();
        }
        String ip = nodeProperties.getIp();
        if (ip == null && placement.isSwarmEnabled() && info.inSwarm()) {
            ip = swarmAddress(info).orElse(null);
        }
        return new NodeCandidate(id, info.name(), ip, null);
    }

    /**
     * Address the swarm reports for this engine. Only managers can list nodes; workers read what a manager
     * recorded in {@code node_metadata}.
     */
    private Optional<String> swarmAddress(EngineInfo info) {
        String swarmNodeId = info.swarmNodeId();
        try {
            if (info.swarmManager()) {
                return runtime.listSwarmNodes().stream()
                    .filter(node -> swarmNodeId.equals(node.id()))
                    .map(SwarmNodeInfo::address)
                    .filter(address -> address != null && !address.isBlank())
                    .findFirst();
            }
            return repository.findById(swarmNodeId).map(NodeMetadata::ip);
        } catch (RuntimeException ex) {
            log.warn("Failed to resolve swarm address of node {}: {}", swarmNodeId, ex.getMessage());
            return Optional.empty();
        }
    }
}
