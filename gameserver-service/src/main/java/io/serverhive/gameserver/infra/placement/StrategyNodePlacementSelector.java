package io.serverhive.gameserver.infra.placement;

import io.serverhive.gameserver.domain.NodeCandidate;
import io.serverhive.gameserver.domain.NodeMetadata;
import io.serverhive.gameserver.domain.NodePlacementSelector;
import io.serverhive.gameserver.infra.jdbc.JdbcNodeMetadataRepository;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class StrategyNodePlacementSelector implements NodePlacementSelector {

    private static final Logger log = LoggerFactory.getLogger(StrategyNodePlacementSelector.class);

    private final DockerNodeInventory inventory;
    private final JdbcNodeMetadataRepository repository;
    private final PlacementPolicy policy;

    public StrategyNodePlacementSelector(DockerNodeInventory inventory,
                                         JdbcNodeMetadataRepository repository,
                                         PlacementPolicy policy) {
        this.inventory = Objects.requireNonNull(inventory, "inventory");
        this.repository = Objects.requireNonNull(repository, "repository");
        this.policy = Objects.requireNonNull(policy, "policy");
        log.info("placing game servers with strategy {}", policy.strategy().value());
    }

    @Override
    public NodeCandidate selectNode() {
        try {
            inventory.sync();
        } catch (RuntimeException ex) {
            log.warn("Failed to sync node inventory, using last known nodes: {}", ex.getMessage());
        }
        List<NodeMetadata> nodes = repository.findAll();
        Map<String, Integer> running = repository.countRunningByNode();
        NodeMetadata chosen = policy.choose(nodes, running)
            .orElseThrow(() -> new IllegalStateException(
                "no available nodes: all " + nodes.size() + " known node(s) are unavailable or at capacity"));
        log.debug("selected node {} for placement", chosen.id());
        NodeCandidate local = inventory.localNode();
        if (local.id().equals(chosen.id())) {
            return local;
        }
        return new NodeCandidate(chosen.id(), chosen.hostname(), chosen.ip(), chosen.apiUrl());
    }
}
