package io.serverhive.gameserver.infra.placement;

import io.serverhive.gameserver.domain.NodeMetadata;
import io.serverhive.gameserver.domain.PlacementStrategy;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Picks a node among the inventory according to a {@link PlacementStrategy}. A node is eligible when it is
 * active, ready and below its game-server ceiling.
 */
public class PlacementPolicy {

    static final double CPU_WEIGHT = 0.4;
    static final double MEMORY_WEIGHT = 0.4;
    static final double CAPACITY_WEIGHT = 0.2;

    private final PlacementStrategy strategy;
    private final int defaultMaxGameServers;
    private final AtomicInteger cursor = new AtomicInteger();

    public PlacementPolicy(PlacementStrategy strategy, int defaultMaxGameServers) {
        this.strategy = Objects.requireNonNull(strategy, "strategy");
        if (defaultMaxGameServers <= 0) {
            throw new IllegalArgumentException("defaultMaxGameServers must be positive");
        }
        this.defaultMaxGameServers = defaultMaxGameServers;
    }

    public PlacementStrategy strategy() {
        return strategy;
    }

    public Optional<NodeMetadata> choose(List<NodeMetadata> nodes, Map<String, Integer> runningByNode) {
        List<NodeMetadata> eligible = nodes.stream()
            .filter(NodeMetadata::isSchedulable)
            .filter(node -> running(node, runningByNode) < capacity(node))
            .sorted(Comparator.comparing(NodeMetadata::id))
            .toList();
        if (eligible.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(switch (strategy) {
            case LEAST_LOADED -> leastLoaded(eligible, runningByNode);
            case ROUND_ROBIN -> eligible.get(Math.floorMod(cursor.getAndIncrement(), eligible.size()));
            case RESOURCE_BASED -> bestScore(eligible, runningByNode);
        });
    }

    private NodeMetadata leastLoaded(List<NodeMetadata> eligible, Map<String, Integer> runningByNode) {
        return eligible.stream()
            .min(Comparator.<NodeMetadata>comparingInt(node -> running(node, runningByNode))
                .thenComparingDouble(NodeMetadata::usedCpu))
            .orElseThrow();
    }

    private NodeMetadata bestScore(List<NodeMetadata> eligible, Map<String, Integer> runningByNode) {
        NodeMetadata best = eligible.get(0);
        double bestScore = score(best, runningByNode);
        for (NodeMetadata node : eligible.subList(1, eligible.size())) {
            double score = score(node, runningByNode);
            if (score > bestScore) {
                best = node;
                bestScore = score;
            }
        }
        return best;
    }

    double score(NodeMetadata node, Map<String, Integer> runningByNode) {
        double freeCpu = freeRatio(node.usedCpu(), node.totalCpu());
        double freeMemory = freeRatio(node.usedMemory(), node.totalMemory());
        double freeCapacity = freeRatio(running(node, runningByNode), capacity(node));
        return CPU_WEIGHT * freeCpu + MEMORY_WEIGHT * freeMemory + CAPACITY_WEIGHT * freeCapacity;
    }

    private static double freeRatio(double used, double total) {
        if (total <= 0) {
            return 0.0;
        }
        return Math.max(0.0, 1.0 - used / total);
    }

    private int capacity(NodeMetadata node) {
        return node.maxGameServers() > 0 ? node.maxGameServers() : defaultMaxGameServers;
    }

    private static int running(NodeMetadata node, Map<String, Integer> runningByNode) {
        return runningByNode.getOrDefault(node.id(), 0);
    }
}
