package io.serverhive.docker;

/**
 * Facts about the local engine used to register it as a placement node.
 *
 * @param swarmNodeId       node id when the engine is part of a swarm, otherwise {@code null}
 * @param swarmManager      whether this engine can list swarm nodes
 */
public record EngineInfo(String name, int cpus, long memoryBytes, String swarmNodeId, boolean swarmManager) {

    public boolean inSwarm() {
        return swarmNodeId != null && !swarmNodeId.isBlank();
    }
}
