package io.serverhive.gameserver.domain;

public interface NodePlacementSelector {

    /**
     * Chooses the node a new game server should run on.
     *
     * @throws IllegalStateException when no node has capacity left
     */
    NodeCandidate selectNode();
}
