package io.serverhive.gameserver.domain;

import java.util.Optional;

public interface NodeDirectory {

    /**
     * The node this process controls the engine of.
     */
    NodeCandidate localNode();

    Optional<NodeCandidate> findNode(String nodeId);
}
