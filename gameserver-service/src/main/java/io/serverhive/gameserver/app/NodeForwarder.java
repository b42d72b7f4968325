package io.serverhive.gameserver.app;

import io.serverhive.gameserver.domain.NodeCandidate;

/**
 * Runs a lifecycle operation on the orchestrator of another node.
 */
public interface NodeForwarder {

    /**
     * Whether forwarding is enabled and an API URL can be resolved for {@code node}.
     */
    boolean canForward(NodeCandidate node);

    /**
     * @param command console command for {@link RemoteOperation#COMMAND}, otherwise ignored
     * @throws io.serverhive.gameserver.domain.GameServerOperationException when the peer rejects or fails the call
     */
    void forward(NodeCandidate node, RemoteOperation operation, String gameServerId, String command);
}
