package io.serverhive.gameserver.domain;

/**
 * A destructive action was refused because the target does not carry the ownership label.
 */
public class OwnershipViolationException extends GameServerOperationException {

    private final String resource;

    public OwnershipViolationException(String gameServerId, String resource) {
        super(gameServerId, "refusing to modify " + resource + ": it is not managed by serverhive");
        this.resource = resource;
    }

    public String getResource() {
        return resource;
    }
}
