package io.serverhive.gameserver.domain;

/**
 * A lifecycle operation could not complete.
 */
public class GameServerOperationException extends RuntimeException {

    private final String gameServerId;

    public GameServerOperationException(String gameServerId, String message) {
        super(message);
        this.gameServerId = gameServerId;
    }

    public GameServerOperationException(String gameServerId, String message, Throwable cause) {
        super(message, cause);
        this.gameServerId = gameServerId;
    }

    public String getGameServerId() {
        return gameServerId;
    }
}
