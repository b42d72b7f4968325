package io.serverhive.gameserver.domain;

/**
 * Lifecycle states of a game server with their stable persisted codes.
 */
public enum GameServerStatus {
    CREATED(0),
    CREATING(1),
    STARTING(2),
    RUNNING(3),
    STOPPING(4),
    STOPPED(5),
    RESTARTING(6),
    FAILED(7),
    DELETING(8);

    private final int code;

    GameServerStatus(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static GameServerStatus fromCode(int code) {
        for (GameServerStatus status : values()) {
            if (status.code == code) {
                return status;
            }
        }
        throw new IllegalArgumentException("unknown game server status code " + code);
    }

    /**
     * States in which a container is expected to exist and be (or become) live.
     */
    public boolean isActive() {
        return this == STARTING || this == RUNNING || this == RESTARTING || this == STOPPING;
    }
}
