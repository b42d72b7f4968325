package io.serverhive.gameserver.domain;

/**
 * The container started but exited within the start grace period. The server did run, so it is left
 * {@link GameServerStatus#STOPPED} rather than failed.
 */
public class GameServerCrashedException extends GameServerOperationException {

    private final long exitCode;
    private final String logTail;

    public GameServerCrashedException(String gameServerId, long exitCode, String logTail) {
        super(gameServerId, "container exited immediately with code " + exitCode
            + " (check container logs and configuration)");
        this.exitCode = exitCode;
        this.logTail = logTail == null ? "" : logTail;
    }

    public long getExitCode() {
        return exitCode;
    }

    public String getLogTail() {
        return logTail;
    }
}
