package io.serverhive.gameserver.app;

import java.util.Locale;

/**
 * Lifecycle operations a peer node can be asked to run on its own engine.
 */
public enum RemoteOperation {
    CREATE,
    START,
    STOP,
    RESTART,
    DELETE,
    COMMAND;

    public String pathSegment() {
        return name().toLowerCase(Locale.ROOT);
    }
}
