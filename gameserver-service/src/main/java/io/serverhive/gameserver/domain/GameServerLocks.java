package io.serverhive.gameserver.domain;

import java.util.function.Supplier;

/**
 * Mutual exclusion per game-server id around an inspect-then-act sequence.
 */
public interface GameServerLocks {

    <T> T withLock(String gameServerId, Supplier<T> action);

    default void withLock(String gameServerId, Runnable action) {
        withLock(gameServerId, () -> {
            action.run();
            return null;
        });
    }
}
