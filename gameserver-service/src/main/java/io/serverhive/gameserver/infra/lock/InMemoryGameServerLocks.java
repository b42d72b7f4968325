package io.serverhive.gameserver.infra.lock;

import io.serverhive.gameserver.domain.GameServerLocks;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Keyed locks for a single control-plane instance. Entries are dropped once no thread holds or waits for them.
 */
public class InMemoryGameServerLocks implements GameServerLocks {

    private final Map<String, Entry> locks = new ConcurrentHashMap<>();

    @Override
    public <T> T withLock(String gameServerId, Supplier<T> action) {
        Entry entry = locks.compute(gameServerId, (id, existing) -> {
            Entry e = existing == null ? new Entry() : existing;
            e.users++;
            return e;
        });
        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            locks.computeIfPresent(gameServerId, (id, e) -> --e.users == 0 ? null : e);
        }
    }

    int size() {
        return locks.size();
    }

    private static final class Entry {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
