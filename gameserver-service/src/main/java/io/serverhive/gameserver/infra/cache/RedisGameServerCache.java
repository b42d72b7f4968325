package io.serverhive.gameserver.infra.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.serverhive.gameserver.domain.GameServer;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Redis-backed {@link GameServerCache} storing JSON under {@code gameserver:<id>}. Redis failures degrade to
 * cache misses.
 */
public class RedisGameServerCache implements GameServerCache {

    static final String KEY_PREFIX = "gameserver:";

    private static final Logger log = LoggerFactory.getLogger(RedisGameServerCache.class);

    private final StringRedisTemplate redis;
    private final ObjectMapper objectMapper;
    private final Duration ttl;

    public RedisGameServerCache(StringRedisTemplate redis, ObjectMapper objectMapper, Duration ttl) {
        this.redis = Objects.requireNonNull(redis, "redis");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.ttl = Objects.requireNonNull(ttl, "ttl");
    }

    static String key(String id) {
        return KEY_PREFIX + id;
    }

    @Override
    public Optional<GameServer> get(String id) {
        try {
            String json = redis.opsForValue().get(key(id));
            if (json == null) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json, GameServer.class));
        } catch (Exception ex) {
            log.warn("Failed to read cached game server {}: {}", id, ex.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void put(GameServer gameServer) {
        try {
            redis.opsForValue().set(key(gameServer.id()), objectMapper.writeValueAsString(gameServer), ttl);
        } catch (Exception ex) {
            log.warn("Failed to cache game server {}: {}", gameServer.id(), ex.getMessage());
        }
    }

    @Override
    public void evict(String id) {
        try {
            redis.delete(key(id));
        } catch (Exception ex) {
            log.warn("Failed to invalidate cached game server {}: {}", id, ex.getMessage());
        }
    }
}
