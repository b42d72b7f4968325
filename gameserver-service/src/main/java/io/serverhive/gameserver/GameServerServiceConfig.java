package io.serverhive.gameserver;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.serverhive.docker.ContainerRuntimeGateway;
import io.serverhive.gameserver.app.ContainerProvisioner;
import io.serverhive.gameserver.app.GameServerOrchestrator;
import io.serverhive.gameserver.app.GameServerStatusReconciler;
import io.serverhive.gameserver.app.LifecycleMetrics;
import io.serverhive.gameserver.app.NodeForwarder;
import io.serverhive.gameserver.config.GameServerProperties;
import io.serverhive.gameserver.domain.GameServerLocks;
import io.serverhive.gameserver.domain.GameServerStore;
import io.serverhive.gameserver.domain.LocationTracker;
import io.serverhive.gameserver.domain.NodeDirectory;
import io.serverhive.gameserver.domain.NodePlacementSelector;
import io.serverhive.gameserver.infra.cache.GameServerCache;
import io.serverhive.gameserver.infra.cache.NoopGameServerCache;
import io.serverhive.gameserver.infra.cache.RedisGameServerCache;
import io.serverhive.gameserver.infra.jdbc.JdbcGameServerStore;
import io.serverhive.gameserver.infra.jdbc.JdbcLocationTracker;
import io.serverhive.gameserver.infra.jdbc.JdbcNodeMetadataRepository;
import io.serverhive.gameserver.infra.lock.InMemoryGameServerLocks;
import io.serverhive.gameserver.infra.lock.PostgresAdvisoryGameServerLocks;
import io.serverhive.gameserver.infra.placement.DockerNodeInventory;
import io.serverhive.gameserver.infra.placement.PlacementPolicy;
import io.serverhive.gameserver.infra.placement.StrategyNodePlacementSelector;
import io.serverhive.gameserver.infra.remote.HttpNodeForwarder;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.jdbc.core.JdbcTemplate;

@Configuration
class GameServerServiceConfig {

    private static final Logger log = LoggerFactory.getLogger(GameServerServiceConfig.class);

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    GameServerCache gameServerCache(GameServerProperties properties,
                                    ObjectProvider<StringRedisTemplate> redis,
                                    ObjectMapper objectMapper) {
        GameServerProperties.Cache cache = properties.getCache();
        StringRedisTemplate template = redis.getIfAvailable();
        if (!cache.isEnabled() || template == null) {
            log.info("game server cache disabled");
            return new NoopGameServerCache();
        }
        log.info("caching game servers in redis for {}", cache.getTtl());
        return new RedisGameServerCache(template, objectMapper, cache.getTtl());
    }

    @Bean
    GameServerStore gameServerStore(JdbcTemplate jdbc, ObjectMapper objectMapper, GameServerCache cache) {
        return new JdbcGameServerStore(jdbc, objectMapper, cache);
    }

    @Bean
    LocationTracker locationTracker(JdbcTemplate jdbc) {
        return new JdbcLocationTracker(jdbc);
    }

    @Bean
    JdbcNodeMetadataRepository nodeMetadataRepository(JdbcTemplate jdbc, ObjectMapper objectMapper) {
        return new JdbcNodeMetadataRepository(jdbc, objectMapper);
    }

    @Bean
    DockerNodeInventory nodeInventory(ContainerRuntimeGateway runtime,
                                      JdbcNodeMetadataRepository repository,
                                      GameServerProperties properties) {
        return new DockerNodeInventory(runtime, repository, properties);
    }

    @Bean
    PlacementPolicy placementPolicy(GameServerProperties properties) {
        GameServerProperties.Placement placement = properties.getPlacement();
        return new PlacementPolicy(placement.getStrategy(), placement.getMaxGameServersPerNode());
    }

    @Bean
    NodePlacementSelector nodePlacementSelector(DockerNodeInventory inventory,
                                                JdbcNodeMetadataRepository repository,
                                                PlacementPolicy policy) {
        return new StrategyNodePlacementSelector(inventory, repository, policy);
    }

    @Bean
    GameServerLocks gameServerLocks(GameServerProperties properties, JdbcTemplate jdbc) {
        GameServerProperties.LockingMode mode = properties.getLocking().getMode();
        log.info("game server locking mode {}", mode);
        return switch (mode) {
            case IN_MEMORY -> new InMemoryGameServerLocks();
            case POSTGRES_ADVISORY -> new PostgresAdvisoryGameServerLocks(jdbc);
        };
    }

    @Bean
    NodeForwarder nodeForwarder(ObjectMapper objectMapper, GameServerProperties properties) {
        return new HttpNodeForwarder(objectMapper, properties);
    }

    @Bean
    ContainerProvisioner containerProvisioner(ContainerRuntimeGateway runtime, GameServerProperties properties) {
        return new ContainerProvisioner(runtime, properties);
    }

    @Bean
    LifecycleMetrics lifecycleMetrics(MeterRegistry meterRegistry) {
        return new LifecycleMetrics(meterRegistry);
    }

    @Bean
    GameServerOrchestrator gameServerOrchestrator(ContainerRuntimeGateway runtime,
                                                  GameServerStore store,
                                                  LocationTracker locations,
                                                  NodePlacementSelector placement,
                                                  NodeDirectory nodes,
                                                  GameServerLocks locks,
                                                  NodeForwarder forwarder,
                                                  ContainerProvisioner provisioner,
                                                  LifecycleMetrics metrics,
                                                  GameServerProperties properties,
                                                  Clock clock) {
        return new GameServerOrchestrator(runtime, store, locations, placement, nodes, locks, forwarder,
            provisioner, metrics, properties, clock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "serverhive.gameservers.reconciler", name = "enabled", havingValue = "true",
        matchIfMissing = true)
    GameServerStatusReconciler gameServerStatusReconciler(ContainerRuntimeGateway runtime,
                                                          GameServerStore store,
                                                          LocationTracker locations,
                                                          NodeDirectory nodes,
                                                          GameServerLocks locks) {
        return new GameServerStatusReconciler(runtime, store, locations, nodes, locks);
    }
}
