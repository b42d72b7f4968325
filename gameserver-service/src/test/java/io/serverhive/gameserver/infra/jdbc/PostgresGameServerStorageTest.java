package io.serverhive.gameserver.infra.jdbc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.serverhive.gameserver.domain.GameServer;
import io.serverhive.gameserver.domain.GameServerConfig;
import io.serverhive.gameserver.domain.GameServerLocation;
import io.serverhive.gameserver.domain.GameServerNotFoundException;
import io.serverhive.gameserver.domain.GameServerStatus;
import io.serverhive.gameserver.domain.LocationStatus;
import io.serverhive.gameserver.domain.NodeCandidate;
import io.serverhive.gameserver.domain.NodeMetadata;
import io.serverhive.gameserver.infra.cache.GameServerCache;
import io.serverhive.gameserver.infra.lock.PostgresAdvisoryGameServerLocks;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

@Testcontainers(disabledWithoutDocker = true)
class PostgresGameServerStorageTest {

  @Container
  static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:15-alpine")
      .withDatabaseName("serverhive")
      .withUsername("serverhive")
      .withPassword("serverhive");

  static JdbcTemplate jdbc;
  static ObjectMapper mapper;

  final RecordingCache cache = new RecordingCache();
  JdbcGameServerStore store;
  JdbcLocationTracker locations;
  JdbcNodeMetadataRepository nodes;

  @BeforeAll
  static void setup() {
    DataSource ds = new DriverManagerDataSource(
        POSTGRES.getJdbcUrl(),
        POSTGRES.getUsername(),
        POSTGRES.getPassword());
    Flyway.configure()
        .dataSource(ds)
        .locations("classpath:db/migration")
        .load()
        .migrate();
    jdbc = new JdbcTemplate(ds);
    mapper = new ObjectMapper().findAndRegisterModules();
  }

  @BeforeEach
  void reset() {
    jdbc.update("DELETE FROM game_server_locations");
    jdbc.update("DELETE FROM game_servers");
    jdbc.update("DELETE FROM node_metadata");
    store = new JdbcGameServerStore(jdbc, mapper, cache);
    locations = new JdbcLocationTracker(jdbc);
    nodes = new JdbcNodeMetadataRepository(jdbc, mapper);
  }

  @Test
  void storesAndUpdatesGameServers() {
    GameServer created = store.create(GameServer.newServer(config("gs-1")));

    assertThat(created.envVars()).containsEntry("EULA", "TRUE");
    assertThat(created.memoryBytes()).isEqualTo(2L << 30);
    assertThat(created.status()).isEqualTo(GameServerStatus.CREATED);
    assertThat(created.createdAt()).isNotNull();

    store.updateContainerInfo("gs-1", "abc", "gameserver-gs-1");
    Instant started = Instant.parse("2026-01-01T12:00:00Z");
    store.markStarted("gs-1", started);

    GameServer running = store.findById("gs-1").orElseThrow();
    assertThat(running.containerId()).isEqualTo("abc");
    assertThat(running.containerName()).isEqualTo("gameserver-gs-1");
    assertThat(running.status()).isEqualTo(GameServerStatus.RUNNING);
    assertThat(running.lastStartedAt()).isEqualTo(started);
    assertThat(store.findByStatuses(EnumSet.of(GameServerStatus.RUNNING))).extracting(GameServer::id)
        .containsExactly("gs-1");

    store.clearContainerInfo("gs-1");
    assertThat(store.findById("gs-1").orElseThrow().hasContainer()).isFalse();
  }

  @Test
  void writesEvictCachedEntries() {
    store.create(GameServer.newServer(config("gs-1")));
    store.findById("gs-1");
    assertThat(cache.entries).containsKey("gs-1");

    store.updateStatus("gs-1", GameServerStatus.STARTING);

    assertThat(cache.entries).doesNotContainKey("gs-1");
    assertThat(cache.evictions.get()).isGreaterThanOrEqualTo(2);
    assertThat(store.findById("gs-1").orElseThrow().status()).isEqualTo(GameServerStatus.STARTING);
  }

  @Test
  void softDeletedServersAreInvisible() {
    store.create(GameServer.newServer(config("gs-1")));
    jdbc.update("UPDATE game_servers SET deleted_at = now() WHERE id = ?", "gs-1");
    cache.evict("gs-1");

    assertThat(store.findById("gs-1")).isEmpty();
    assertThatThrownBy(() -> store.updateStatus("gs-1", GameServerStatus.RUNNING))
        .isInstanceOf(GameServerNotFoundException.class);
  }

  @Test
  void locationsAreKeyedByContainer() {
    store.create(GameServer.newServer(config("gs-1")));
    NodeCandidate node = new NodeCandidate("node-a", "host-a", null, null);
    String first = "a".repeat(64);
    String second = "b".repeat(64);

    locations.upsert(GameServerLocation.created("gs-1", node, first, 25565));
    locations.upsert(GameServerLocation.created("gs-1", node, second, 25565));
    locations.updateStatus(second, LocationStatus.RUNNING, "10.0.0.1");
    locations.upsert(GameServerLocation.created("gs-1", node, first, 25566));

    List<GameServerLocation> rows = locations.findByGameServerId("gs-1");
    assertThat(rows).extracting(GameServerLocation::containerId).containsExactly(first, second);
    assertThat(rows.get(0).port()).isEqualTo(25566);
    assertThat(rows.get(0).id()).isEqualTo("loc-gs-gs-1-aaaaaaaaaaaa");

    GameServerLocation running = locations.findRunningByGameServerId("gs-1").orElseThrow();
    assertThat(running.containerId()).isEqualTo(second);
    assertThat(running.nodeIp()).isEqualTo("10.0.0.1");
    assertThat(running.isAuthoritative()).isTrue();

    locations.deleteByContainerId(second);
    assertThat(locations.findRunningByGameServerId("gs-1")).isEmpty();
  }

  @Test
  void nodeUsageFollowsRunningLocations() {
    nodes.upsert(node("node-a", Map.of(NodeMetadata.API_URL_LABEL, "http://10.0.0.1:8080")));
    nodes.upsert(node("node-b", Map.of()));
    store.create(GameServer.newServer(config("gs-1")));
    store.create(GameServer.newServer(config("gs-2")));
    NodeCandidate nodeA = new NodeCandidate("node-a", "host-a", "10.0.0.1", null);
    locations.upsert(GameServerLocation.created("gs-1", nodeA, "c1", 25565));
    locations.upsert(GameServerLocation.created("gs-2", nodeA, "c2", 25566));
    locations.updateStatus("c1", LocationStatus.RUNNING, null);
    locations.updateStatus("c2", LocationStatus.RUNNING, null);

    nodes.refreshUsage();

    assertThat(nodes.countRunningByNode()).containsExactly(Map.entry("node-a", 2));
    NodeMetadata a = nodes.findById("node-a").orElseThrow();
    assertThat(a.usedCpu()).isEqualTo(4.0);
    assertThat(a.usedMemory()).isEqualTo(4L << 30);
    assertThat(a.apiUrl()).isEqualTo("http://10.0.0.1:8080");
    assertThat(nodes.findById("node-b").orElseThrow().usedCpu()).isZero();
    assertThat(nodes.findAll()).extracting(NodeMetadata::id).containsExactly("node-a", "node-b");
  }

  @Test
  void advisoryLocksSerialiseWorkOnOneServer() throws Exception {
    PostgresAdvisoryGameServerLocks locks = new PostgresAdvisoryGameServerLocks(jdbc);
    AtomicInteger inside = new AtomicInteger();
    AtomicInteger maxInside = new AtomicInteger();
    ExecutorService pool = Executors.newFixedThreadPool(4);
    try {
      List<Future<Integer>> futures = new ArrayList<>();
      for (int i = 0; i < 8; i++) {
        int n = i;
        futures.add(pool.submit(() -> locks.withLock("gs-1", () -> {
          maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
          jdbc.execute("SELECT pg_sleep(0.01)");
          inside.decrementAndGet();
          return n;
        })));
      }
      for (Future<Integer> future : futures) {
        future.get(30, TimeUnit.SECONDS);
      }
    } finally {
      pool.shutdownNow();
    }

    assertThat(maxInside.get()).isEqualTo(1);
    Integer held = jdbc.queryForObject(
        "SELECT COUNT(*) FROM pg_locks WHERE locktype = 'advisory'", Integer.class);
    assertThat(held).isZero();
  }

  private static GameServerConfig config(String id) {
    return new GameServerConfig(id, "itzg/minecraft-server", 25565, Map.of("EULA", "TRUE"), 2L << 30, 2.0, null);
  }

  private static NodeMetadata node(String id, Map<String, String> labels) {
    return new NodeMetadata(id, "host-" + id, null, "worker", "active", "ready", 8, 32L << 30, 0, 0, 50,
        labels, null);
  }

  static final class RecordingCache implements GameServerCache {

    final Map<String, GameServer> entries = new ConcurrentHashMap<>();
    final AtomicInteger evictions = new AtomicInteger();

    @Override
    public Optional<GameServer> get(String id) {
      return Optional.ofNullable(entries.get(id));
    }

    @Override
    public void put(GameServer gameServer) {
      entries.put(gameServer.id(), gameServer);
    }

    @Override
    public void evict(String id) {
      evictions.incrementAndGet();
      entries.remove(id);
    }
  }
}
