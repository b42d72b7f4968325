package io.serverhive.gameserver.infra.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.serverhive.gameserver.domain.GameServer;
import io.serverhive.gameserver.domain.GameServerNotFoundException;
import io.serverhive.gameserver.domain.GameServerStatus;
import io.serverhive.gameserver.domain.GameServerStore;
import io.serverhive.gameserver.infra.cache.GameServerCache;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * {@link GameServerStore} over the {@code game_servers} table. Soft-deleted rows are invisible. Every write
 * evicts the cached entry once the surrounding transaction (if any) has committed.
 */
public class JdbcGameServerStore implements GameServerStore {

  private static final Logger log = LoggerFactory.getLogger(JdbcGameServerStore.class);
  private static final TypeReference<Map<String, String>> ENV_TYPE = new TypeReference<>() {};
  private static final String COLUMNS = """
      id, image, port, env_vars, memory_bytes, cpu_cores, start_command, container_id, container_name,
      status, last_started_at, created_at, updated_at
      """;

  private final JdbcTemplate jdbc;
  private final ObjectMapper mapper;
  private final GameServerCache cache;

  public JdbcGameServerStore(JdbcTemplate jdbc, ObjectMapper mapper, GameServerCache cache) {
    this.jdbc = Objects.requireNonNull(jdbc, "jdbc");
    this.mapper = Objects.requireNonNull(mapper, "mapper");
    this.cache = Objects.requireNonNull(cache, "cache");
  }

  @Override
  public Optional<GameServer> findById(String id) {
    Optional<GameServer> cached = cache.get(id);
    if (cached.isPresent()) {
      return cached;
    }
    List<GameServer> rows = jdbc.query(
        "SELECT " + COLUMNS + " FROM game_servers WHERE id = ? AND deleted_at IS NULL",
        this::mapRow,
        id);
    if (rows.isEmpty()) {
      return Optional.empty();
    }
    GameServer gameServer = rows.get(0);
    cache.put(gameServer);
    return Optional.of(gameServer);
  }

  @Override
  public GameServer create(GameServer gameServer) {
    Objects.requireNonNull(gameServer, "gameServer");
    String sql = """
        INSERT INTO game_servers (
          id, image, port, env_vars, memory_bytes, cpu_cores, start_command, container_id, container_name, status
        ) VALUES (?, ?, ?, ?::jsonb, ?, ?, ?, ?, ?, ?)
        """;
    jdbc.update(sql,
        gameServer.id(),
        gameServer.image(),
        gameServer.port(),
        toJson(gameServer.envVars()),
        gameServer.memoryBytes(),
        gameServer.cpuCores(),
        gameServer.startCommand(),
        gameServer.containerId(),
        gameServer.containerName(),
        gameServer.status().code());
    invalidateAfterCommit(gameServer.id());
    return findById(gameServer.id()).orElseThrow(() -> new GameServerNotFoundException(gameServer.id()));
  }

  @Override
  public void updateStatus(String id, GameServerStatus status) {
    Objects.requireNonNull(status, "status");
    update(id, "UPDATE game_servers SET status = ?, updated_at = now() WHERE id = ? AND deleted_at IS NULL",
        status.code(), id);
  }

  @Override
  public void updateContainerInfo(String id, String containerId, String containerName) {
    update(id, """
        UPDATE game_servers
           SET container_id = ?, container_name = ?, updated_at = now()
         WHERE id = ? AND deleted_at IS NULL
        """, containerId, containerName, id);
  }

  @Override
  public void clearContainerInfo(String id) {
    update(id, """
        UPDATE game_servers
           SET container_id = NULL, container_name = NULL, updated_at = now()
         WHERE id = ? AND deleted_at IS NULL
        """, id);
  }

  @Override
  public void markStarted(String id, Instant startedAt) {
    update(id, """
        UPDATE game_servers
           SET status = ?, last_started_at = ?, updated_at = now()
         WHERE id = ? AND deleted_at IS NULL
        """, GameServerStatus.RUNNING.code(), Timestamp.from(startedAt), id);
  }

  @Override
  public List<GameServer> findByStatuses(Collection<GameServerStatus> statuses) {
    if (statuses == null || statuses.isEmpty()) {
      return List.of();
    }
    String placeholders = String.join(", ", Collections.nCopies(statuses.size(), "?"));
    Object[] codes = statuses.stream().map(GameServerStatus::code).toArray();
    return jdbc.query(
        "SELECT " + COLUMNS + " FROM game_servers WHERE deleted_at IS NULL AND status IN (" + placeholders
            + ") ORDER BY id",
        this::mapRow,
        codes);
  }

  private void update(String id, String sql, Object... args) {
    int rows = jdbc.update(sql, args);
    if (rows == 0) {
      throw new GameServerNotFoundException(id);
    }
    invalidateAfterCommit(id);
  }

  private void invalidateAfterCommit(String id) {
    if (TransactionSynchronizationManager.isSynchronizationActive()) {
      TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
        @Override
        public void afterCommit() {
          cache.evict(id);
        }
      });
      return;
    }
    cache.evict(id);
  }

  private GameServer mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new GameServer(
        rs.getString("id"),
        rs.getString("image"),
        rs.getInt("port"),
        fromJson(rs.getString("env_vars"), rs.getString("id")),
        rs.getLong("memory_bytes"),
        rs.getDouble("cpu_cores"),
        rs.getString("start_command"),
        rs.getString("container_id"),
        rs.getString("container_name"),
        GameServerStatus.fromCode(rs.getInt("status")),
        toInstant(rs.getTimestamp("last_started_at")),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")));
  }

  private String toJson(Map<String, String> env) {
    try {
      return mapper.writeValueAsString(env == null ? Map.of() : env);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("env vars are not serialisable: " + e.getMessage(), e);
    }
  }

  private Map<String, String> fromJson(String json, String id) {
    if (json == null || json.isBlank()) {
      return Map.of();
    }
    try {
      return mapper.readValue(json, ENV_TYPE);
    } catch (JsonProcessingException e) {
      log.warn("Failed to parse env vars of game server {}: {}", id, e.getMessage());
      return Map.of();
    }
  }

  static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }
}
