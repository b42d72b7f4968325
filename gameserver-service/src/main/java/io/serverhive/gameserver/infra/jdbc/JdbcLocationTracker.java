package io.serverhive.gameserver.infra.jdbc;

import io.serverhive.gameserver.domain.GameServerLocation;
import io.serverhive.gameserver.domain.LocationStatus;
import io.serverhive.gameserver.domain.LocationTracker;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * {@link LocationTracker} over {@code game_server_locations}, one row per container.
 */
public class JdbcLocationTracker implements LocationTracker {

  private static final Logger log = LoggerFactory.getLogger(JdbcLocationTracker.class);
  private static final String COLUMNS = """
      id, game_server_id, node_id, node_hostname, node_ip, container_id, status, port, created_at, updated_at
      """;

  private final JdbcTemplate jdbc;

  public JdbcLocationTracker(JdbcTemplate jdbc) {
    this.jdbc = Objects.requireNonNull(jdbc, "jdbc");
  }

  @Override
  public void upsert(GameServerLocation location) {
    Objects.requireNonNull(location, "location");
    String sql = """
        INSERT INTO game_server_locations (
          id, game_server_id, node_id, node_hostname, node_ip, container_id, status, port, created_at, updated_at
        ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, now(), now())
        ON CONFLICT (container_id) DO UPDATE SET
          game_server_id = EXCLUDED.game_server_id,
          node_id = EXCLUDED.node_id,
          node_hostname = EXCLUDED.node_hostname,
          node_ip = COALESCE(EXCLUDED.node_ip, game_server_locations.node_ip),
          status = EXCLUDED.status,
          port = EXCLUDED.port,
          updated_at = now()
        """;
    jdbc.update(sql,
        location.id(),
        location.gameServerId(),
        location.nodeId(),
        location.nodeHostname(),
        location.nodeIp(),
        location.containerId(),
        location.status().value(),
        location.port());
  }

  @Override
  public void updateStatus(String containerId, LocationStatus status, String nodeIp) {
    Objects.requireNonNull(status, "status");
    String sql = """
        UPDATE game_server_locations
           SET status = ?, node_ip = COALESCE(?, node_ip), updated_at = now()
         WHERE container_id = ?
        """;
    int rows = jdbc.update(sql, status.value(), nodeIp, containerId);
    if (rows == 0) {
      log.debug("no location row for container {}", containerId);
    }
  }

  @Override
  public void deleteByContainerId(String containerId) {
    jdbc.update("DELETE FROM game_server_locations WHERE container_id = ?", containerId);
  }

  @Override
  public List<GameServerLocation> findByGameServerId(String gameServerId) {
    return jdbc.query(
        "SELECT " + COLUMNS + " FROM game_server_locations WHERE game_server_id = ? ORDER BY updated_at DESC, id",
        JdbcLocationTracker::mapRow,
        gameServerId);
  }

  @Override
  public Optional<GameServerLocation> findRunningByGameServerId(String gameServerId) {
    List<GameServerLocation> rows = jdbc.query(
        "SELECT " + COLUMNS + " FROM game_server_locations WHERE game_server_id = ? AND status = ? "
            + "ORDER BY updated_at DESC LIMIT 1",
        JdbcLocationTracker::mapRow,
        gameServerId,
        LocationStatus.RUNNING.value());
    return rows.stream().findFirst();
  }

  private static GameServerLocation mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new GameServerLocation(
        rs.getString("id"),
        rs.getString("game_server_id"),
        rs.getString("node_id"),
        rs.getString("node_hostname"),
        rs.getString("node_ip"),
        rs.getString("container_id"),
        LocationStatus.fromValue(rs.getString("status")),
        rs.getInt("port"),
        JdbcGameServerStore.toInstant(rs.getTimestamp("created_at")),
        JdbcGameServerStore.toInstant(rs.getTimestamp("updated_at")));
  }
}
