package io.serverhive.gameserver.infra.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.serverhive.gameserver.domain.NodeMetadata;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Node inventory in {@code node_metadata}, plus load figures derived from running locations.
 */
public class JdbcNodeMetadataRepository {

  private static final Logger log = LoggerFactory.getLogger(JdbcNodeMetadataRepository.class);
  private static final TypeReference<Map<String, String>> LABELS_TYPE = new TypeReference<>() {};
  private static final String COLUMNS = """
      id, hostname, ip, role, availability, status, total_cpu, total_memory, used_cpu, used_memory,
      max_game_servers, labels, updated_at
      """;

  private final JdbcTemplate jdbc;
  private final ObjectMapper mapper;

  public JdbcNodeMetadataRepository(JdbcTemplate jdbc, ObjectMapper mapper) {
    this.jdbc = Objects.requireNonNull(jdbc, "jdbc");
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  public void upsert(NodeMetadata node) {
    Objects.requireNonNull(node, "node");
    String sql = """
        INSERT INTO node_metadata (
          id, hostname, ip, role, availability, status, total_cpu, total_memory, max_game_servers, labels, updated_at
        ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb, now())
        ON CONFLICT (id) DO UPDATE SET
          hostname = EXCLUDED.hostname,
          ip = COALESCE(EXCLUDED.ip, node_metadata.ip),
          role = EXCLUDED.role,
          availability = EXCLUDED.availability,
          status = EXCLUDED.status,
          total_cpu = EXCLUDED.total_cpu,
          total_memory = EXCLUDED.total_memory,
          max_game_servers = EXCLUDED.max_game_servers,
          labels = EXCLUDED.labels,
          updated_at = now()
        """;
    jdbc.update(sql,
        node.id(),
        node.hostname(),
        node.ip(),
        node.role(),
        node.availability(),
        node.status(),
        node.totalCpu(),
        node.totalMemory(),
        node.maxGameServers(),
        toJson(node.labels()));
  }

  /**
   * Recomputes used CPU and memory of every node from the game servers running on it.
   */
  public void refreshUsage() {
    String sql = """
        UPDATE node_metadata n
           SET used_cpu = node_load.cpu, used_memory = node_load.memory
          FROM (
            SELECT nm.id AS node_id,
                   COALESCE(SUM(g.cpu_cores), 0) AS cpu,
                   COALESCE(SUM(g.memory_bytes), 0) AS memory
              FROM node_metadata nm
              LEFT JOIN game_server_locations l ON l.node_id = nm.id AND l.status = 'running'
              LEFT JOIN game_servers g ON g.id = l.game_server_id AND g.deleted_at IS NULL
             GROUP BY nm.id
          ) AS node_load
         WHERE n.id = node_load.node_id
        """;
    jdbc.update(sql);
  }

  public List<NodeMetadata> findAll() {
    return jdbc.query("SELECT " + COLUMNS + " FROM node_metadata ORDER BY id", this::mapRow);
  }

  public Optional<NodeMetadata> findById(String id) {
    return jdbc.query("SELECT " + COLUMNS + " FROM node_metadata WHERE id = ?", this::mapRow, id)
        .stream()
        .findFirst();
  }

  /**
   * Number of running game servers per node id. Nodes without any are absent.
   */
  public Map<String, Integer> countRunningByNode() {
    Map<String, Integer> counts = new HashMap<>();
    jdbc.query("""
        SELECT node_id, COUNT(*) AS running
          FROM game_server_locations
         WHERE status = 'running'
         GROUP BY node_id
        """, rs -> {
      counts.put(rs.getString("node_id"), rs.getInt("running"));
    });
    return counts;
  }

  private NodeMetadata mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new NodeMetadata(
        rs.getString("id"),
        rs.getString("hostname"),
        rs.getString("ip"),
        rs.getString("role"),
        rs.getString("availability"),
        rs.getString("status"),
        rs.getDouble("total_cpu"),
        rs.getLong("total_memory"),
        rs.getDouble("used_cpu"),
        rs.getLong("used_memory"),
        rs.getInt("max_game_servers"),
        fromJson(rs.getString("labels"), rs.getString("id")),
        JdbcGameServerStore.toInstant(rs.getTimestamp("updated_at")));
  }

  private String toJson(Map<String, String> labels) {
    try {
      return mapper.writeValueAsString(labels == null ? Map.of() : labels);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("node labels are not serialisable: " + e.getMessage(), e);
    }
  }

  private Map<String, String> fromJson(String json, String id) {
    if (json == null || json.isBlank()) {
      return Map.of();
    }
    try {
      return mapper.readValue(json, LABELS_TYPE);
    } catch (JsonProcessingException e) {
      log.warn("Failed to parse labels of node {}: {}", id, e.getMessage());
      return Map.of();
    }
  }
}
