package io.serverhive.gameserver.infra.lock;

import io.serverhive.gameserver.domain.GameServerLocks;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Cross-instance keyed locks using session-level Postgres advisory locks. The lock is taken and released on
 * one pooled connection that stays checked out for the duration of the action, so the pool needs a spare
 * connection per concurrently locked game server.
 */
public class PostgresAdvisoryGameServerLocks implements GameServerLocks {

  static final String KEY_PREFIX = "gameserver:";

  private static final Logger log = LoggerFactory.getLogger(PostgresAdvisoryGameServerLocks.class);

  private final JdbcTemplate jdbc;
  private final InMemoryGameServerLocks local = new InMemoryGameServerLocks();

  public PostgresAdvisoryGameServerLocks(JdbcTemplate jdbc) {
    this.jdbc = Objects.requireNonNull(jdbc, "jdbc");
  }

  @Override
  public <T> T withLock(String gameServerId, Supplier<T> action) {
    String key = KEY_PREFIX + gameServerId;
    // serialise threads of this instance first so each holds at most one connection per key
    return local.withLock(gameServerId, () -> jdbc.execute((ConnectionCallback<T>) connection -> {
      execute(connection, "SELECT pg_advisory_lock(hashtext(?))", key);
      try {
        return action.get();
      } finally {
        try {
          execute(connection, "SELECT pg_advisory_unlock(hashtext(?))", key);
        } catch (SQLException ex) {
          log.warn("Failed to release advisory lock {}: {}", key, ex.getMessage());
        }
      }
    }));
  }

  private static void execute(Connection connection, String sql, String key) throws SQLException {
    try (PreparedStatement statement = connection.prepareStatement(sql)) {
      statement.setString(1, key);
      statement.execute();
    }
  }
}
