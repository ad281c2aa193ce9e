package siorgsync.jdbc.purge;

import siorgsync.jdbc.JdbcTemplate;
import siorgsync.jdbc.TableNames;
import siorgsync.model.SyncStatus;
import siorgsync.spi.QueuePurger;

import java.sql.Connection;
import java.time.Instant;

/**
 * JDBC queue purger with subquery-based {@code DELETE}s that work for H2 and PostgreSQL.
 *
 * <p>Only PENDING items past their deadline and COMPLETED items are ever deleted; FAILED
 * and CONFLICT items stay until an operator acts on them.
 */
public final class JdbcQueuePurger implements QueuePurger {
  private final String tableName;

  public JdbcQueuePurger() {
    this(TableNames.DEFAULT_QUEUE_TABLE);
  }

  public JdbcQueuePurger(String tableName) {
    this.tableName = TableNames.validate(tableName);
  }

  @Override
  public int purgeExpired(Connection conn, Instant now, int limit) {
    String sql = "DELETE FROM " + tableName + " WHERE id IN (" +
        "SELECT id FROM " + tableName +
        " WHERE status=" + SyncStatus.PENDING.code() +
        " AND expires_at IS NOT NULL AND expires_at <= ?" +
        " ORDER BY created_at LIMIT ?)" +
        " AND status=" + SyncStatus.PENDING.code();
    return JdbcTemplate.update(conn, sql, now, limit);
  }

  @Override
  public int purgeCompleted(Connection conn, Instant before, int limit) {
    String sql = "DELETE FROM " + tableName + " WHERE id IN (" +
        "SELECT id FROM " + tableName +
        " WHERE status=" + SyncStatus.COMPLETED.code() +
        " AND COALESCE(processed_at, updated_at) < ?" +
        " ORDER BY created_at LIMIT ?)";
    return JdbcTemplate.update(conn, sql, before, limit);
  }
}
