package siorgsync.jdbc.store;

import siorgsync.jdbc.JdbcTemplate;
import siorgsync.model.QueueItem;

import java.sql.Connection;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * PostgreSQL sync queue store.
 *
 * <p>Uses {@code FOR UPDATE SKIP LOCKED} with {@code RETURNING} for a single-round-trip
 * claim: rows locked by a concurrent claim are skipped instead of waited on.
 */
public final class PostgresSyncQueueStore extends AbstractJdbcSyncQueueStore {

  public PostgresSyncQueueStore() {
    super();
  }

  public PostgresSyncQueueStore(String tableName) {
    super(tableName);
  }

  @Override
  public AbstractJdbcSyncQueueStore withTableName(String tableName) {
    return new PostgresSyncQueueStore(tableName);
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public List<QueueItem> claimBatch(Connection conn, String workerId, String claimToken,
      Instant now, Instant leaseExpiry, int limit) {
    Instant nowMs = millis(now);
    String sql = "UPDATE " + tableName() + " SET " + claimAssignments() +
        " WHERE id IN (" +
        "SELECT id FROM " + tableName() + " WHERE " + eligibleCondition() +
        " ORDER BY created_at, id LIMIT ?" +
        " FOR UPDATE SKIP LOCKED" +
        ") RETURNING " + COLUMNS;
    List<QueueItem> claimed = new ArrayList<>(JdbcTemplate.updateReturning(conn, sql, ITEM_ROW_MAPPER,
        workerId, nowMs, claimToken, nowMs, nowMs,
        now, now, leaseExpiry, limit));
    // RETURNING does not preserve the subquery order
    claimed.sort(Comparator.comparing(QueueItem::createdAt).thenComparing(QueueItem::id));
    return claimed;
  }
}
