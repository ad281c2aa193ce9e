package siorgsync.jdbc.store;

import siorgsync.jdbc.JdbcTemplate;
import siorgsync.jdbc.TableNames;
import siorgsync.model.EntityType;
import siorgsync.model.NewQueueItem;
import siorgsync.model.QueueItem;
import siorgsync.model.SyncOperation;
import siorgsync.model.SyncStatus;
import siorgsync.spi.SyncQueueStore;

import java.sql.Connection;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Base JDBC sync queue store with standard SQL implementations.
 *
 * <p>Subclasses override {@link #claimBatch} to provide database-specific claim strategies.
 * Register custom implementations via
 * {@code META-INF/services/siorgsync.jdbc.store.AbstractJdbcSyncQueueStore}.
 *
 * <p>Timestamps are truncated to milliseconds before they are written so values read back
 * compare equal to the ones the caller passed in.
 *
 * @see JdbcSyncQueueStores
 */
public abstract class AbstractJdbcSyncQueueStore implements SyncQueueStore {
  private static final int MAX_TEXT_LENGTH = 4000;

  protected static final int PENDING = SyncStatus.PENDING.code();
  protected static final int PROCESSING = SyncStatus.PROCESSING.code();

  protected static final String COLUMNS =
      "id, entity_type, operation, external_code, payload, status, attempts, max_attempts, " +
      "next_attempt_at, expires_at, last_error, error_details, detected_changes, local_value, " +
      "remote_value, remote_snapshot, claimed_by, claimed_at, claim_token, last_attempt_at, processed_at, " +
      "processed_by, resolution_notes, created_at, updated_at";

  // Guarded by claim token so a worker whose lease was taken over cannot write
  private static final String CLAIM_GUARD = " WHERE id=? AND status=" + PROCESSING + " AND claim_token=?";
  private static final String CLEAR_CLAIM = "claimed_by=NULL, claimed_at=NULL, claim_token=NULL";

  protected static final JdbcTemplate.RowMapper<QueueItem> ITEM_ROW_MAPPER = rs -> new QueueItem(
      rs.getString("id"),
      EntityType.valueOf(rs.getString("entity_type")),
      SyncOperation.valueOf(rs.getString("operation")),
      rs.getString("external_code"),
      rs.getString("payload"),
      SyncStatus.fromCode(rs.getInt("status")),
      rs.getInt("attempts"),
      rs.getInt("max_attempts"),
      JdbcTemplate.instant(rs, "next_attempt_at"),
      JdbcTemplate.instant(rs, "expires_at"),
      rs.getString("last_error"),
      rs.getString("error_details"),
      rs.getString("detected_changes"),
      rs.getString("local_value"),
      rs.getString("remote_value"),
      rs.getString("remote_snapshot"),
      rs.getString("claimed_by"),
      JdbcTemplate.instant(rs, "claimed_at"),
      rs.getString("claim_token"),
      JdbcTemplate.instant(rs, "last_attempt_at"),
      JdbcTemplate.instant(rs, "processed_at"),
      rs.getString("processed_by"),
      rs.getString("resolution_notes"),
      JdbcTemplate.instant(rs, "created_at"),
      JdbcTemplate.instant(rs, "updated_at"));

  private final String tableName;

  protected AbstractJdbcSyncQueueStore() {
    this(TableNames.DEFAULT_QUEUE_TABLE);
  }

  protected AbstractJdbcSyncQueueStore(String tableName) {
    this.tableName = TableNames.validate(tableName);
  }

  /**
   * JDBC URL prefixes this store handles (e.g., "jdbc:postgresql:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Returns a store of the same dialect bound to another table.
   */
  public abstract AbstractJdbcSyncQueueStore withTableName(String tableName);

  protected String tableName() {
    return tableName;
  }

  /**
   * WHERE clause selecting claimable rows. Binds {@code now}, {@code now} and
   * {@code leaseExpiry}, in that order.
   */
  protected static String eligibleCondition() {
    return "((status=" + PENDING + " AND next_attempt_at <= ? AND (expires_at IS NULL OR expires_at > ?))" +
        " OR (status=" + PROCESSING + " AND claimed_at <= ?))";
  }

  /**
   * SET clause shared by both claim strategies. Binds {@code workerId}, {@code claimedAt},
   * {@code claimToken}, {@code lastAttemptAt} and {@code updatedAt}, in that order. Taking
   * over an expired lease counts the abandoned attempt, capped at {@code max_attempts}.
   */
  protected static String claimAssignments() {
    return "status=" + PROCESSING +
        ", attempts=CASE WHEN status=" + PROCESSING + " AND attempts < max_attempts THEN attempts+1 ELSE attempts END" +
        ", claimed_by=?, claimed_at=?, claim_token=?, last_attempt_at=?, updated_at=?";
  }

  @Override
  public void insert(Connection conn, NewQueueItem item) {
    String sql = "INSERT INTO " + tableName() + " (" +
        "id, entity_type, operation, external_code, payload, status, attempts, max_attempts, " +
        "next_attempt_at, expires_at, created_at, updated_at" +
        ") VALUES (?,?,?,?,?,?,?,?,?,?,?,?)";
    Instant createdAt = millis(item.createdAt());
    JdbcTemplate.update(conn, sql,
        item.id(), item.entityType().name(), item.operation().name(), item.externalCode(),
        item.payloadJson(), PENDING, 0, item.maxAttempts(),
        millis(item.nextAttemptAt()), millis(item.expiresAt()), createdAt, createdAt);
  }

  /**
   * Two-phase claim: a conditional {@code UPDATE} over a subquery, then a {@code SELECT}
   * by claim token. The eligibility condition is repeated on the outer {@code UPDATE}, so a
   * row claimed by a concurrent transaction between the two steps is re-checked after its
   * lock is released and skipped. Works on H2; the caller must run it in one transaction.
   */
  @Override
  public List<QueueItem> claimBatch(Connection conn, String workerId, String claimToken,
      Instant now, Instant leaseExpiry, int limit) {
    Instant nowMs = millis(now);
    String claimSql = "UPDATE " + tableName() + " SET " + claimAssignments() +
        " WHERE id IN (" +
        "SELECT id FROM " + tableName() + " WHERE " + eligibleCondition() +
        " ORDER BY created_at, id LIMIT ?)" +
        " AND " + eligibleCondition();
    int updated = JdbcTemplate.update(conn, claimSql,
        workerId, nowMs, claimToken, nowMs, nowMs,
        now, now, leaseExpiry, limit,
        now, now, leaseExpiry);
    if (updated == 0) {
      return List.of();
    }
    return selectClaimed(conn, claimToken);
  }

  /**
   * Selects rows claimed under the given token, oldest first.
   */
  protected List<QueueItem> selectClaimed(Connection conn, String claimToken) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() +
        " WHERE claim_token=? AND status=" + PROCESSING + " ORDER BY created_at, id";
    return JdbcTemplate.query(conn, sql, ITEM_ROW_MAPPER, claimToken);
  }

  @Override
  public int complete(Connection conn, String id, String claimToken, Instant now, String resolutionNotes) {
    String sql = "UPDATE " + tableName() +
        " SET status=" + SyncStatus.COMPLETED.code() +
        ", processed_at=?, processed_by=claimed_by, resolution_notes=?, updated_at=?, " + CLEAR_CLAIM +
        CLAIM_GUARD;
    Instant nowMs = millis(now);
    return JdbcTemplate.update(conn, sql, nowMs, truncate(resolutionNotes), nowMs, id, claimToken);
  }

  @Override
  public int failRetry(Connection conn, String id, String claimToken, Instant now, Instant nextAttemptAt,
      String error, String errorDetailsJson) {
    String sql = "UPDATE " + tableName() +
        " SET status=" + PENDING +
        ", attempts=attempts+1, next_attempt_at=?, last_error=?, error_details=?, updated_at=?, " + CLEAR_CLAIM +
        CLAIM_GUARD;
    return JdbcTemplate.update(conn, sql,
        millis(nextAttemptAt), truncate(error), errorDetailsJson, millis(now), id, claimToken);
  }

  @Override
  public int failTerminal(Connection conn, String id, String claimToken, Instant now,
      String error, String errorDetailsJson) {
    String sql = "UPDATE " + tableName() +
        " SET status=" + SyncStatus.FAILED.code() +
        ", attempts=CASE WHEN attempts < max_attempts THEN attempts+1 ELSE attempts END" +
        ", last_error=?, error_details=?, processed_by=claimed_by, updated_at=?, " + CLEAR_CLAIM +
        CLAIM_GUARD;
    return JdbcTemplate.update(conn, sql,
        truncate(error), errorDetailsJson, millis(now), id, claimToken);
  }

  @Override
  public int markConflict(Connection conn, String id, String claimToken, Instant now, String detectedChangesJson,
      String localValueJson, String remoteValueJson, String remoteSnapshotJson) {
    String sql = "UPDATE " + tableName() +
        " SET status=" + SyncStatus.CONFLICT.code() +
        ", detected_changes=?, local_value=?, remote_value=?, remote_snapshot=?, processed_by=claimed_by" +
        ", updated_at=?, " + CLEAR_CLAIM + CLAIM_GUARD;
    return JdbcTemplate.update(conn, sql,
        detectedChangesJson, localValueJson, remoteValueJson, remoteSnapshotJson, millis(now), id, claimToken);
  }

  @Override
  public Optional<QueueItem> findById(Connection conn, String id) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE id=?";
    return JdbcTemplate.query(conn, sql, ITEM_ROW_MAPPER, id).stream().findFirst();
  }

  @Override
  public List<QueueItem> listByStatus(Connection conn, SyncStatus status, int limit, int offset) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() +
        " WHERE status=? ORDER BY created_at DESC, id DESC LIMIT ? OFFSET ?";
    return JdbcTemplate.query(conn, sql, ITEM_ROW_MAPPER, status.code(), limit, offset);
  }

  @Override
  public Map<SyncStatus, Long> countByStatus(Connection conn) {
    String sql = "SELECT status, COUNT(*) AS cnt FROM " + tableName() + " GROUP BY status";
    Map<SyncStatus, Long> counts = new EnumMap<>(SyncStatus.class);
    List<Map.Entry<SyncStatus, Long>> rows = JdbcTemplate.query(conn, sql,
        rs -> Map.entry(SyncStatus.fromCode(rs.getInt("status")), rs.getLong("cnt")));
    for (Map.Entry<SyncStatus, Long> row : rows) {
      counts.put(row.getKey(), row.getValue());
    }
    return counts;
  }

  @Override
  public int delete(Connection conn, String id) {
    return JdbcTemplate.update(conn, "DELETE FROM " + tableName() + " WHERE id=?", id);
  }

  @Override
  public int requeueFailed(Connection conn, String id, Instant now) {
    String sql = "UPDATE " + tableName() +
        " SET status=" + PENDING +
        ", attempts=0, next_attempt_at=?, last_error=NULL, error_details=NULL, processed_by=NULL, updated_at=?" +
        " WHERE id=? AND status=" + SyncStatus.FAILED.code();
    Instant nowMs = millis(now);
    return JdbcTemplate.update(conn, sql, nowMs, nowMs, id);
  }

  @Override
  public int resolveConflict(Connection conn, String id, String resolutionNotes, String resolvedBy, Instant now) {
    String sql = "UPDATE " + tableName() +
        " SET status=" + SyncStatus.COMPLETED.code() +
        ", resolution_notes=?, processed_by=?, processed_at=?, updated_at=?" +
        " WHERE id=? AND status=" + SyncStatus.CONFLICT.code();
    Instant nowMs = millis(now);
    return JdbcTemplate.update(conn, sql, truncate(resolutionNotes), resolvedBy, nowMs, nowMs, id);
  }

  // Truncate to millis so stored value matches query (DB may drop nanos)
  protected static Instant millis(Instant instant) {
    return instant == null ? null : instant.truncatedTo(ChronoUnit.MILLIS);
  }

  private static String truncate(String text) {
    if (text == null || text.length() <= MAX_TEXT_LENGTH) {
      return text;
    }
    return text.substring(0, MAX_TEXT_LENGTH - 3) + "...";
  }
}
