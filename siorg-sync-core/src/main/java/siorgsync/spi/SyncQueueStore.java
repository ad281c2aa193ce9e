package siorgsync.spi;

import siorgsync.model.NewQueueItem;
import siorgsync.model.QueueItem;
import siorgsync.model.SyncStatus;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistence contract for the sync queue.
 *
 * <p>Worker-side transitions ({@link #complete}, {@link #failRetry}, {@link #failTerminal},
 * {@link #markConflict}) are single conditional updates guarded by
 * {@code id = ? AND status = PROCESSING AND claim_token = ?}. A return value of {@code 0}
 * means the claim was lost: the lease expired and another worker owns the item now, or an
 * operator changed it.
 *
 * <p>All methods receive an explicit {@link Connection} so the caller controls transaction
 * boundaries. Implementations live in the {@code siorg-sync-jdbc} module.
 *
 * @see siorgsync.jdbc.store.AbstractJdbcSyncQueueStore
 */
public interface SyncQueueStore {

  /**
   * Inserts a new item with status PENDING and zero attempts.
   *
   * @param conn the JDBC connection
   * @param item the item to persist
   */
  void insert(Connection conn, NewQueueItem item);

  /**
   * Atomically claims up to {@code limit} eligible items for {@code workerId}.
   *
   * <p>Eligible items are PENDING with {@code next_attempt_at <= now} and no
   * {@code expires_at} in the past, plus PROCESSING items whose lease started at or before
   * {@code leaseExpiry}. Claimed items are PROCESSING, stamped with {@code claimToken},
   * and returned oldest first by {@code created_at}. Taking over an expired lease counts
   * the abandoned attempt.
   *
   * <p>Must run inside a transaction; the caller commits.
   *
   * @param conn        the JDBC connection (auto-commit off)
   * @param workerId    identifier of the claiming worker
   * @param claimToken  token unique to this claim
   * @param now         current time
   * @param leaseExpiry claims started at or before this instant are abandoned
   * @param limit       maximum number of items to claim
   * @return claimed items, oldest first; empty when nothing is eligible
   */
  List<QueueItem> claimBatch(Connection conn, String workerId, String claimToken,
      Instant now, Instant leaseExpiry, int limit);

  /**
   * PROCESSING -> COMPLETED.
   *
   * @return rows updated (0 when the claim was lost)
   */
  int complete(Connection conn, String id, String claimToken, Instant now, String resolutionNotes);

  /**
   * PROCESSING -> PENDING, increments {@code attempts} and schedules the next attempt.
   *
   * @return rows updated (0 when the claim was lost)
   */
  int failRetry(Connection conn, String id, String claimToken, Instant now, Instant nextAttemptAt,
      String error, String errorDetailsJson);

  /**
   * PROCESSING -> FAILED, increments {@code attempts}.
   *
   * @return rows updated (0 when the claim was lost)
   */
  int failTerminal(Connection conn, String id, String claimToken, Instant now,
      String error, String errorDetailsJson);

  /**
   * PROCESSING -> CONFLICT, recording the diff and both competing values. Attempts are
   * left unchanged.
   *
   * @param detectedChangesJson names of the conflicting fields
   * @param localValueJson      local values of the conflicting fields
   * @param remoteValueJson     remote values of the conflicting fields
   * @param remoteSnapshotJson  the full remote value the item was reconciled against, used
   *                            when the conflict is resolved
   * @return rows updated (0 when the claim was lost)
   */
  int markConflict(Connection conn, String id, String claimToken, Instant now, String detectedChangesJson,
      String localValueJson, String remoteValueJson, String remoteSnapshotJson);

  Optional<QueueItem> findById(Connection conn, String id);

  /**
   * Lists items in the given status, newest first.
   */
  List<QueueItem> listByStatus(Connection conn, SyncStatus status, int limit, int offset);

  /**
   * Counts items per status. Statuses without items may be absent from the result.
   */
  Map<SyncStatus, Long> countByStatus(Connection conn);

  /**
   * Hard-deletes an item regardless of status.
   *
   * @return rows deleted (0 or 1)
   */
  int delete(Connection conn, String id);

  /**
   * Operator retry: FAILED -> PENDING with attempts reset and errors cleared.
   *
   * @return rows updated (0 when the item does not exist or is not FAILED)
   */
  int requeueFailed(Connection conn, String id, Instant now);

  /**
   * Operator resolution: CONFLICT -> COMPLETED.
   *
   * @return rows updated (0 when the item does not exist or is not CONFLICT)
   */
  int resolveConflict(Connection conn, String id, String resolutionNotes, String resolvedBy, Instant now);
}
