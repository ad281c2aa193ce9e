package siorgsync.admin;

import siorgsync.model.EntityType;
import siorgsync.model.HistorySource;
import siorgsync.model.LocalRecord;
import siorgsync.model.QueueItem;
import siorgsync.model.QueueStats;
import siorgsync.model.SyncHistoryEntry;
import siorgsync.model.SyncStatus;
import siorgsync.reconcile.FieldDelta;
import siorgsync.reconcile.Reconciler;
import siorgsync.spi.ConnectionProvider;
import siorgsync.spi.LocalRecordStore;
import siorgsync.spi.SyncHistoryStore;
import siorgsync.spi.SyncQueueStore;
import siorgsync.util.JsonCodec;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Operator facade over the sync queue: dashboards, conflict triage and manual retries.
 *
 * <p>Manages connection lifecycle internally using a {@link ConnectionProvider}. Limits are
 * clamped to {@code 1..}{@value #MAX_PAGE_SIZE} and offsets to {@code >= 0}. Store
 * failures are logged and reported as empty results or {@code false}.
 *
 * @see SyncQueueStore
 */
public final class SyncQueueAdmin {
  private static final Logger logger = Logger.getLogger(SyncQueueAdmin.class.getName());

  public static final int MAX_PAGE_SIZE = 500;

  private final ConnectionProvider connectionProvider;
  private final SyncQueueStore queueStore;
  private final LocalRecordStore localRecordStore;
  private final SyncHistoryStore historyStore;
  private final Reconciler reconciler = new Reconciler();
  private final JsonCodec jsonCodec;
  private final Clock clock;

  public SyncQueueAdmin(ConnectionProvider connectionProvider, SyncQueueStore queueStore,
      LocalRecordStore localRecordStore) {
    this(connectionProvider, queueStore, localRecordStore, SyncHistoryStore.NOOP,
        JsonCodec.getDefault(), Clock.systemUTC());
  }

  public SyncQueueAdmin(ConnectionProvider connectionProvider, SyncQueueStore queueStore,
      LocalRecordStore localRecordStore, SyncHistoryStore historyStore, JsonCodec jsonCodec, Clock clock) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.queueStore = Objects.requireNonNull(queueStore, "queueStore");
    this.localRecordStore = Objects.requireNonNull(localRecordStore, "localRecordStore");
    this.historyStore = Objects.requireNonNull(historyStore, "historyStore");
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Lists CONFLICT items, newest first.
   */
  public List<QueueItem> listConflicts(int limit, int offset) {
    return listByStatus(SyncStatus.CONFLICT, limit, offset);
  }

  /**
   * Lists items in the given status, newest first.
   */
  public List<QueueItem> listByStatus(SyncStatus status, int limit, int offset) {
    Objects.requireNonNull(status, "status");
    try (Connection conn = connectionProvider.getConnection()) {
      return queueStore.listByStatus(conn, status, clampLimit(limit), Math.max(0, offset));
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to list " + status + " items", e);
      return List.of();
    }
  }

  /**
   * Returns item counts for all five statuses.
   */
  public QueueStats stats() {
    try (Connection conn = connectionProvider.getConnection()) {
      return QueueStats.of(queueStore.countByStatus(conn));
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to count sync queue items", e);
      return QueueStats.of(Map.of());
    }
  }

  public Optional<QueueItem> find(String id) {
    Objects.requireNonNull(id, "id");
    try (Connection conn = connectionProvider.getConnection()) {
      return queueStore.findById(conn, id);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to load sync queue item " + id, e);
      return Optional.empty();
    }
  }

  /**
   * Hard-deletes an item in any status.
   *
   * @return {@code true} if the item existed
   */
  public boolean delete(String id) {
    Objects.requireNonNull(id, "id");
    try (Connection conn = connectionProvider.getConnection()) {
      return queueStore.delete(conn, id) > 0;
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to delete sync queue item " + id, e);
      return false;
    }
  }

  /**
   * Puts a FAILED item back to PENDING with its attempts reset.
   *
   * @return {@code true} if the item was requeued, {@code false} if not found or not FAILED
   */
  public boolean retryFailed(String id) {
    Objects.requireNonNull(id, "id");
    try (Connection conn = connectionProvider.getConnection()) {
      return queueStore.requeueFailed(conn, id, clock.instant()) > 0;
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to requeue sync queue item " + id, e);
      return false;
    }
  }

  /**
   * Lists the sync history of one entity, newest first.
   */
  public List<SyncHistoryEntry> history(EntityType entityType, String externalCode, int limit) {
    Objects.requireNonNull(entityType, "entityType");
    Objects.requireNonNull(externalCode, "externalCode");
    try (Connection conn = connectionProvider.getConnection()) {
      return historyStore.listForEntity(conn, entityType, externalCode, clampLimit(limit));
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to load history of " + entityType + " " + externalCode, e);
      return List.of();
    }
  }

  /**
   * Resolves a CONFLICT item with {@link ConflictResolution#ACCEPT_REMOTE},
   * {@link ConflictResolution#KEEP_LOCAL} or {@link ConflictResolution#SKIP}.
   *
   * @throws IllegalArgumentException for {@link ConflictResolution#MERGE}, which needs
   *                                  field choices
   * @see #resolveConflict(String, ConflictResolution, Map, String, String)
   */
  public boolean resolveConflict(String id, ConflictResolution resolution, String notes, String resolvedBy) {
    return resolveConflict(id, resolution, Map.of(), notes, resolvedBy);
  }

  /**
   * Resolves a CONFLICT item and marks it COMPLETED. The local record change, the history
   * entry and the status transition commit together.
   *
   * <p>The stored remote snapshot is compared again with the current local record. Remote
   * changes that do not conflict are written for every resolution but {@code SKIP}; the
   * conflicting fields take the side chosen by {@code resolution} (per field for
   * {@code MERGE}), and the snapshot becomes the new baseline.
   *
   * @param id           the item id
   * @param resolution   which side wins
   * @param fieldChoices for {@code MERGE}, the winner of each conflicting field; choices
   *                     for fields that no longer conflict are ignored
   * @param notes        free-text justification, stored in {@code resolution_notes}
   * @param resolvedBy   operator identifier, stored in {@code processed_by}
   * @return {@code true} if resolved, {@code false} if not found or not in CONFLICT
   * @throws IllegalArgumentException if a {@code MERGE} leaves a conflicting field without
   *                                  a choice
   */
  public boolean resolveConflict(String id, ConflictResolution resolution, Map<String, FieldChoice> fieldChoices,
      String notes, String resolvedBy) {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(resolution, "resolution");
    Objects.requireNonNull(fieldChoices, "fieldChoices");
    Objects.requireNonNull(resolvedBy, "resolvedBy");
    if (resolution == ConflictResolution.MERGE && fieldChoices.isEmpty()) {
      throw new IllegalArgumentException("MERGE requires field choices");
    }
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(false);
      try {
        boolean resolved = resolve(conn, id, resolution, fieldChoices, notes, resolvedBy);
        if (resolved) {
          conn.commit();
        } else {
          conn.rollback();
        }
        return resolved;
      } catch (SQLException | RuntimeException e) {
        conn.rollback();
        throw e;
      }
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to resolve conflict for sync queue item " + id, e);
      return false;
    }
  }

  private boolean resolve(Connection conn, String id, ConflictResolution resolution,
      Map<String, FieldChoice> fieldChoices, String notes, String resolvedBy) {
    Optional<QueueItem> found = queueStore.findById(conn, id);
    if (found.isEmpty() || found.get().status() != SyncStatus.CONFLICT) {
      return false;
    }
    QueueItem item = found.get();
    Instant now = clock.instant();
    String resolutionNotes = notes == null || notes.isBlank() ? resolution.name() : resolution + ": " + notes;

    LocalRecord local = null;
    Map<String, Object> changes = Map.of();
    if (resolution != ConflictResolution.SKIP) {
      // rows written before the snapshot column existed only carry the conflicting fields
      Map<String, Object> snapshot = jsonCodec.parseObject(
          item.remoteSnapshotJson() != null ? item.remoteSnapshotJson() : item.remoteValueJson());
      local = localRecordStore.findForUpdate(conn, item.entityType(), item.externalCode()).orElse(null);
      FieldDelta delta = reconciler.delta(snapshot, local);
      changes = resolvedChanges(delta, snapshot, resolution, fieldChoices);
      localRecordStore.apply(conn, item.entityType(), item.externalCode(), changes, snapshot, now);
    }

    if (queueStore.resolveConflict(conn, id, resolutionNotes, resolvedBy, now) == 0) {
      return false;
    }
    historyStore.record(conn, SyncHistoryEntry.forChanges(item, resolution.name(), HistorySource.MANUAL,
        local, changes, resolutionNotes, resolvedBy, now));
    logger.log(Level.INFO, "Conflict on item {0} resolved with {1} by {2}",
        new Object[]{id, resolution, resolvedBy});
    return true;
  }

  private static Map<String, Object> resolvedChanges(FieldDelta delta, Map<String, Object> snapshot,
      ConflictResolution resolution, Map<String, FieldChoice> fieldChoices) {
    Map<String, Object> changes = new LinkedHashMap<>(delta.changes());
    for (String field : delta.conflicting()) {
      FieldChoice choice;
      if (resolution == ConflictResolution.ACCEPT_REMOTE) {
        choice = FieldChoice.REMOTE;
      } else if (resolution == ConflictResolution.KEEP_LOCAL) {
        choice = FieldChoice.LOCAL;
      } else {
        choice = fieldChoices.get(field);
        if (choice == null) {
          throw new IllegalArgumentException("No field choice for conflicting field: " + field);
        }
      }
      if (choice == FieldChoice.REMOTE) {
        changes.put(field, snapshot.get(field));
      }
    }
    return changes;
  }

  static int clampLimit(int limit) {
    return Math.max(1, Math.min(MAX_PAGE_SIZE, limit));
  }
}
