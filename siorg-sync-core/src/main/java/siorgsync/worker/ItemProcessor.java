package siorgsync.worker;

import siorgsync.model.EntityType;
import siorgsync.model.HistorySource;
import siorgsync.model.LocalRecord;
import siorgsync.model.QueueItem;
import siorgsync.model.SyncHistoryEntry;
import siorgsync.model.SyncOperation;
import siorgsync.reconcile.ReconcileOutcome;
import siorgsync.reconcile.Reconciler;
import siorgsync.registry.RegistryClient;
import siorgsync.registry.RegistryException;
import siorgsync.registry.RemoteRecord;
import siorgsync.spi.ConnectionProvider;
import siorgsync.spi.LocalRecordStore;
import siorgsync.spi.MetricsExporter;
import siorgsync.spi.SyncHistoryStore;
import siorgsync.spi.SyncQueueStore;
import siorgsync.util.JsonCodec;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs one claimed item through the sync pipeline and records the outcome.
 *
 * <p>Order of steps: decode the payload, skip what the worker does not handle, validate
 * against the registry, then reconcile and write the outcome in a single transaction
 * together with any local change. Failures are classified here: invalid payloads and
 * registry rejections are terminal, everything else is retried with backoff until
 * {@code max_attempts} is reached.
 *
 * <p>Never throws for item-level failures; the result tells the caller what happened.
 */
public final class ItemProcessor {
  private static final Logger logger = Logger.getLogger(ItemProcessor.class.getName());

  static final String ACTIVE_FIELD = "active";

  private final ConnectionProvider connectionProvider;
  private final SyncQueueStore queueStore;
  private final LocalRecordStore localRecordStore;
  private final SyncHistoryStore historyStore;
  private final RegistryClient registryClient;
  private final Reconciler reconciler;
  private final RetryPolicy retryPolicy;
  private final MetricsExporter metrics;
  private final JsonCodec jsonCodec;
  private final Clock clock;
  private final String workerId;

  ItemProcessor(ConnectionProvider connectionProvider, SyncQueueStore queueStore,
      LocalRecordStore localRecordStore, SyncHistoryStore historyStore, RegistryClient registryClient,
      Reconciler reconciler,
      RetryPolicy retryPolicy, MetricsExporter metrics, JsonCodec jsonCodec, Clock clock, String workerId) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.queueStore = Objects.requireNonNull(queueStore, "queueStore");
    this.localRecordStore = Objects.requireNonNull(localRecordStore, "localRecordStore");
    this.historyStore = Objects.requireNonNull(historyStore, "historyStore");
    this.registryClient = Objects.requireNonNull(registryClient, "registryClient");
    this.reconciler = Objects.requireNonNull(reconciler, "reconciler");
    this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.workerId = Objects.requireNonNull(workerId, "workerId");
  }

  public ItemResult process(QueueItem item, String claimToken) {
    try {
      if (item.attempts() >= item.maxAttempts()) {
        // a lease takeover already counted the abandoned attempt
        return failTerminal(item, claimToken,
            new IllegalStateException("Lease expired on the final attempt"), item.attempts());
      }
      Map<String, Object> payload = decodePayload(item);

      String skipReason = skipReason(item);
      if (skipReason != null) {
        return skip(item, claimToken, skipReason);
      }

      Optional<RemoteRecord> fetched = registryClient.fetch(item.entityType(), item.externalCode());
      Map<String, Object> remote = remoteValue(item, payload, fetched);
      return reconcileAndRecord(item, claimToken, remote);
    } catch (ClaimLostException e) {
      return claimLost(item);
    } catch (InvalidPayloadException e) {
      return failTerminal(item, claimToken, e, item.attempts() + 1);
    } catch (RegistryException e) {
      if (e.isRetryable()) {
        return failRetryable(item, claimToken, e);
      }
      return failTerminal(item, claimToken, e, item.attempts() + 1);
    } catch (SQLException | RuntimeException e) {
      return failRetryable(item, claimToken, e);
    }
  }

  private Map<String, Object> decodePayload(QueueItem item) {
    try {
      return jsonCodec.parseObject(item.payloadJson());
    } catch (IllegalArgumentException e) {
      throw new InvalidPayloadException("Malformed payload: " + e.getMessage(), e);
    }
  }

  static String skipReason(QueueItem item) {
    EntityType type = item.entityType();
    if (type.isLocallyManaged()) {
      return "Skipped: " + type + " entities are managed locally";
    }
    SyncOperation operation = item.operation();
    if (operation.requiresManualReview()) {
      return "Skipped: " + operation + " requires manual review";
    }
    return null;
  }

  private Map<String, Object> remoteValue(QueueItem item, Map<String, Object> payload,
      Optional<RemoteRecord> fetched) {
    if (item.operation() == SyncOperation.EXTINCTION) {
      Map<String, Object> remote = new LinkedHashMap<>(
          payload.isEmpty() && fetched.isPresent() ? fetched.get().fields() : payload);
      remote.put(ACTIVE_FIELD, Boolean.FALSE);
      return remote;
    }
    if (fetched.isEmpty()) {
      throw new InvalidPayloadException("Registry has no " + item.entityType() + " with code " + item.externalCode());
    }
    return payload.isEmpty() ? fetched.get().fields() : payload;
  }

  private ItemResult skip(QueueItem item, String claimToken, String reason) throws SQLException {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      guard(item, queueStore.complete(conn, item.id(), claimToken, clock.instant(), reason));
    }
    metrics.incrementSkipped();
    logger.log(Level.FINE, "Skipped item {0}: {1}", new Object[]{item.id(), reason});
    return ItemResult.SKIPPED;
  }

  private ItemResult reconcileAndRecord(QueueItem item, String claimToken, Map<String, Object> remote)
      throws SQLException {
    ItemResult result;
    ReconcileOutcome outcome = null;
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(false);
      try {
        Instant now = clock.instant();
        Optional<LocalRecord> local = localRecordStore.findForUpdate(conn, item.entityType(), item.externalCode());
        if (item.operation() == SyncOperation.EXTINCTION && local.isEmpty()) {
          guard(item, queueStore.complete(conn, item.id(), claimToken, now, "Entity not present locally"));
          result = ItemResult.SUCCEEDED;
        } else {
          outcome = reconciler.reconcile(remote, local.orElse(null));
          result = record(conn, item, claimToken, outcome, local.orElse(null), remote, now);
        }
        conn.commit();
      } catch (SQLException | RuntimeException e) {
        conn.rollback();
        throw e;
      }
    }

    if (result == ItemResult.CONFLICT) {
      metrics.incrementConflict();
      ReconcileOutcome.Conflict conflict = (ReconcileOutcome.Conflict) outcome;
      logger.log(Level.WARNING, "Conflict on {0} {1} (item {2}): fields {3}",
          new Object[]{item.entityType(), item.externalCode(), item.id(), conflict.diff()});
    } else {
      metrics.incrementCompleted();
    }
    return result;
  }

  private ItemResult record(Connection conn, QueueItem item, String claimToken, ReconcileOutcome outcome,
      LocalRecord local, Map<String, Object> remote, Instant now) {
    if (outcome instanceof ReconcileOutcome.Apply apply) {
      localRecordStore.apply(conn, item.entityType(), item.externalCode(), apply.changes(), apply.baseline(), now);
      historyStore.record(conn, SyncHistoryEntry.forChanges(item, item.operation().name(), HistorySource.SYNC,
          local, apply.changes(), null, workerId, now));
      guard(item, queueStore.complete(conn, item.id(), claimToken, now, null));
      return ItemResult.SUCCEEDED;
    }
    if (outcome instanceof ReconcileOutcome.Conflict conflict) {
      guard(item, queueStore.markConflict(conn, item.id(), claimToken, now,
          jsonCodec.toJson(conflict.diff()),
          jsonCodec.toJson(conflict.localValue()),
          jsonCodec.toJson(conflict.remoteValue()),
          jsonCodec.toJson(remote)));
      return ItemResult.CONFLICT;
    }
    guard(item, queueStore.complete(conn, item.id(), claimToken, now, "No changes"));
    return ItemResult.SUCCEEDED;
  }

  private ItemResult failRetryable(QueueItem item, String claimToken, Exception failure) {
    int attempt = item.attempts() + 1;
    if (attempt >= item.maxAttempts()) {
      return failTerminal(item, claimToken, failure, attempt);
    }
    long delayMs = retryPolicy.computeDelayMs(item.attempts());
    Instant now = clock.instant();
    Instant nextAttemptAt = now.plusMillis(delayMs);
    String details = errorDetails(failure, attempt, delayMs);
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      guard(item, queueStore.failRetry(conn, item.id(), claimToken, now, nextAttemptAt,
          errorMessage(failure), details));
    } catch (ClaimLostException e) {
      return claimLost(item);
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to schedule retry for item " + item.id(), e);
      return ItemResult.UNRECORDED;
    }
    metrics.incrementRetried();
    logger.log(Level.FINE, "Item {0} failed attempt {1}, retrying in {2} ms",
        new Object[]{item.id(), attempt, delayMs});
    return ItemResult.RETRY_SCHEDULED;
  }

  private ItemResult failTerminal(QueueItem item, String claimToken, Exception failure, int attempt) {
    String details = errorDetails(failure, attempt, null);
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      guard(item, queueStore.failTerminal(conn, item.id(), claimToken, clock.instant(),
          errorMessage(failure), details));
    } catch (ClaimLostException e) {
      return claimLost(item);
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to mark FAILED for item " + item.id(), e);
      return ItemResult.UNRECORDED;
    }
    metrics.incrementFailed();
    logger.log(Level.FINE, "Item {0} failed terminally after attempt {1}: {2}",
        new Object[]{item.id(), attempt, errorMessage(failure)});
    return ItemResult.FAILED;
  }

  private ItemResult claimLost(QueueItem item) {
    metrics.incrementClaimLost();
    logger.log(Level.WARNING, "Claim lost for item {0}; outcome discarded", item.id());
    return ItemResult.CLAIM_LOST;
  }

  private String errorDetails(Exception failure, int attempt, Long nextRetryDelayMs) {
    Map<String, Object> details = new LinkedHashMap<>();
    details.put("error", errorMessage(failure));
    details.put("exception", failure.getClass().getName());
    details.put("attempt", attempt);
    details.put("next_retry_delay_ms", nextRetryDelayMs);
    details.put("worker_id", workerId);
    return jsonCodec.toJson(details);
  }

  private static String errorMessage(Exception failure) {
    String message = failure.getMessage();
    return message == null || message.isBlank() ? failure.getClass().getSimpleName() : message;
  }

  private static void guard(QueueItem item, int rows) {
    if (rows == 0) {
      throw new ClaimLostException(item.id());
    }
  }
}
