package siorgsync.jdbc;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import siorgsync.jdbc.history.JdbcSyncHistoryStore;
import siorgsync.jdbc.local.JdbcLocalRecordStore;
import siorgsync.jdbc.store.H2SyncQueueStore;
import siorgsync.model.EntityType;
import siorgsync.model.HistorySource;
import siorgsync.model.LocalRecord;
import siorgsync.model.NewQueueItem;
import siorgsync.model.QueueItem;
import siorgsync.model.SyncHistoryEntry;
import siorgsync.model.SyncOperation;
import siorgsync.model.SyncStatus;
import siorgsync.registry.RegistryRejectedException;
import siorgsync.registry.RegistryUnavailableException;
import siorgsync.util.JsonCodec;
import siorgsync.worker.BatchStats;
import siorgsync.worker.ExponentialBackoffRetryPolicy;
import siorgsync.worker.SyncWorker;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SyncWorkerTest {
  private static final Duration LEASE = Duration.ofMinutes(5);

  private JdbcDataSource dataSource;
  private final H2SyncQueueStore queueStore = new H2SyncQueueStore();
  private final JdbcLocalRecordStore localStore = new JdbcLocalRecordStore();
  private final JdbcSyncHistoryStore historyStore = new JdbcSyncHistoryStore();
  private final JsonCodec json = JsonCodec.getDefault();
  private StubRegistryClient registry;
  private RecordingMetrics metrics;
  private MutableClock clock;

  @BeforeEach
  void setUp() throws SQLException {
    dataSource = H2Database.create();
    registry = new StubRegistryClient();
    metrics = new RecordingMetrics();
    clock = MutableClock.startingNow();
  }

  @Test
  void remoteUpdateIsAppliedAndCompleted() throws SQLException {
    synced(EntityType.UNIT, "U123", Map.of("name", "Old"));
    registry.put(EntityType.UNIT, "U123", Map.of("name", "Dept A"));
    String id = enqueue(EntityType.UNIT, SyncOperation.UPDATE, "U123", "{\"name\":\"Dept A\"}");

    try (SyncWorker worker = worker().build()) {
      BatchStats stats = worker.runOnce();
      assertEquals(1, stats.processed());
      assertEquals(1, stats.succeeded());
    }

    QueueItem item = find(id);
    assertEquals(SyncStatus.COMPLETED, item.status());
    assertEquals("worker-test", item.processedBy());
    assertEquals(clock.instant(), item.processedAt());
    LocalRecord local = local(EntityType.UNIT, "U123");
    assertEquals("Dept A", local.fields().get("name"));
    assertEquals("Dept A", local.baseline().get("name"));
    assertEquals(1, metrics.claimed.get());
    assertEquals(1, metrics.completed.get());
    assertEquals(1, metrics.lastBatchSize);
  }

  @Test
  void concurrentLocalEditBecomesConflict() throws SQLException {
    synced(EntityType.UNIT, "U123", Map.of("name", "Old"));
    edit(EntityType.UNIT, "U123", Map.of("name", "Local"));
    registry.put(EntityType.UNIT, "U123", Map.of("name", "Remote"));
    String id = enqueue(EntityType.UNIT, SyncOperation.UPDATE, "U123", "{\"name\":\"Remote\"}");

    try (SyncWorker worker = worker().build()) {
      BatchStats stats = worker.runOnce();
      assertEquals(1, stats.conflicts());
    }

    QueueItem item = find(id);
    assertEquals(SyncStatus.CONFLICT, item.status());
    assertEquals(0, item.attempts());
    assertEquals("[\"name\"]", item.detectedChangesJson());
    assertEquals("Local", json.parseObject(item.localValueJson()).get("name"));
    assertEquals("Remote", json.parseObject(item.remoteValueJson()).get("name"));
    assertEquals(Map.of("name", "Remote"), json.parseObject(item.remoteSnapshotJson()));
    assertEquals("Local", local(EntityType.UNIT, "U123").fields().get("name"));
    assertEquals(1, metrics.conflicts.get());
  }

  @Test
  void conflictKeepsFullRemoteSnapshot() throws SQLException {
    synced(EntityType.UNIT, "U1", Map.of("name", "Old", "acronym", "OLD"));
    edit(EntityType.UNIT, "U1", Map.of("name", "Local"));
    registry.put(EntityType.UNIT, "U1", Map.of("name", "Remote", "acronym", "NEW"));
    String id = enqueue(EntityType.UNIT, SyncOperation.UPDATE, "U1", "{\"name\":\"Remote\",\"acronym\":\"NEW\"}");

    try (SyncWorker worker = worker().build()) {
      worker.runOnce();
    }

    QueueItem item = find(id);
    assertEquals(SyncStatus.CONFLICT, item.status());
    assertEquals(Map.of("name", "Remote"), json.parseObject(item.remoteValueJson()));
    assertEquals(Map.of("name", "Remote", "acronym", "NEW"), json.parseObject(item.remoteSnapshotJson()));
    assertEquals("OLD", local(EntityType.UNIT, "U1").fields().get("acronym"));
    assertTrue(history(EntityType.UNIT, "U1").isEmpty());
  }

  @Test
  void appliedChangesAreRecordedInHistory() throws SQLException {
    synced(EntityType.UNIT, "U1", Map.of("name", "Old", "acronym", "SAME"));
    registry.put(EntityType.UNIT, "U1", Map.of("name", "New", "acronym", "SAME"));
    String id = enqueue(EntityType.UNIT, SyncOperation.UPDATE, "U1", "{\"name\":\"New\",\"acronym\":\"SAME\"}");

    try (SyncWorker worker = worker().build()) {
      worker.runOnce();
    }

    List<SyncHistoryEntry> history = history(EntityType.UNIT, "U1");
    assertEquals(1, history.size());
    SyncHistoryEntry entry = history.get(0);
    assertEquals(id, entry.queueItemId());
    assertEquals("UPDATE", entry.changeType());
    assertEquals(HistorySource.SYNC, entry.source());
    assertEquals(Map.of("name", "Old"), entry.previousData());
    assertEquals(Map.of("name", "New"), entry.newData());
    assertEquals(List.of("name"), entry.affectedFields());
    assertEquals("worker-test", entry.createdBy());
    assertEquals(clock.instant(), entry.createdAt());
  }

  @Test
  void creationHasNoPreviousDataInHistory() throws SQLException {
    registry.put(EntityType.UNIT, "U9", Map.of("name", "Fresh"));
    enqueue(EntityType.UNIT, SyncOperation.CREATION, "U9", "{\"name\":\"Fresh\"}");

    try (SyncWorker worker = worker().build()) {
      worker.runOnce();
    }

    SyncHistoryEntry entry = history(EntityType.UNIT, "U9").get(0);
    assertEquals("CREATION", entry.changeType());
    assertNull(entry.previousData());
    assertEquals(Map.of("name", "Fresh"), entry.newData());
  }

  @Test
  void noChangeWritesNoHistory() throws SQLException {
    synced(EntityType.ORGANIZATION, "O1", Map.of("name", "Org"));
    registry.put(EntityType.ORGANIZATION, "O1", Map.of("name", "Org"));
    enqueue(EntityType.ORGANIZATION, SyncOperation.UPDATE, "O1", "{\"name\":\"Org\"}");

    try (SyncWorker worker = worker().build()) {
      worker.runOnce();
    }

    assertTrue(history(EntityType.ORGANIZATION, "O1").isEmpty());
  }

  @Test
  void identicalRemoteCompletesWithNoChanges() throws SQLException {
    synced(EntityType.ORGANIZATION, "O1", Map.of("name", "Org"));
    registry.put(EntityType.ORGANIZATION, "O1", Map.of("name", "Org"));
    String id = enqueue(EntityType.ORGANIZATION, SyncOperation.UPDATE, "O1", "{\"name\":\"Org\"}");

    try (SyncWorker worker = worker().build()) {
      worker.runOnce();
    }

    QueueItem item = find(id);
    assertEquals(SyncStatus.COMPLETED, item.status());
    assertEquals("No changes", item.resolutionNotes());
  }

  @Test
  void emptyPayloadIsHydratedFromRegistry() throws SQLException {
    registry.put(EntityType.UNIT, "U7", Map.of("name", "Fetched", "acronym", "FTD"));
    enqueue(EntityType.UNIT, SyncOperation.CREATION, "U7", "{}");

    try (SyncWorker worker = worker().build()) {
      worker.runOnce();
    }

    LocalRecord local = local(EntityType.UNIT, "U7");
    assertEquals("Fetched", local.fields().get("name"));
    assertEquals("FTD", local.fields().get("acronym"));
  }

  @Test
  void unavailableRegistryRetriesUntilMaxAttempts() throws SQLException {
    registry.failAlways(new RegistryUnavailableException("registry down"));
    String id = enqueue(EntityType.UNIT, SyncOperation.UPDATE, "U1", "{\"name\":\"A\"}");

    try (SyncWorker worker = worker().build()) {
      BatchStats first = worker.runOnce();
      assertEquals(1, first.failed());
      QueueItem afterFirst = find(id);
      assertEquals(SyncStatus.PENDING, afterFirst.status());
      assertEquals(1, afterFirst.attempts());
      assertEquals(clock.instant().plusMillis(10), afterFirst.nextAttemptAt());
      Map<String, Object> details = json.parseObject(afterFirst.errorDetailsJson());
      assertEquals("registry down", details.get("error"));
      assertEquals(1, ((Number) details.get("attempt")).intValue());
      assertEquals(10, ((Number) details.get("next_retry_delay_ms")).intValue());
      assertEquals("worker-test", details.get("worker_id"));

      // not due yet
      assertEquals(0, worker.runOnce().processed());

      clock.advance(Duration.ofSeconds(1));
      worker.runOnce();
      assertEquals(2, find(id).attempts());
      assertEquals(clock.instant().plusMillis(20), find(id).nextAttemptAt());

      clock.advance(Duration.ofSeconds(1));
      worker.runOnce();
    }

    QueueItem item = find(id);
    assertEquals(SyncStatus.FAILED, item.status());
    assertEquals(3, item.attempts());
    assertEquals("registry down", item.lastError());
    assertEquals(3, registry.calls());
    assertEquals(2, metrics.retried.get());
    assertEquals(1, metrics.failed.get());
  }

  @Test
  void lastRemainingAttemptGoesStraightToFailed() throws SQLException {
    registry.failNext(new RegistryUnavailableException("timeout"));
    NewQueueItem item = NewQueueItem.builder(EntityType.UNIT, SyncOperation.UPDATE, "U1")
        .payloadJson("{\"name\":\"A\"}")
        .maxAttempts(1)
        .createdAt(clock.instant())
        .build();
    insert(item);

    try (SyncWorker worker = worker().build()) {
      worker.runOnce();
    }

    QueueItem stored = find(item.id());
    assertEquals(SyncStatus.FAILED, stored.status());
    assertEquals(1, stored.attempts());
  }

  @Test
  void rejectedRequestFailsWithoutRetry() throws SQLException {
    registry.failNext(new RegistryRejectedException("Registry rejected request (HTTP 422)", 422));
    String id = enqueue(EntityType.UNIT, SyncOperation.UPDATE, "U1", "{\"name\":\"A\"}");

    try (SyncWorker worker = worker().build()) {
      worker.runOnce();
    }

    QueueItem item = find(id);
    assertEquals(SyncStatus.FAILED, item.status());
    assertEquals(1, item.attempts());
    assertTrue(item.lastError().contains("422"));
  }

  @Test
  void unknownEntityInRegistryFails() throws SQLException {
    String id = enqueue(EntityType.UNIT, SyncOperation.UPDATE, "NOPE", "{\"name\":\"A\"}");

    try (SyncWorker worker = worker().build()) {
      worker.runOnce();
    }

    QueueItem item = find(id);
    assertEquals(SyncStatus.FAILED, item.status());
    assertTrue(item.lastError().contains("NOPE"));
  }

  @Test
  void malformedPayloadFailsWithoutCallingRegistry() throws SQLException {
    String id = enqueue(EntityType.UNIT, SyncOperation.UPDATE, "U1", "[1,2,3]");

    try (SyncWorker worker = worker().build()) {
      worker.runOnce();
    }

    assertEquals(SyncStatus.FAILED, find(id).status());
    assertEquals(0, registry.calls());
  }

  @Test
  void locallyManagedTypesAndStructuralOperationsAreSkipped() throws SQLException {
    String category = enqueue(EntityType.CATEGORY, SyncOperation.UPDATE, "C1", "{\"name\":\"X\"}");
    String merge = enqueue(EntityType.UNIT, SyncOperation.MERGE, "U1", "{}");

    try (SyncWorker worker = worker().build()) {
      BatchStats stats = worker.runOnce();
      assertEquals(2, stats.skipped());
    }

    assertEquals(SyncStatus.COMPLETED, find(category).status());
    assertEquals("Skipped: CATEGORY entities are managed locally", find(category).resolutionNotes());
    assertEquals("Skipped: MERGE requires manual review", find(merge).resolutionNotes());
    assertEquals(0, registry.calls());
    assertTrue(localRecord(EntityType.CATEGORY, "C1").isEmpty());
    assertEquals(2, metrics.skipped.get());
  }

  @Test
  void extinctionDeactivatesLocalRecord() throws SQLException {
    synced(EntityType.UNIT, "U5", Map.of("name", "Closing", "active", true));
    String id = enqueue(EntityType.UNIT, SyncOperation.EXTINCTION, "U5", "{}");

    try (SyncWorker worker = worker().build()) {
      worker.runOnce();
    }

    assertEquals(SyncStatus.COMPLETED, find(id).status());
    LocalRecord local = local(EntityType.UNIT, "U5");
    assertEquals(Boolean.FALSE, local.fields().get("active"));
    assertEquals("Closing", local.fields().get("name"));
  }

  @Test
  void extinctionOfUnknownEntityCompletesWithoutCreatingIt() throws SQLException {
    String id = enqueue(EntityType.UNIT, SyncOperation.EXTINCTION, "U404", "{}");

    try (SyncWorker worker = worker().build()) {
      worker.runOnce();
    }

    QueueItem item = find(id);
    assertEquals(SyncStatus.COMPLETED, item.status());
    assertEquals("Entity not present locally", item.resolutionNotes());
    assertTrue(localRecord(EntityType.UNIT, "U404").isEmpty());
  }

  @Test
  void outcomeIsDiscardedWhenClaimIsLost() throws SQLException {
    registry.put(EntityType.UNIT, "U1", Map.of("name", "A"));
    String id = enqueue(EntityType.UNIT, SyncOperation.UPDATE, "U1", "{\"name\":\"A\"}");
    registry.onFetch(() -> stealClaim(id, "other-token"));

    try (SyncWorker worker = worker().build()) {
      BatchStats stats = worker.runOnce();
      assertEquals(1, stats.skipped());
    }

    QueueItem item = find(id);
    assertEquals(SyncStatus.PROCESSING, item.status());
    assertEquals("other-token", item.claimToken());
    assertTrue(localRecord(EntityType.UNIT, "U1").isEmpty());
    assertEquals(1, metrics.claimLost.get());
  }

  @Test
  void abandonedItemIsReclaimedAfterLease() throws SQLException {
    registry.put(EntityType.UNIT, "U1", Map.of("name", "A"));
    String id = enqueue(EntityType.UNIT, SyncOperation.UPDATE, "U1", "{\"name\":\"A\"}");
    crashedClaim("dead-worker");

    try (SyncWorker worker = worker().build()) {
      assertEquals(0, worker.runOnce().processed());
      clock.advance(LEASE);
      assertEquals(1, worker.runOnce().succeeded());
    }

    QueueItem item = find(id);
    assertEquals(SyncStatus.COMPLETED, item.status());
    assertEquals(1, item.attempts());
    assertEquals("worker-test", item.processedBy());
  }

  @Test
  void leaseExpiredOnFinalAttemptFails() throws SQLException {
    NewQueueItem item = NewQueueItem.builder(EntityType.UNIT, SyncOperation.UPDATE, "U1")
        .payloadJson("{\"name\":\"A\"}")
        .maxAttempts(1)
        .createdAt(clock.instant())
        .build();
    insert(item);
    crashedClaim("dead-worker");
    clock.advance(LEASE);

    try (SyncWorker worker = worker().build()) {
      assertEquals(1, worker.runOnce().failed());
    }

    QueueItem stored = find(item.id());
    assertEquals(SyncStatus.FAILED, stored.status());
    assertEquals(1, stored.attempts());
    assertEquals("Lease expired on the final attempt", stored.lastError());
    assertEquals(0, registry.calls());
  }

  @Test
  void itemsForTheSameEntityApplyInClaimOrder() throws SQLException {
    registry.put(EntityType.UNIT, "U1", Map.of("name", "B"));
    registry.put(EntityType.UNIT, "U2", Map.of("name", "X"));
    insert(NewQueueItem.builder(EntityType.UNIT, SyncOperation.UPDATE, "U1")
        .payloadJson("{\"name\":\"A\"}").createdAt(clock.instant().minusSeconds(3)).build());
    insert(NewQueueItem.builder(EntityType.UNIT, SyncOperation.UPDATE, "U2")
        .payloadJson("{\"name\":\"X\"}").createdAt(clock.instant().minusSeconds(2)).build());
    insert(NewQueueItem.builder(EntityType.UNIT, SyncOperation.UPDATE, "U1")
        .payloadJson("{\"name\":\"B\"}").createdAt(clock.instant().minusSeconds(1)).build());

    try (SyncWorker worker = worker().concurrency(4).build()) {
      BatchStats stats = worker.runOnce();
      assertEquals(3, stats.processed());
      assertEquals(3, stats.succeeded());
    }

    assertEquals("B", local(EntityType.UNIT, "U1").fields().get("name"));
    assertEquals("X", local(EntityType.UNIT, "U2").fields().get("name"));
  }

  @Test
  void batchSizeLimitsOneCycle() throws SQLException {
    for (int i = 0; i < 5; i++) {
      registry.put(EntityType.UNIT, "U" + i, Map.of("name", "N" + i));
      enqueue(EntityType.UNIT, SyncOperation.UPDATE, "U" + i, "{}");
    }

    try (SyncWorker worker = worker().batchSize(2).build()) {
      assertEquals(2, worker.runOnce().processed());
      assertEquals(2, worker.runOnce().processed());
      assertEquals(1, worker.runOnce().processed());
      assertEquals(0, worker.runOnce().processed());
    }
  }

  @Test
  void startedWorkerDrainsQueueInBackground() throws Exception {
    registry.put(EntityType.UNIT, "U1", Map.of("name", "A"));
    String id = enqueue(EntityType.UNIT, SyncOperation.UPDATE, "U1", "{}");

    try (SyncWorker worker = worker().pollInterval(Duration.ofMillis(50)).build()) {
      worker.start();
      worker.start();
      long deadline = System.currentTimeMillis() + 5000;
      while (find(id).status() != SyncStatus.COMPLETED && System.currentTimeMillis() < deadline) {
        Thread.sleep(20);
      }
    }

    assertEquals(SyncStatus.COMPLETED, find(id).status());
  }

  @Test
  void closedWorkerClaimsNothing() throws SQLException {
    String id = enqueue(EntityType.UNIT, SyncOperation.UPDATE, "U1", "{}");
    SyncWorker worker = worker().build();
    worker.close();

    assertEquals(0, worker.runOnce().processed());
    assertEquals(SyncStatus.PENDING, find(id).status());
    assertThrows(IllegalStateException.class, worker::start);
  }

  @Test
  void builderRejectsInvalidSettings() {
    assertThrows(NullPointerException.class, () -> SyncWorker.builder()
        .queueStore(queueStore)
        .localRecordStore(localStore)
        .historyStore(historyStore)
        .registryClient(registry)
        .build());
    assertThrows(IllegalArgumentException.class, () -> worker().batchSize(0).build());
    assertThrows(IllegalArgumentException.class, () -> worker().concurrency(0).build());
    assertThrows(IllegalArgumentException.class, () -> worker().leaseDuration(Duration.ZERO).build());
    assertThrows(IllegalArgumentException.class, () -> worker().pollInterval(Duration.ofSeconds(-1)).build());
  }

  @Test
  void generatesWorkerIdWhenNotSet() {
    try (SyncWorker worker = SyncWorker.builder()
        .connectionProvider(dataSource::getConnection)
        .queueStore(queueStore)
        .localRecordStore(localStore)
        .historyStore(historyStore)
        .registryClient(registry)
        .build()) {
      assertTrue(worker.workerId().startsWith("worker-"));
      assertFalse(worker.workerId().equals("worker-"));
    }
  }

  private SyncWorker.Builder worker() {
    return SyncWorker.builder()
        .connectionProvider(dataSource::getConnection)
        .queueStore(queueStore)
        .localRecordStore(localStore)
        .historyStore(historyStore)
        .registryClient(registry)
        .retryPolicy(new ExponentialBackoffRetryPolicy(10, 1000, 0))
        .metrics(metrics)
        .clock(clock)
        .workerId("worker-test")
        .leaseDuration(LEASE)
        .concurrency(1);
  }

  private String enqueue(EntityType type, SyncOperation operation, String code, String payload)
      throws SQLException {
    NewQueueItem item = NewQueueItem.builder(type, operation, code)
        .payloadJson(payload)
        .createdAt(clock.instant())
        .build();
    insert(item);
    return item.id();
  }

  private List<SyncHistoryEntry> history(EntityType type, String code) throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      return historyStore.listForEntity(conn, type, code, 10);
    }
  }

  private void insert(NewQueueItem item) throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      queueStore.insert(conn, item);
    }
  }

  private void synced(EntityType type, String code, Map<String, Object> fields) throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      localStore.apply(conn, type, code, fields, fields, clock.instant().minusSeconds(3600));
    }
  }

  private void edit(EntityType type, String code, Map<String, Object> fields) throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      localStore.editFields(conn, type, code, fields, clock.instant().minusSeconds(60));
    }
  }

  private void crashedClaim(String workerId) throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      conn.setAutoCommit(false);
      queueStore.claimBatch(conn, workerId, "crashed-token", clock.instant(), clock.instant().minus(LEASE), 10);
      conn.commit();
    }
  }

  private void stealClaim(String id, String token) {
    try (Connection conn = dataSource.getConnection();
         PreparedStatement ps = conn.prepareStatement(
             "UPDATE siorg_sync_queue SET claim_token=?, claimed_by='other-worker' WHERE id=?")) {
      ps.setString(1, token);
      ps.setString(2, id);
      ps.executeUpdate();
    } catch (SQLException e) {
      throw new IllegalStateException(e);
    }
  }

  private QueueItem find(String id) throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      return queueStore.findById(conn, id).orElseThrow();
    }
  }

  private LocalRecord local(EntityType type, String code) throws SQLException {
    return localRecord(type, code).orElseThrow();
  }

  private java.util.Optional<LocalRecord> localRecord(EntityType type, String code) throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      return localStore.find(conn, type, code);
    }
  }
}
