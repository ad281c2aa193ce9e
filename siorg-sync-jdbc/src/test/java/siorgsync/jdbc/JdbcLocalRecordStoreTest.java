package siorgsync.jdbc;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import siorgsync.jdbc.local.JdbcLocalRecordStore;
import siorgsync.model.EntityType;
import siorgsync.model.LocalRecord;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JdbcLocalRecordStoreTest {

  private JdbcDataSource dataSource;
  private JdbcLocalRecordStore store;
  private Instant now;

  @BeforeEach
  void setUp() throws SQLException {
    dataSource = H2Database.create();
    store = new JdbcLocalRecordStore();
    now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
  }

  @Test
  void applyCreatesMissingRecord() throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      store.apply(conn, EntityType.UNIT, "U1", Map.of("name", "Dept A"), Map.of("name", "Dept A"), now);

      LocalRecord record = store.find(conn, EntityType.UNIT, "U1").orElseThrow();
      assertEquals(Map.of("name", "Dept A"), record.fields());
      assertEquals(Map.of("name", "Dept A"), record.baseline());
      assertEquals(now, record.lastSyncedAt());
    }
  }

  @Test
  void applyMergesChangesAndBaselineOverExistingValues() throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      store.apply(conn, EntityType.UNIT, "U1",
          Map.of("name", "Dept A", "acronym", "DA"), Map.of("name", "Dept A", "acronym", "DA"), now);
      store.editFields(conn, EntityType.UNIT, "U1", Map.of("acronym", "DEP-A"), now.plusSeconds(1));

      store.apply(conn, EntityType.UNIT, "U1",
          Map.of("name", "Dept B"), Map.of("name", "Dept B", "acronym", "DA"), now.plusSeconds(2));

      LocalRecord record = store.find(conn, EntityType.UNIT, "U1").orElseThrow();
      assertEquals("Dept B", record.fields().get("name"));
      assertEquals("DEP-A", record.fields().get("acronym"));
      assertEquals(Map.of("name", "Dept B", "acronym", "DA"), record.baseline());
      assertEquals(now.plusSeconds(2), record.lastSyncedAt());
    }
  }

  @Test
  void editFieldsLeavesBaselineAlone() throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      store.apply(conn, EntityType.ORGANIZATION, "O1", Map.of("name", "Org"), Map.of("name", "Org"), now);
      store.editFields(conn, EntityType.ORGANIZATION, "O1", Map.of("name", "Org (local)"), now.plusSeconds(5));

      LocalRecord record = store.find(conn, EntityType.ORGANIZATION, "O1").orElseThrow();
      assertEquals("Org (local)", record.fields().get("name"));
      assertEquals("Org", record.baseline().get("name"));
      assertEquals(now, record.lastSyncedAt());
      assertEquals(now.plusSeconds(5), record.updatedAt());
    }
  }

  @Test
  void editFieldsOnMissingRecordCreatesUnsyncedRecord() throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      store.editFields(conn, EntityType.UNIT, "U9", Map.of("name", "Manual"), now);

      LocalRecord record = store.find(conn, EntityType.UNIT, "U9").orElseThrow();
      assertFalse(record.hasBaseline());
      assertNull(record.lastSyncedAt());
    }
  }

  @Test
  void findForUpdateInsideTransaction() throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      store.apply(conn, EntityType.UNIT, "U1", Map.of("name", "A"), Map.of("name", "A"), now);
      conn.setAutoCommit(false);
      assertTrue(store.findForUpdate(conn, EntityType.UNIT, "U1").isPresent());
      assertTrue(store.findForUpdate(conn, EntityType.UNIT, "missing").isEmpty());
      conn.commit();
    }
  }

  @Test
  void keysIncludeEntityType() throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      store.apply(conn, EntityType.UNIT, "X1", Map.of("name", "Unit"), Map.of("name", "Unit"), now);
      assertTrue(store.find(conn, EntityType.ORGANIZATION, "X1").isEmpty());
    }
  }
}
