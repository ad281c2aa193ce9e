package siorgsync.jdbc;

import org.junit.jupiter.api.Test;
import siorgsync.jdbc.store.AbstractJdbcSyncQueueStore;
import siorgsync.jdbc.store.H2SyncQueueStore;
import siorgsync.jdbc.store.JdbcSyncQueueStores;
import siorgsync.jdbc.store.PostgresSyncQueueStore;

import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JdbcSyncQueueStoresTest {

  @Test
  void detectsFromJdbcUrl() {
    assertInstanceOf(PostgresSyncQueueStore.class,
        JdbcSyncQueueStores.detect("jdbc:postgresql://localhost:5432/siorg"));
    assertInstanceOf(H2SyncQueueStore.class, JdbcSyncQueueStores.detect("jdbc:h2:mem:test"));
    assertInstanceOf(H2SyncQueueStore.class, JdbcSyncQueueStores.detect("JDBC:H2:mem:upper"));
  }

  @Test
  void unsupportedUrlListsKnownPrefixes() {
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
        () -> JdbcSyncQueueStores.detect("jdbc:mysql://x/y"));
    assertTrue(e.getMessage().contains("jdbc:postgresql:"));
    assertThrows(IllegalArgumentException.class, () -> JdbcSyncQueueStores.detect(""));
  }

  @Test
  void detectsFromDataSource() throws SQLException {
    assertInstanceOf(H2SyncQueueStore.class, JdbcSyncQueueStores.detect(H2Database.create()));
  }

  @Test
  void unreachableDataSourceFails() {
    org.h2.jdbcx.JdbcDataSource broken = new org.h2.jdbcx.JdbcDataSource();
    broken.setURL("jdbc:h2:mem:missing;IFEXISTS=TRUE");
    assertThrows(IllegalStateException.class, () -> JdbcSyncQueueStores.detect(broken));
  }

  @Test
  void detectedStoreKeepsDialectWithCustomTable() {
    AbstractJdbcSyncQueueStore store = JdbcSyncQueueStores.detect("jdbc:postgresql://db/siorg")
        .withTableName("custom_queue");
    assertInstanceOf(PostgresSyncQueueStore.class, store);
  }
}
