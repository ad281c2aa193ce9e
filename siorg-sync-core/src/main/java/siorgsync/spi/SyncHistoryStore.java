package siorgsync.spi;

import siorgsync.model.EntityType;
import siorgsync.model.SyncHistoryEntry;

import java.sql.Connection;
import java.util.List;

/**
 * Audit trail of changes the sync pipeline made to local entities.
 *
 * <p>Entries are written through the caller's connection, inside the transaction that
 * changes the local record, so a rolled-back change leaves no entry behind.
 *
 * @see siorgsync.jdbc.history.JdbcSyncHistoryStore
 */
public interface SyncHistoryStore {

  /**
   * Store that records nothing and lists nothing.
   */
  SyncHistoryStore NOOP = new Noop();

  void record(Connection conn, SyncHistoryEntry entry);

  /**
   * Lists the entries of one entity, newest first.
   */
  List<SyncHistoryEntry> listForEntity(Connection conn, EntityType entityType, String externalCode, int limit);

  final class Noop implements SyncHistoryStore {
    @Override
    public void record(Connection conn, SyncHistoryEntry entry) {
    }

    @Override
    public List<SyncHistoryEntry> listForEntity(Connection conn, EntityType entityType,
        String externalCode, int limit) {
      return List.of();
    }
  }
}
