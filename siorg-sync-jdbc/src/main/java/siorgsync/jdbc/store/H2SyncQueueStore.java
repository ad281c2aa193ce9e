package siorgsync.jdbc.store;

import java.util.List;

/**
 * H2 sync queue store. Primarily for tests and local runs.
 *
 * <p>Uses the default two-phase claim from {@link AbstractJdbcSyncQueueStore}.
 */
public final class H2SyncQueueStore extends AbstractJdbcSyncQueueStore {

  public H2SyncQueueStore() {
    super();
  }

  public H2SyncQueueStore(String tableName) {
    super(tableName);
  }

  @Override
  public AbstractJdbcSyncQueueStore withTableName(String tableName) {
    return new H2SyncQueueStore(tableName);
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }
}
