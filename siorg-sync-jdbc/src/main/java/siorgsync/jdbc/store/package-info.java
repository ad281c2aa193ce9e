/**
 * JDBC-based {@link siorgsync.spi.SyncQueueStore} implementations.
 *
 * <p>{@link siorgsync.jdbc.store.AbstractJdbcSyncQueueStore} provides shared SQL and row
 * mapping; subclasses supply database-specific claim strategies: H2 (two-phase conditional
 * update) and PostgreSQL ({@code FOR UPDATE SKIP LOCKED}).
 *
 * @see siorgsync.jdbc.store.H2SyncQueueStore
 * @see siorgsync.jdbc.store.PostgresSyncQueueStore
 * @see siorgsync.jdbc.store.JdbcSyncQueueStores
 */
package siorgsync.jdbc.store;
