/**
 * JDBC implementations of the sync queue SPIs.
 *
 * <p>{@link siorgsync.jdbc.store.AbstractJdbcSyncQueueStore} holds the shared SQL; H2 and
 * PostgreSQL subclasses differ in how they claim. {@link siorgsync.jdbc.local.JdbcLocalRecordStore}
 * keeps the local entity copies with their sync baselines, and
 * {@link siorgsync.jdbc.purge.JdbcQueuePurger} backs the cleanup task.
 *
 * @see siorgsync.jdbc.store.JdbcSyncQueueStores
 */
package siorgsync.jdbc;
