package siorgsync.jdbc;

/**
 * Unchecked exception wrapping JDBC errors thrown by the JDBC stores and purger.
 *
 * <p>The worker treats it as an infrastructure failure: the item is retried with backoff.
 */
public final class SyncQueueStoreException extends RuntimeException {
  public SyncQueueStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
