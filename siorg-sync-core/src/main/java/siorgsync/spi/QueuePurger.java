package siorgsync.spi;

import java.sql.Connection;
import java.time.Instant;

/**
 * Deletes queue items that no longer need processing.
 *
 * @see siorgsync.cleanup.CleanupScheduler
 * @see siorgsync.jdbc.purge.JdbcQueuePurger
 */
public interface QueuePurger {

  /**
   * Deletes up to {@code limit} PENDING items whose {@code expires_at <= now}.
   *
   * @return the number of rows deleted
   */
  int purgeExpired(Connection conn, Instant now, int limit);

  /**
   * Deletes up to {@code limit} COMPLETED items processed before {@code before}.
   *
   * @return the number of rows deleted
   */
  int purgeCompleted(Connection conn, Instant before, int limit);
}
