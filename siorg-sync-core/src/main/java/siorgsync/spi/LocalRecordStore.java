package siorgsync.spi;

import siorgsync.model.EntityType;
import siorgsync.model.LocalRecord;

import java.sql.Connection;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Access to the local copies of registry entities and their sync baselines.
 *
 * <p>The worker reads and writes through the same connection it uses to record the queue
 * outcome, so an applied change and the COMPLETED transition commit together.
 */
public interface LocalRecordStore {

  /**
   * Reads the local record, locking it until the surrounding transaction ends.
   *
   * @return the record, or empty when the entity does not exist locally
   */
  Optional<LocalRecord> findForUpdate(Connection conn, EntityType entityType, String externalCode);

  /**
   * Writes {@code changes} over the current fields and {@code baseline} over the current
   * baseline, creating the record when it does not exist.
   *
   * @param changes  field values to write (may be empty to advance only the baseline)
   * @param baseline remote field values now known to be in sync
   * @param syncedAt time of this sync
   */
  void apply(Connection conn, EntityType entityType, String externalCode,
      Map<String, Object> changes, Map<String, Object> baseline, Instant syncedAt);
}
