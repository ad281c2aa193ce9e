package siorgsync.model;

import java.util.EnumMap;
import java.util.Map;

/**
 * Item counts per status, as shown on the operator dashboard.
 */
public record QueueStats(long pending, long processing, long completed, long failed, long conflict) {

  public long total() {
    return pending + processing + completed + failed + conflict;
  }

  /**
   * Builds stats from a (possibly sparse) per-status count map; missing statuses count as zero.
   */
  public static QueueStats of(Map<SyncStatus, Long> counts) {
    Map<SyncStatus, Long> all = new EnumMap<>(SyncStatus.class);
    for (SyncStatus status : SyncStatus.values()) {
      all.put(status, counts.getOrDefault(status, 0L));
    }
    return new QueueStats(
        all.get(SyncStatus.PENDING),
        all.get(SyncStatus.PROCESSING),
        all.get(SyncStatus.COMPLETED),
        all.get(SyncStatus.FAILED),
        all.get(SyncStatus.CONFLICT));
  }
}
