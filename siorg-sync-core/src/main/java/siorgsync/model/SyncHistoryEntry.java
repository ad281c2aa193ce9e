package siorgsync.model;

import com.github.f4b6a3.ulid.UlidCreator;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One audit record of a change made to a local entity by the sync pipeline.
 *
 * <p>{@code changeType} is the queue operation for worker writes ({@code UPDATE},
 * {@code CREATION}, ...) and the resolution name for operator writes
 * ({@code ACCEPT_REMOTE}, {@code MERGE}, ...). {@code previousData} holds the local values
 * of the affected fields before the change and is {@code null} when the entity did not
 * exist locally; {@code newData} holds the values written.
 */
public record SyncHistoryEntry(
    String id,
    String queueItemId,
    EntityType entityType,
    String externalCode,
    String changeType,
    HistorySource source,
    Map<String, Object> previousData,
    Map<String, Object> newData,
    List<String> affectedFields,
    String notes,
    String createdBy,
    Instant createdAt
) {

  public SyncHistoryEntry {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(entityType, "entityType");
    Objects.requireNonNull(externalCode, "externalCode");
    Objects.requireNonNull(changeType, "changeType");
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(createdAt, "createdAt");
    previousData = copy(previousData);
    newData = copy(newData);
    affectedFields = affectedFields == null ? List.of() : List.copyOf(affectedFields);
  }

  private static SyncHistoryEntry forItem(QueueItem item, String changeType, HistorySource source,
      Map<String, Object> previousData, Map<String, Object> newData, List<String> affectedFields,
      String notes, String createdBy, Instant createdAt) {
    return new SyncHistoryEntry(UlidCreator.getMonotonicUlid().toString(), item.id(),
        item.entityType(), item.externalCode(), changeType, source,
        previousData, newData, affectedFields, notes, createdBy, createdAt);
  }

  /**
   * Creates an entry for {@code changes} written over {@code local}. The previous data are
   * the local values of the changed fields, or {@code null} when {@code local} is
   * {@code null}; the affected fields are the changed field names, sorted.
   */
  public static SyncHistoryEntry forChanges(QueueItem item, String changeType, HistorySource source,
      LocalRecord local, Map<String, Object> changes, String notes, String createdBy, Instant createdAt) {
    Map<String, Object> previous = null;
    if (local != null) {
      previous = new LinkedHashMap<>();
      for (String field : changes.keySet()) {
        previous.put(field, local.fields().get(field));
      }
    }
    List<String> affected = new ArrayList<>(changes.keySet());
    Collections.sort(affected);
    return forItem(item, changeType, source, previous, changes, affected, notes, createdBy, createdAt);
  }

  // JSON null values are legal, so Map.copyOf does not fit
  private static Map<String, Object> copy(Map<String, Object> map) {
    return map == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(map));
  }
}
