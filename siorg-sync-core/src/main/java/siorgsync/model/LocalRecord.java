package siorgsync.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Snapshot of a local entity mirrored from the registry, together with its sync baseline.
 *
 * <p>{@code baseline} holds the field values written by the last successful sync. A field
 * whose current value differs from its baseline value has been edited locally since then.
 * A {@code null} baseline means the record was never synced.
 */
public record LocalRecord(
    EntityType entityType,
    String externalCode,
    Map<String, Object> fields,
    Map<String, Object> baseline,
    Instant lastSyncedAt,
    Instant updatedAt
) {

  public LocalRecord {
    Objects.requireNonNull(entityType, "entityType");
    Objects.requireNonNull(externalCode, "externalCode");
    fields = fields == null
        ? Collections.emptyMap()
        : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    baseline = baseline == null
        ? null
        : Collections.unmodifiableMap(new LinkedHashMap<>(baseline));
  }

  public boolean hasBaseline() {
    return baseline != null;
  }
}
