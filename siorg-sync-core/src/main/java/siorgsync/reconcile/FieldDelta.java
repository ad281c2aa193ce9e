package siorgsync.reconcile;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Per-field comparison of a remote snapshot with a local record.
 *
 * @param changes     remote values of fields that are safe to write
 * @param conflicting names of fields changed on both sides, sorted
 * @see Reconciler#delta
 */
public record FieldDelta(Map<String, Object> changes, List<String> conflicting) {

  public FieldDelta {
    changes = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(changes, "changes")));
    conflicting = List.copyOf(Objects.requireNonNull(conflicting, "conflicting"));
  }
}
