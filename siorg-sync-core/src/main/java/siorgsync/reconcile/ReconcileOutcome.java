package siorgsync.reconcile;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Decision returned by {@link Reconciler#reconcile}.
 */
public sealed interface ReconcileOutcome
    permits ReconcileOutcome.Apply, ReconcileOutcome.NoOp, ReconcileOutcome.Conflict {

  static NoOp noOp() {
    return NoOp.INSTANCE;
  }

  /**
   * The remote change can be written. {@code changes} are the field values to write over the
   * local record; {@code baseline} is the full remote snapshot, which becomes the new sync
   * baseline.
   */
  record Apply(Map<String, Object> changes, Map<String, Object> baseline) implements ReconcileOutcome {
    public Apply {
      changes = copy(changes);
      baseline = copy(baseline);
    }
  }

  /** Local state already matches the remote. */
  record NoOp() implements ReconcileOutcome {
    static final NoOp INSTANCE = new NoOp();
  }

  /**
   * Both sides changed the same fields since the last sync.
   *
   * @param diff        names of the conflicting fields, sorted
   * @param localValue  local values of the conflicting fields
   * @param remoteValue remote values of the conflicting fields
   */
  record Conflict(List<String> diff, Map<String, Object> localValue, Map<String, Object> remoteValue)
      implements ReconcileOutcome {
    public Conflict {
      diff = List.copyOf(Objects.requireNonNull(diff, "diff"));
      localValue = copy(localValue);
      remoteValue = copy(remoteValue);
    }
  }

  // Map.copyOf rejects null values, which are legal JSON field values here
  private static Map<String, Object> copy(Map<String, Object> map) {
    return map == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(map));
  }
}
