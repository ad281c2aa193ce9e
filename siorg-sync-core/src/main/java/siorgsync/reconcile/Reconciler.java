package siorgsync.reconcile;

import siorgsync.model.LocalRecord;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Compares a remote snapshot with the local record and decides whether it can be applied.
 *
 * <p>For every remote field {@code f}:
 * <ul>
 *   <li>equal local and remote values need nothing;
 *   <li>a field not modified locally since the last sync is a change to apply;
 *   <li>a field modified locally whose remote value also moved away from the baseline is a
 *       conflict;
 *   <li>a field modified locally whose remote value still equals the baseline keeps the
 *       local edit.
 * </ul>
 *
 * <p>"Modified locally" means {@code fields[f]} differs from {@code baseline[f]}; a record
 * without a baseline counts every field as modified. Values are compared structurally, with
 * numbers compared by numeric value.
 *
 * <p>Stateless and thread-safe; the same inputs always produce the same outcome.
 */
public final class Reconciler {

  public ReconcileOutcome reconcile(Map<String, Object> remote, LocalRecord local) {
    FieldDelta delta = delta(remote, local);
    if (!delta.conflicting().isEmpty()) {
      Map<String, Object> localValues = new LinkedHashMap<>();
      Map<String, Object> remoteValues = new LinkedHashMap<>();
      for (String field : delta.conflicting()) {
        localValues.put(field, local.fields().get(field));
        remoteValues.put(field, remote.get(field));
      }
      return new ReconcileOutcome.Conflict(delta.conflicting(), localValues, remoteValues);
    }
    if (delta.changes().isEmpty()) {
      return ReconcileOutcome.noOp();
    }
    return new ReconcileOutcome.Apply(delta.changes(), remote);
  }

  /**
   * Splits the fields of {@code remote} that differ from the local record into changes that
   * can be written as they are and fields that conflict. Fields edited only locally appear
   * in neither.
   */
  public FieldDelta delta(Map<String, Object> remote, LocalRecord local) {
    Objects.requireNonNull(remote, "remote");
    if (local == null) {
      return new FieldDelta(remote, List.of());
    }

    Map<String, Object> fields = local.fields();
    Map<String, Object> baseline = local.baseline();
    Map<String, Object> changes = new LinkedHashMap<>();
    List<String> conflicting = new ArrayList<>();

    for (Map.Entry<String, Object> entry : remote.entrySet()) {
      String field = entry.getKey();
      Object remoteValue = entry.getValue();
      Object localValue = fields.get(field);
      if (valuesEqual(localValue, remoteValue)) {
        continue;
      }
      boolean localModified = baseline == null || !valuesEqual(localValue, baseline.get(field));
      if (!localModified) {
        changes.put(field, remoteValue);
        continue;
      }
      boolean remoteChanged = baseline == null || !valuesEqual(remoteValue, baseline.get(field));
      if (remoteChanged) {
        conflicting.add(field);
      }
    }
    Collections.sort(conflicting);
    return new FieldDelta(changes, conflicting);
  }

  /**
   * Structural equality for decoded JSON values. Numbers compare by value, so {@code 1},
   * {@code 1L} and {@code 1.0} are equal.
   */
  static boolean valuesEqual(Object a, Object b) {
    if (a == b) {
      return true;
    }
    if (a == null || b == null) {
      return false;
    }
    if (a instanceof Number x && b instanceof Number y) {
      return toBigDecimal(x).compareTo(toBigDecimal(y)) == 0;
    }
    if (a instanceof Map<?, ?> x && b instanceof Map<?, ?> y) {
      if (x.size() != y.size()) {
        return false;
      }
      for (Map.Entry<?, ?> entry : x.entrySet()) {
        if (!y.containsKey(entry.getKey()) || !valuesEqual(entry.getValue(), y.get(entry.getKey()))) {
          return false;
        }
      }
      return true;
    }
    if (a instanceof List<?> x && b instanceof List<?> y) {
      if (x.size() != y.size()) {
        return false;
      }
      Iterator<?> left = x.iterator();
      Iterator<?> right = y.iterator();
      while (left.hasNext()) {
        if (!valuesEqual(left.next(), right.next())) {
          return false;
        }
      }
      return true;
    }
    return a.equals(b);
  }

  private static BigDecimal toBigDecimal(Number n) {
    if (n instanceof BigDecimal d) {
      return d;
    }
    if (n instanceof Double || n instanceof Float) {
      return BigDecimal.valueOf(n.doubleValue());
    }
    return new BigDecimal(n.toString());
  }
}
