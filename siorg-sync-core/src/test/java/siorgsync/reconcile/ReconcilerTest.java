package siorgsync.reconcile;

import org.junit.jupiter.api.Test;
import siorgsync.model.EntityType;
import siorgsync.model.LocalRecord;

import java.time.Instant;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ReconcilerTest {
  private static final Instant SYNCED = Instant.parse("2024-01-01T00:00:00Z");

  private final Reconciler reconciler = new Reconciler();

  private static LocalRecord local(Map<String, Object> fields, Map<String, Object> baseline) {
    return new LocalRecord(EntityType.UNIT, "U123", fields, baseline, SYNCED, SYNCED);
  }

  @Test
  void appliesRemoteChangeWhenFieldUnmodifiedLocally() {
    LocalRecord record = local(Map.of("name", "Dept A (old)"), Map.of("name", "Dept A (old)"));

    ReconcileOutcome outcome = reconciler.reconcile(Map.of("name", "Dept A"), record);

    ReconcileOutcome.Apply apply = assertInstanceOf(ReconcileOutcome.Apply.class, outcome);
    assertEquals(Map.of("name", "Dept A"), apply.changes());
    assertEquals(Map.of("name", "Dept A"), apply.baseline());
  }

  @Test
  void deltaSeparatesCleanChangesFromConflicts() {
    LocalRecord record = local(
        Map.of("name", "Local", "acronym", "OLD", "email", "mine@example.org"),
        Map.of("name", "Old", "acronym", "OLD", "email", "old@example.org"));

    FieldDelta delta = reconciler.delta(
        Map.of("name", "Remote", "acronym", "NEW", "email", "old@example.org"), record);

    assertEquals(Map.of("acronym", "NEW"), delta.changes());
    assertEquals(List.of("name"), delta.conflicting());
  }

  @Test
  void deltaWithoutLocalRecordIsAllChanges() {
    FieldDelta delta = reconciler.delta(Map.of("name", "Remote"), null);

    assertEquals(Map.of("name", "Remote"), delta.changes());
    assertTrue(delta.conflicting().isEmpty());
  }

  @Test
  void conflictsWhenBothSidesChangedSameField() {
    LocalRecord record = local(Map.of("name", "Dept A (local edit)"), Map.of("name", "Dept A (old)"));

    ReconcileOutcome outcome = reconciler.reconcile(Map.of("name", "Dept A"), record);

    ReconcileOutcome.Conflict conflict = assertInstanceOf(ReconcileOutcome.Conflict.class, outcome);
    assertEquals(List.of("name"), conflict.diff());
    assertEquals(Map.of("name", "Dept A (local edit)"), conflict.localValue());
    assertEquals(Map.of("name", "Dept A"), conflict.remoteValue());
  }

  @Test
  void keepsLocalEditWhenRemoteDidNotChangeField() {
    LocalRecord record = local(
        Map.of("name", "Dept A (local edit)", "acronym", "DA"),
        Map.of("name", "Dept A", "acronym", "DA"));

    ReconcileOutcome outcome = reconciler.reconcile(Map.of("name", "Dept A", "acronym", "DA"), record);

    assertEquals(ReconcileOutcome.noOp(), outcome);
  }

  @Test
  void appliesOnlyUnmodifiedFieldsAlongsideKeptLocalEdits() {
    LocalRecord record = local(
        Map.of("name", "Dept A (local edit)", "acronym", "DA"),
        Map.of("name", "Dept A", "acronym", "DA"));

    ReconcileOutcome outcome = reconciler.reconcile(Map.of("name", "Dept A", "acronym", "DPA"), record);

    ReconcileOutcome.Apply apply = assertInstanceOf(ReconcileOutcome.Apply.class, outcome);
    assertEquals(Map.of("acronym", "DPA"), apply.changes());
    assertEquals(Map.of("name", "Dept A", "acronym", "DPA"), apply.baseline());
  }

  @Test
  void identicalValuesAreNoOp() {
    LocalRecord record = local(Map.of("name", "Dept A"), Map.of("name", "Dept A"));

    assertEquals(ReconcileOutcome.noOp(), reconciler.reconcile(Map.of("name", "Dept A"), record));
  }

  @Test
  void missingLocalRecordAppliesEverything() {
    Map<String, Object> remote = Map.of("name", "Dept A", "active", true);

    ReconcileOutcome outcome = reconciler.reconcile(remote, null);

    ReconcileOutcome.Apply apply = assertInstanceOf(ReconcileOutcome.Apply.class, outcome);
    assertEquals(remote, apply.changes());
    assertEquals(remote, apply.baseline());
  }

  @Test
  void emptyRemoteWithoutLocalRecordIsNoOp() {
    assertEquals(ReconcileOutcome.noOp(), reconciler.reconcile(Map.of(), null));
  }

  @Test
  void recordWithoutBaselineConflictsOnEveryDifferingField() {
    LocalRecord record = local(Map.of("name", "Local", "acronym", "X"), null);

    ReconcileOutcome outcome = reconciler.reconcile(Map.of("name", "Remote", "acronym", "X"), record);

    ReconcileOutcome.Conflict conflict = assertInstanceOf(ReconcileOutcome.Conflict.class, outcome);
    assertEquals(List.of("name"), conflict.diff());
  }

  @Test
  void conflictDiffIsSorted() {
    LocalRecord record = local(
        Map.of("zeta", "l", "alpha", "l", "mid", "l"),
        Map.of("zeta", "b", "alpha", "b", "mid", "b"));
    Map<String, Object> remote = new LinkedHashMap<>();
    remote.put("zeta", "r");
    remote.put("mid", "r");
    remote.put("alpha", "r");

    ReconcileOutcome.Conflict conflict =
        assertInstanceOf(ReconcileOutcome.Conflict.class, reconciler.reconcile(remote, record));

    assertEquals(List.of("alpha", "mid", "zeta"), conflict.diff());
  }

  @Test
  void replayAfterApplyIsNoOp() {
    LocalRecord before = local(Map.of("name", "Dept A (old)"), Map.of("name", "Dept A (old)"));
    Map<String, Object> remote = Map.of("name", "Dept A");
    ReconcileOutcome.Apply apply =
        assertInstanceOf(ReconcileOutcome.Apply.class, reconciler.reconcile(remote, before));

    Map<String, Object> fields = new HashMap<>(before.fields());
    fields.putAll(apply.changes());
    LocalRecord after = local(fields, apply.baseline());

    assertEquals(ReconcileOutcome.noOp(), reconciler.reconcile(remote, after));
  }

  @Test
  void sameInputsAlwaysGiveSameOutcome() {
    LocalRecord record = local(Map.of("name", "Dept A (local edit)"), Map.of("name", "Dept A (old)"));
    Map<String, Object> remote = Map.of("name", "Dept A");

    ReconcileOutcome first = reconciler.reconcile(remote, record);
    for (int i = 0; i < 10; i++) {
      assertEquals(first, reconciler.reconcile(remote, record));
    }
    assertEquals(first, new Reconciler().reconcile(remote, record));
  }

  @Test
  void numbersCompareByValue() {
    LocalRecord record = local(Map.of("level", 2), Map.of("level", 2));

    assertEquals(ReconcileOutcome.noOp(), reconciler.reconcile(Map.of("level", 2.0), record));
    assertEquals(ReconcileOutcome.noOp(), reconciler.reconcile(Map.of("level", 2L), record));
  }

  @Test
  void nestedValuesCompareStructurally() {
    Map<String, Object> address = Map.of("city", "Brasilia", "zip", 70000);
    LocalRecord record = local(
        Map.of("address", address, "tags", List.of("a", "b")),
        Map.of("address", address, "tags", List.of("a", "b")));
    Map<String, Object> remote = Map.of(
        "address", Map.of("zip", 70000L, "city", "Brasilia"),
        "tags", List.of("a", "b"));

    assertEquals(ReconcileOutcome.noOp(), reconciler.reconcile(remote, record));
    assertInstanceOf(ReconcileOutcome.Apply.class,
        reconciler.reconcile(Map.of("tags", List.of("b", "a")), record));
  }

  @Test
  void nullValuesAreComparable() {
    Map<String, Object> fields = new HashMap<>();
    fields.put("parent", null);
    LocalRecord record = local(fields, fields);
    Map<String, Object> remote = new HashMap<>();
    remote.put("parent", null);

    assertEquals(ReconcileOutcome.noOp(), reconciler.reconcile(remote, record));

    ReconcileOutcome.Apply apply = assertInstanceOf(ReconcileOutcome.Apply.class,
        reconciler.reconcile(Map.of("parent", "ORG1"), record));
    assertEquals(Map.of("parent", "ORG1"), apply.changes());
  }

  @Test
  void newRemoteFieldIsAppliedWhenAbsentLocally() {
    LocalRecord record = local(Map.of("name", "Dept A"), Map.of("name", "Dept A"));

    ReconcileOutcome.Apply apply = assertInstanceOf(ReconcileOutcome.Apply.class,
        reconciler.reconcile(Map.of("name", "Dept A", "acronym", "DA"), record));

    assertEquals(Map.of("acronym", "DA"), apply.changes());
  }

  @Test
  void valuesEqualHandlesMixedTypes() {
    assertTrue(Reconciler.valuesEqual(1, 1.0));
    assertTrue(Reconciler.valuesEqual(Arrays.asList(1, null), Arrays.asList(1L, null)));
    assertFalse(Reconciler.valuesEqual("1", 1));
    assertFalse(Reconciler.valuesEqual(Map.of("a", 1), Map.of("b", 1)));
    assertFalse(Reconciler.valuesEqual(null, "x"));
  }
}
