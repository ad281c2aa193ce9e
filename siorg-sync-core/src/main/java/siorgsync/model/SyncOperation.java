package siorgsync.model;

/**
 * Change kinds reported by the registry for a single entity.
 */
public enum SyncOperation {
  CREATION,
  UPDATE,
  EXTINCTION,
  HIERARCHY_CHANGE,
  MERGE,
  SPLIT;

  /** Structural operations span several entities and are left to an operator. */
  public boolean requiresManualReview() {
    return this == MERGE || this == SPLIT;
  }
}
