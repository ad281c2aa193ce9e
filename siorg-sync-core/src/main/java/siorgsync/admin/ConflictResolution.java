package siorgsync.admin;

/**
 * Operator decision for an item in CONFLICT.
 *
 * <p>Every resolution except {@link #SKIP} also writes the remote changes that did not
 * conflict and records the full remote snapshot as the new baseline.
 */
public enum ConflictResolution {
  /** Write the registry's values over the conflicting local fields. */
  ACCEPT_REMOTE,
  /** Keep the local values of the conflicting fields. */
  KEEP_LOCAL,
  /** Pick LOCAL or REMOTE for each conflicting field; see {@link FieldChoice}. */
  MERGE,
  /** Close the item without touching the local record or its baseline. */
  SKIP
}
