package siorgsync.worker;

/**
 * What happened to one claimed item.
 */
public enum ItemResult {
  /** Applied or found to be a no-op; COMPLETED. */
  SUCCEEDED,
  /** Completed without processing (locally managed type, manual-review operation). */
  SKIPPED,
  /** Moved to CONFLICT for operator review. */
  CONFLICT,
  /** Failed retryably and went back to PENDING with a later next attempt. */
  RETRY_SCHEDULED,
  /** Moved to FAILED. */
  FAILED,
  /** The guarded write touched no row; another worker or an operator owns the item now. */
  CLAIM_LOST,
  /** The outcome could not be written; the item stays PROCESSING until its lease expires. */
  UNRECORDED
}
