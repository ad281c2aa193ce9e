package siorgsync.model;

/**
 * Lifecycle status of a sync queue item, persisted as a small integer code.
 *
 * <pre>
 * PENDING --claim--> PROCESSING --> COMPLETED | CONFLICT | FAILED
 *                    PROCESSING --retryable error--> PENDING
 * </pre>
 */
public enum SyncStatus {
  PENDING(0),
  PROCESSING(1),
  COMPLETED(2),
  FAILED(3),
  CONFLICT(4);

  private final int code;

  SyncStatus(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  /**
   * Whether the automatic pipeline never touches an item in this status again.
   */
  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED || this == CONFLICT;
  }

  public static SyncStatus fromCode(int code) {
    for (SyncStatus status : values()) {
      if (status.code == code) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown sync status code: " + code);
  }
}
