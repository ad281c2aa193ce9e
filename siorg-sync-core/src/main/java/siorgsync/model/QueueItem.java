package siorgsync.model;

import java.time.Instant;

/**
 * Read-only view of a persisted sync queue row.
 *
 * <p>JSON-valued columns ({@code payload}, {@code error_details}, {@code detected_changes},
 * {@code local_value}, {@code remote_value}, {@code remote_snapshot}) are carried as raw JSON text; decoding is
 * left to the caller.
 *
 * @see siorgsync.spi.SyncQueueStore#claimBatch
 */
public record QueueItem(
    String id,
    EntityType entityType,
    SyncOperation operation,
    String externalCode,
    String payloadJson,
    SyncStatus status,
    int attempts,
    int maxAttempts,
    Instant nextAttemptAt,
    Instant expiresAt,
    String lastError,
    String errorDetailsJson,
    String detectedChangesJson,
    String localValueJson,
    String remoteValueJson,
    String remoteSnapshotJson,
    String claimedBy,
    Instant claimedAt,
    String claimToken,
    Instant lastAttemptAt,
    Instant processedAt,
    String processedBy,
    String resolutionNotes,
    Instant createdAt,
    Instant updatedAt
) {

  /** Key that identifies the local entity this item changes. */
  public String entityKey() {
    return entityType.name() + ":" + externalCode;
  }
}
