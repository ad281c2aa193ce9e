package siorgsync.model;

import com.github.f4b6a3.ulid.UlidCreator;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable description of a queue item to be inserted by a producer.
 *
 * <p>Each item is assigned a ULID-based {@code id} by default, so ids sort by creation
 * time. The payload is the registry record snapshot as received and is limited to
 * {@value #MAX_PAYLOAD_BYTES} bytes.
 *
 * @see siorgsync.spi.SyncQueueStore#insert
 */
public final class NewQueueItem {
  public static final int MAX_PAYLOAD_BYTES = 1024 * 1024;
  public static final int DEFAULT_MAX_ATTEMPTS = 3;

  private final String id;
  private final EntityType entityType;
  private final SyncOperation operation;
  private final String externalCode;
  private final String payloadJson;
  private final int maxAttempts;
  private final Instant createdAt;
  private final Instant nextAttemptAt;
  private final Instant expiresAt;

  private NewQueueItem(Builder builder) {
    this.id = builder.id == null ? UlidCreator.getMonotonicUlid().toString() : builder.id;
    this.entityType = Objects.requireNonNull(builder.entityType, "entityType");
    this.operation = Objects.requireNonNull(builder.operation, "operation");
    this.externalCode = Objects.requireNonNull(builder.externalCode, "externalCode");
    if (externalCode.isBlank()) {
      throw new IllegalArgumentException("externalCode cannot be blank");
    }
    this.payloadJson = builder.payloadJson == null ? "{}" : builder.payloadJson;
    if (payloadJson.getBytes(StandardCharsets.UTF_8).length > MAX_PAYLOAD_BYTES) {
      throw new IllegalArgumentException("Payload exceeds maximum size of " + MAX_PAYLOAD_BYTES + " bytes");
    }
    if (builder.maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    this.maxAttempts = builder.maxAttempts;
    this.createdAt = builder.createdAt == null ? Instant.now() : builder.createdAt;
    this.nextAttemptAt = builder.nextAttemptAt == null ? createdAt : builder.nextAttemptAt;

    if (builder.expiresAt != null && builder.expiresIn != null) {
      throw new IllegalArgumentException("Set either expiresAt or expiresIn, not both");
    }
    if (builder.expiresIn != null && (builder.expiresIn.isZero() || builder.expiresIn.isNegative())) {
      throw new IllegalArgumentException("expiresIn must be positive");
    }
    this.expiresAt = builder.expiresIn != null ? createdAt.plus(builder.expiresIn) : builder.expiresAt;
  }

  public static Builder builder(EntityType entityType, SyncOperation operation, String externalCode) {
    return new Builder(entityType, operation, externalCode);
  }

  public String id() {
    return id;
  }

  public EntityType entityType() {
    return entityType;
  }

  public SyncOperation operation() {
    return operation;
  }

  public String externalCode() {
    return externalCode;
  }

  public String payloadJson() {
    return payloadJson;
  }

  public int maxAttempts() {
    return maxAttempts;
  }

  public Instant createdAt() {
    return createdAt;
  }

  public Instant nextAttemptAt() {
    return nextAttemptAt;
  }

  /** Deadline after which an unprocessed item is dropped, or {@code null} for none. */
  public Instant expiresAt() {
    return expiresAt;
  }

  /** Builder for {@link NewQueueItem}. */
  public static final class Builder {
    private final EntityType entityType;
    private final SyncOperation operation;
    private final String externalCode;
    private String id;
    private String payloadJson;
    private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
    private Instant createdAt;
    private Instant nextAttemptAt;
    private Instant expiresAt;
    private Duration expiresIn;

    private Builder(EntityType entityType, SyncOperation operation, String externalCode) {
      this.entityType = entityType;
      this.operation = operation;
      this.externalCode = externalCode;
    }

    public Builder id(String id) {
      this.id = id;
      return this;
    }

    /**
     * Sets the registry snapshot as a JSON object. Optional; an empty object means the
     * worker hydrates the remote value from the registry.
     */
    public Builder payloadJson(String payloadJson) {
      this.payloadJson = payloadJson;
      return this;
    }

    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    public Builder createdAt(Instant createdAt) {
      this.createdAt = createdAt;
      return this;
    }

    /** Defers the first claim until {@code nextAttemptAt}. */
    public Builder nextAttemptAt(Instant nextAttemptAt) {
      this.nextAttemptAt = nextAttemptAt;
      return this;
    }

    public Builder expiresAt(Instant expiresAt) {
      this.expiresAt = expiresAt;
      return this;
    }

    public Builder expiresIn(Duration expiresIn) {
      this.expiresIn = expiresIn;
      return this;
    }

    public NewQueueItem build() {
      return new NewQueueItem(this);
    }
  }
}
