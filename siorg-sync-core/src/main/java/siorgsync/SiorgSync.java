package siorgsync;

import siorgsync.admin.SyncQueueAdmin;
import siorgsync.cleanup.CleanupScheduler;
import siorgsync.model.EntityType;
import siorgsync.model.NewQueueItem;
import siorgsync.model.SyncOperation;
import siorgsync.registry.HttpRegistryClient;
import siorgsync.registry.RegistryClient;
import siorgsync.spi.ConnectionProvider;
import siorgsync.spi.LocalRecordStore;
import siorgsync.spi.MetricsExporter;
import siorgsync.spi.QueuePurger;
import siorgsync.spi.SyncHistoryStore;
import siorgsync.spi.SyncQueueStore;
import siorgsync.util.JsonCodec;
import siorgsync.worker.ExponentialBackoffRetryPolicy;
import siorgsync.worker.RetryPolicy;
import siorgsync.worker.SyncWorker;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Composite entry point that wires a {@link SyncWorker}, an optional
 * {@link CleanupScheduler} and a {@link SyncQueueAdmin} into a single
 * {@link AutoCloseable} unit.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (SiorgSync sync = SiorgSync.builder()
 *     .connectionProvider(connProvider)
 *     .queueStore(queueStore)
 *     .localRecordStore(localStore)
 *     .purger(purger)
 *     .config(WorkerConfig.fromEnvironment(System.getenv()))
 *     .build()) {
 *   sync.enqueue(EntityType.UNIT, SyncOperation.UPDATE, "U123", "{\"name\":\"Dept A\"}");
 * }
 * }</pre>
 *
 * @see SyncWorker
 * @see CleanupScheduler
 * @see SyncQueueAdmin
 */
public final class SiorgSync implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(SiorgSync.class.getName());

  private final ConnectionProvider connectionProvider;
  private final SyncQueueStore queueStore;
  private final SyncWorker worker;
  private final CleanupScheduler cleanupScheduler;
  private final SyncQueueAdmin admin;
  private final MetricsExporter metrics;
  private final int maxAttempts;

  private SiorgSync(ConnectionProvider connectionProvider, SyncQueueStore queueStore, SyncWorker worker,
      CleanupScheduler cleanupScheduler, SyncQueueAdmin admin, MetricsExporter metrics, int maxAttempts) {
    this.connectionProvider = connectionProvider;
    this.queueStore = queueStore;
    this.worker = worker;
    this.cleanupScheduler = cleanupScheduler;
    this.admin = admin;
    this.metrics = metrics;
    this.maxAttempts = maxAttempts;
  }

  public static Builder builder() {
    return new Builder();
  }

  public SyncWorker worker() {
    return worker;
  }

  /**
   * Returns the cleanup scheduler, or {@code null} when cleanup is disabled.
   */
  public CleanupScheduler cleanupScheduler() {
    return cleanupScheduler;
  }

  public SyncQueueAdmin admin() {
    return admin;
  }

  /**
   * Inserts an item inside the caller's transaction.
   *
   * @param conn connection of the producer's transaction
   * @param item the item to insert
   */
  public void enqueue(Connection conn, NewQueueItem item) {
    queueStore.insert(conn, item);
  }

  /**
   * Inserts an item on its own auto-committed connection, with the configured
   * {@code max_attempts}.
   *
   * @return the id of the new item
   * @throws SQLException if no connection can be obtained
   */
  public String enqueue(EntityType entityType, SyncOperation operation, String externalCode, String payloadJson)
      throws SQLException {
    NewQueueItem item = NewQueueItem.builder(entityType, operation, externalCode)
        .payloadJson(payloadJson)
        .maxAttempts(maxAttempts)
        .build();
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      queueStore.insert(conn, item);
    }
    return item.id();
  }

  /**
   * Shuts down components in order: cleanup scheduler, worker (draining the in-flight
   * batch), then the metrics exporter when it is closeable.
   */
  @Override
  public void close() {
    RuntimeException first = null;
    if (cleanupScheduler != null) {
      try {
        cleanupScheduler.close();
      } catch (RuntimeException e) {
        first = e;
      }
    }
    try {
      worker.close();
    } catch (RuntimeException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /**
   * Builder for {@link SiorgSync}. Each builder can be used once.
   */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private SyncQueueStore queueStore;
    private LocalRecordStore localRecordStore;
    private SyncHistoryStore historyStore;
    private QueuePurger purger;
    private RegistryClient registryClient;
    private RetryPolicy retryPolicy;
    private MetricsExporter metrics;
    private JsonCodec jsonCodec;
    private Clock clock;
    private WorkerConfig config;
    private boolean autoStart = true;
    private final AtomicBoolean built = new AtomicBoolean(false);

    private Builder() {}

    /**
     * <p><b>Required.</b>
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder queueStore(SyncQueueStore queueStore) {
      this.queueStore = queueStore;
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder localRecordStore(LocalRecordStore localRecordStore) {
      this.localRecordStore = localRecordStore;
      return this;
    }

    /**
     * Audit trail written by the worker and by conflict resolution.
     *
     * <p>Optional. Defaults to {@link SyncHistoryStore#NOOP}.
     */
    public Builder historyStore(SyncHistoryStore historyStore) {
      this.historyStore = historyStore;
      return this;
    }

    /**
     * Sets the purger used by the cleanup scheduler.
     *
     * <p>Optional. Without a purger no cleanup runs, whatever the config says.
     */
    public Builder purger(QueuePurger purger) {
      this.purger = purger;
      return this;
    }

    /**
     * Optional. Defaults to an {@link HttpRegistryClient} for the configured base URL and token.
     */
    public Builder registryClient(RegistryClient registryClient) {
      this.registryClient = registryClient;
      return this;
    }

    /**
     * Optional. Defaults to {@link ExponentialBackoffRetryPolicy} with the configured delays.
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Optional. Defaults to {@link MetricsExporter#NOOP}. Closed with the composite when it
     * implements {@link AutoCloseable}.
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public Builder jsonCodec(JsonCodec jsonCodec) {
      this.jsonCodec = jsonCodec;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Optional. Defaults to {@code new WorkerConfig()}.
     */
    public Builder config(WorkerConfig config) {
      this.config = config;
      return this;
    }

    /**
     * Whether {@link #build()} starts the worker and cleanup schedules.
     *
     * <p>Optional. Defaults to {@code true}.
     */
    public Builder autoStart(boolean autoStart) {
      this.autoStart = autoStart;
      return this;
    }

    /**
     * Builds the composite and, unless disabled, starts the cleanup scheduler and worker.
     *
     * @throws IllegalStateException    if this builder was already used
     * @throws NullPointerException     if a required collaborator is missing
     * @throws IllegalArgumentException if a config value is out of range
     */
    public SiorgSync build() {
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
      Objects.requireNonNull(connectionProvider, "connectionProvider");
      Objects.requireNonNull(queueStore, "queueStore");
      Objects.requireNonNull(localRecordStore, "localRecordStore");
      WorkerConfig cfg = config != null ? config : new WorkerConfig();
      if (cfg.getMaxAttempts() < 1) {
        throw new IllegalArgumentException("maxAttempts must be >= 1");
      }
      MetricsExporter exporter = metrics != null ? metrics : MetricsExporter.NOOP;
      JsonCodec codec = jsonCodec != null ? jsonCodec : JsonCodec.getDefault();
      Clock clk = clock != null ? clock : Clock.systemUTC();
      SyncHistoryStore history = historyStore != null ? historyStore : SyncHistoryStore.NOOP;

      RegistryClient registry = registryClient != null
          ? registryClient
          : HttpRegistryClient.builder()
              .baseUrl(cfg.getRegistryBaseUrl())
              .token(cfg.getRegistryToken())
              .build();
      RetryPolicy retry = retryPolicy != null
          ? retryPolicy
          : new ExponentialBackoffRetryPolicy(cfg.getRetryBaseDelayMs(), cfg.getRetryMaxDelayMs());

      SyncWorker worker = SyncWorker.builder()
          .connectionProvider(connectionProvider)
          .queueStore(queueStore)
          .localRecordStore(localRecordStore)
          .historyStore(history)
          .registryClient(registry)
          .retryPolicy(retry)
          .metrics(exporter)
          .jsonCodec(codec)
          .clock(clk)
          .workerId(cfg.getWorkerId())
          .batchSize(cfg.getBatchSize())
          .pollInterval(cfg.getPollInterval())
          .leaseDuration(cfg.getLeaseDuration())
          .concurrency(cfg.getConcurrency())
          .drainTimeout(cfg.getDrainTimeout())
          .build();

      CleanupScheduler cleanup = null;
      if (cfg.isCleanupEnabled() && purger != null) {
        cleanup = CleanupScheduler.builder()
            .connectionProvider(connectionProvider)
            .purger(purger)
            .metrics(exporter)
            .clock(clk)
            .interval(cfg.getCleanupInterval())
            .completedRetention(cfg.getCompletedRetention())
            .build();
      } else if (cfg.isCleanupEnabled()) {
        logger.log(Level.WARNING, "Cleanup enabled but no purger configured; expired items will not be removed");
      }

      SyncQueueAdmin admin = new SyncQueueAdmin(connectionProvider, queueStore, localRecordStore, history,
          codec, clk);
      SiorgSync sync = new SiorgSync(connectionProvider, queueStore, worker, cleanup, admin, exporter,
          cfg.getMaxAttempts());
      if (autoStart) {
        try {
          if (cleanup != null) {
            cleanup.start();
          }
          worker.start();
        } catch (RuntimeException e) {
          try {
            sync.close();
          } catch (RuntimeException closeError) {
            e.addSuppressed(closeError);
          }
          throw e;
        }
      }
      return sync;
    }
  }
}
