package siorgsync.worker;

import siorgsync.model.QueueItem;
import siorgsync.reconcile.Reconciler;
import siorgsync.registry.RegistryClient;
import siorgsync.spi.ConnectionProvider;
import siorgsync.spi.LocalRecordStore;
import siorgsync.spi.MetricsExporter;
import siorgsync.spi.SyncHistoryStore;
import siorgsync.spi.SyncQueueStore;
import siorgsync.util.DaemonThreadFactory;
import siorgsync.util.JsonCodec;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Poll loop of the sync worker: claims a batch, processes it, writes one summary line,
 * sleeps for the poll interval, and repeats.
 *
 * <p>Items of a batch are grouped by entity ({@code entity_type} and {@code external_code}).
 * Groups run concurrently on a bounded pool; the items of one group run one after another
 * in claim order, so two changes to the same entity never race inside a process. Mutual
 * exclusion across processes comes from the store's claim protocol alone.
 *
 * <p>{@link #close()} stops claiming, lets the in-flight batch finish within the drain
 * timeout, then stops the threads. Items still PROCESSING after that are picked up again
 * once their lease expires.
 *
 * <p>Create instances via {@link #builder()}. The {@link #start()} and {@link #close()}
 * methods are synchronized to prevent concurrent lifecycle transitions.
 *
 * @see ItemProcessor
 * @see SyncQueueStore#claimBatch
 */
public final class SyncWorker implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(SyncWorker.class.getName());

  private final ConnectionProvider connectionProvider;
  private final SyncQueueStore queueStore;
  private final ItemProcessor processor;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final String workerId;
  private final int batchSize;
  private final Duration pollInterval;
  private final Duration leaseDuration;
  private final int concurrency;
  private final Duration drainTimeout;

  // threads are created on first submit
  private final ExecutorService itemPool;
  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> pollTask;
  private volatile boolean closed;

  private SyncWorker(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.queueStore = Objects.requireNonNull(builder.queueStore, "queueStore");
    Objects.requireNonNull(builder.localRecordStore, "localRecordStore");
    Objects.requireNonNull(builder.registryClient, "registryClient");

    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (builder.concurrency <= 0) {
      throw new IllegalArgumentException("concurrency must be > 0");
    }
    requirePositive(builder.pollInterval, "pollInterval");
    requirePositive(builder.leaseDuration, "leaseDuration");
    if (builder.drainTimeout.isNegative()) {
      throw new IllegalArgumentException("drainTimeout must be >= 0");
    }

    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.workerId = builder.workerId != null
        ? builder.workerId
        : "worker-" + UUID.randomUUID().toString().substring(0, 8);
    this.batchSize = builder.batchSize;
    this.pollInterval = builder.pollInterval;
    this.leaseDuration = builder.leaseDuration;
    this.concurrency = builder.concurrency;
    this.drainTimeout = builder.drainTimeout;

    RetryPolicy retryPolicy = builder.retryPolicy != null
        ? builder.retryPolicy
        : new ExponentialBackoffRetryPolicy(1000L, 60000L);
    JsonCodec jsonCodec = builder.jsonCodec != null ? builder.jsonCodec : JsonCodec.getDefault();
    this.itemPool = Executors.newFixedThreadPool(concurrency, new DaemonThreadFactory("siorg-sync-worker-"));
    SyncHistoryStore historyStore = builder.historyStore != null ? builder.historyStore : SyncHistoryStore.NOOP;
    this.processor = new ItemProcessor(connectionProvider, queueStore, builder.localRecordStore, historyStore,
        builder.registryClient, new Reconciler(), retryPolicy, metrics, jsonCodec, clock, workerId);
  }

  private static void requirePositive(Duration value, String name) {
    Objects.requireNonNull(value, name);
    if (value.isNegative() || value.isZero()) {
      throw new IllegalArgumentException(name + " must be positive");
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  public String workerId() {
    return workerId;
  }

  /**
   * Starts the poll loop. The first batch is claimed immediately. Subsequent calls are
   * no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("SyncWorker has been closed");
    }
    if (pollTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("siorg-sync-poller-"));
    pollTask = scheduler.scheduleWithFixedDelay(
        this::poll, 0L, pollInterval.toMillis(), TimeUnit.MILLISECONDS);
    logger.log(Level.INFO, "Sync worker {0} started (batchSize={1}, pollInterval={2}, concurrency={3})",
        new Object[]{workerId, batchSize, pollInterval, concurrency});
  }

  private void poll() {
    try {
      runOnce();
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Sync poll cycle failed", t);
    }
  }

  /**
   * Claims and processes a single batch. Called by the scheduler, but may also be invoked
   * directly for testing or one-off runs.
   *
   * @return counters for the batch; all zero when nothing was claimed or the worker is closed
   */
  public BatchStats runOnce() {
    BatchStats stats = new BatchStats();
    if (closed) {
      return stats;
    }
    String claimToken = UUID.randomUUID().toString();
    List<QueueItem> items = claim(claimToken);
    metrics.recordBatchSize(items.size());
    if (items.isEmpty()) {
      return stats;
    }
    metrics.incrementClaimed(items.size());

    Map<String, List<QueueItem>> groups = new LinkedHashMap<>();
    for (QueueItem item : items) {
      groups.computeIfAbsent(item.entityKey(), k -> new ArrayList<>()).add(item);
    }

    if (concurrency == 1 || groups.size() == 1) {
      groups.values().forEach(group -> processGroup(group, claimToken, stats));
    } else {
      List<Future<?>> futures = new ArrayList<>(groups.size());
      for (List<QueueItem> group : groups.values()) {
        futures.add(itemPool.submit(() -> processGroup(group, claimToken, stats)));
      }
      awaitAll(futures);
    }

    logger.log(Level.INFO, "Batch complete: processed={0} succeeded={1} failed={2} conflicts={3} skipped={4}",
        new Object[]{stats.processed(), stats.succeeded(), stats.failed(), stats.conflicts(), stats.skipped()});
    return stats;
  }

  private List<QueueItem> claim(String claimToken) {
    Instant now = clock.instant();
    try (Connection conn = connectionProvider.getConnection()) {
      // Two-phase claim (UPDATE then SELECT) must run in a single transaction
      conn.setAutoCommit(false);
      try {
        List<QueueItem> claimed = queueStore.claimBatch(
            conn, workerId, claimToken, now, now.minus(leaseDuration), batchSize);
        conn.commit();
        return claimed;
      } catch (SQLException | RuntimeException e) {
        conn.rollback();
        throw e;
      }
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to claim sync queue items", e);
      return List.of();
    }
  }

  private void processGroup(List<QueueItem> group, String claimToken, BatchStats stats) {
    for (QueueItem item : group) {
      ItemResult result;
      try {
        result = processor.process(item, claimToken);
      } catch (Throwable t) {
        logger.log(Level.SEVERE, "Unexpected failure processing item " + item.id(), t);
        result = ItemResult.UNRECORDED;
      }
      stats.record(result);
    }
  }

  private void awaitAll(List<Future<?>> futures) {
    for (Future<?> future : futures) {
      try {
        future.get();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        logger.log(Level.WARNING, "Interrupted waiting for batch; unfinished items will be reclaimed after lease expiry");
        return;
      } catch (ExecutionException e) {
        logger.log(Level.SEVERE, "Item group failed", e.getCause());
      }
    }
  }

  /**
   * Stops claiming new batches, waits up to the drain timeout for the in-flight batch, and
   * shuts down the threads.
   */
  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    if (pollTask != null) {
      pollTask.cancel(false);
      pollTask = null;
    }
    long deadline = System.nanoTime() + drainTimeout.toNanos();
    drain(scheduler, deadline);
    drain(itemPool, deadline);
    logger.log(Level.INFO, "Sync worker {0} stopped", workerId);
  }

  private static void drain(ExecutorService executor, long deadlineNanos) {
    if (executor == null) {
      return;
    }
    executor.shutdown();
    try {
      long remaining = Math.max(0L, deadlineNanos - System.nanoTime());
      if (!executor.awaitTermination(remaining, TimeUnit.NANOSECONDS)) {
        executor.shutdownNow();
        executor.awaitTermination(5, TimeUnit.SECONDS);
      }
    } catch (InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  /**
   * Builder for {@link SyncWorker}.
   */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private SyncQueueStore queueStore;
    private LocalRecordStore localRecordStore;
    private SyncHistoryStore historyStore;
    private RegistryClient registryClient;
    private RetryPolicy retryPolicy;
    private MetricsExporter metrics;
    private JsonCodec jsonCodec;
    private Clock clock;
    private String workerId;
    private int batchSize = 10;
    private Duration pollInterval = Duration.ofSeconds(5);
    private Duration leaseDuration = Duration.ofMinutes(5);
    private int concurrency = 4;
    private Duration drainTimeout = Duration.ofSeconds(30);

    private Builder() {
    }

    /**
     * Sets the connection provider for claims and outcome writes.
     *
     * <p><b>Required.</b>
     *
     * @param connectionProvider the connection provider
     * @return this builder
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * <p><b>Required.</b>
     *
     * @param queueStore the queue persistence backend
     * @return this builder
     */
    public Builder queueStore(SyncQueueStore queueStore) {
      this.queueStore = queueStore;
      return this;
    }

    /**
     * <p><b>Required.</b>
     *
     * @param localRecordStore store of local entity copies and sync baselines
     * @return this builder
     */
    public Builder localRecordStore(LocalRecordStore localRecordStore) {
      this.localRecordStore = localRecordStore;
      return this;
    }

    /**
     * Sets the audit trail written alongside every applied change.
     *
     * <p>Optional. Defaults to {@link SyncHistoryStore#NOOP}.
     */
    public Builder historyStore(SyncHistoryStore historyStore) {
      this.historyStore = historyStore;
      return this;
    }

    /**
     * <p><b>Required.</b>
     *
     * @param registryClient client used to validate items against the registry
     * @return this builder
     */
    public Builder registryClient(RegistryClient registryClient) {
      this.registryClient = registryClient;
      return this;
    }

    /**
     * Optional. Defaults to exponential backoff from 1 s up to 60 s with 20% jitter.
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Optional. Defaults to {@link MetricsExporter#NOOP}.
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Optional. Defaults to {@link JsonCodec#getDefault()}.
     */
    public Builder jsonCodec(JsonCodec jsonCodec) {
      this.jsonCodec = jsonCodec;
      return this;
    }

    /**
     * Optional. Defaults to {@link Clock#systemUTC()}.
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Sets the identifier recorded as {@code claimed_by}.
     *
     * <p>Optional. Defaults to {@code worker-} plus a random suffix.
     */
    public Builder workerId(String workerId) {
      this.workerId = workerId;
      return this;
    }

    /**
     * Optional. Defaults to {@code 10}. Must be &gt; 0.
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Sets the idle sleep between the end of one batch and the next claim.
     *
     * <p>Optional. Defaults to 5 seconds.
     */
    public Builder pollInterval(Duration pollInterval) {
      this.pollInterval = pollInterval;
      return this;
    }

    /**
     * Sets how long a claim stays valid before another worker may take the item over.
     *
     * <p>Optional. Defaults to 5 minutes. Must exceed the worst-case processing time of one
     * item, registry timeouts included.
     */
    public Builder leaseDuration(Duration leaseDuration) {
      this.leaseDuration = leaseDuration;
      return this;
    }

    /**
     * Sets the number of entity groups processed in parallel within a batch.
     *
     * <p>Optional. Defaults to {@code 4}. Must be &gt; 0.
     */
    public Builder concurrency(int concurrency) {
      this.concurrency = concurrency;
      return this;
    }

    /**
     * Optional. Defaults to 30 seconds.
     */
    public Builder drainTimeout(Duration drainTimeout) {
      this.drainTimeout = Objects.requireNonNull(drainTimeout, "drainTimeout");
      return this;
    }

    /**
     * Builds the worker. Call {@link SyncWorker#start()} to begin polling.
     *
     * @return a new {@link SyncWorker}
     * @throws NullPointerException     if a required collaborator is missing
     * @throws IllegalArgumentException if a size or duration is out of range
     */
    public SyncWorker build() {
      return new SyncWorker(this);
    }
  }
}
