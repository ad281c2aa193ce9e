package siorgsync.cleanup;

import siorgsync.spi.ConnectionProvider;
import siorgsync.spi.MetricsExporter;
import siorgsync.spi.QueuePurger;
import siorgsync.util.DaemonThreadFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scheduled sweep that deletes PENDING queue items past their {@code expires_at} and,
 * when a retention is configured, COMPLETED items processed before it.
 *
 * <p>Runs on its own daemon thread, independent of the worker's poll loop. Each cycle
 * deletes in batches (default 500) until fewer than {@code batchSize} rows come back,
 * each batch on its own auto-committed connection to keep locks short. A failed cycle is
 * logged and tried again on the next tick.
 *
 * <p>Create instances via {@link #builder()}.
 *
 * @see CleanupScheduler.Builder
 * @see QueuePurger
 */
public final class CleanupScheduler implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(CleanupScheduler.class.getName());

  private final ConnectionProvider connectionProvider;
  private final QueuePurger purger;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final Duration completedRetention;
  private final int batchSize;
  private final Duration interval;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> cleanupTask;
  private volatile boolean closed;

  private CleanupScheduler(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.purger = Objects.requireNonNull(builder.purger, "purger");
    Objects.requireNonNull(builder.interval, "interval");

    if (builder.completedRetention != null && builder.completedRetention.isNegative()) {
      throw new IllegalArgumentException("completedRetention must be >= 0");
    }
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (builder.interval.isNegative() || builder.interval.isZero()) {
      throw new IllegalArgumentException("interval must be positive");
    }

    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.completedRetention = builder.completedRetention;
    this.batchSize = builder.batchSize;
    this.interval = builder.interval;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the scheduled cleanup loop. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("CleanupScheduler has been closed");
    }
    if (cleanupTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("siorg-sync-cleanup-"));
    long intervalMs = interval.toMillis();
    cleanupTask = scheduler.scheduleWithFixedDelay(this::runOnce, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Executes a single cleanup cycle. May be invoked directly for testing or one-off
   * cleanups.
   *
   * @return the number of expired PENDING items deleted
   */
  public int runOnce() {
    if (closed) {
      return 0;
    }
    try {
      Instant now = clock.instant();
      int expired = purgeAll(now, Kind.EXPIRED);
      if (expired > 0) {
        metrics.incrementExpiredPurged(expired);
        logger.log(Level.INFO, "Purged {0} expired pending items", expired);
      }
      if (completedRetention != null) {
        Instant cutoff = now.minus(completedRetention);
        int completed = purgeAll(cutoff, Kind.COMPLETED);
        if (completed > 0) {
          logger.log(Level.INFO, "Purged {0} completed items processed before {1}",
              new Object[]{completed, cutoff});
        }
      }
      return expired;
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Cleanup cycle failed", t);
      return 0;
    }
  }

  private enum Kind { EXPIRED, COMPLETED }

  private int purgeAll(Instant cutoff, Kind kind) throws SQLException {
    int total = 0;
    int deleted;
    do {
      try (Connection conn = connectionProvider.getConnection()) {
        conn.setAutoCommit(true);
        deleted = kind == Kind.EXPIRED
            ? purger.purgeExpired(conn, cutoff, batchSize)
            : purger.purgeCompleted(conn, cutoff, batchSize);
      }
      total += deleted;
    } while (deleted >= batchSize);
    return total;
  }

  /** Cancels the cleanup schedule and shuts down the scheduler thread. */
  @Override
  public synchronized void close() {
    closed = true;
    if (cleanupTask != null) {
      cleanupTask.cancel(false);
      cleanupTask = null;
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
      try {
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /** Builder for {@link CleanupScheduler}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private QueuePurger purger;
    private MetricsExporter metrics;
    private Clock clock;
    private Duration completedRetention;
    private int batchSize = 500;
    private Duration interval = Duration.ofHours(1);

    private Builder() {}

    /**
     * Sets the connection provider for obtaining JDBC connections during cleanup.
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
     * @param purger the delete strategy
     * @return this builder
     */
    public Builder purger(QueuePurger purger) {
      this.purger = purger;
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
     * Optional. Defaults to {@link Clock#systemUTC()}.
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Sets how long COMPLETED items are kept after processing.
     *
     * <p>Optional. Completed items are kept forever when unset. Must be &ge; 0.
     *
     * @param completedRetention the retention, or {@code null} to keep completed items
     * @return this builder
     */
    public Builder completedRetention(Duration completedRetention) {
      this.completedRetention = completedRetention;
      return this;
    }

    /**
     * Sets the maximum number of items deleted per batch within a cycle.
     *
     * <p>Optional. Defaults to {@code 500}. Must be &gt; 0.
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Sets the delay between cleanup cycles.
     *
     * <p>Optional. Defaults to 1 hour. Must be positive.
     */
    public Builder interval(Duration interval) {
      this.interval = interval;
      return this;
    }

    /**
     * Builds the scheduler. Call {@link CleanupScheduler#start()} to begin.
     *
     * @return a new {@link CleanupScheduler}
     * @throws NullPointerException     if {@code connectionProvider} or {@code purger} is null
     * @throws IllegalArgumentException if {@code completedRetention} is negative,
     *     {@code batchSize <= 0}, or {@code interval} is not positive
     */
    public CleanupScheduler build() {
      return new CleanupScheduler(this);
    }
  }
}
