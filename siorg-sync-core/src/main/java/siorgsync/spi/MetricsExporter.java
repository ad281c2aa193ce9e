package siorgsync.spi;

/**
 * Observability hook for exporting sync worker counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Adds the number of items claimed by one batch.
   */
  void incrementClaimed(int count);

  /**
   * Increments the count of items COMPLETED by the worker (applied or no-op).
   */
  void incrementCompleted();

  /**
   * Increments the count of items completed without processing (locally managed types,
   * manual-review operations).
   */
  void incrementSkipped();

  /**
   * Increments the count of items moved to CONFLICT.
   */
  void incrementConflict();

  /**
   * Increments the count of failed attempts rescheduled with backoff.
   */
  void incrementRetried();

  /**
   * Increments the count of items moved to FAILED.
   */
  void incrementFailed();

  /**
   * Increments the count of outcomes discarded because the claim was lost.
   */
  default void incrementClaimLost() {
  }

  /**
   * Adds the number of expired PENDING items removed by cleanup.
   */
  default void incrementExpiredPurged(int count) {
  }

  /**
   * Records the size of the most recent claimed batch.
   */
  default void recordBatchSize(int size) {
  }

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementClaimed(int count) {
    }

    @Override
    public void incrementCompleted() {
    }

    @Override
    public void incrementSkipped() {
    }

    @Override
    public void incrementConflict() {
    }

    @Override
    public void incrementRetried() {
    }

    @Override
    public void incrementFailed() {
    }
  }
}
