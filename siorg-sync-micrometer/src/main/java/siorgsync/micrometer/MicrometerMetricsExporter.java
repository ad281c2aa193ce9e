package siorgsync.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import siorgsync.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters and a gauge with a {@link MeterRegistry} for export to
 * Prometheus, Grafana, Datadog, and other monitoring backends.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code siorg.sync.items.claimed} items claimed by the worker</li>
 *   <li>{@code siorg.sync.items.completed} items COMPLETED after reconciliation</li>
 *   <li>{@code siorg.sync.items.skipped} items completed without processing</li>
 *   <li>{@code siorg.sync.items.conflict} items moved to CONFLICT</li>
 *   <li>{@code siorg.sync.items.retried} failed attempts rescheduled</li>
 *   <li>{@code siorg.sync.items.failed} items moved to FAILED</li>
 *   <li>{@code siorg.sync.items.claim.lost} outcomes discarded after a lost claim</li>
 *   <li>{@code siorg.sync.items.expired.purged} expired items deleted by cleanup</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code siorg.sync.batch.size} size of the most recent claimed batch</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {
  public static final String DEFAULT_PREFIX = "siorg.sync";

  private final MeterRegistry registry;
  private final Counter claimed;
  private final Counter completed;
  private final Counter skipped;
  private final Counter conflict;
  private final Counter retried;
  private final Counter failed;
  private final Counter claimLost;
  private final Counter expiredPurged;
  private final Gauge batchSizeGauge;

  private final AtomicInteger batchSize = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@value #DEFAULT_PREFIX}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, DEFAULT_PREFIX);
  }

  /**
   * Creates an exporter with a custom metric name prefix, for running several workers
   * against one registry.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "siorg.sync.replica"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.claimed = counter(namePrefix + ".items.claimed", "Items claimed by the worker");
    this.completed = counter(namePrefix + ".items.completed", "Items completed after reconciliation");
    this.skipped = counter(namePrefix + ".items.skipped", "Items completed without processing");
    this.conflict = counter(namePrefix + ".items.conflict", "Items moved to CONFLICT");
    this.retried = counter(namePrefix + ".items.retried", "Failed attempts rescheduled with backoff");
    this.failed = counter(namePrefix + ".items.failed", "Items moved to FAILED");
    this.claimLost = counter(namePrefix + ".items.claim.lost", "Outcomes discarded after a lost claim");
    this.expiredPurged = counter(namePrefix + ".items.expired.purged", "Expired pending items deleted");

    this.batchSizeGauge = Gauge.builder(namePrefix + ".batch.size", batchSize, AtomicInteger::get)
        .description("Size of the most recent claimed batch")
        .register(registry);
  }

  private Counter counter(String name, String description) {
    return Counter.builder(name).description(description).register(registry);
  }

  @Override
  public void incrementClaimed(int count) {
    if (closed) return;
    claimed.increment(count);
  }

  @Override
  public void incrementCompleted() {
    if (closed) return;
    completed.increment();
  }

  @Override
  public void incrementSkipped() {
    if (closed) return;
    skipped.increment();
  }

  @Override
  public void incrementConflict() {
    if (closed) return;
    conflict.increment();
  }

  @Override
  public void incrementRetried() {
    if (closed) return;
    retried.increment();
  }

  @Override
  public void incrementFailed() {
    if (closed) return;
    failed.increment();
  }

  @Override
  public void incrementClaimLost() {
    if (closed) return;
    claimLost.increment();
  }

  @Override
  public void incrementExpiredPurged(int count) {
    if (closed) return;
    expiredPurged.increment(count);
  }

  @Override
  public void recordBatchSize(int size) {
    if (closed) return;
    batchSize.set(size);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Called by {@link siorgsync.SiorgSync#close()} so a stopped worker leaves no stale
   * gauge behind.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(claimed, completed, skipped, conflict, retried, failed,
        claimLost, expiredPurged, batchSizeGauge)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
