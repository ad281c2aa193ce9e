package siorgsync;

import siorgsync.registry.HttpRegistryClient;

import java.time.Duration;
import java.util.Map;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Tunables of a sync worker process.
 *
 * <p>{@link #fromEnvironment(Map)} reads the {@code WORKER_*} and {@code SIORG_API_*}
 * variables; a variable that does not parse keeps its default and logs a warning.
 */
public final class WorkerConfig {
  private static final Logger logger = Logger.getLogger(WorkerConfig.class.getName());

  private int batchSize = 10;
  private Duration pollInterval = Duration.ofSeconds(5);
  private int maxAttempts = 3;
  private long retryBaseDelayMs = 1000L;
  private long retryMaxDelayMs = 60000L;
  private boolean cleanupEnabled = true;
  private Duration cleanupInterval = Duration.ofHours(1);
  private Duration completedRetention;
  private String registryBaseUrl = HttpRegistryClient.DEFAULT_BASE_URL;
  private String registryToken;
  private Duration leaseDuration = Duration.ofMinutes(5);
  private int concurrency = 4;
  private Duration drainTimeout = Duration.ofSeconds(30);
  private String workerId;

  /**
   * Builds a config from environment variables, e.g. {@code WorkerConfig.fromEnvironment(System.getenv())}.
   */
  public static WorkerConfig fromEnvironment(Map<String, String> env) {
    WorkerConfig config = new WorkerConfig();
    config.batchSize = read(env, "WORKER_BATCH_SIZE", Integer::parseInt, config.batchSize);
    config.pollInterval = Duration.ofSeconds(
        read(env, "WORKER_POLL_INTERVAL_SECS", Long::parseLong, config.pollInterval.getSeconds()));
    config.maxAttempts = read(env, "WORKER_MAX_RETRIES", Integer::parseInt, config.maxAttempts);
    config.retryBaseDelayMs = read(env, "WORKER_RETRY_BASE_DELAY_MS", Long::parseLong, config.retryBaseDelayMs);
    config.retryMaxDelayMs = read(env, "WORKER_RETRY_MAX_DELAY_MS", Long::parseLong, config.retryMaxDelayMs);
    config.cleanupEnabled = read(env, "WORKER_ENABLE_CLEANUP", WorkerConfig::parseBoolean, config.cleanupEnabled);
    config.cleanupInterval = Duration.ofSeconds(
        read(env, "WORKER_CLEANUP_INTERVAL_SECS", Long::parseLong, config.cleanupInterval.getSeconds()));
    config.leaseDuration = Duration.ofSeconds(
        read(env, "WORKER_LEASE_SECS", Long::parseLong, config.leaseDuration.getSeconds()));
    config.concurrency = read(env, "WORKER_CONCURRENCY", Integer::parseInt, config.concurrency);
    config.registryBaseUrl = read(env, "SIORG_API_URL", Function.identity(), config.registryBaseUrl);
    config.registryToken = read(env, "SIORG_API_TOKEN", Function.identity(), null);
    config.workerId = read(env, "WORKER_ID", Function.identity(), null);
    return config;
  }

  private static <T> T read(Map<String, String> env, String name, Function<String, T> parser, T fallback) {
    String raw = env.get(name);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    try {
      return parser.apply(raw.trim());
    } catch (IllegalArgumentException e) {
      logger.log(Level.WARNING, "Ignoring invalid value for {0}: {1}", new Object[]{name, raw});
      return fallback;
    }
  }

  private static Boolean parseBoolean(String raw) {
    if ("true".equalsIgnoreCase(raw) || "1".equals(raw)) {
      return Boolean.TRUE;
    }
    if ("false".equalsIgnoreCase(raw) || "0".equals(raw)) {
      return Boolean.FALSE;
    }
    throw new IllegalArgumentException("Not a boolean: " + raw);
  }

  public int getBatchSize() {
    return batchSize;
  }

  public WorkerConfig setBatchSize(int batchSize) {
    this.batchSize = batchSize;
    return this;
  }

  public Duration getPollInterval() {
    return pollInterval;
  }

  public WorkerConfig setPollInterval(Duration pollInterval) {
    this.pollInterval = pollInterval;
    return this;
  }

  /** Attempts allowed per item before it is FAILED; new items are enqueued with this ceiling. */
  public int getMaxAttempts() {
    return maxAttempts;
  }

  public WorkerConfig setMaxAttempts(int maxAttempts) {
    this.maxAttempts = maxAttempts;
    return this;
  }

  public long getRetryBaseDelayMs() {
    return retryBaseDelayMs;
  }

  public WorkerConfig setRetryBaseDelayMs(long retryBaseDelayMs) {
    this.retryBaseDelayMs = retryBaseDelayMs;
    return this;
  }

  public long getRetryMaxDelayMs() {
    return retryMaxDelayMs;
  }

  public WorkerConfig setRetryMaxDelayMs(long retryMaxDelayMs) {
    this.retryMaxDelayMs = retryMaxDelayMs;
    return this;
  }

  public boolean isCleanupEnabled() {
    return cleanupEnabled;
  }

  public WorkerConfig setCleanupEnabled(boolean cleanupEnabled) {
    this.cleanupEnabled = cleanupEnabled;
    return this;
  }

  public Duration getCleanupInterval() {
    return cleanupInterval;
  }

  public WorkerConfig setCleanupInterval(Duration cleanupInterval) {
    this.cleanupInterval = cleanupInterval;
    return this;
  }

  /** {@code null} keeps COMPLETED items forever. */
  public Duration getCompletedRetention() {
    return completedRetention;
  }

  public WorkerConfig setCompletedRetention(Duration completedRetention) {
    this.completedRetention = completedRetention;
    return this;
  }

  public String getRegistryBaseUrl() {
    return registryBaseUrl;
  }

  public WorkerConfig setRegistryBaseUrl(String registryBaseUrl) {
    this.registryBaseUrl = registryBaseUrl;
    return this;
  }

  public String getRegistryToken() {
    return registryToken;
  }

  public WorkerConfig setRegistryToken(String registryToken) {
    this.registryToken = registryToken;
    return this;
  }

  public Duration getLeaseDuration() {
    return leaseDuration;
  }

  public WorkerConfig setLeaseDuration(Duration leaseDuration) {
    this.leaseDuration = leaseDuration;
    return this;
  }

  public int getConcurrency() {
    return concurrency;
  }

  public WorkerConfig setConcurrency(int concurrency) {
    this.concurrency = concurrency;
    return this;
  }

  public Duration getDrainTimeout() {
    return drainTimeout;
  }

  public WorkerConfig setDrainTimeout(Duration drainTimeout) {
    this.drainTimeout = drainTimeout;
    return this;
  }

  /** {@code null} lets the worker pick a random id. */
  public String getWorkerId() {
    return workerId;
  }

  public WorkerConfig setWorkerId(String workerId) {
    this.workerId = workerId;
    return this;
  }
}
