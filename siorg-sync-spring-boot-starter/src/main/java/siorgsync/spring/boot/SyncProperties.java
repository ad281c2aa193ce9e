package siorgsync.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;
import siorgsync.WorkerConfig;
import siorgsync.jdbc.TableNames;
import siorgsync.registry.HttpRegistryClient;

import java.time.Duration;

/**
 * Configuration properties for the SIORG sync worker.
 *
 * @see SyncAutoConfiguration
 */
@ConfigurationProperties(prefix = "siorg.sync")
public class SyncProperties {

  /**
   * Whether the worker and cleanup schedules start with the application context.
   */
  private boolean autoStart = true;

  /**
   * Identifier recorded as {@code claimed_by}; generated when empty.
   */
  private String workerId;

  /**
   * Table holding the sync queue.
   */
  private String tableName = TableNames.DEFAULT_QUEUE_TABLE;

  /**
   * Table holding local entity copies and their sync baselines.
   */
  private String localRecordTableName = TableNames.DEFAULT_LOCAL_RECORD_TABLE;

  /**
   * Table holding the sync history audit trail.
   */
  private String historyTableName = TableNames.DEFAULT_HISTORY_TABLE;

  private final Poller poller = new Poller();
  private final Retry retry = new Retry();
  private final Registry registry = new Registry();
  private final Cleanup cleanup = new Cleanup();
  private final Metrics metrics = new Metrics();

  public boolean isAutoStart() {
    return autoStart;
  }

  public void setAutoStart(boolean autoStart) {
    this.autoStart = autoStart;
  }

  public String getWorkerId() {
    return workerId;
  }

  public void setWorkerId(String workerId) {
    this.workerId = workerId;
  }

  public String getTableName() {
    return tableName;
  }

  public void setTableName(String tableName) {
    this.tableName = tableName;
  }

  public String getLocalRecordTableName() {
    return localRecordTableName;
  }

  public void setLocalRecordTableName(String localRecordTableName) {
    this.localRecordTableName = localRecordTableName;
  }

  public String getHistoryTableName() {
    return historyTableName;
  }

  public void setHistoryTableName(String historyTableName) {
    this.historyTableName = historyTableName;
  }

  public Poller getPoller() {
    return poller;
  }

  public Retry getRetry() {
    return retry;
  }

  public Registry getRegistry() {
    return registry;
  }

  public Cleanup getCleanup() {
    return cleanup;
  }

  public Metrics getMetrics() {
    return metrics;
  }

  /**
   * Maps these properties onto the core {@link WorkerConfig}.
   */
  public WorkerConfig toWorkerConfig() {
    return new WorkerConfig()
        .setWorkerId(workerId == null || workerId.isBlank() ? null : workerId)
        .setBatchSize(poller.getBatchSize())
        .setPollInterval(poller.getInterval())
        .setLeaseDuration(poller.getLeaseDuration())
        .setConcurrency(poller.getConcurrency())
        .setDrainTimeout(poller.getDrainTimeout())
        .setMaxAttempts(retry.getMaxAttempts())
        .setRetryBaseDelayMs(retry.getBaseDelayMs())
        .setRetryMaxDelayMs(retry.getMaxDelayMs())
        .setRegistryBaseUrl(registry.getBaseUrl())
        .setRegistryToken(registry.getToken())
        .setCleanupEnabled(cleanup.isEnabled())
        .setCleanupInterval(cleanup.getInterval())
        .setCompletedRetention(cleanup.getCompletedRetention());
  }

  public static class Poller {
    private int batchSize = 10;
    private Duration interval = Duration.ofSeconds(5);
    private Duration leaseDuration = Duration.ofMinutes(5);
    private int concurrency = 4;
    private Duration drainTimeout = Duration.ofSeconds(30);

    public int getBatchSize() {
      return batchSize;
    }

    public void setBatchSize(int batchSize) {
      this.batchSize = batchSize;
    }

    public Duration getInterval() {
      return interval;
    }

    public void setInterval(Duration interval) {
      this.interval = interval;
    }

    public Duration getLeaseDuration() {
      return leaseDuration;
    }

    public void setLeaseDuration(Duration leaseDuration) {
      this.leaseDuration = leaseDuration;
    }

    public int getConcurrency() {
      return concurrency;
    }

    public void setConcurrency(int concurrency) {
      this.concurrency = concurrency;
    }

    public Duration getDrainTimeout() {
      return drainTimeout;
    }

    public void setDrainTimeout(Duration drainTimeout) {
      this.drainTimeout = drainTimeout;
    }
  }

  public static class Retry {
    private int maxAttempts = 3;
    private long baseDelayMs = 1000;
    private long maxDelayMs = 60000;

    public int getMaxAttempts() {
      return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
    }

    public long getBaseDelayMs() {
      return baseDelayMs;
    }

    public void setBaseDelayMs(long baseDelayMs) {
      this.baseDelayMs = baseDelayMs;
    }

    public long getMaxDelayMs() {
      return maxDelayMs;
    }

    public void setMaxDelayMs(long maxDelayMs) {
      this.maxDelayMs = maxDelayMs;
    }
  }

  public static class Registry {
    private String baseUrl = HttpRegistryClient.DEFAULT_BASE_URL;
    private String token;
    private Duration connectTimeout = Duration.ofSeconds(10);
    private Duration requestTimeout = Duration.ofSeconds(30);

    public String getBaseUrl() {
      return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
      this.baseUrl = baseUrl;
    }

    public String getToken() {
      return token;
    }

    public void setToken(String token) {
      this.token = token;
    }

    public Duration getConnectTimeout() {
      return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
      this.connectTimeout = connectTimeout;
    }

    public Duration getRequestTimeout() {
      return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
      this.requestTimeout = requestTimeout;
    }
  }

  public static class Cleanup {
    private boolean enabled = true;
    private Duration interval = Duration.ofHours(1);
    private Duration completedRetention;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public Duration getInterval() {
      return interval;
    }

    public void setInterval(Duration interval) {
      this.interval = interval;
    }

    /**
     * How long COMPLETED items are kept; {@code null} keeps them forever.
     */
    public Duration getCompletedRetention() {
      return completedRetention;
    }

    public void setCompletedRetention(Duration completedRetention) {
      this.completedRetention = completedRetention;
    }
  }

  public static class Metrics {
    private boolean enabled = true;
    private String namePrefix = "siorg.sync";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getNamePrefix() {
      return namePrefix;
    }

    public void setNamePrefix(String namePrefix) {
      this.namePrefix = namePrefix;
    }
  }
}
