package siorgsync.spring.boot;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;
import siorgsync.WorkerConfig;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SyncPropertiesTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withUserConfiguration(PropsConfig.class);

  @Test
  void defaultValues() {
    runner.run(ctx -> {
      var props = ctx.getBean(SyncProperties.class);
      assertTrue(props.isAutoStart());
      assertNull(props.getWorkerId());
      assertEquals("siorg_sync_queue", props.getTableName());
      assertEquals("siorg_local_record", props.getLocalRecordTableName());
      assertEquals("siorg_sync_history", props.getHistoryTableName());
      assertEquals(10, props.getPoller().getBatchSize());
      assertEquals(Duration.ofSeconds(5), props.getPoller().getInterval());
      assertEquals(Duration.ofMinutes(5), props.getPoller().getLeaseDuration());
      assertEquals(4, props.getPoller().getConcurrency());
      assertEquals(Duration.ofSeconds(30), props.getPoller().getDrainTimeout());
      assertEquals(3, props.getRetry().getMaxAttempts());
      assertEquals(1000, props.getRetry().getBaseDelayMs());
      assertEquals(60000, props.getRetry().getMaxDelayMs());
      assertEquals("https://api.siorg.gov.br", props.getRegistry().getBaseUrl());
      assertNull(props.getRegistry().getToken());
      assertTrue(props.getCleanup().isEnabled());
      assertEquals(Duration.ofHours(1), props.getCleanup().getInterval());
      assertNull(props.getCleanup().getCompletedRetention());
      assertTrue(props.getMetrics().isEnabled());
      assertEquals("siorg.sync", props.getMetrics().getNamePrefix());
    });
  }

  @Test
  void customValuesMapOntoWorkerConfig() {
    runner.withPropertyValues(
        "siorg.sync.worker-id=w-9",
        "siorg.sync.poller.batch-size=25",
        "siorg.sync.poller.interval=2s",
        "siorg.sync.poller.lease-duration=10m",
        "siorg.sync.poller.concurrency=8",
        "siorg.sync.retry.max-attempts=5",
        "siorg.sync.retry.base-delay-ms=500",
        "siorg.sync.retry.max-delay-ms=30000",
        "siorg.sync.registry.base-url=http://localhost:8089",
        "siorg.sync.registry.token=secret",
        "siorg.sync.cleanup.enabled=false",
        "siorg.sync.cleanup.completed-retention=7d",
        "siorg.sync.metrics.enabled=false",
        "siorg.sync.history-table-name=audit_history"
    ).run(ctx -> {
      var props = ctx.getBean(SyncProperties.class);
      assertFalse(props.getMetrics().isEnabled());
      assertEquals("audit_history", props.getHistoryTableName());

      WorkerConfig config = props.toWorkerConfig();
      assertEquals("w-9", config.getWorkerId());
      assertEquals(25, config.getBatchSize());
      assertEquals(Duration.ofSeconds(2), config.getPollInterval());
      assertEquals(Duration.ofMinutes(10), config.getLeaseDuration());
      assertEquals(8, config.getConcurrency());
      assertEquals(5, config.getMaxAttempts());
      assertEquals(500, config.getRetryBaseDelayMs());
      assertEquals(30000, config.getRetryMaxDelayMs());
      assertEquals("http://localhost:8089", config.getRegistryBaseUrl());
      assertEquals("secret", config.getRegistryToken());
      assertFalse(config.isCleanupEnabled());
      assertEquals(Duration.ofDays(7), config.getCompletedRetention());
    });
  }

  @Test
  void blankWorkerIdIsGenerated() {
    runner.withPropertyValues("siorg.sync.worker-id= ").run(ctx ->
        assertNull(ctx.getBean(SyncProperties.class).toWorkerConfig().getWorkerId()));
  }

  @Configuration
  @EnableConfigurationProperties(SyncProperties.class)
  static class PropsConfig {
  }
}
