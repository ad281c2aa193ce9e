package siorgsync.worker.app;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import siorgsync.SiorgSync;
import siorgsync.model.QueueStats;
import siorgsync.registry.RegistryClient;

/**
 * Logs the worker identity, registry reachability and the queue backlog once the
 * context is up.
 */
@Component
public class StartupReport implements ApplicationRunner {

  private static final Logger log = LoggerFactory.getLogger(StartupReport.class);

  private final SiorgSync siorgSync;
  private final RegistryClient registryClient;

  public StartupReport(SiorgSync siorgSync, RegistryClient registryClient) {
    this.siorgSync = siorgSync;
    this.registryClient = registryClient;
  }

  @Override
  public void run(ApplicationArguments args) {
    log.info("Sync worker {} is up", siorgSync.worker().workerId());

    if (registryClient.healthCheck()) {
      log.info("Registry health check passed");
    } else {
      log.warn("Registry health check failed; items will be retried until it recovers");
    }

    QueueStats stats = siorgSync.admin().stats();
    log.info("Queue backlog: pending={} processing={} failed={} conflicts={}",
        stats.pending(), stats.processing(), stats.failed(), stats.conflict());
  }
}
