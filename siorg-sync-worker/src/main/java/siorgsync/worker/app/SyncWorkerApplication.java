package siorgsync.worker.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Standalone sync worker process.
 *
 * <p>The starter auto-configures the queue store, registry client and worker from
 * {@code siorg.sync.*}; {@code application.yml} maps the worker's environment variables
 * ({@code WORKER_BATCH_SIZE}, {@code SIORG_API_URL}, ...) onto those properties.
 * Run several instances against the same database to scale out.
 */
@SpringBootApplication
public class SyncWorkerApplication {

  public static void main(String[] args) {
    SpringApplication.run(SyncWorkerApplication.class, args);
  }
}
