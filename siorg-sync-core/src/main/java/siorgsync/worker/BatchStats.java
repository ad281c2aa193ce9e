package siorgsync.worker;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Per-batch counters, safe to update from the item pool threads.
 *
 * <p>Failed counts both retried and terminally failed items; skipped includes items whose
 * claim was lost.
 */
public final class BatchStats {
  private final AtomicInteger processed = new AtomicInteger();
  private final AtomicInteger succeeded = new AtomicInteger();
  private final AtomicInteger failed = new AtomicInteger();
  private final AtomicInteger conflicts = new AtomicInteger();
  private final AtomicInteger skipped = new AtomicInteger();

  public void record(ItemResult result) {
    processed.incrementAndGet();
    switch (result) {
      case SUCCEEDED -> succeeded.incrementAndGet();
      case SKIPPED, CLAIM_LOST -> skipped.incrementAndGet();
      case CONFLICT -> conflicts.incrementAndGet();
      case RETRY_SCHEDULED, FAILED, UNRECORDED -> failed.incrementAndGet();
    }
  }

  public int processed() {
    return processed.get();
  }

  public int succeeded() {
    return succeeded.get();
  }

  public int failed() {
    return failed.get();
  }

  public int conflicts() {
    return conflicts.get();
  }

  public int skipped() {
    return skipped.get();
  }

  @Override
  public String toString() {
    return "processed=" + processed() + " succeeded=" + succeeded() + " failed=" + failed()
        + " conflicts=" + conflicts() + " skipped=" + skipped();
  }
}
