package siorgsync.worker;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Retry policy using exponential backoff with bounded jitter.
 *
 * <p>Delay formula: {@code baseDelay * 2^attempts}, capped at {@code maxDelay}, then
 * scaled by a random factor in {@code [1 - jitter, 1 + jitter)} and capped again. With
 * the default jitter of 0.2 the first retry lands between 0.8 and 1.2 times the base
 * delay.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  public static final double DEFAULT_JITTER = 0.2;

  private final long baseDelayMs;
  private final long maxDelayMs;
  private final double jitter;

  /**
   * @param baseDelayMs base delay for the first retry (milliseconds)
   * @param maxDelayMs  maximum delay cap (milliseconds)
   */
  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
    this(baseDelayMs, maxDelayMs, DEFAULT_JITTER);
  }

  /**
   * @param baseDelayMs base delay for the first retry (milliseconds)
   * @param maxDelayMs  maximum delay cap (milliseconds)
   * @param jitter      relative jitter in {@code [0, 1)}; {@code 0} disables it
   */
  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs, double jitter) {
    if (baseDelayMs <= 0) {
      throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
    }
    if (maxDelayMs < baseDelayMs) {
      throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
    }
    if (jitter < 0.0 || jitter >= 1.0) {
      throw new IllegalArgumentException("jitter must be in [0, 1), got: " + jitter);
    }
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
    this.jitter = jitter;
  }

  @Override
  public long computeDelayMs(int attempts) {
    int exponent = Math.max(0, attempts);
    long expDelay;
    if (exponent >= 62) {
      expDelay = Long.MAX_VALUE;
    } else {
      long shift = 1L << exponent;
      // Guard against overflow: if shift exceeds maxDelayMs/baseDelayMs, cap directly
      expDelay = shift > maxDelayMs / baseDelayMs ? Long.MAX_VALUE : baseDelayMs * shift;
    }
    long capped = Math.min(maxDelayMs, expDelay);
    if (jitter == 0.0) {
      return capped;
    }
    double factor = ThreadLocalRandom.current().nextDouble(1.0 - jitter, 1.0 + jitter);
    long withJitter = (long) (capped * factor);
    return Math.min(maxDelayMs, Math.max(0L, withJitter));
  }
}
