package siorgsync.worker;

/**
 * Strategy for computing the delay before a failed queue item becomes claimable again.
 *
 * @see ExponentialBackoffRetryPolicy
 */
public interface RetryPolicy {

  /**
   * Computes the delay in milliseconds before the next attempt.
   *
   * @param attempts the item's attempt count before this failure is counted (0 for the
   *                 first failure)
   * @return delay in milliseconds (non-negative)
   */
  long computeDelayMs(int attempts);
}
