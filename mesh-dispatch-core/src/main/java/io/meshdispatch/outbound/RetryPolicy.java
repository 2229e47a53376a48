package io.meshdispatch.outbound;

/**
 * Strategy for computing how long to wait for an acknowledgment before re-sending.
 *
 * @see FixedIntervalRetryPolicy
 * @see ExponentialBackoffRetryPolicy
 */
public interface RetryPolicy {

  /**
   * Computes the wait after a send.
   *
   * @param attempts the number of sends performed so far (1-based)
   * @return delay in milliseconds (non-negative)
   */
  long computeDelayMs(int attempts);
}
