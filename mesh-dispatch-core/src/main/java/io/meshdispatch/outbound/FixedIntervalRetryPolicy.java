package io.meshdispatch.outbound;

/**
 * Waits the same interval after every send.
 */
public final class FixedIntervalRetryPolicy implements RetryPolicy {
  private final long intervalMs;

  public FixedIntervalRetryPolicy(long intervalMs) {
    if (intervalMs <= 0) {
      throw new IllegalArgumentException("intervalMs must be > 0, got: " + intervalMs);
    }
    this.intervalMs = intervalMs;
  }

  @Override
  public long computeDelayMs(int attempts) {
    return attempts <= 0 ? 0L : intervalMs;
  }
}
