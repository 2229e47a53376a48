package io.meshdispatch.outbound;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

  @Test
  void fixedIntervalIsConstant() {
    FixedIntervalRetryPolicy policy = new FixedIntervalRetryPolicy(30_000);
    assertEquals(30_000, policy.computeDelayMs(1));
    assertEquals(30_000, policy.computeDelayMs(4));
    assertEquals(0, policy.computeDelayMs(0));
  }

  @Test
  void exponentialDoublesUpToCap() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(1000, 5000, false);
    assertEquals(1000, policy.computeDelayMs(1));
    assertEquals(2000, policy.computeDelayMs(2));
    assertEquals(4000, policy.computeDelayMs(3));
    assertEquals(5000, policy.computeDelayMs(4));
    assertEquals(5000, policy.computeDelayMs(40));
  }

  @Test
  void jitterStaysWithinBounds() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(1000, 60_000, true);
    for (int i = 0; i < 200; i++) {
      long delay = policy.computeDelayMs(2);
      assertTrue(delay >= 1000 && delay < 3000, "delay out of range: " + delay);
    }
  }

  @Test
  void rejectsInvalidArguments() {
    assertThrows(IllegalArgumentException.class, () -> new FixedIntervalRetryPolicy(0));
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(0, 10));
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(100, 50));
  }
}
