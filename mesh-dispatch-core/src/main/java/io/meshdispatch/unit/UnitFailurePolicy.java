package io.meshdispatch.unit;

import io.meshdispatch.model.UnitStatus;

/**
 * Where a unit goes when its delivery fails (dispatcher decision or unanswered assignment).
 */
public enum UnitFailurePolicy {
  /** Hold the unit in {@code error} until a dispatcher clears it. */
  ERROR(UnitStatus.ERROR),
  /** Return the unit to the pool straight away. */
  IDLE(UnitStatus.IDLE);

  private final UnitStatus target;

  UnitFailurePolicy(UnitStatus target) {
    this.target = target;
  }

  public UnitStatus target() {
    return target;
  }
}
