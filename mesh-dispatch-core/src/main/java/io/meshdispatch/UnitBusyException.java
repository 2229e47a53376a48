package io.meshdispatch;

/**
 * An assignment targeted a unit that is not {@code idle}.
 */
public class UnitBusyException extends InvalidTransitionException {
  private final String unitId;

  public UnitBusyException(String unitId, String unitStatus) {
    super("Unit " + unitId + " is not idle (status=" + unitStatus + ")");
    this.unitId = unitId;
  }

  public String unitId() {
    return unitId;
  }
}
