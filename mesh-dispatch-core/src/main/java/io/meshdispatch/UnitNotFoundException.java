package io.meshdispatch;

public class UnitNotFoundException extends DispatchException {
  private final String unitId;

  public UnitNotFoundException(String unitId) {
    super("Unit not found: " + unitId);
    this.unitId = unitId;
  }

  public String unitId() {
    return unitId;
  }
}
