package io.meshdispatch.model;

import java.util.Locale;

/**
 * Lifecycle status of a delivery unit.
 */
public enum UnitStatus {
  IDLE,
  ASSIGNED,
  EN_ROUTE,
  ARRIVED_DEST,
  RETURNING,
  OFFLINE,
  ERROR;

  private final String wireName = name().toLowerCase(Locale.ROOT);

  public String wireName() {
    return wireName;
  }

  /** Statuses in which the unit carries an assigned delivery. */
  public boolean carriesDelivery() {
    return this == ASSIGNED || this == EN_ROUTE || this == ARRIVED_DEST;
  }

  /**
   * Unit status mirroring an active delivery status.
   *
   * @throws IllegalArgumentException if the delivery status is not active
   */
  public static UnitStatus forActiveDelivery(DeliveryStatus status) {
    return switch (status) {
      case ASSIGNED -> ASSIGNED;
      case EN_ROUTE -> EN_ROUTE;
      case ARRIVED_DEST -> ARRIVED_DEST;
      default -> throw new IllegalArgumentException("Not an active delivery status: " + status);
    };
  }

  public static UnitStatus fromWireName(String wireName) {
    for (UnitStatus status : values()) {
      if (status.wireName.equals(wireName)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown unit status: " + wireName);
  }
}
