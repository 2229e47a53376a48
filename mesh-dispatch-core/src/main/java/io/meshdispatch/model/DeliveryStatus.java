package io.meshdispatch.model;

import java.util.Locale;

/**
 * Lifecycle status of a delivery. {@link #wireName()} is the lower-case form used in
 * envelopes and in the {@code status} column.
 */
public enum DeliveryStatus {
  PENDING,
  ASSIGNED,
  EN_ROUTE,
  ARRIVED_DEST,
  COMPLETED,
  FAILED;

  private final String wireName = name().toLowerCase(Locale.ROOT);

  public String wireName() {
    return wireName;
  }

  /** A unit is bound to the delivery in these states. */
  public boolean isActive() {
    return this == ASSIGNED || this == EN_ROUTE || this == ARRIVED_DEST;
  }

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }

  public static DeliveryStatus fromWireName(String wireName) {
    for (DeliveryStatus status : values()) {
      if (status.wireName.equals(wireName)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown delivery status: " + wireName);
  }
}
