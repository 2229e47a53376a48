package io.meshdispatch.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable snapshot of a delivery unit row.
 *
 * @param id                  human-chosen identifier, stable across restarts (e.g. {@code Truck-01})
 * @param status              current lifecycle status
 * @param assignedDeliveryId  delivery the unit is working on, set only while carrying one
 * @param location            last reported position, or {@code null}
 * @param lastFixAt           sender timestamp of {@code location}
 * @param lastContactAt       server receipt time of the last frame from the unit
 * @param statusBeforeOffline status held when the staleness sweep marked the unit offline
 * @param statusChangedAt     time of the last status change
 */
public record DeliveryUnit(
    String id,
    UnitStatus status,
    Long assignedDeliveryId,
    Coordinates location,
    Instant lastFixAt,
    Instant lastContactAt,
    UnitStatus statusBeforeOffline,
    Instant statusChangedAt
) {

  public DeliveryUnit {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(statusChangedAt, "statusChangedAt");
  }

  public static DeliveryUnit newIdle(String id, Instant now) {
    return new DeliveryUnit(id, UnitStatus.IDLE, null, null, null, null, null, now);
  }

  public DeliveryUnit withStatus(UnitStatus newStatus, Long deliveryId, Instant now) {
    return new DeliveryUnit(id, newStatus, deliveryId, location, lastFixAt, lastContactAt,
        newStatus == UnitStatus.OFFLINE ? statusBeforeOffline : null, now);
  }

  public DeliveryUnit withOffline(Instant now) {
    return new DeliveryUnit(id, UnitStatus.OFFLINE, null, location, lastFixAt, lastContactAt,
        status, now);
  }

  public DeliveryUnit withContact(Instant receivedAt) {
    return new DeliveryUnit(id, status, assignedDeliveryId, location, lastFixAt, receivedAt,
        statusBeforeOffline, statusChangedAt);
  }

  public DeliveryUnit withFix(Coordinates position, Instant fixAt) {
    return new DeliveryUnit(id, status, assignedDeliveryId, position, fixAt, lastContactAt,
        statusBeforeOffline, statusChangedAt);
  }
}
