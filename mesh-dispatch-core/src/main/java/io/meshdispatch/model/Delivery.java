package io.meshdispatch.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable snapshot of a delivery row.
 *
 * <p>{@code assignedUnitId} is non-null exactly when {@code status} is
 * {@link DeliveryStatus#isActive() active}. Deliveries are never deleted.
 *
 * @param id              server-assigned, monotonically increasing identifier
 * @param address         destination address as entered by the dispatcher
 * @param coordinates     resolved destination, {@code null} until geocoded
 * @param status          current lifecycle status
 * @param assignedUnitId  unit carrying the delivery, or {@code null}
 * @param createdAt       creation time
 * @param statusChangedAt time of the last status change
 * @param assignedAt      time the delivery entered {@code assigned}
 * @param enRouteAt       time the unit reported departure
 * @param arrivedAt       time the unit reported arrival
 * @param completedAt     time the delivery reached a terminal state
 * @param failureReason   reason recorded when the delivery failed
 */
public record Delivery(
    long id,
    String address,
    Coordinates coordinates,
    DeliveryStatus status,
    String assignedUnitId,
    Instant createdAt,
    Instant statusChangedAt,
    Instant assignedAt,
    Instant enRouteAt,
    Instant arrivedAt,
    Instant completedAt,
    String failureReason
) {

  public Delivery {
    Objects.requireNonNull(address, "address");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(createdAt, "createdAt");
    Objects.requireNonNull(statusChangedAt, "statusChangedAt");
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  /** Copy-and-modify helper used by the state machines. */
  public static final class Builder {
    private final long id;
    private final String address;
    private final Instant createdAt;
    private Coordinates coordinates;
    private DeliveryStatus status;
    private String assignedUnitId;
    private Instant statusChangedAt;
    private Instant assignedAt;
    private Instant enRouteAt;
    private Instant arrivedAt;
    private Instant completedAt;
    private String failureReason;

    private Builder(Delivery source) {
      this.id = source.id;
      this.address = source.address;
      this.createdAt = source.createdAt;
      this.coordinates = source.coordinates;
      this.status = source.status;
      this.assignedUnitId = source.assignedUnitId;
      this.statusChangedAt = source.statusChangedAt;
      this.assignedAt = source.assignedAt;
      this.enRouteAt = source.enRouteAt;
      this.arrivedAt = source.arrivedAt;
      this.completedAt = source.completedAt;
      this.failureReason = source.failureReason;
    }

    public Builder coordinates(Coordinates coordinates) {
      this.coordinates = coordinates;
      return this;
    }

    public Builder status(DeliveryStatus status, Instant changedAt) {
      this.status = status;
      this.statusChangedAt = changedAt;
      return this;
    }

    public Builder assignedUnitId(String assignedUnitId) {
      this.assignedUnitId = assignedUnitId;
      return this;
    }

    public Builder assignedAt(Instant assignedAt) {
      this.assignedAt = assignedAt;
      return this;
    }

    public Builder enRouteAt(Instant enRouteAt) {
      this.enRouteAt = enRouteAt;
      return this;
    }

    public Builder arrivedAt(Instant arrivedAt) {
      this.arrivedAt = arrivedAt;
      return this;
    }

    public Builder completedAt(Instant completedAt) {
      this.completedAt = completedAt;
      return this;
    }

    public Builder failureReason(String failureReason) {
      this.failureReason = failureReason;
      return this;
    }

    public Delivery build() {
      return new Delivery(id, address, coordinates, status, assignedUnitId, createdAt,
          statusChangedAt, assignedAt, enRouteAt, arrivedAt, completedAt, failureReason);
    }
  }
}
