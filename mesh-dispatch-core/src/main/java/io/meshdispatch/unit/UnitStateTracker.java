package io.meshdispatch.unit;

import io.meshdispatch.InvalidTransitionException;
import io.meshdispatch.UnitNotFoundException;
import io.meshdispatch.geo.GeoMath;
import io.meshdispatch.model.Coordinates;
import io.meshdispatch.model.Delivery;
import io.meshdispatch.model.DeliveryUnit;
import io.meshdispatch.model.UnitStatus;
import io.meshdispatch.spi.DeliveryStore;
import io.meshdispatch.spi.MetricsExporter;
import io.meshdispatch.spi.UnitStore;
import io.meshdispatch.tx.TransactionManager.Transaction;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns unit lifecycle transitions.
 *
 * <pre>
 * idle -> assigned -> en_route -> arrived_dest -> returning -> idle
 * any  -> error -> idle                 (failure, unit-reported error, dispatcher clear)
 * non-idle -> offline -> (restored)     (staleness sweep, reconnection)
 * </pre>
 *
 * <p>All methods run inside the caller's transaction and re-read the unit row under lock
 * before changing it. Status writes are compare-and-set on the status that was read.
 */
public final class UnitStateTracker {
  private static final Logger logger = Logger.getLogger(UnitStateTracker.class.getName());

  private static final Map<UnitStatus, EnumSet<UnitStatus>> TRANSITIONS;

  static {
    Map<UnitStatus, EnumSet<UnitStatus>> t = new EnumMap<>(UnitStatus.class);
    t.put(UnitStatus.IDLE, EnumSet.of(UnitStatus.ASSIGNED, UnitStatus.ERROR));
    t.put(UnitStatus.ASSIGNED, EnumSet.of(UnitStatus.EN_ROUTE, UnitStatus.IDLE, UnitStatus.ERROR,
        UnitStatus.OFFLINE));
    t.put(UnitStatus.EN_ROUTE, EnumSet.of(UnitStatus.ARRIVED_DEST, UnitStatus.IDLE, UnitStatus.ERROR,
        UnitStatus.OFFLINE));
    t.put(UnitStatus.ARRIVED_DEST, EnumSet.of(UnitStatus.RETURNING, UnitStatus.IDLE, UnitStatus.ERROR,
        UnitStatus.OFFLINE));
    t.put(UnitStatus.RETURNING, EnumSet.of(UnitStatus.IDLE, UnitStatus.ERROR, UnitStatus.OFFLINE));
    t.put(UnitStatus.OFFLINE, EnumSet.of(UnitStatus.IDLE, UnitStatus.ASSIGNED, UnitStatus.EN_ROUTE,
        UnitStatus.ARRIVED_DEST, UnitStatus.RETURNING, UnitStatus.ERROR));
    t.put(UnitStatus.ERROR, EnumSet.of(UnitStatus.IDLE, UnitStatus.OFFLINE));
    TRANSITIONS = Collections.unmodifiableMap(t);
  }

  private final UnitStore unitStore;
  private final DeliveryStore deliveryStore;
  private final Clock clock;
  private final MetricsExporter metrics;
  private final Duration offlineTimeout;
  private final double arrivalProximityMeters;
  private final Coordinates baseCoordinates;

  private UnitStateTracker(Builder builder) {
    this.unitStore = Objects.requireNonNull(builder.unitStore, "unitStore");
    this.deliveryStore = Objects.requireNonNull(builder.deliveryStore, "deliveryStore");
    this.offlineTimeout = Objects.requireNonNull(builder.offlineTimeout, "offlineTimeout");
    if (offlineTimeout.isNegative() || offlineTimeout.isZero()) {
      throw new IllegalArgumentException("offlineTimeout must be > 0");
    }
    if (builder.arrivalProximityMeters <= 0) {
      throw new IllegalArgumentException("arrivalProximityMeters must be > 0");
    }
    this.arrivalProximityMeters = builder.arrivalProximityMeters;
    this.baseCoordinates = builder.baseCoordinates;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns {@code true} if the transition is allowed by the unit lifecycle.
   */
  public static boolean canTransition(UnitStatus from, UnitStatus to) {
    return TRANSITIONS.getOrDefault(from, EnumSet.noneOf(UnitStatus.class)).contains(to);
  }

  /**
   * Creates the unit in {@code idle} if it does not exist yet.
   *
   * @return the stored unit
   */
  public DeliveryUnit register(Transaction tx, String unitId) {
    Objects.requireNonNull(unitId, "unitId");
    if (unitId.isBlank()) {
      throw new IllegalArgumentException("unitId must not be blank");
    }
    Optional<DeliveryUnit> existing = unitStore.findForUpdate(tx.connection(), unitId);
    if (existing.isPresent()) {
      return existing.get();
    }
    DeliveryUnit unit = DeliveryUnit.newIdle(unitId, clock.instant());
    unitStore.insert(tx.connection(), unit);
    logger.log(Level.INFO, "Registered unit {0}", unitId);
    return unit;
  }

  /**
   * Reads a unit under lock.
   *
   * @throws UnitNotFoundException if the unit is unknown
   */
  public DeliveryUnit require(Transaction tx, String unitId) {
    return unitStore.findForUpdate(tx.connection(), unitId)
        .orElseThrow(() -> new UnitNotFoundException(unitId));
  }

  /**
   * Records contact from a unit: registers it on first contact, refreshes its last-contact
   * time and, if it was {@code offline}, restores its status.
   *
   * @param receivedAt server receipt time of the frame
   * @return the unit after the update
   */
  public DeliveryUnit touch(Transaction tx, String unitId, Instant receivedAt) {
    DeliveryUnit unit = register(tx, unitId);
    DeliveryUnit contacted = unit.withContact(receivedAt);
    if (unit.status() == UnitStatus.OFFLINE) {
      contacted = restore(tx, contacted);
    }
    write(tx, contacted, unit.status());
    return contacted;
  }

  /**
   * Stores a reported position unless it is older than the stored fix.
   *
   * <p>The sender clock is not trusted past the receive time: a fix stamped in the future
   * is stored as of {@code receivedAt}, and a stored fix time later than
   * {@code receivedAt} does not hold back newer reports.
   *
   * @param sentAt     sender timestamp of the fix, or {@code null} if the frame had none
   * @param receivedAt when the frame reached the server
   * @return the unit after the update
   */
  public DeliveryUnit updatePosition(Transaction tx, DeliveryUnit unit, Coordinates position,
      Instant sentAt, Instant receivedAt) {
    if (position == null) {
      return unit;
    }
    Instant fixAt = sentAt == null || sentAt.isAfter(receivedAt) ? receivedAt : sentAt;
    if (sentAt != null && sentAt.isAfter(receivedAt)) {
      logger.log(Level.WARNING, "Fix from {0} stamped {1}, after receipt at {2}; clock skew assumed",
          new Object[]{unit.id(), sentAt, receivedAt});
    }
    Instant lastFixAt = unit.lastFixAt();
    if (lastFixAt != null && !lastFixAt.isAfter(receivedAt) && fixAt.isBefore(lastFixAt)) {
      logger.log(Level.FINE, "Ignoring out-of-order fix from {0} ({1} < {2})",
          new Object[]{unit.id(), fixAt, lastFixAt});
      return unit;
    }
    DeliveryUnit moved = unit.withFix(position, fixAt);
    write(tx, moved, unit.status());
    return moved;
  }

  /**
   * Moves a unit to {@code target}, binding it to {@code deliveryId} when the target
   * status carries a delivery and clearing the binding otherwise.
   *
   * @throws InvalidTransitionException if the lifecycle forbids the move
   */
  public DeliveryUnit transition(Transaction tx, String unitId, UnitStatus target, Long deliveryId) {
    DeliveryUnit unit = require(tx, unitId);
    return transition(tx, unit, target, deliveryId);
  }

  private DeliveryUnit transition(Transaction tx, DeliveryUnit unit, UnitStatus target, Long deliveryId) {
    if (unit.status() == target && Objects.equals(unit.assignedDeliveryId(),
        target.carriesDelivery() ? deliveryId : null)) {
      return unit;
    }
    if (unit.status() != target && !canTransition(unit.status(), target)) {
      throw new InvalidTransitionException("Unit " + unit.id() + " cannot go from "
          + unit.status().wireName() + " to " + target.wireName());
    }
    DeliveryUnit updated = unit.withStatus(target, target.carriesDelivery() ? deliveryId : null,
        clock.instant());
    write(tx, updated, unit.status());
    logger.log(Level.INFO, "Unit {0}: {1} -> {2}",
        new Object[]{unit.id(), unit.status().wireName(), target.wireName()});
    return updated;
  }

  /**
   * Releases a unit from a delivery that left the active states.
   *
   * <p>Only touches the unit if it is still bound to that delivery. An {@code offline} unit
   * keeps its status and has {@code target} remembered for when it reconnects.
   *
   * @return the unit after the update, or empty if it was not bound to the delivery
   */
  public Optional<DeliveryUnit> release(Transaction tx, String unitId, long deliveryId, UnitStatus target) {
    Optional<DeliveryUnit> found = unitStore.findForUpdate(tx.connection(), unitId);
    if (found.isEmpty()) {
      return Optional.empty();
    }
    DeliveryUnit unit = found.get();
    if (unit.status() == UnitStatus.OFFLINE) {
      DeliveryUnit remembered = new DeliveryUnit(unit.id(), UnitStatus.OFFLINE, null, unit.location(),
          unit.lastFixAt(), unit.lastContactAt(), target, unit.statusChangedAt());
      write(tx, remembered, UnitStatus.OFFLINE);
      return Optional.of(remembered);
    }
    if (!Objects.equals(unit.assignedDeliveryId(), deliveryId)) {
      return Optional.empty();
    }
    return Optional.of(transition(tx, unit, target, null));
  }

  /**
   * {@code error --dispatcher_clears_error--> idle}.
   *
   * @throws InvalidTransitionException if the unit is not in {@code error}
   */
  public DeliveryUnit clearError(Transaction tx, String unitId) {
    DeliveryUnit unit = require(tx, unitId);
    if (unit.status() != UnitStatus.ERROR) {
      throw new InvalidTransitionException("Unit " + unitId + " is not in error (status="
          + unit.status().wireName() + ")");
    }
    return transition(tx, unit, UnitStatus.IDLE, null);
  }

  /**
   * Marks every unit whose last contact is older than the offline timeout as
   * {@code offline}. Their deliveries are left untouched.
   *
   * @return the units marked offline
   */
  public List<DeliveryUnit> sweepOffline(Transaction tx, Instant now) {
    Instant cutoff = now.minus(offlineTimeout);
    List<DeliveryUnit> marked = new ArrayList<>();
    for (DeliveryUnit stale : unitStore.findStale(tx.connection(), cutoff)) {
      DeliveryUnit offline = stale.withOffline(now);
      if (unitStore.compareAndSet(tx.connection(), offline, stale.status()) == 1) {
        marked.add(offline);
        metrics.incrementUnitsOffline();
        logger.log(Level.WARNING, "Unit {0} offline: no contact since {1} (was {2})",
            new Object[]{stale.id(), stale.lastContactAt(), stale.status().wireName()});
      }
    }
    return marked;
  }

  /**
   * {@code true} if {@code position} counts as the return base. Without configured base
   * coordinates any position does.
   */
  public boolean isAtBase(Coordinates position) {
    if (baseCoordinates == null || position == null) {
      return true;
    }
    return GeoMath.within(position, baseCoordinates, arrivalProximityMeters);
  }

  /**
   * {@code true} if a unit at {@code position} may be considered arrived at
   * {@code destination}. Unknown positions are accepted.
   */
  public boolean isNear(Coordinates position, Coordinates destination) {
    if (position == null || destination == null) {
      return true;
    }
    return GeoMath.within(position, destination, arrivalProximityMeters);
  }

  private DeliveryUnit restore(Transaction tx, DeliveryUnit offline) {
    Optional<Delivery> active = deliveryStore.findActiveByUnit(tx.connection(), offline.id());
    UnitStatus restored;
    Long deliveryId = null;
    if (active.isPresent()) {
      restored = UnitStatus.forActiveDelivery(active.get().status());
      deliveryId = active.get().id();
    } else if (offline.statusBeforeOffline() == UnitStatus.RETURNING
        || offline.statusBeforeOffline() == UnitStatus.ERROR) {
      restored = offline.statusBeforeOffline();
    } else {
      restored = UnitStatus.IDLE;
    }
    logger.log(Level.INFO, "Unit {0} back online: offline -> {1}",
        new Object[]{offline.id(), restored.wireName()});
    return offline.withStatus(restored, deliveryId, clock.instant());
  }

  private void write(Transaction tx, DeliveryUnit updated, UnitStatus expected) {
    if (unitStore.compareAndSet(tx.connection(), updated, expected) == 0) {
      throw new InvalidTransitionException("Unit " + updated.id() + " changed concurrently (expected "
          + expected.wireName() + ")");
    }
  }

  /** Builder for {@link UnitStateTracker}. */
  public static final class Builder {
    private UnitStore unitStore;
    private DeliveryStore deliveryStore;
    private Duration offlineTimeout = Duration.ofSeconds(300);
    private double arrivalProximityMeters = 50.0;
    private Coordinates baseCoordinates;
    private Clock clock;
    private MetricsExporter metrics;

    private Builder() {}

    public Builder unitStore(UnitStore unitStore) {
      this.unitStore = unitStore;
      return this;
    }

    /**
     * Used to find the delivery a reconnecting unit is still bound to.
     */
    public Builder deliveryStore(DeliveryStore deliveryStore) {
      this.deliveryStore = deliveryStore;
      return this;
    }

    /**
     * <p>Optional. Defaults to 300 seconds.
     */
    public Builder offlineTimeout(Duration offlineTimeout) {
      this.offlineTimeout = offlineTimeout;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@code 50} metres.
     */
    public Builder arrivalProximityMeters(double arrivalProximityMeters) {
      this.arrivalProximityMeters = arrivalProximityMeters;
      return this;
    }

    /**
     * Sets the return base. Without one, any base-arrival report is accepted.
     */
    public Builder baseCoordinates(Coordinates baseCoordinates) {
      this.baseCoordinates = baseCoordinates;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public UnitStateTracker build() {
      return new UnitStateTracker(this);
    }
  }
}
