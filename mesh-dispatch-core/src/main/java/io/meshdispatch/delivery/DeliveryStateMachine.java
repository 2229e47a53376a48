package io.meshdispatch.delivery;

import io.meshdispatch.DeliveryNotFoundException;
import io.meshdispatch.InvalidTransitionException;
import io.meshdispatch.UnitBusyException;
import io.meshdispatch.envelope.Envelope;
import io.meshdispatch.geo.GeoMath;
import io.meshdispatch.model.Coordinates;
import io.meshdispatch.model.Delivery;
import io.meshdispatch.model.DeliveryStatus;
import io.meshdispatch.model.DeliveryUnit;
import io.meshdispatch.model.UnitStatus;
import io.meshdispatch.outbound.ReliableOutboundManager;
import io.meshdispatch.spi.DeliveryStore;
import io.meshdispatch.spi.MetricsExporter;
import io.meshdispatch.tx.TransactionManager.Transaction;
import io.meshdispatch.unit.UnitFailurePolicy;
import io.meshdispatch.unit.UnitStateTracker;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.function.UnaryOperator;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns delivery lifecycle transitions and their side effects.
 *
 * <pre>
 * pending -> assigned -> en_route -> arrived_dest -> completed
 * assigned | en_route | arrived_dest -> failed
 * completed | failed -> pending                  (reopen)
 * </pre>
 *
 * <p>Each transition locks the delivery row, checks the lifecycle table and writes with a
 * compare-and-set on the status it read. The paired unit transition is applied through the
 * {@link UnitStateTracker} in the same transaction. Entering {@code assigned} queues a
 * reliable {@code assign} message; leaving it retires that message.
 */
public final class DeliveryStateMachine {
  private static final Logger logger = Logger.getLogger(DeliveryStateMachine.class.getName());

  private static final Map<DeliveryStatus, EnumSet<DeliveryStatus>> TRANSITIONS;

  static {
    Map<DeliveryStatus, EnumSet<DeliveryStatus>> t = new EnumMap<>(DeliveryStatus.class);
    t.put(DeliveryStatus.PENDING, EnumSet.of(DeliveryStatus.ASSIGNED));
    t.put(DeliveryStatus.ASSIGNED, EnumSet.of(DeliveryStatus.EN_ROUTE, DeliveryStatus.FAILED));
    t.put(DeliveryStatus.EN_ROUTE, EnumSet.of(DeliveryStatus.ARRIVED_DEST, DeliveryStatus.FAILED));
    t.put(DeliveryStatus.ARRIVED_DEST, EnumSet.of(DeliveryStatus.COMPLETED, DeliveryStatus.FAILED));
    t.put(DeliveryStatus.COMPLETED, EnumSet.of(DeliveryStatus.PENDING));
    t.put(DeliveryStatus.FAILED, EnumSet.of(DeliveryStatus.PENDING));
    TRANSITIONS = Collections.unmodifiableMap(t);
  }

  private final DeliveryStore deliveryStore;
  private final UnitStateTracker units;
  private final ReliableOutboundManager outbound;
  private final UnitFailurePolicy failurePolicy;
  private final Clock clock;
  private final MetricsExporter metrics;

  public DeliveryStateMachine(DeliveryStore deliveryStore, UnitStateTracker units,
      ReliableOutboundManager outbound, UnitFailurePolicy failurePolicy, Clock clock,
      MetricsExporter metrics) {
    this.deliveryStore = Objects.requireNonNull(deliveryStore, "deliveryStore");
    this.units = Objects.requireNonNull(units, "units");
    this.outbound = Objects.requireNonNull(outbound, "outbound");
    this.failurePolicy = Objects.requireNonNull(failurePolicy, "failurePolicy");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
  }

  public static boolean canTransition(DeliveryStatus from, DeliveryStatus to) {
    return TRANSITIONS.getOrDefault(from, EnumSet.noneOf(DeliveryStatus.class)).contains(to);
  }

  /**
   * Stores a new {@code pending} delivery.
   */
  public Delivery create(Transaction tx, String address, Coordinates coordinates) {
    Delivery created = deliveryStore.insert(tx.connection(), address, coordinates, clock.instant());
    metrics.incrementDeliveryTransition(DeliveryStatus.PENDING);
    logger.log(Level.INFO, "Created delivery {0} for ''{1}''", new Object[]{created.id(), address});
    return created;
  }

  /**
   * Reads a delivery under lock.
   *
   * @throws DeliveryNotFoundException if it does not exist
   */
  public Delivery require(Transaction tx, long deliveryId) {
    return deliveryStore.findForUpdate(tx.connection(), deliveryId)
        .orElseThrow(() -> new DeliveryNotFoundException(deliveryId));
  }

  /**
   * {@code pending --assign(unit)--> assigned}. The unit must be {@code idle}. Queues the
   * reliable {@code assign} message carrying the destination and the straight-line distance
   * from the unit's last known position.
   *
   * @throws InvalidTransitionException if the delivery is not {@code pending}
   * @throws UnitBusyException if the unit is not {@code idle}
   */
  public Delivery assign(Transaction tx, long deliveryId, String unitId) {
    Delivery delivery = require(tx, deliveryId);
    if (delivery.status() != DeliveryStatus.PENDING) {
      throw invalid(delivery, DeliveryStatus.ASSIGNED);
    }
    DeliveryUnit unit = units.require(tx, unitId);
    if (unit.status() != UnitStatus.IDLE) {
      throw new UnitBusyException(unitId, unit.status().wireName());
    }
    Instant now = clock.instant();
    Delivery assigned = write(tx, delivery, DeliveryStatus.ASSIGNED, b -> b
        .assignedUnitId(unitId)
        .assignedAt(now));
    units.transition(tx, unitId, UnitStatus.ASSIGNED, deliveryId);

    Double distM = unit.location() != null && delivery.coordinates() != null
        ? GeoMath.distanceMeters(unit.location(), delivery.coordinates()) : null;
    Envelope message = Envelope.assign(null, deliveryId, unitId, delivery.coordinates(),
        delivery.address(), distM, now.getEpochSecond());
    outbound.sendReliable(tx, unitId, message, deliveryId);
    return assigned;
  }

  /**
   * {@code assigned --unit_departs--> en_route}. A departure proves the assignment arrived,
   * so its pending message is retired.
   */
  public Delivery depart(Transaction tx, long deliveryId) {
    Delivery delivery = require(tx, deliveryId);
    Delivery enRoute = write(tx, delivery, DeliveryStatus.EN_ROUTE, b -> b.enRouteAt(clock.instant()));
    outbound.cancelForDelivery(tx, deliveryId);
    units.transition(tx, delivery.assignedUnitId(), UnitStatus.EN_ROUTE, deliveryId);
    return enRoute;
  }

  /**
   * {@code en_route --unit_reports_arrival--> arrived_dest}.
   */
  public Delivery arrive(Transaction tx, long deliveryId) {
    Delivery delivery = require(tx, deliveryId);
    Delivery arrived = write(tx, delivery, DeliveryStatus.ARRIVED_DEST, b -> b.arrivedAt(clock.instant()));
    units.transition(tx, delivery.assignedUnitId(), UnitStatus.ARRIVED_DEST, deliveryId);
    return arrived;
  }

  /**
   * {@code arrived_dest --dispatcher_confirms_complete--> completed}. The unit starts its
   * return trip and is told so with a best-effort {@code task_complete} message.
   */
  public Delivery complete(Transaction tx, long deliveryId) {
    Delivery delivery = require(tx, deliveryId);
    String unitId = delivery.assignedUnitId();
    Instant now = clock.instant();
    Delivery completed = write(tx, delivery, DeliveryStatus.COMPLETED, b -> b
        .assignedUnitId(null)
        .completedAt(now));
    units.release(tx, unitId, deliveryId, UnitStatus.RETURNING);
    outbound.sendBestEffort(tx, Envelope.taskComplete(deliveryId, unitId, now.getEpochSecond()));
    return completed;
  }

  /**
   * {@code assigned | en_route | arrived_dest --> failed}. Retires any pending message and
   * releases the unit according to the failure policy.
   */
  public Delivery fail(Transaction tx, long deliveryId, String reason) {
    Delivery delivery = require(tx, deliveryId);
    String unitId = delivery.assignedUnitId();
    Instant now = clock.instant();
    Delivery failed = write(tx, delivery, DeliveryStatus.FAILED, b -> b
        .assignedUnitId(null)
        .completedAt(now)
        .failureReason(reason));
    outbound.cancelForDelivery(tx, deliveryId);
    if (unitId != null) {
      units.release(tx, unitId, deliveryId, failurePolicy.target());
    }
    return failed;
  }

  /**
   * {@code completed | failed --reopen--> pending}. Clears the unit, the progress
   * timestamps and the failure reason.
   */
  public Delivery reopen(Transaction tx, long deliveryId) {
    Delivery delivery = require(tx, deliveryId);
    return write(tx, delivery, DeliveryStatus.PENDING, b -> b
        .assignedUnitId(null)
        .assignedAt(null)
        .enRouteAt(null)
        .arrivedAt(null)
        .completedAt(null)
        .failureReason(null));
  }

  private Delivery write(Transaction tx, Delivery current, DeliveryStatus target,
      UnaryOperator<Delivery.Builder> changes) {
    if (!canTransition(current.status(), target)) {
      throw invalid(current, target);
    }
    Delivery updated = changes.apply(current.toBuilder().status(target, clock.instant())).build();
    if (deliveryStore.compareAndSet(tx.connection(), updated, current.status()) == 0) {
      throw new InvalidTransitionException("Delivery " + current.id() + " changed concurrently (expected "
          + current.status().wireName() + ")");
    }
    metrics.incrementDeliveryTransition(target);
    logger.log(Level.INFO, "Delivery {0}: {1} -> {2}",
        new Object[]{current.id(), current.status().wireName(), target.wireName()});
    return updated;
  }

  private static InvalidTransitionException invalid(Delivery delivery, DeliveryStatus target) {
    return new InvalidTransitionException("Delivery " + delivery.id() + " cannot go from "
        + delivery.status().wireName() + " to " + target.wireName());
  }
}
