package io.meshdispatch;

import io.meshdispatch.delivery.DeliveryStateMachine;
import io.meshdispatch.envelope.Envelope;
import io.meshdispatch.envelope.EnvelopeCodec;
import io.meshdispatch.inbound.InboundFrame;
import io.meshdispatch.inbound.InboundFrameHandler;
import io.meshdispatch.model.Coordinates;
import io.meshdispatch.model.Delivery;
import io.meshdispatch.model.DeliveryStatus;
import io.meshdispatch.model.DeliveryUnit;
import io.meshdispatch.model.PendingAck;
import io.meshdispatch.model.UnitStatus;
import io.meshdispatch.outbound.AckExhaustionListener;
import io.meshdispatch.outbound.ReliableOutboundManager;
import io.meshdispatch.spi.DeliveryStore;
import io.meshdispatch.spi.Geocoder;
import io.meshdispatch.spi.MetricsExporter;
import io.meshdispatch.spi.UnitStore;
import io.meshdispatch.tx.TransactionManager;
import io.meshdispatch.tx.TransactionManager.Transaction;
import io.meshdispatch.unit.UnitStateTracker;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for dispatcher commands and radio frames.
 *
 * <p>Dispatcher commands ({@link #createDelivery}, {@link #assignDelivery},
 * {@link #confirmComplete}, {@link #markFailed}, {@link #reopen}, ...) each run as one
 * transaction and report guard violations synchronously. Radio frames arrive through
 * {@link #handle(InboundFrame)} on the single inbound consumer thread; malformed frames
 * are logged and dropped, and errors raised while applying a frame never escape.
 *
 * <p>Also receives exhausted reliable messages and fails the delivery they belonged to.
 */
public final class DispatchCoordinator implements InboundFrameHandler, AckExhaustionListener {
  private static final Logger logger = Logger.getLogger(DispatchCoordinator.class.getName());

  static final String REASON_ACK_EXHAUSTED = "ack_exhausted";
  static final String REASON_UNIT_ERROR = "unit_error";

  private final TransactionManager txManager;
  private final DeliveryStore deliveryStore;
  private final UnitStore unitStore;
  private final DeliveryStateMachine deliveries;
  private final UnitStateTracker units;
  private final ReliableOutboundManager outbound;
  private final Geocoder geocoder;
  private final EnvelopeCodec codec;
  private final Clock clock;
  private final MetricsExporter metrics;

  private DispatchCoordinator(Builder builder) {
    this.txManager = Objects.requireNonNull(builder.txManager, "txManager");
    this.deliveryStore = Objects.requireNonNull(builder.deliveryStore, "deliveryStore");
    this.unitStore = Objects.requireNonNull(builder.unitStore, "unitStore");
    this.deliveries = Objects.requireNonNull(builder.deliveries, "deliveries");
    this.units = Objects.requireNonNull(builder.units, "units");
    this.outbound = Objects.requireNonNull(builder.outbound, "outbound");
    this.geocoder = Objects.requireNonNull(builder.geocoder, "geocoder");
    this.codec = Objects.requireNonNull(builder.codec, "codec");
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    outbound.setExhaustionListener(this);
  }

  public static Builder builder() {
    return new Builder();
  }

  // ---- dispatcher commands ----

  /**
   * Geocodes {@code address} and stores a {@code pending} delivery.
   *
   * @throws GeocodeException if resolution failed; the delivery was still stored without
   *     coordinates and is available from {@link GeocodeException#delivery()}
   */
  public Delivery createDelivery(String address) {
    if (address == null || address.isBlank()) {
      throw new IllegalArgumentException("address must not be blank");
    }
    String trimmed = address.trim();
    Coordinates coordinates = null;
    GeocodeException failure = null;
    try {
      coordinates = geocoder.resolve(trimmed);
    } catch (GeocodeException e) {
      failure = e;
      logger.log(Level.WARNING, "Geocoding failed for ''{0}'': {1}", new Object[]{trimmed, e.getMessage()});
    }
    Coordinates resolved = coordinates;
    Delivery created = txManager.inTransaction(tx -> deliveries.create(tx, trimmed, resolved));
    if (failure != null) {
      throw failure.withDelivery(created);
    }
    return created;
  }

  /**
   * Re-runs geocoding for a delivery.
   *
   * @throws DeliveryNotFoundException if the delivery does not exist
   * @throws GeocodeException if resolution failed again
   */
  public Delivery retryGeocode(long deliveryId) {
    Delivery delivery = getDelivery(deliveryId);
    Coordinates coordinates;
    try {
      coordinates = geocoder.resolve(delivery.address());
    } catch (GeocodeException e) {
      throw e.withDelivery(delivery);
    }
    return txManager.inTransaction(tx -> {
      deliveryStore.updateCoordinates(tx.connection(), deliveryId, coordinates);
      return deliveries.require(tx, deliveryId);
    });
  }

  /**
   * Assigns a {@code pending} delivery to an {@code idle} unit and queues the reliable
   * {@code assign} message.
   *
   * @throws DeliveryNotFoundException if the delivery does not exist
   * @throws UnitNotFoundException if the unit does not exist
   * @throws InvalidTransitionException if the delivery is not {@code pending}
   * @throws UnitBusyException if the unit is not {@code idle}
   */
  public Delivery assignDelivery(long deliveryId, String unitId) {
    Objects.requireNonNull(unitId, "unitId");
    return txManager.inTransaction(tx -> deliveries.assign(tx, deliveryId, unitId));
  }

  /**
   * Confirms an {@code arrived_dest} delivery as completed; the unit starts returning.
   */
  public Delivery confirmComplete(long deliveryId) {
    return txManager.inTransaction(tx -> deliveries.complete(tx, deliveryId));
  }

  /**
   * Fails an active delivery.
   */
  public Delivery markFailed(long deliveryId, String reason) {
    String recorded = reason == null || reason.isBlank() ? "dispatcher" : reason;
    return txManager.inTransaction(tx -> deliveries.fail(tx, deliveryId, recorded));
  }

  /**
   * Moves a {@code completed} or {@code failed} delivery back to {@code pending}.
   */
  public Delivery reopen(long deliveryId) {
    return txManager.inTransaction(tx -> deliveries.reopen(tx, deliveryId));
  }

  /**
   * Adds a unit to the fleet in {@code idle}. Returns the existing unit if already known.
   */
  public DeliveryUnit registerUnit(String unitId) {
    Objects.requireNonNull(unitId, "unitId");
    return txManager.inTransaction(tx -> units.register(tx, unitId.trim()));
  }

  /**
   * {@code error -> idle}.
   */
  public DeliveryUnit clearUnitError(String unitId) {
    return txManager.inTransaction(tx -> units.clearError(tx, unitId));
  }

  // ---- snapshots ----

  public Delivery getDelivery(long deliveryId) {
    return txManager.read(conn -> deliveryStore.find(conn, deliveryId))
        .orElseThrow(() -> new DeliveryNotFoundException(deliveryId));
  }

  public DeliveryUnit getUnit(String unitId) {
    return txManager.read(conn -> unitStore.find(conn, unitId))
        .orElseThrow(() -> new UnitNotFoundException(unitId));
  }

  /** All deliveries, newest first. */
  public List<Delivery> listDeliveries() {
    return txManager.read(deliveryStore::findAll);
  }

  /** All units ordered by id. */
  public List<DeliveryUnit> listUnits() {
    return txManager.read(unitStore::findAll);
  }

  /** Messages still awaiting acknowledgment, oldest first. */
  public List<PendingAck> listPendingAcks() {
    return outbound.pending();
  }

  // ---- radio ----

  /**
   * Decodes and applies one raw frame, stamped with the current time.
   */
  public void ingest(byte[] frame) {
    handle(new InboundFrame(frame, clock.instant()));
  }

  @Override
  public void handle(InboundFrame frame) {
    Envelope envelope;
    try {
      envelope = codec.decode(frame.payload());
    } catch (MalformedFrameException e) {
      metrics.incrementMalformedFrames();
      logger.log(Level.WARNING, "Dropping malformed frame: {0}", e.getMessage());
      return;
    }
    try {
      route(envelope, frame.receivedAt());
    } catch (DispatchException e) {
      logger.log(Level.WARNING, "Frame " + envelope.type().wireName() + " from " + envelope.unitId()
          + " rejected: " + e.getMessage());
    }
  }

  private void route(Envelope envelope, Instant receivedAt) {
    switch (envelope.type()) {
      case ACK -> onAckFrame(envelope, receivedAt);
      case TELEMETRY -> onUnitFrame(envelope, receivedAt, false);
      case ARRIVAL -> onUnitFrame(envelope, receivedAt, true);
      case STATUS -> onUnitFrame(envelope, receivedAt, false);
      case ASSIGN, TASK_COMPLETE -> logger.log(Level.FINE, "Ignoring outbound-only frame type {0}",
          envelope.type().wireName());
      default -> throw new IllegalStateException("Unhandled frame type " + envelope.type());
    }
  }

  private void onAckFrame(Envelope envelope, Instant receivedAt) {
    if (envelope.msgId() == null) {
      metrics.incrementMalformedFrames();
      logger.warning("Dropping ack frame without msg_id");
      return;
    }
    outbound.onAck(envelope.msgId());
    if (envelope.unitId() != null) {
      txManager.inTransaction(tx -> units.touch(tx, envelope.unitId(), receivedAt));
    }
  }

  private void onUnitFrame(Envelope envelope, Instant receivedAt, boolean arrival) {
    if (envelope.unitId() == null || envelope.unitId().isBlank()) {
      metrics.incrementMalformedFrames();
      logger.log(Level.WARNING, "Dropping {0} frame without unit_id", envelope.type().wireName());
      return;
    }
    // contact and position commit even if the reported transition is rejected
    Instant sentAt = envelope.timestamp() == null ? null : Instant.ofEpochSecond(envelope.timestamp());
    txManager.inTransaction(tx -> {
      DeliveryUnit unit = units.touch(tx, envelope.unitId(), receivedAt);
      return units.updatePosition(tx, unit, envelope.coordinates(), sentAt, receivedAt);
    });

    boolean arrived = arrival || Boolean.TRUE.equals(envelope.arrived());
    if (!arrived && envelope.status() == null) {
      return;
    }
    txManager.inTransaction(tx -> {
      DeliveryUnit unit = units.require(tx, envelope.unitId());
      if (arrived) {
        onArrival(tx, unit, envelope);
      } else {
        onReportedStatus(tx, unit, envelope);
      }
      return null;
    });
  }

  private void onReportedStatus(Transaction tx, DeliveryUnit unit, Envelope envelope) {
    UnitStatus reported;
    try {
      reported = UnitStatus.fromWireName(envelope.status());
    } catch (IllegalArgumentException e) {
      logger.log(Level.WARNING, "Unit {0} reported unknown status ''{1}''",
          new Object[]{unit.id(), envelope.status()});
      return;
    }
    switch (reported) {
      case EN_ROUTE -> {
        Optional<Delivery> active = activeDelivery(tx, unit, envelope);
        if (active.isPresent() && active.get().status() == DeliveryStatus.ASSIGNED) {
          deliveries.depart(tx, active.get().id());
        }
      }
      case ARRIVED_DEST -> onArrival(tx, unit, envelope);
      case IDLE -> {
        if (unit.status() == UnitStatus.RETURNING) {
          units.transition(tx, unit.id(), UnitStatus.IDLE, null);
        } else if (unit.status() != UnitStatus.IDLE) {
          logger.log(Level.FINE, "Unit {0} reports idle while {1}; ignored",
              new Object[]{unit.id(), unit.status().wireName()});
        }
      }
      case ERROR -> {
        Optional<Delivery> active = deliveryStore.findActiveByUnit(tx.connection(), unit.id());
        if (unit.status() != UnitStatus.ERROR) {
          units.transition(tx, unit.id(), UnitStatus.ERROR, null);
        }
        if (active.isPresent()) {
          deliveries.fail(tx, active.get().id(), REASON_UNIT_ERROR);
        }
      }
      default -> logger.log(Level.FINE, "Unit {0} reports {1}; nothing to apply",
          new Object[]{unit.id(), reported.wireName()});
    }
  }

  private void onArrival(Transaction tx, DeliveryUnit unit, Envelope envelope) {
    Coordinates position = envelope.coordinates() != null ? envelope.coordinates() : unit.location();
    if (unit.status() == UnitStatus.RETURNING) {
      // destination arrivals carry delivery_id; a repeat after completion is stale
      if (envelope.deliveryId() != null) {
        logger.log(Level.INFO, "Unit {0} repeated arrival for delivery {1} while returning; ignored",
            new Object[]{unit.id(), envelope.deliveryId()});
        return;
      }
      if (units.isAtBase(position)) {
        units.transition(tx, unit.id(), UnitStatus.IDLE, null);
      } else {
        logger.log(Level.INFO, "Unit {0} reported arrival away from base; still returning", unit.id());
      }
      return;
    }
    Optional<Delivery> active = activeDelivery(tx, unit, envelope);
    if (active.isEmpty()) {
      logger.log(Level.FINE, "Unit {0} reported arrival with no active delivery; position refreshed only",
          unit.id());
      return;
    }
    Delivery delivery = active.get();
    if (delivery.status() == DeliveryStatus.ARRIVED_DEST) {
      return;
    }
    if (!units.isNear(position, delivery.coordinates())) {
      logger.log(Level.WARNING, "Arrival from {0} rejected: too far from delivery {1}",
          new Object[]{unit.id(), delivery.id()});
      return;
    }
    if (delivery.status() == DeliveryStatus.ASSIGNED) {
      delivery = deliveries.depart(tx, delivery.id());
    }
    deliveries.arrive(tx, delivery.id());
  }

  /**
   * The delivery the unit is bound to. A frame naming a different delivery is stale and
   * yields nothing; terminal deliveries are never returned.
   */
  private Optional<Delivery> activeDelivery(Transaction tx, DeliveryUnit unit, Envelope envelope) {
    Optional<Delivery> active = deliveryStore.findActiveByUnit(tx.connection(), unit.id());
    if (active.isPresent() && envelope.deliveryId() != null
        && envelope.deliveryId() != active.get().id()) {
      logger.log(Level.INFO, "Unit {0} refers to delivery {1} but is bound to {2}; ignored",
          new Object[]{unit.id(), envelope.deliveryId(), active.get().id()});
      return Optional.empty();
    }
    return active;
  }

  // ---- exhaustion ----

  @Override
  public void onExhausted(Transaction tx, PendingAck pendingAck) {
    if (pendingAck.deliveryId() == null) {
      return;
    }
    long deliveryId = pendingAck.deliveryId();
    Optional<Delivery> delivery = deliveryStore.findForUpdate(tx.connection(), deliveryId);
    if (delivery.isEmpty()) {
      logger.log(Level.WARNING, "Exhausted message {0} refers to unknown delivery {1}",
          new Object[]{pendingAck.msgId(), deliveryId});
      return;
    }
    Delivery current = delivery.get();
    if (current.status() != DeliveryStatus.ASSIGNED
        || !pendingAck.unitId().equals(current.assignedUnitId())) {
      logger.log(Level.INFO, "Exhausted message {0} is stale (delivery {1} is {2})",
          new Object[]{pendingAck.msgId(), deliveryId, current.status().wireName()});
      return;
    }
    deliveries.fail(tx, deliveryId, REASON_ACK_EXHAUSTED);
  }

  /** Builder for {@link DispatchCoordinator}. */
  public static final class Builder {
    private TransactionManager txManager;
    private DeliveryStore deliveryStore;
    private UnitStore unitStore;
    private DeliveryStateMachine deliveries;
    private UnitStateTracker units;
    private ReliableOutboundManager outbound;
    private Geocoder geocoder;
    private EnvelopeCodec codec;
    private Clock clock;
    private MetricsExporter metrics;

    private Builder() {}

    public Builder txManager(TransactionManager txManager) {
      this.txManager = txManager;
      return this;
    }

    public Builder deliveryStore(DeliveryStore deliveryStore) {
      this.deliveryStore = deliveryStore;
      return this;
    }

    public Builder unitStore(UnitStore unitStore) {
      this.unitStore = unitStore;
      return this;
    }

    public Builder deliveries(DeliveryStateMachine deliveries) {
      this.deliveries = deliveries;
      return this;
    }

    public Builder units(UnitStateTracker units) {
      this.units = units;
      return this;
    }

    /**
     * Sets the outbound manager. The coordinator registers itself as its exhaustion listener.
     */
    public Builder outbound(ReliableOutboundManager outbound) {
      this.outbound = outbound;
      return this;
    }

    public Builder geocoder(Geocoder geocoder) {
      this.geocoder = geocoder;
      return this;
    }

    public Builder codec(EnvelopeCodec codec) {
      this.codec = codec;
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

    public DispatchCoordinator build() {
      return new DispatchCoordinator(this);
    }
  }
}
