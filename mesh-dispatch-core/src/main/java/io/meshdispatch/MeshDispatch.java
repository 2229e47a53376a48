package io.meshdispatch;

import io.meshdispatch.delivery.DeliveryStateMachine;
import io.meshdispatch.envelope.EnvelopeCodec;
import io.meshdispatch.envelope.JacksonEnvelopeCodec;
import io.meshdispatch.geo.RetryingGeocoder;
import io.meshdispatch.inbound.InboundQueue;
import io.meshdispatch.outbound.ReliableOutboundManager;
import io.meshdispatch.spi.ConnectionProvider;
import io.meshdispatch.spi.DeliveryStore;
import io.meshdispatch.spi.Geocoder;
import io.meshdispatch.spi.MetricsExporter;
import io.meshdispatch.spi.PendingAckStore;
import io.meshdispatch.spi.Transport;
import io.meshdispatch.spi.UnitStore;
import io.meshdispatch.tx.TransactionManager;
import io.meshdispatch.unit.OfflineSweeper;
import io.meshdispatch.unit.UnitStateTracker;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Composite entry point that wires the dispatch core into a single {@link AutoCloseable}
 * unit: inbound queue, reliable outbound manager, unit tracker with its offline sweep,
 * delivery state machine and the {@link DispatchCoordinator} in front of them.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (MeshDispatch dispatch = MeshDispatch.builder()
 *     .connectionProvider(connProvider)
 *     .deliveryStore(store)
 *     .unitStore(store)
 *     .pendingAckStore(store)
 *     .transport(TcpTransport.builder().host("meshtastic.local").build())
 *     .geocoder(new NominatimGeocoder(NominatimGeocoder.DEFAULT_BASE_URL, "dispatch/1.0", Duration.ofSeconds(10)))
 *     .build()) {
 *   dispatch.start();
 *   Delivery d = dispatch.coordinator().createDelivery("1 Main St");
 *   dispatch.coordinator().assignDelivery(d.id(), "!a1b2c3d4");
 * }
 * }</pre>
 */
public final class MeshDispatch implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(MeshDispatch.class.getName());

  private final TransactionManager txManager;
  private final Transport transport;
  private final InboundQueue inboundQueue;
  private final ReliableOutboundManager outbound;
  private final OfflineSweeper sweeper;
  private final DispatchCoordinator coordinator;
  private final MetricsExporter metrics;
  private boolean started;
  private boolean closed;

  private MeshDispatch(Builder builder) {
    Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    DeliveryStore deliveryStore = Objects.requireNonNull(builder.deliveryStore, "deliveryStore");
    UnitStore unitStore = Objects.requireNonNull(builder.unitStore, "unitStore");
    PendingAckStore pendingAckStore = Objects.requireNonNull(builder.pendingAckStore, "pendingAckStore");
    this.transport = Objects.requireNonNull(builder.transport, "transport");
    Geocoder geocoder = Objects.requireNonNull(builder.geocoder, "geocoder");
    DispatchConfig config = builder.config != null ? builder.config : new DispatchConfig();
    EnvelopeCodec codec = builder.codec != null ? builder.codec : new JacksonEnvelopeCodec();
    Clock clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;

    this.txManager = new TransactionManager(builder.connectionProvider);
    this.outbound = ReliableOutboundManager.builder()
        .txManager(txManager)
        .pendingAckStore(pendingAckStore)
        .transport(transport)
        .codec(codec)
        .retryPolicy(config.retryPolicy())
        .maxAttempts(config.getMaxAttempts())
        .batchSize(config.getRetryBatchSize())
        .tickIntervalMs(config.getRetryTickMs())
        .clock(clock)
        .metrics(metrics)
        .build();
    UnitStateTracker units = UnitStateTracker.builder()
        .unitStore(unitStore)
        .deliveryStore(deliveryStore)
        .offlineTimeout(Duration.ofMillis(config.getOfflineTimeoutMs()))
        .arrivalProximityMeters(config.getArrivalProximityMeters())
        .baseCoordinates(config.getBaseCoordinates())
        .clock(clock)
        .metrics(metrics)
        .build();
    DeliveryStateMachine deliveries = new DeliveryStateMachine(deliveryStore, units, outbound,
        config.getUnitFailurePolicy(), clock, metrics);
    Geocoder resolved = config.getGeocoderAttempts() > 1
        ? new RetryingGeocoder(geocoder, config.getGeocoderAttempts(), config.getGeocoderBaseDelayMs())
        : geocoder;
    this.coordinator = DispatchCoordinator.builder()
        .txManager(txManager)
        .deliveryStore(deliveryStore)
        .unitStore(unitStore)
        .deliveries(deliveries)
        .units(units)
        .outbound(outbound)
        .geocoder(resolved)
        .codec(codec)
        .clock(clock)
        .metrics(metrics)
        .build();
    this.inboundQueue = InboundQueue.builder()
        .handler(coordinator)
        .capacity(config.getInboundQueueCapacity())
        .drainTimeoutMs(config.getInboundDrainTimeoutMs())
        .clock(clock)
        .metrics(metrics)
        .build();
    this.sweeper = new OfflineSweeper(txManager, units, clock, config.getOfflineSweepIntervalMs());
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts consuming frames, recovers pending acknowledgments and schedules the
   * retransmit and offline sweeps. Idempotent.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("MeshDispatch has been closed");
    }
    if (started) {
      return;
    }
    inboundQueue.start();
    transport.start(inboundQueue);
    outbound.start();
    sweeper.start();
    started = true;
    logger.log(Level.INFO, "Mesh dispatch started");
  }

  public DispatchCoordinator coordinator() {
    return coordinator;
  }

  public ReliableOutboundManager outbound() {
    return outbound;
  }

  public InboundQueue inboundQueue() {
    return inboundQueue;
  }

  public OfflineSweeper sweeper() {
    return sweeper;
  }

  public TransactionManager txManager() {
    return txManager;
  }

  /**
   * Shuts down in order: transport, inbound queue (draining), retransmit loop, offline
   * sweep, then the metrics exporter if it is closeable.
   */
  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    RuntimeException first = null;
    try {
      transport.close();
    } catch (Exception e) {
      first = asRuntime(e);
    }
    try {
      inboundQueue.close();
    } catch (RuntimeException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    try {
      outbound.close();
    } catch (RuntimeException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    try {
      sweeper.close();
    } catch (RuntimeException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = asRuntime(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  private static RuntimeException asRuntime(Exception e) {
    return (e instanceof RuntimeException r) ? r : new DispatchException("Close failed", e);
  }

  /** Builder for {@link MeshDispatch}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private DeliveryStore deliveryStore;
    private UnitStore unitStore;
    private PendingAckStore pendingAckStore;
    private Transport transport;
    private Geocoder geocoder;
    private EnvelopeCodec codec;
    private DispatchConfig config;
    private Clock clock;
    private MetricsExporter metrics;

    private Builder() {}

    /**
     * <p><b>Required.</b>
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder deliveryStore(DeliveryStore deliveryStore) {
      this.deliveryStore = deliveryStore;
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder unitStore(UnitStore unitStore) {
      this.unitStore = unitStore;
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder pendingAckStore(PendingAckStore pendingAckStore) {
      this.pendingAckStore = pendingAckStore;
      return this;
    }

    /**
     * <p><b>Required.</b> Started by {@link MeshDispatch#start()} and closed with it.
     */
    public Builder transport(Transport transport) {
      this.transport = transport;
      return this;
    }

    /**
     * <p><b>Required.</b> Wrapped in a {@link RetryingGeocoder} when
     * {@link DispatchConfig#getGeocoderAttempts()} is greater than one.
     */
    public Builder geocoder(Geocoder geocoder) {
      this.geocoder = geocoder;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link JacksonEnvelopeCodec}.
     */
    public Builder codec(EnvelopeCodec codec) {
      this.codec = codec;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@code new DispatchConfig()}.
     */
    public Builder config(DispatchConfig config) {
      this.config = config;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public MeshDispatch build() {
      return new MeshDispatch(this);
    }
  }
}
