package io.meshdispatch.micrometer;

import io.meshdispatch.model.DeliveryStatus;
import io.meshdispatch.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code meshdispatch.inbound.received} - frames accepted into the inbound queue</li>
 *   <li>{@code meshdispatch.inbound.dropped} - frames evicted because the queue was full</li>
 *   <li>{@code meshdispatch.inbound.malformed} - frames discarded as malformed</li>
 *   <li>{@code meshdispatch.reliable.sent} - first sends of reliable messages</li>
 *   <li>{@code meshdispatch.reliable.retried} - retransmissions</li>
 *   <li>{@code meshdispatch.ack.received} - ACKs that retired a pending message</li>
 *   <li>{@code meshdispatch.ack.duplicate} - ACKs with no pending message</li>
 *   <li>{@code meshdispatch.ack.exhausted} - messages that ran out of attempts</li>
 *   <li>{@code meshdispatch.send.failures} - frames the radio link refused</li>
 *   <li>{@code meshdispatch.units.offline} - units marked offline by the sweep</li>
 *   <li>{@code meshdispatch.delivery.transitions} - delivery status changes, tagged {@code status}</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code meshdispatch.inbound.depth} - current inbound queue depth</li>
 *   <li>{@code meshdispatch.ack.pending} - messages awaiting acknowledgment</li>
 * </ul>
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final List<Meter> meters = new ArrayList<>();
  private final Counter inboundReceived;
  private final Counter inboundDropped;
  private final Counter malformedFrames;
  private final Counter reliableSent;
  private final Counter reliableRetried;
  private final Counter ackReceived;
  private final Counter duplicateAck;
  private final Counter ackExhausted;
  private final Counter sendFailures;
  private final Counter unitsOffline;
  private final Map<DeliveryStatus, Counter> transitions = new EnumMap<>(DeliveryStatus.class);

  private final AtomicInteger inboundDepth = new AtomicInteger();
  private final AtomicInteger pendingAcks = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "meshdispatch"}.
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "meshdispatch");
  }

  /**
   * Creates an exporter with a custom metric name prefix.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "depot1.dispatch"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }
    this.registry = registry;

    this.inboundReceived = counter(namePrefix + ".inbound.received", "Frames accepted into the inbound queue");
    this.inboundDropped = counter(namePrefix + ".inbound.dropped", "Frames dropped (inbound queue full)");
    this.malformedFrames = counter(namePrefix + ".inbound.malformed", "Frames discarded as malformed");
    this.reliableSent = counter(namePrefix + ".reliable.sent", "Reliable messages sent");
    this.reliableRetried = counter(namePrefix + ".reliable.retried", "Reliable messages re-sent");
    this.ackReceived = counter(namePrefix + ".ack.received", "ACKs that retired a pending message");
    this.duplicateAck = counter(namePrefix + ".ack.duplicate", "ACKs with no pending message");
    this.ackExhausted = counter(namePrefix + ".ack.exhausted", "Reliable messages that ran out of attempts");
    this.sendFailures = counter(namePrefix + ".send.failures", "Frames refused by the radio link");
    this.unitsOffline = counter(namePrefix + ".units.offline", "Units marked offline");
    for (DeliveryStatus status : DeliveryStatus.values()) {
      Counter c = Counter.builder(namePrefix + ".delivery.transitions")
          .description("Delivery status changes")
          .tag("status", status.wireName())
          .register(registry);
      meters.add(c);
      transitions.put(status, c);
    }

    meters.add(Gauge.builder(namePrefix + ".inbound.depth", inboundDepth, AtomicInteger::get)
        .register(registry));
    meters.add(Gauge.builder(namePrefix + ".ack.pending", pendingAcks, AtomicInteger::get)
        .register(registry));
  }

  private Counter counter(String name, String description) {
    Counter c = Counter.builder(name).description(description).register(registry);
    meters.add(c);
    return c;
  }

  @Override
  public void incrementInboundReceived() {
    if (closed) return;
    inboundReceived.increment();
  }

  @Override
  public void incrementInboundDropped() {
    if (closed) return;
    inboundDropped.increment();
  }

  @Override
  public void incrementMalformedFrames() {
    if (closed) return;
    malformedFrames.increment();
  }

  @Override
  public void incrementReliableSent() {
    if (closed) return;
    reliableSent.increment();
  }

  @Override
  public void incrementReliableRetried() {
    if (closed) return;
    reliableRetried.increment();
  }

  @Override
  public void incrementAckReceived() {
    if (closed) return;
    ackReceived.increment();
  }

  @Override
  public void incrementDuplicateAck() {
    if (closed) return;
    duplicateAck.increment();
  }

  @Override
  public void incrementAckExhausted() {
    if (closed) return;
    ackExhausted.increment();
  }

  @Override
  public void incrementSendFailures() {
    if (closed) return;
    sendFailures.increment();
  }

  @Override
  public void incrementUnitsOffline() {
    if (closed) return;
    unitsOffline.increment();
  }

  @Override
  public void incrementDeliveryTransition(DeliveryStatus status) {
    if (closed || status == null) return;
    transitions.get(status).increment();
  }

  @Override
  public void recordInboundDepth(int depth) {
    if (closed) return;
    inboundDepth.set(depth);
  }

  @Override
  public void recordPendingAcks(int count) {
    if (closed) return;
    pendingAcks.set(count);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
