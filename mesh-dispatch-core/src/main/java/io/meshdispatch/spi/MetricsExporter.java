package io.meshdispatch.spi;

import io.meshdispatch.model.DeliveryStatus;

/**
 * Observability hook for exporting dispatch counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Increments the count of frames accepted into the inbound queue.
   */
  void incrementInboundReceived();

  /**
   * Increments the count of frames dropped because the inbound queue was full.
   */
  void incrementInboundDropped();

  /**
   * Increments the count of inbound frames discarded as malformed.
   */
  void incrementMalformedFrames();

  /**
   * Increments the count of first sends of reliable messages.
   */
  void incrementReliableSent();

  /**
   * Increments the count of reliable message retransmissions.
   */
  void incrementReliableRetried();

  /**
   * Increments the count of ACKs that retired a pending message.
   */
  void incrementAckReceived();

  /**
   * Increments the count of ACKs with no matching pending message.
   */
  void incrementDuplicateAck();

  /**
   * Increments the count of reliable messages that ran out of attempts.
   */
  void incrementAckExhausted();

  /**
   * Increments the count of frames the transport refused.
   */
  void incrementSendFailures();

  /**
   * Increments the count of units marked offline by the staleness sweep.
   */
  default void incrementUnitsOffline() {
  }

  /**
   * Increments the count of delivery transitions into {@code status}.
   */
  default void incrementDeliveryTransition(DeliveryStatus status) {
  }

  /**
   * Records the current inbound queue depth.
   */
  void recordInboundDepth(int depth);

  /**
   * Records the number of messages currently awaiting acknowledgment.
   */
  default void recordPendingAcks(int count) {
  }

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementInboundReceived() {
    }

    @Override
    public void incrementInboundDropped() {
    }

    @Override
    public void incrementMalformedFrames() {
    }

    @Override
    public void incrementReliableSent() {
    }

    @Override
    public void incrementReliableRetried() {
    }

    @Override
    public void incrementAckReceived() {
    }

    @Override
    public void incrementDuplicateAck() {
    }

    @Override
    public void incrementAckExhausted() {
    }

    @Override
    public void incrementSendFailures() {
    }

    @Override
    public void recordInboundDepth(int depth) {
    }
  }
}
