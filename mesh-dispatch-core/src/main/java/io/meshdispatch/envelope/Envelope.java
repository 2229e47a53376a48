package io.meshdispatch.envelope;

import io.meshdispatch.model.Coordinates;

import java.util.Objects;

/**
 * One JSON message exchanged over the radio link.
 *
 * <p>Only {@code type} is always present. Which other fields are set depends on the type:
 * {@code assign} and {@code ack} carry {@code msgId}; {@code telemetry} and {@code arrival}
 * carry {@code lat}/{@code lon}; {@code status} carries {@code status}.
 *
 * @param type       message kind
 * @param msgId      correlation id of a reliable message and its ACK
 * @param deliveryId correlated delivery
 * @param unitId     sending or receiving unit
 * @param lat        latitude in decimal degrees
 * @param lon        longitude in decimal degrees
 * @param timestamp  unix seconds, sender clock
 * @param status     unit status reported by the unit (wire name)
 * @param address    destination address text ({@code assign})
 * @param distM      straight-line distance to the destination in metres ({@code assign})
 * @param arrived    arrival-detection flag on telemetry
 */
public record Envelope(
    EnvelopeType type,
    String msgId,
    Long deliveryId,
    String unitId,
    Double lat,
    Double lon,
    Long timestamp,
    String status,
    String address,
    Double distM,
    Boolean arrived
) {

  public Envelope {
    Objects.requireNonNull(type, "type");
  }

  public static Envelope assign(String msgId, long deliveryId, String unitId, Coordinates destination,
      String address, Double distM, long timestamp) {
    return new Envelope(EnvelopeType.ASSIGN, msgId, deliveryId, unitId,
        destination == null ? null : destination.lat(),
        destination == null ? null : destination.lon(),
        timestamp, null, address, distM, null);
  }

  public static Envelope taskComplete(long deliveryId, String unitId, long timestamp) {
    return new Envelope(EnvelopeType.TASK_COMPLETE, null, deliveryId, unitId,
        null, null, timestamp, null, null, null, null);
  }

  public static Envelope ack(String msgId, String unitId, long timestamp) {
    return new Envelope(EnvelopeType.ACK, msgId, null, unitId,
        null, null, timestamp, null, null, null, null);
  }

  public static Envelope telemetry(String unitId, Long deliveryId, double lat, double lon, long timestamp) {
    return new Envelope(EnvelopeType.TELEMETRY, null, deliveryId, unitId,
        lat, lon, timestamp, null, null, null, null);
  }

  public static Envelope arrival(String unitId, long deliveryId, double lat, double lon, long timestamp) {
    return new Envelope(EnvelopeType.ARRIVAL, null, deliveryId, unitId,
        lat, lon, timestamp, null, null, null, Boolean.TRUE);
  }

  public static Envelope status(String unitId, Long deliveryId, String status, long timestamp) {
    return new Envelope(EnvelopeType.STATUS, null, deliveryId, unitId,
        null, null, timestamp, status, null, null, null);
  }

  /**
   * Returns a copy carrying the given message id.
   */
  public Envelope withMsgId(String newMsgId) {
    return new Envelope(type, newMsgId, deliveryId, unitId, lat, lon, timestamp, status,
        address, distM, arrived);
  }

  /**
   * Reported position, or {@code null} when the frame has no usable fix.
   */
  public Coordinates coordinates() {
    if (lat == null || lon == null) {
      return null;
    }
    try {
      return new Coordinates(lat, lon);
    } catch (IllegalArgumentException e) {
      return null;
    }
  }
}
