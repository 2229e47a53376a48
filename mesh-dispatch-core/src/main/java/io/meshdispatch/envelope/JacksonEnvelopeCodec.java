package io.meshdispatch.envelope;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.meshdispatch.MalformedFrameException;

import java.util.Objects;

/**
 * {@link EnvelopeCodec} backed by a Jackson {@link ObjectMapper} tree model.
 *
 * <p>Decoding is lenient in the ways radio firmware needs: numeric fields may arrive as
 * JSON strings, {@code ack_id} is accepted in place of {@code msg_id}, and unknown fields
 * are ignored.
 */
public final class JacksonEnvelopeCodec implements EnvelopeCodec {
  private static final String TYPE = "type";
  private static final String MSG_ID = "msg_id";
  private static final String LEGACY_ACK_ID = "ack_id";
  private static final String DELIVERY_ID = "delivery_id";
  private static final String UNIT_ID = "unit_id";
  private static final String LAT = "lat";
  private static final String LON = "lon";
  private static final String TIMESTAMP = "timestamp";
  private static final String STATUS = "status";
  private static final String ADDRESS = "address";
  private static final String DIST_M = "dist_m";
  private static final String ARRIVED = "arrived";

  private final ObjectMapper mapper;

  public JacksonEnvelopeCodec() {
    this(new ObjectMapper());
  }

  public JacksonEnvelopeCodec(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  @Override
  public String encode(Envelope envelope) {
    ObjectNode node = mapper.createObjectNode();
    node.put(TYPE, envelope.type().wireName());
    putIfPresent(node, MSG_ID, envelope.msgId());
    if (envelope.deliveryId() != null) node.put(DELIVERY_ID, envelope.deliveryId());
    putIfPresent(node, UNIT_ID, envelope.unitId());
    if (envelope.lat() != null) node.put(LAT, envelope.lat());
    if (envelope.lon() != null) node.put(LON, envelope.lon());
    if (envelope.timestamp() != null) node.put(TIMESTAMP, envelope.timestamp());
    putIfPresent(node, STATUS, envelope.status());
    putIfPresent(node, ADDRESS, envelope.address());
    if (envelope.distM() != null) node.put(DIST_M, Math.round(envelope.distM()));
    if (envelope.arrived() != null) node.put(ARRIVED, envelope.arrived());
    try {
      return mapper.writeValueAsString(node);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to encode envelope", e);
    }
  }

  @Override
  public Envelope decode(String json) {
    if (json == null || json.isBlank()) {
      throw new MalformedFrameException("Empty frame");
    }
    JsonNode node;
    try {
      node = mapper.readTree(json);
    } catch (JsonProcessingException e) {
      throw new MalformedFrameException("Frame is not valid JSON", e);
    }
    if (node == null || !node.isObject()) {
      throw new MalformedFrameException("Frame is not a JSON object");
    }
    String typeName = text(node, TYPE);
    if (typeName == null) {
      throw new MalformedFrameException("Frame has no type");
    }
    EnvelopeType type = EnvelopeType.fromWireName(typeName);
    if (type == null) {
      throw new MalformedFrameException("Unknown frame type: " + typeName);
    }
    String msgId = text(node, MSG_ID);
    if (msgId == null) {
      msgId = text(node, LEGACY_ACK_ID);
    }
    return new Envelope(type, msgId,
        longValue(node, DELIVERY_ID),
        text(node, UNIT_ID),
        doubleValue(node, LAT),
        doubleValue(node, LON),
        longValue(node, TIMESTAMP),
        text(node, STATUS),
        text(node, ADDRESS),
        doubleValue(node, DIST_M),
        booleanValue(node, ARRIVED));
  }

  private static void putIfPresent(ObjectNode node, String field, String value) {
    if (value != null) {
      node.put(field, value);
    }
  }

  private static String text(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      return null;
    }
    if (!value.isValueNode()) {
      throw new MalformedFrameException("Field " + field + " must be a scalar");
    }
    return value.asText();
  }

  private static Long longValue(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      return null;
    }
    if (value.isIntegralNumber()) {
      return value.longValue();
    }
    if (value.isNumber()) {
      return (long) value.doubleValue();
    }
    if (value.isTextual()) {
      try {
        return Long.parseLong(value.textValue().trim());
      } catch (NumberFormatException e) {
        throw new MalformedFrameException("Field " + field + " is not an integer: " + value.textValue(), e);
      }
    }
    throw new MalformedFrameException("Field " + field + " is not an integer");
  }

  private static Double doubleValue(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      return null;
    }
    if (value.isNumber()) {
      return value.doubleValue();
    }
    if (value.isTextual()) {
      try {
        return Double.parseDouble(value.textValue().trim());
      } catch (NumberFormatException e) {
        throw new MalformedFrameException("Field " + field + " is not a number: " + value.textValue(), e);
      }
    }
    throw new MalformedFrameException("Field " + field + " is not a number");
  }

  private static Boolean booleanValue(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      return null;
    }
    if (value.isBoolean()) {
      return value.booleanValue();
    }
    if (value.isTextual()) {
      return Boolean.parseBoolean(value.textValue().trim());
    }
    if (value.isNumber()) {
      return value.intValue() != 0;
    }
    throw new MalformedFrameException("Field " + field + " is not a boolean");
  }
}
