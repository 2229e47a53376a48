package io.meshdispatch.envelope;

import java.util.Locale;

/**
 * Message kinds exchanged with units. Outbound: {@link #ASSIGN}, {@link #TASK_COMPLETE}.
 * Inbound: {@link #ACK}, {@link #TELEMETRY}, {@link #ARRIVAL}, {@link #STATUS}.
 */
public enum EnvelopeType {
  ASSIGN,
  ACK,
  TELEMETRY,
  ARRIVAL,
  STATUS,
  TASK_COMPLETE;

  private final String wireName = name().toLowerCase(Locale.ROOT);

  public String wireName() {
    return wireName;
  }

  /**
   * @return the matching type, or {@code null} if the name is unknown
   */
  public static EnvelopeType fromWireName(String wireName) {
    for (EnvelopeType type : values()) {
      if (type.wireName.equals(wireName)) {
        return type;
      }
    }
    return null;
  }
}
