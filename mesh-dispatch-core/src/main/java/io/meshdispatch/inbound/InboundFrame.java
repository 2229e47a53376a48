package io.meshdispatch.inbound;

import java.time.Instant;
import java.util.Objects;

/**
 * A raw frame as received from the radio, stamped with the server receipt time.
 */
public record InboundFrame(byte[] payload, Instant receivedAt) {

  public InboundFrame {
    Objects.requireNonNull(payload, "payload");
    Objects.requireNonNull(receivedAt, "receivedAt");
  }
}
