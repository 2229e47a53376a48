package io.meshdispatch.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Durable record of an outbound message awaiting acknowledgment.
 *
 * @param msgId       unique message id carried in the frame and echoed by the ACK
 * @param unitId      destination unit
 * @param deliveryId  correlated delivery, or {@code null}
 * @param payload     encoded frame, re-sent verbatim on every attempt
 * @param createdAt   creation time
 * @param lastSentAt  time of the most recent send attempt
 * @param attempts    number of sends performed so far
 * @param nextRetryAt deadline at which the next attempt (or exhaustion) is due
 */
public record PendingAck(
    String msgId,
    String unitId,
    Long deliveryId,
    String payload,
    Instant createdAt,
    Instant lastSentAt,
    int attempts,
    Instant nextRetryAt
) {

  public PendingAck {
    Objects.requireNonNull(msgId, "msgId");
    Objects.requireNonNull(unitId, "unitId");
    Objects.requireNonNull(payload, "payload");
    Objects.requireNonNull(createdAt, "createdAt");
    Objects.requireNonNull(nextRetryAt, "nextRetryAt");
  }
}
