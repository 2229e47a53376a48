package io.meshdispatch.spi;

import io.meshdispatch.model.PendingAck;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence operations for pending acknowledgments.
 *
 * <p>The {@code next_retry_at} ordering of {@link #findDue} is the retry scheduler's
 * deadline queue. Removal methods return the number of rows deleted; exactly one caller
 * observes {@code 1} for a given message id, which is what makes ACK, exhaustion and
 * cancellation mutually exclusive.
 */
public interface PendingAckStore {

  void insert(Connection conn, PendingAck pendingAck);

  Optional<PendingAck> find(Connection conn, String msgId);

  /**
   * Returns records whose {@code next_retry_at} is at or before {@code now}, earliest
   * deadline first.
   */
  List<PendingAck> findDue(Connection conn, Instant now, int limit);

  /**
   * Returns all records ordered by creation time.
   */
  List<PendingAck> findAll(Connection conn);

  List<PendingAck> findByDelivery(Connection conn, long deliveryId);

  /**
   * Records another send attempt if the stored attempt count still equals
   * {@code expectedAttempts}.
   *
   * @return 1 if updated, 0 if the record is gone or was updated concurrently
   */
  int markResent(Connection conn, String msgId, int expectedAttempts, Instant sentAt, Instant nextRetryAt);

  /**
   * Moves every deadline earlier than {@code now} to {@code now}. Attempt counts are untouched.
   *
   * @return rows updated
   */
  int rescheduleOverdue(Connection conn, Instant now);

  int delete(Connection conn, String msgId);

  int count(Connection conn);
}
