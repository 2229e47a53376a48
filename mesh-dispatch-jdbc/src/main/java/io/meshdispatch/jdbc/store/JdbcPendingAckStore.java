package io.meshdispatch.jdbc.store;

import io.meshdispatch.jdbc.JdbcTemplate;
import io.meshdispatch.model.PendingAck;
import io.meshdispatch.spi.PendingAckStore;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * {@link PendingAckStore} over the {@code pending_ack} table.
 */
public final class JdbcPendingAckStore implements PendingAckStore {
  private static final String COLUMNS = "msg_id, unit_id, delivery_id, payload, created_at, "
      + "last_sent_at, attempts, next_retry_at";

  static final JdbcTemplate.RowMapper<PendingAck> ROW_MAPPER = rs -> new PendingAck(
      rs.getString("msg_id"),
      rs.getString("unit_id"),
      JdbcTemplate.nullableLong(rs, "delivery_id"),
      rs.getString("payload"),
      JdbcTemplate.instant(rs, "created_at"),
      JdbcTemplate.instant(rs, "last_sent_at"),
      rs.getInt("attempts"),
      JdbcTemplate.instant(rs, "next_retry_at"));

  JdbcPendingAckStore() {}

  @Override
  public void insert(Connection conn, PendingAck pendingAck) {
    String sql = "INSERT INTO pending_ack (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?)";
    JdbcTemplate.update(conn, sql,
        pendingAck.msgId(), pendingAck.unitId(), pendingAck.deliveryId(), pendingAck.payload(),
        pendingAck.createdAt(), pendingAck.lastSentAt(), pendingAck.attempts(),
        pendingAck.nextRetryAt());
  }

  @Override
  public Optional<PendingAck> find(Connection conn, String msgId) {
    return JdbcTemplate.queryOne(conn, "SELECT " + COLUMNS + " FROM pending_ack WHERE msg_id=?",
        ROW_MAPPER, msgId);
  }

  @Override
  public List<PendingAck> findDue(Connection conn, Instant now, int limit) {
    String sql = "SELECT " + COLUMNS + " FROM pending_ack WHERE next_retry_at <= ?"
        + " ORDER BY next_retry_at, created_at LIMIT ?";
    return JdbcTemplate.query(conn, sql, ROW_MAPPER, now, limit);
  }

  @Override
  public List<PendingAck> findAll(Connection conn) {
    return JdbcTemplate.query(conn, "SELECT " + COLUMNS + " FROM pending_ack ORDER BY created_at, msg_id",
        ROW_MAPPER);
  }

  @Override
  public List<PendingAck> findByDelivery(Connection conn, long deliveryId) {
    String sql = "SELECT " + COLUMNS + " FROM pending_ack WHERE delivery_id=? ORDER BY created_at";
    return JdbcTemplate.query(conn, sql, ROW_MAPPER, deliveryId);
  }

  @Override
  public int markResent(Connection conn, String msgId, int expectedAttempts, Instant sentAt, Instant nextRetryAt) {
    String sql = "UPDATE pending_ack SET attempts=attempts+1, last_sent_at=?, next_retry_at=?"
        + " WHERE msg_id=? AND attempts=?";
    return JdbcTemplate.update(conn, sql, sentAt, nextRetryAt, msgId, expectedAttempts);
  }

  @Override
  public int rescheduleOverdue(Connection conn, Instant now) {
    return JdbcTemplate.update(conn, "UPDATE pending_ack SET next_retry_at=? WHERE next_retry_at < ?", now, now);
  }

  @Override
  public int delete(Connection conn, String msgId) {
    return JdbcTemplate.update(conn, "DELETE FROM pending_ack WHERE msg_id=?", msgId);
  }

  @Override
  public int count(Connection conn) {
    return JdbcTemplate.query(conn, "SELECT COUNT(*) FROM pending_ack", rs -> rs.getInt(1)).get(0);
  }
}
