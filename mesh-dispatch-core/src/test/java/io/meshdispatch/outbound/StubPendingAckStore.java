package io.meshdispatch.outbound;

import io.meshdispatch.model.PendingAck;
import io.meshdispatch.spi.PendingAckStore;

import java.sql.Connection;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/** In-memory {@link PendingAckStore}; ignores the connection. */
class StubPendingAckStore implements PendingAckStore {
  final Map<String, PendingAck> rows = new LinkedHashMap<>();
  final AtomicInteger deletes = new AtomicInteger();

  @Override
  public synchronized void insert(Connection conn, PendingAck pendingAck) {
    if (rows.putIfAbsent(pendingAck.msgId(), pendingAck) != null) {
      throw new IllegalStateException("duplicate msg_id " + pendingAck.msgId());
    }
  }

  @Override
  public synchronized Optional<PendingAck> find(Connection conn, String msgId) {
    return Optional.ofNullable(rows.get(msgId));
  }

  @Override
  public synchronized List<PendingAck> findDue(Connection conn, Instant now, int limit) {
    return rows.values().stream()
        .filter(p -> !p.nextRetryAt().isAfter(now))
        .sorted(Comparator.comparing(PendingAck::nextRetryAt))
        .limit(limit)
        .toList();
  }

  @Override
  public synchronized List<PendingAck> findAll(Connection conn) {
    return new ArrayList<>(rows.values());
  }

  @Override
  public synchronized List<PendingAck> findByDelivery(Connection conn, long deliveryId) {
    return rows.values().stream()
        .filter(p -> Objects.equals(p.deliveryId(), deliveryId))
        .toList();
  }

  @Override
  public synchronized int markResent(Connection conn, String msgId, int expectedAttempts, Instant sentAt,
      Instant nextRetryAt) {
    PendingAck p = rows.get(msgId);
    if (p == null || p.attempts() != expectedAttempts) {
      return 0;
    }
    rows.put(msgId, new PendingAck(p.msgId(), p.unitId(), p.deliveryId(), p.payload(), p.createdAt(),
        sentAt, p.attempts() + 1, nextRetryAt));
    return 1;
  }

  @Override
  public synchronized int rescheduleOverdue(Connection conn, Instant now) {
    int updated = 0;
    for (PendingAck p : new ArrayList<>(rows.values())) {
      if (p.nextRetryAt().isBefore(now)) {
        rows.put(p.msgId(), new PendingAck(p.msgId(), p.unitId(), p.deliveryId(), p.payload(),
            p.createdAt(), p.lastSentAt(), p.attempts(), now));
        updated++;
      }
    }
    return updated;
  }

  @Override
  public synchronized int delete(Connection conn, String msgId) {
    if (rows.remove(msgId) == null) {
      return 0;
    }
    deletes.incrementAndGet();
    return 1;
  }

  @Override
  public synchronized int count(Connection conn) {
    return rows.size();
  }
}
