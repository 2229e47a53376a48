package io.meshdispatch.jdbc.store;

import io.meshdispatch.model.PendingAck;
import io.meshdispatch.spi.PendingAckStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JdbcPendingAckStoreTest {
  private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

  private Connection conn;
  private PendingAckStore store;

  @BeforeEach
  void setUp() throws SQLException {
    AbstractJdbcDispatchStore dispatchStore = JdbcDispatchStores.get("h2");
    conn = StoreTestSupport.openWithSchema(dispatchStore);
    store = dispatchStore.pendingAckStore();
  }

  @AfterEach
  void tearDown() throws SQLException {
    conn.close();
  }

  private PendingAck insert(String msgId, Long deliveryId, Instant nextRetryAt) {
    PendingAck row = new PendingAck(msgId, "Truck-01", deliveryId, "{\"type\":\"assign\"}",
        T0, T0, 1, nextRetryAt);
    store.insert(conn, row);
    return row;
  }

  @Test
  void insertAndFind() {
    PendingAck row = insert("a1", 7L, T0.plusSeconds(30));

    assertEquals(row, store.find(conn, "a1").orElseThrow());
    assertTrue(store.find(conn, "zz").isEmpty());
    assertEquals(1, store.count(conn));
  }

  @Test
  void findDueInDeadlineOrderWithLimit() {
    insert("late", 1L, T0.plusSeconds(90));
    insert("first", 2L, T0.plusSeconds(10));
    insert("second", 3L, T0.plusSeconds(20));
    insert("future", null, T0.plusSeconds(500));

    List<PendingAck> due = store.findDue(conn, T0.plusSeconds(100), 2);

    assertEquals(List.of("first", "second"), due.stream().map(PendingAck::msgId).toList());
    assertEquals(3, store.findDue(conn, T0.plusSeconds(100), 10).size());
  }

  @Test
  void markResentIsGuardedByAttemptCount() {
    insert("a1", 7L, T0.plusSeconds(30));
    Instant sent = T0.plusSeconds(30);

    assertEquals(1, store.markResent(conn, "a1", 1, sent, sent.plusSeconds(30)));
    assertEquals(0, store.markResent(conn, "a1", 1, sent, sent.plusSeconds(30)));

    PendingAck row = store.find(conn, "a1").orElseThrow();
    assertEquals(2, row.attempts());
    assertEquals(sent, row.lastSentAt());
    assertEquals(sent.plusSeconds(30), row.nextRetryAt());
  }

  @Test
  void rescheduleOverduePullsDeadlinesToNow() {
    insert("overdue", 1L, T0.plusSeconds(30));
    insert("ahead", 2L, T0.plusSeconds(900));
    Instant now = T0.plusSeconds(600);

    assertEquals(1, store.rescheduleOverdue(conn, now));

    assertEquals(now, store.find(conn, "overdue").orElseThrow().nextRetryAt());
    assertEquals(1, store.find(conn, "overdue").orElseThrow().attempts());
    assertEquals(T0.plusSeconds(900), store.find(conn, "ahead").orElseThrow().nextRetryAt());
  }

  @Test
  void deleteRemovesOnce() {
    insert("a1", 7L, T0);

    assertEquals(1, store.delete(conn, "a1"));
    assertEquals(0, store.delete(conn, "a1"));
    assertEquals(0, store.count(conn));
  }

  @Test
  void findByDelivery() {
    insert("a1", 7L, T0);
    insert("a2", 7L, T0);
    insert("b1", 8L, T0);
    insert("n1", null, T0);

    assertEquals(2, store.findByDelivery(conn, 7L).size());
    assertEquals(4, store.findAll(conn).size());
  }
}
