package io.meshdispatch.outbound;

import io.meshdispatch.CountingMetrics;
import io.meshdispatch.MutableClock;
import io.meshdispatch.RecordingTransport;
import io.meshdispatch.envelope.Envelope;
import io.meshdispatch.envelope.JacksonEnvelopeCodec;
import io.meshdispatch.model.Coordinates;
import io.meshdispatch.model.PendingAck;
import io.meshdispatch.tx.TransactionManager;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class ReliableOutboundManagerTest {
  private static final long INTERVAL_MS = 30_000;
  private static final int MAX_ATTEMPTS = 5;

  private MutableClock clock;
  private RecordingTransport transport;
  private StubPendingAckStore store;
  private TransactionManager txManager;
  private CountingMetrics metrics;
  private List<PendingAck> exhausted;
  private ReliableOutboundManager manager;

  @BeforeEach
  void setUp() {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:outbound_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    txManager = new TransactionManager(ds::getConnection);
    clock = MutableClock.at("2024-05-01T10:00:00Z");
    transport = new RecordingTransport();
    store = new StubPendingAckStore();
    metrics = new CountingMetrics();
    exhausted = new ArrayList<>();
    manager = newManager();
  }

  @AfterEach
  void tearDown() {
    manager.close();
  }

  private ReliableOutboundManager newManager() {
    ReliableOutboundManager m = ReliableOutboundManager.builder()
        .txManager(txManager)
        .pendingAckStore(store)
        .transport(transport)
        .codec(new JacksonEnvelopeCodec())
        .retryPolicy(new FixedIntervalRetryPolicy(INTERVAL_MS))
        .maxAttempts(MAX_ATTEMPTS)
        .clock(clock)
        .metrics(metrics)
        .build();
    m.setExhaustionListener((tx, pendingAck) -> exhausted.add(pendingAck));
    return m;
  }

  private PendingAck sendAssign(long deliveryId) {
    Envelope assign = Envelope.assign(null, deliveryId, "Truck-01", new Coordinates(1.0, 2.0),
        "1 Main St", null, clock.instant().getEpochSecond());
    return manager.sendReliable("Truck-01", assign, deliveryId);
  }

  @Test
  void sendPersistsThenTransmitsWithFreshMessageId() {
    PendingAck sent = sendAssign(1L);

    assertEquals(12, sent.msgId().length());
    assertEquals(1, sent.attempts());
    assertEquals(clock.instant().plusMillis(INTERVAL_MS), sent.nextRetryAt());
    assertEquals(1, store.rows.size());
    assertEquals(1, transport.sent().size());
    assertTrue(transport.sent().get(0).contains("\"msg_id\":\"" + sent.msgId() + "\""));
    assertEquals(1, metrics.reliableSent.get());
  }

  @Test
  void nothingIsTransmittedWhenTheTransactionRollsBack() {
    assertThrows(IllegalStateException.class, () -> txManager.inTransaction(tx -> {
      manager.sendReliable(tx, "Truck-01", Envelope.ack("x", "Truck-01", 0L), 1L);
      throw new IllegalStateException("boom");
    }));
    assertTrue(transport.sent().isEmpty());
  }

  @Test
  void retransmitsIdenticalPayloadAtTheIntervalAndStopsAtMaxAttempts() {
    PendingAck sent = sendAssign(1L);

    clock.advanceMillis(INTERVAL_MS - 1);
    assertEquals(0, manager.tick());
    assertEquals(1, transport.sent().size());

    for (int attempt = 2; attempt <= MAX_ATTEMPTS; attempt++) {
      clock.advanceMillis(1);
      assertEquals(1, manager.tick());
      assertEquals(attempt, transport.sent().size());
      assertEquals(attempt, store.rows.get(sent.msgId()).attempts());
      clock.advanceMillis(INTERVAL_MS - 1);
    }
    assertTrue(transport.sent().stream().allMatch(f -> f.equals(transport.sent().get(0))));
    assertTrue(exhausted.isEmpty());

    clock.advanceMillis(1);
    assertEquals(1, manager.tick());
    assertEquals(MAX_ATTEMPTS, transport.sent().size());
    assertTrue(store.rows.isEmpty());
    assertEquals(1, exhausted.size());
    assertEquals(sent.msgId(), exhausted.get(0).msgId());
    assertEquals(1, metrics.ackExhausted.get());

    clock.advance(Duration.ofHours(1));
    assertEquals(0, manager.tick());
    assertEquals(1, exhausted.size());
  }

  @Test
  void ackRetiresRecordAndDuplicateIsIgnored() {
    PendingAck sent = sendAssign(1L);

    Optional<PendingAck> first = manager.onAck(sent.msgId());
    Optional<PendingAck> second = manager.onAck(sent.msgId());

    assertTrue(first.isPresent());
    assertTrue(second.isEmpty());
    assertEquals(1, store.deletes.get());
    assertEquals(1, metrics.ackReceived.get());
    assertEquals(1, metrics.duplicateAck.get());

    clock.advance(Duration.ofHours(1));
    manager.tick();
    assertTrue(exhausted.isEmpty());
    assertEquals(1, transport.sent().size());
  }

  @Test
  void ackAfterExhaustionIsIgnored() {
    PendingAck sent = sendAssign(1L);
    for (int i = 0; i < MAX_ATTEMPTS; i++) {
      clock.advanceMillis(INTERVAL_MS);
      manager.tick();
    }
    assertEquals(1, exhausted.size());

    assertTrue(manager.onAck(sent.msgId()).isEmpty());
    assertEquals(1, store.deletes.get());
  }

  @Test
  void cancelForDeliveryRemovesWithoutExhaustion() {
    sendAssign(1L);
    sendAssign(2L);

    int removed = txManager.inTransaction(tx -> manager.cancelForDelivery(tx, 1L));

    assertEquals(1, removed);
    assertEquals(1, store.rows.size());
    clock.advance(Duration.ofHours(5));
    for (int i = 0; i < MAX_ATTEMPTS; i++) {
      manager.tick();
      clock.advanceMillis(INTERVAL_MS);
    }
    assertEquals(1, exhausted.size());
    assertEquals(2L, exhausted.get(0).deliveryId());
  }

  @Test
  void sendFailureKeepsRetryTimerArmed() {
    transport.setConnected(false);
    PendingAck sent = sendAssign(1L);

    assertTrue(transport.sent().isEmpty());
    assertEquals(1, metrics.sendFailures.get());
    assertTrue(store.rows.containsKey(sent.msgId()));

    transport.setConnected(true);
    clock.advanceMillis(INTERVAL_MS);
    manager.tick();
    assertEquals(1, transport.sent().size());
    assertEquals(2, store.rows.get(sent.msgId()).attempts());
  }

  @Test
  void restartPreservesAttemptsAndResumesFromDeadline() {
    PendingAck sent = sendAssign(1L);
    clock.advanceMillis(INTERVAL_MS);
    manager.tick();
    clock.advanceMillis(INTERVAL_MS);
    manager.tick();
    assertEquals(3, store.rows.get(sent.msgId()).attempts());
    manager.close();

    // process down for a long time
    clock.advance(Duration.ofMinutes(10));
    manager = newManager();
    assertEquals(1, manager.recover());

    PendingAck recovered = store.rows.get(sent.msgId());
    assertEquals(3, recovered.attempts());
    assertEquals(clock.instant(), recovered.nextRetryAt());

    manager.tick();
    assertEquals(4, store.rows.get(sent.msgId()).attempts());
    clock.advanceMillis(INTERVAL_MS);
    manager.tick();
    assertEquals(5, store.rows.get(sent.msgId()).attempts());
    clock.advanceMillis(INTERVAL_MS);
    manager.tick();

    assertTrue(store.rows.isEmpty());
    assertEquals(1, exhausted.size());
    assertEquals(MAX_ATTEMPTS, transport.sent().size());
  }

  @Test
  void tickSurvivesListenerFailure() {
    manager.setExhaustionListener((tx, pendingAck) -> {
      throw new IllegalStateException("listener broke");
    });
    sendAssign(1L);
    for (int i = 0; i < MAX_ATTEMPTS - 1; i++) {
      clock.advanceMillis(INTERVAL_MS);
      manager.tick();
    }

    clock.advanceMillis(INTERVAL_MS);
    assertEquals(0, manager.tick());
    assertEquals(0, metrics.ackExhausted.get());

    PendingAck next = sendAssign(2L);
    assertEquals(MAX_ATTEMPTS + 1, transport.sent().size());
    assertTrue(transport.sent().get(MAX_ATTEMPTS).contains(next.msgId()));
  }

  @Test
  void builderRejectsInvalidSettings() {
    assertThrows(NullPointerException.class, () -> ReliableOutboundManager.builder().build());
    assertThrows(IllegalArgumentException.class, () -> ReliableOutboundManager.builder()
        .txManager(txManager).pendingAckStore(store).transport(transport)
        .codec(new JacksonEnvelopeCodec()).retryPolicy(new FixedIntervalRetryPolicy(1))
        .maxAttempts(0).build());
  }
}
