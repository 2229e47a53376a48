package io.meshdispatch.jdbc;

import io.meshdispatch.DispatchConfig;
import io.meshdispatch.MeshDispatch;
import io.meshdispatch.envelope.Envelope;
import io.meshdispatch.envelope.JacksonEnvelopeCodec;
import io.meshdispatch.jdbc.store.AbstractJdbcDispatchStore;
import io.meshdispatch.jdbc.store.JdbcDispatchStores;
import io.meshdispatch.model.Delivery;
import io.meshdispatch.model.DeliveryStatus;
import io.meshdispatch.model.PendingAck;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;

import static io.meshdispatch.jdbc.DispatchFixture.MAIN_ST;
import static io.meshdispatch.jdbc.DispatchFixture.MAIN_ST_ADDRESS;
import static org.junit.jupiter.api.Assertions.*;

class MeshDispatchRestartTest {
  private final JacksonEnvelopeCodec codec = new JacksonEnvelopeCodec();
  private final MutableClock clock = MutableClock.at("2024-05-01T10:00:00Z");
  private JdbcDataSource dataSource;
  private AbstractJdbcDispatchStore store;

  @BeforeEach
  void setUp() throws SQLException {
    dataSource = DispatchFixture.newDataSource();
    store = JdbcDispatchStores.detect(dataSource);
    try (Connection conn = dataSource.getConnection()) {
      store.createSchema(conn);
    }
  }

  private MeshDispatch newInstance(RecordingTransport transport) {
    DispatchConfig config = new DispatchConfig()
        .setAckTimeoutMs(30_000)
        .setMaxAttempts(5)
        // background loops stay idle; the test drives ticks itself
        .setRetryTickMs(3_600_000)
        .setOfflineSweepIntervalMs(3_600_000)
        .setGeocoderAttempts(1);
    return MeshDispatch.builder()
        .connectionProvider(new DataSourceConnectionProvider(dataSource))
        .deliveryStore(store.deliveryStore())
        .unitStore(store.unitStore())
        .pendingAckStore(store.pendingAckStore())
        .transport(transport)
        .geocoder(address -> MAIN_ST)
        .config(config)
        .clock(clock)
        .build();
  }

  private static void awaitNoPending(MeshDispatch dispatch) throws InterruptedException {
    long deadline = System.currentTimeMillis() + 5000;
    while (!dispatch.coordinator().listPendingAcks().isEmpty() && System.currentTimeMillis() < deadline) {
      Thread.sleep(10);
    }
  }

  @Test
  void pendingAssignmentSurvivesRestart() throws InterruptedException {
    RecordingTransport firstLink = new RecordingTransport();
    MeshDispatch first = newInstance(firstLink);
    first.start();
    first.coordinator().registerUnit("Truck-01");
    Delivery delivery = first.coordinator().createDelivery(MAIN_ST_ADDRESS);
    first.coordinator().assignDelivery(delivery.id(), "Truck-01");
    clock.advance(Duration.ofSeconds(30));
    first.outbound().tick();
    assertEquals(2, firstLink.sent().size());
    String msgId = codec.decode(firstLink.sent().get(0)).msgId();
    first.close();
    assertTrue(firstLink.isClosed());

    clock.advance(Duration.ofMinutes(10));
    RecordingTransport secondLink = new RecordingTransport();
    MeshDispatch second = newInstance(secondLink);
    try {
      second.start();

      List<PendingAck> pending = second.coordinator().listPendingAcks();
      assertEquals(1, pending.size());
      assertEquals(msgId, pending.get(0).msgId());
      assertEquals(2, pending.get(0).attempts());
      assertEquals(clock.instant(), pending.get(0).nextRetryAt());

      assertEquals(1, second.outbound().tick());
      Envelope resent = codec.decode(secondLink.sent().get(0));
      assertEquals(msgId, resent.msgId());
      assertEquals(delivery.id(), resent.deliveryId());

      secondLink.receive("{\"type\":\"ack\",\"unit_id\":\"Truck-01\",\"msg_id\":\"" + msgId + "\"}");
      awaitNoPending(second);

      assertTrue(second.coordinator().listPendingAcks().isEmpty());
      assertEquals(DeliveryStatus.ASSIGNED, second.coordinator().getDelivery(delivery.id()).status());
    } finally {
      second.close();
    }
  }

  @Test
  void startIsIdempotentAndCloseIsFinal() {
    RecordingTransport link = new RecordingTransport();
    MeshDispatch dispatch = newInstance(link);

    dispatch.start();
    dispatch.start();
    dispatch.close();
    dispatch.close();

    assertTrue(link.isClosed());
    assertThrows(IllegalStateException.class, dispatch::start);
  }

  @Test
  void builderRequiresCollaborators() {
    assertThrows(NullPointerException.class, () -> MeshDispatch.builder().build());
  }
}
