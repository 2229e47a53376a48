package io.meshdispatch.jdbc.store;

import io.meshdispatch.model.Coordinates;
import io.meshdispatch.model.Delivery;
import io.meshdispatch.model.DeliveryStatus;
import io.meshdispatch.spi.DeliveryStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JdbcDeliveryStoreTest {
  private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

  private Connection conn;
  private DeliveryStore store;

  @BeforeEach
  void setUp() throws SQLException {
    AbstractJdbcDispatchStore dispatchStore = JdbcDispatchStores.get("h2");
    conn = StoreTestSupport.openWithSchema(dispatchStore);
    store = dispatchStore.deliveryStore();
  }

  @AfterEach
  void tearDown() throws SQLException {
    conn.close();
  }

  @Test
  void insertAssignsIncreasingIds() {
    Delivery first = store.insert(conn, "1 Main St", new Coordinates(40.0, -75.0), T0);
    Delivery second = store.insert(conn, "2 Main St", null, T0);

    assertTrue(second.id() > first.id());
    assertEquals(DeliveryStatus.PENDING, first.status());
    assertEquals(T0, first.createdAt());
    assertEquals(T0, first.statusChangedAt());

    Delivery loaded = store.find(conn, first.id()).orElseThrow();
    assertEquals(first, loaded);
    assertNull(store.find(conn, second.id()).orElseThrow().coordinates());
  }

  @Test
  void compareAndSetHonoursExpectedStatus() {
    Delivery pending = store.insert(conn, "1 Main St", null, T0);
    Instant t1 = T0.plusSeconds(5);
    Delivery assigned = pending.toBuilder()
        .status(DeliveryStatus.ASSIGNED, t1)
        .assignedUnitId("Truck-01")
        .assignedAt(t1)
        .build();

    assertEquals(1, store.compareAndSet(conn, assigned, DeliveryStatus.PENDING));
    assertEquals(0, store.compareAndSet(conn, assigned, DeliveryStatus.PENDING));

    Delivery loaded = store.findForUpdate(conn, pending.id()).orElseThrow();
    assertEquals(DeliveryStatus.ASSIGNED, loaded.status());
    assertEquals("Truck-01", loaded.assignedUnitId());
    assertEquals(t1, loaded.assignedAt());
  }

  @Test
  void failureReasonIsTruncated() {
    Delivery pending = store.insert(conn, "1 Main St", null, T0);
    Delivery failed = pending.toBuilder()
        .status(DeliveryStatus.FAILED, T0)
        .failureReason("x".repeat(400))
        .build();

    store.compareAndSet(conn, failed, DeliveryStatus.PENDING);

    assertEquals(255, store.find(conn, pending.id()).orElseThrow().failureReason().length());
  }

  @Test
  void findActiveByUnitIgnoresInactiveRows() {
    Delivery done = store.insert(conn, "a", null, T0);
    store.compareAndSet(conn, done.toBuilder().status(DeliveryStatus.COMPLETED, T0)
        .assignedUnitId("Truck-01").build(), DeliveryStatus.PENDING);
    assertTrue(store.findActiveByUnit(conn, "Truck-01").isEmpty());

    Delivery active = store.insert(conn, "b", null, T0);
    store.compareAndSet(conn, active.toBuilder().status(DeliveryStatus.EN_ROUTE, T0)
        .assignedUnitId("Truck-01").build(), DeliveryStatus.PENDING);

    assertEquals(active.id(), store.findActiveByUnit(conn, "Truck-01").orElseThrow().id());
    assertTrue(store.findActiveByUnit(conn, "Truck-02").isEmpty());
  }

  @Test
  void updateCoordinatesOnly() {
    Delivery pending = store.insert(conn, "1 Main St", null, T0);

    assertEquals(1, store.updateCoordinates(conn, pending.id(), new Coordinates(1.0, 2.0)));
    assertEquals(0, store.updateCoordinates(conn, 999L, new Coordinates(1.0, 2.0)));

    Delivery loaded = store.find(conn, pending.id()).orElseThrow();
    assertEquals(new Coordinates(1.0, 2.0), loaded.coordinates());
    assertEquals(DeliveryStatus.PENDING, loaded.status());
  }

  @Test
  void findAllNewestFirst() {
    Delivery a = store.insert(conn, "a", null, T0);
    Delivery b = store.insert(conn, "b", null, T0);

    assertEquals(List.of(b.id(), a.id()),
        store.findAll(conn).stream().map(Delivery::id).toList());
  }
}
