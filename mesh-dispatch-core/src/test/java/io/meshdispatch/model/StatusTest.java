package io.meshdispatch.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StatusTest {

  @Test
  void deliveryWireNames() {
    assertEquals("arrived_dest", DeliveryStatus.ARRIVED_DEST.wireName());
    assertEquals(DeliveryStatus.EN_ROUTE, DeliveryStatus.fromWireName("en_route"));
    assertThrows(IllegalArgumentException.class, () -> DeliveryStatus.fromWireName("EN_ROUTE"));
  }

  @Test
  void activeAndTerminalAreDisjoint() {
    for (DeliveryStatus status : DeliveryStatus.values()) {
      assertFalse(status.isActive() && status.isTerminal(), status.name());
    }
    assertFalse(DeliveryStatus.PENDING.isActive());
    assertFalse(DeliveryStatus.PENDING.isTerminal());
    assertTrue(DeliveryStatus.ARRIVED_DEST.isActive());
    assertTrue(DeliveryStatus.FAILED.isTerminal());
  }

  @Test
  void unitStatusMirrorsActiveDelivery() {
    assertEquals(UnitStatus.EN_ROUTE, UnitStatus.forActiveDelivery(DeliveryStatus.EN_ROUTE));
    assertThrows(IllegalArgumentException.class, () -> UnitStatus.forActiveDelivery(DeliveryStatus.PENDING));
    assertTrue(UnitStatus.ASSIGNED.carriesDelivery());
    assertFalse(UnitStatus.RETURNING.carriesDelivery());
    assertEquals(UnitStatus.OFFLINE, UnitStatus.fromWireName("offline"));
  }

  @Test
  void coordinatesRejectOutOfRange() {
    assertThrows(IllegalArgumentException.class, () -> new Coordinates(91, 0));
    assertThrows(IllegalArgumentException.class, () -> new Coordinates(0, -181));
    assertEquals(45.0, new Coordinates(45, 90).lat());
  }
}
