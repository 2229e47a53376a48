package io.meshdispatch.jdbc;

import io.meshdispatch.DispatchException;
import io.meshdispatch.model.Coordinates;
import io.meshdispatch.model.Delivery;
import io.meshdispatch.model.DeliveryUnit;
import io.meshdispatch.model.PendingAck;
import io.meshdispatch.model.UnitStatus;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static io.meshdispatch.jdbc.DispatchFixture.BASE;
import static io.meshdispatch.jdbc.DispatchFixture.MAIN_ST;
import static io.meshdispatch.jdbc.DispatchFixture.MAIN_ST_ADDRESS;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Drives random command and frame sequences and checks the cross-entity invariants after
 * every step.
 */
class DispatchInvariantsTest {
  private static final List<String> UNITS = List.of("Truck-01", "Truck-02", "Truck-03");
  private static final List<String> REPORTED = List.of("en_route", "arrived_dest", "idle", "error");

  @Test
  void randomSequencesKeepDeliveriesAndUnitsConsistent() {
    for (long seed = 1; seed <= 15; seed++) {
      runSequence(seed, 150);
    }
  }

  private void runSequence(long seed, int steps) {
    Random random = new Random(seed);
    DispatchFixture f = new DispatchFixture();
    UNITS.forEach(f.coordinator::registerUnit);
    for (int i = 0; i < 4; i++) {
      f.coordinator.createDelivery(MAIN_ST_ADDRESS);
    }

    for (int step = 0; step < steps; step++) {
      try {
        applyRandomStep(f, random);
      } catch (DispatchException expected) {
        // rejected commands must leave state untouched; checked below
      }
      assertConsistent(f, "seed=" + seed + " step=" + step);
    }
  }

  private void applyRandomStep(DispatchFixture f, Random random) {
    List<Delivery> deliveries = f.coordinator.listDeliveries();
    Delivery delivery = deliveries.get(random.nextInt(deliveries.size()));
    String unit = UNITS.get(random.nextInt(UNITS.size()));
    switch (random.nextInt(11)) {
      case 0, 1 -> f.coordinator.assignDelivery(delivery.id(), unit);
      case 2 -> f.coordinator.confirmComplete(delivery.id());
      case 3 -> f.coordinator.markFailed(delivery.id(), "random");
      case 4 -> f.coordinator.reopen(delivery.id());
      case 5 -> f.coordinator.clearUnitError(unit);
      case 6 -> f.status(unit, REPORTED.get(random.nextInt(REPORTED.size())));
      case 7 -> {
        Coordinates at = random.nextBoolean() ? MAIN_ST : BASE;
        if (random.nextBoolean()) {
          f.arrival(unit, delivery.id(), at);
        } else {
          f.baseArrival(unit, at);
        }
      }
      case 8 -> {
        List<PendingAck> pending = f.coordinator.listPendingAcks();
        if (!pending.isEmpty()) {
          PendingAck p = pending.get(random.nextInt(pending.size()));
          f.ack(p.unitId(), p.msgId());
        }
      }
      case 9 -> f.runRetries(1);
      default -> {
        f.clock.advance(Duration.ofMinutes(random.nextInt(8)));
        f.sweep();
        if (random.nextBoolean()) {
          f.telemetry(unit, MAIN_ST);
        }
      }
    }
  }

  private static void assertConsistent(DispatchFixture f, String context) {
    Map<String, Delivery> activeByUnit = new HashMap<>();
    for (Delivery d : f.coordinator.listDeliveries()) {
      assertEquals(d.status().isActive(), d.assignedUnitId() != null,
          context + ": assigned unit iff active, delivery " + d);
      if (d.status().isActive()) {
        Delivery previous = activeByUnit.put(d.assignedUnitId(), d);
        assertNull(previous, context + ": two active deliveries on " + d.assignedUnitId());
      }
    }
    for (DeliveryUnit u : f.coordinator.listUnits()) {
      Delivery active = activeByUnit.get(u.id());
      if (u.status().carriesDelivery()) {
        assertNotNull(active, context + ": unit without delivery " + u);
        assertEquals(active.id(), u.assignedDeliveryId(), context + ": " + u);
        assertEquals(UnitStatus.forActiveDelivery(active.status()), u.status(), context + ": " + u);
      } else {
        assertNull(u.assignedDeliveryId(), context + ": " + u);
        if (active != null) {
          assertEquals(UnitStatus.OFFLINE, u.status(), context + ": idle unit bound to " + active);
        }
      }
    }
    for (PendingAck p : f.coordinator.listPendingAcks()) {
      assertNotNull(p.deliveryId());
      assertTrue(p.attempts() >= 1 && p.attempts() <= DispatchFixture.MAX_ATTEMPTS, context);
    }
  }
}
