package io.meshdispatch.geo;

import io.meshdispatch.GeocodeException;
import io.meshdispatch.model.Coordinates;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RetryingGeocoderTest {
  private final List<Long> sleeps = new ArrayList<>();

  @Test
  void retriesTransientFailuresWithDoublingDelay() {
    AtomicInteger calls = new AtomicInteger();
    RetryingGeocoder geocoder = new RetryingGeocoder(address -> {
      if (calls.incrementAndGet() < 3) {
        throw new GeocodeException("timeout", false);
      }
      return new Coordinates(1.5, 2.5);
    }, 3, 100, sleeps::add);

    Coordinates result = geocoder.resolve("1 Main St");

    assertEquals(new Coordinates(1.5, 2.5), result);
    assertEquals(3, calls.get());
    assertEquals(List.of(100L, 200L), sleeps);
  }

  @Test
  void givesUpAfterMaxAttempts() {
    AtomicInteger calls = new AtomicInteger();
    RetryingGeocoder geocoder = new RetryingGeocoder(address -> {
      calls.incrementAndGet();
      throw new GeocodeException("service down", false);
    }, 3, 10, sleeps::add);

    GeocodeException e = assertThrows(GeocodeException.class, () -> geocoder.resolve("x"));
    assertFalse(e.isNotFound());
    assertEquals(3, calls.get());
    assertEquals(2, sleeps.size());
  }

  @Test
  void notFoundIsNotRetried() {
    AtomicInteger calls = new AtomicInteger();
    RetryingGeocoder geocoder = new RetryingGeocoder(address -> {
      calls.incrementAndGet();
      throw new GeocodeException("no match", true);
    }, 5, 10, sleeps::add);

    GeocodeException e = assertThrows(GeocodeException.class, () -> geocoder.resolve("nowhere"));
    assertTrue(e.isNotFound());
    assertEquals(1, calls.get());
    assertTrue(sleeps.isEmpty());
  }

  @Test
  void blankAddressFailsWithoutCallingDelegate() {
    RetryingGeocoder geocoder = new RetryingGeocoder(address -> {
      throw new AssertionError("should not be called");
    }, 3, 10, sleeps::add);

    assertTrue(assertThrows(GeocodeException.class, () -> geocoder.resolve("  ")).isNotFound());
    assertTrue(assertThrows(GeocodeException.class, () -> geocoder.resolve(null)).isNotFound());
  }

  @Test
  void interruptedSleepAbortsRetries() {
    RetryingGeocoder geocoder = new RetryingGeocoder(address -> {
      throw new GeocodeException("timeout", false);
    }, 3, 10, millis -> {
      throw new InterruptedException();
    });

    GeocodeException e = assertThrows(GeocodeException.class, () -> geocoder.resolve("x"));
    assertEquals(1, e.getSuppressed().length);
    assertTrue(Thread.interrupted());
  }

  @Test
  void rejectsInvalidArguments() {
    assertThrows(IllegalArgumentException.class,
        () -> new RetryingGeocoder(address -> null, 0, 10));
    assertThrows(IllegalArgumentException.class,
        () -> new RetryingGeocoder(address -> null, 1, -1));
  }
}
