package io.meshdispatch.geo;

import io.meshdispatch.model.Coordinates;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GeoMathTest {

  @Test
  void samePointIsZero() {
    Coordinates p = new Coordinates(52.52, 13.405);
    assertEquals(0.0, GeoMath.distanceMeters(p, p), 1e-9);
  }

  @Test
  void oneDegreeOfLatitude() {
    double d = GeoMath.distanceMeters(new Coordinates(0, 0), new Coordinates(1, 0));
    assertEquals(111_195, d, 5);
  }

  @Test
  void knownCityPair() {
    Coordinates berlin = new Coordinates(52.5200, 13.4050);
    Coordinates paris = new Coordinates(48.8566, 2.3522);
    assertEquals(878_000, GeoMath.distanceMeters(berlin, paris), 3_000);
    assertEquals(GeoMath.distanceMeters(berlin, paris), GeoMath.distanceMeters(paris, berlin), 1e-6);
  }

  @Test
  void withinThreshold() {
    Coordinates a = new Coordinates(10.0, 10.0);
    Coordinates b = new Coordinates(10.0003, 10.0);
    assertTrue(GeoMath.within(a, b, 50));
    assertFalse(GeoMath.within(a, b, 20));
    assertFalse(GeoMath.within(a, null, 50));
  }
}
