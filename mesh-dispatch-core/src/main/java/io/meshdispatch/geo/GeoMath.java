package io.meshdispatch.geo;

import io.meshdispatch.model.Coordinates;

/**
 * Great-circle distance helpers.
 */
public final class GeoMath {
  /** Mean Earth radius in metres. */
  public static final double EARTH_RADIUS_M = 6_371_000.0;

  private GeoMath() {
  }

  /**
   * Haversine distance between two points in metres.
   */
  public static double distanceMeters(Coordinates from, Coordinates to) {
    double lat1 = Math.toRadians(from.lat());
    double lat2 = Math.toRadians(to.lat());
    double dLat = lat2 - lat1;
    double dLon = Math.toRadians(to.lon() - from.lon());
    double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
        + Math.cos(lat1) * Math.cos(lat2) * Math.sin(dLon / 2) * Math.sin(dLon / 2);
    double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
    return EARTH_RADIUS_M * c;
  }

  /**
   * {@code true} if both points are known and no further apart than {@code thresholdMeters}.
   */
  public static boolean within(Coordinates a, Coordinates b, double thresholdMeters) {
    return a != null && b != null && distanceMeters(a, b) <= thresholdMeters;
  }
}
