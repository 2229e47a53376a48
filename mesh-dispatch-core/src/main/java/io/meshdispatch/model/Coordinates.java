package io.meshdispatch.model;

/**
 * WGS84 latitude/longitude in decimal degrees.
 */
public record Coordinates(double lat, double lon) {

  public Coordinates {
    if (Double.isNaN(lat) || lat < -90.0 || lat > 90.0) {
      throw new IllegalArgumentException("lat out of range: " + lat);
    }
    if (Double.isNaN(lon) || lon < -180.0 || lon > 180.0) {
      throw new IllegalArgumentException("lon out of range: " + lon);
    }
  }
}
