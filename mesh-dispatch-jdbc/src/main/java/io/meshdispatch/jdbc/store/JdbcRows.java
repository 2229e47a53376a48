package io.meshdispatch.jdbc.store;

import io.meshdispatch.jdbc.JdbcTemplate;
import io.meshdispatch.model.Coordinates;
import io.meshdispatch.model.UnitStatus;

import java.sql.ResultSet;
import java.sql.SQLException;

/** Column conversions shared by the JDBC stores. */
final class JdbcRows {
  private JdbcRows() {}

  static Coordinates coordinates(ResultSet rs) throws SQLException {
    Double lat = JdbcTemplate.nullableDouble(rs, "lat");
    Double lon = JdbcTemplate.nullableDouble(rs, "lon");
    return lat == null || lon == null ? null : new Coordinates(lat, lon);
  }

  static Double lat(Coordinates coordinates) {
    return coordinates == null ? null : coordinates.lat();
  }

  static Double lon(Coordinates coordinates) {
    return coordinates == null ? null : coordinates.lon();
  }

  static String wireName(UnitStatus status) {
    return status == null ? null : status.wireName();
  }

  static UnitStatus unitStatus(String wireName) {
    return wireName == null ? null : UnitStatus.fromWireName(wireName);
  }
}
