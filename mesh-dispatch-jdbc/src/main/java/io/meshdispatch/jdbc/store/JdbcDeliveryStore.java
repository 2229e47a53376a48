package io.meshdispatch.jdbc.store;

import io.meshdispatch.jdbc.JdbcTemplate;
import io.meshdispatch.model.Coordinates;
import io.meshdispatch.model.Delivery;
import io.meshdispatch.model.DeliveryStatus;
import io.meshdispatch.spi.DeliveryStore;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link DeliveryStore} over the {@code delivery} table.
 */
public final class JdbcDeliveryStore implements DeliveryStore {
  private static final int MAX_REASON_LENGTH = 255;

  private static final String COLUMNS = "id, address, lat, lon, status, assigned_unit_id, "
      + "created_at, status_changed_at, assigned_at, en_route_at, arrived_at, completed_at, failure_reason";

  private static final String ACTIVE_STATUS_IN = "('" + DeliveryStatus.ASSIGNED.wireName() + "','"
      + DeliveryStatus.EN_ROUTE.wireName() + "','" + DeliveryStatus.ARRIVED_DEST.wireName() + "')";

  static final JdbcTemplate.RowMapper<Delivery> ROW_MAPPER = rs -> new Delivery(
      rs.getLong("id"),
      rs.getString("address"),
      JdbcRows.coordinates(rs),
      DeliveryStatus.fromWireName(rs.getString("status")),
      rs.getString("assigned_unit_id"),
      JdbcTemplate.instant(rs, "created_at"),
      JdbcTemplate.instant(rs, "status_changed_at"),
      JdbcTemplate.instant(rs, "assigned_at"),
      JdbcTemplate.instant(rs, "en_route_at"),
      JdbcTemplate.instant(rs, "arrived_at"),
      JdbcTemplate.instant(rs, "completed_at"),
      rs.getString("failure_reason"));

  private final AbstractJdbcDispatchStore dialect;

  JdbcDeliveryStore(AbstractJdbcDispatchStore dialect) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
  }

  @Override
  public Delivery insert(Connection conn, String address, Coordinates coordinates, Instant now) {
    String sql = "INSERT INTO delivery (address, lat, lon, status, assigned_unit_id, created_at, "
        + "status_changed_at) VALUES (?,?,?,?,NULL,?,?)";
    long id = JdbcTemplate.insertReturningKey(conn, sql,
        address, JdbcRows.lat(coordinates), JdbcRows.lon(coordinates),
        DeliveryStatus.PENDING.wireName(), now, now);
    return new Delivery(id, address, coordinates, DeliveryStatus.PENDING, null, now, now,
        null, null, null, null, null);
  }

  @Override
  public Optional<Delivery> find(Connection conn, long deliveryId) {
    return JdbcTemplate.queryOne(conn, "SELECT " + COLUMNS + " FROM delivery WHERE id=?",
        ROW_MAPPER, deliveryId);
  }

  @Override
  public Optional<Delivery> findForUpdate(Connection conn, long deliveryId) {
    String sql = "SELECT " + COLUMNS + " FROM delivery WHERE id=?" + dialect.forUpdateClause();
    return JdbcTemplate.queryOne(conn, sql, ROW_MAPPER, deliveryId);
  }

  @Override
  public int compareAndSet(Connection conn, Delivery updated, DeliveryStatus expected) {
    String sql = "UPDATE delivery SET lat=?, lon=?, status=?, assigned_unit_id=?, status_changed_at=?, "
        + "assigned_at=?, en_route_at=?, arrived_at=?, completed_at=?, failure_reason=? "
        + "WHERE id=? AND status=?";
    return JdbcTemplate.update(conn, sql,
        JdbcRows.lat(updated.coordinates()), JdbcRows.lon(updated.coordinates()),
        updated.status().wireName(), updated.assignedUnitId(), updated.statusChangedAt(),
        updated.assignedAt(), updated.enRouteAt(), updated.arrivedAt(), updated.completedAt(),
        truncateReason(updated.failureReason()),
        updated.id(), expected.wireName());
  }

  @Override
  public int updateCoordinates(Connection conn, long deliveryId, Coordinates coordinates) {
    return JdbcTemplate.update(conn, "UPDATE delivery SET lat=?, lon=? WHERE id=?",
        JdbcRows.lat(coordinates), JdbcRows.lon(coordinates), deliveryId);
  }

  @Override
  public Optional<Delivery> findActiveByUnit(Connection conn, String unitId) {
    String sql = "SELECT " + COLUMNS + " FROM delivery WHERE assigned_unit_id=?"
        + " AND status IN " + ACTIVE_STATUS_IN + " ORDER BY id DESC LIMIT 1";
    return JdbcTemplate.queryOne(conn, sql, ROW_MAPPER, unitId);
  }

  @Override
  public List<Delivery> findAll(Connection conn) {
    return JdbcTemplate.query(conn, "SELECT " + COLUMNS + " FROM delivery ORDER BY id DESC", ROW_MAPPER);
  }

  private static String truncateReason(String reason) {
    if (reason == null || reason.length() <= MAX_REASON_LENGTH) {
      return reason;
    }
    return reason.substring(0, MAX_REASON_LENGTH);
  }
}
