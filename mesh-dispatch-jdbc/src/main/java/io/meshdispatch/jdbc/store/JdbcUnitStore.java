package io.meshdispatch.jdbc.store;

import io.meshdispatch.jdbc.JdbcTemplate;
import io.meshdispatch.model.DeliveryUnit;
import io.meshdispatch.model.UnitStatus;
import io.meshdispatch.spi.UnitStore;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link UnitStore} over the {@code delivery_unit} table.
 */
public final class JdbcUnitStore implements UnitStore {
  private static final String COLUMNS = "id, status, assigned_delivery_id, lat, lon, "
      + "last_fix_at, last_contact_at, status_before_offline, status_changed_at";

  static final JdbcTemplate.RowMapper<DeliveryUnit> ROW_MAPPER = rs -> new DeliveryUnit(
      rs.getString("id"),
      UnitStatus.fromWireName(rs.getString("status")),
      JdbcTemplate.nullableLong(rs, "assigned_delivery_id"),
      JdbcRows.coordinates(rs),
      JdbcTemplate.instant(rs, "last_fix_at"),
      JdbcTemplate.instant(rs, "last_contact_at"),
      JdbcRows.unitStatus(rs.getString("status_before_offline")),
      JdbcTemplate.instant(rs, "status_changed_at"));

  private final AbstractJdbcDispatchStore dialect;

  JdbcUnitStore(AbstractJdbcDispatchStore dialect) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
  }

  @Override
  public void insert(Connection conn, DeliveryUnit unit) {
    String sql = "INSERT INTO delivery_unit (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?)";
    JdbcTemplate.update(conn, sql,
        unit.id(), unit.status().wireName(), unit.assignedDeliveryId(),
        JdbcRows.lat(unit.location()), JdbcRows.lon(unit.location()),
        unit.lastFixAt(), unit.lastContactAt(), JdbcRows.wireName(unit.statusBeforeOffline()),
        unit.statusChangedAt());
  }

  @Override
  public Optional<DeliveryUnit> find(Connection conn, String unitId) {
    return JdbcTemplate.queryOne(conn, "SELECT " + COLUMNS + " FROM delivery_unit WHERE id=?",
        ROW_MAPPER, unitId);
  }

  @Override
  public Optional<DeliveryUnit> findForUpdate(Connection conn, String unitId) {
    String sql = "SELECT " + COLUMNS + " FROM delivery_unit WHERE id=?" + dialect.forUpdateClause();
    return JdbcTemplate.queryOne(conn, sql, ROW_MAPPER, unitId);
  }

  @Override
  public int compareAndSet(Connection conn, DeliveryUnit updated, UnitStatus expected) {
    String sql = "UPDATE delivery_unit SET status=?, assigned_delivery_id=?, lat=?, lon=?, "
        + "last_fix_at=?, last_contact_at=?, status_before_offline=?, status_changed_at=? "
        + "WHERE id=? AND status=?";
    return JdbcTemplate.update(conn, sql,
        updated.status().wireName(), updated.assignedDeliveryId(),
        JdbcRows.lat(updated.location()), JdbcRows.lon(updated.location()),
        updated.lastFixAt(), updated.lastContactAt(), JdbcRows.wireName(updated.statusBeforeOffline()),
        updated.statusChangedAt(),
        updated.id(), expected.wireName());
  }

  @Override
  public List<DeliveryUnit> findStale(Connection conn, Instant cutoff) {
    String sql = "SELECT " + COLUMNS + " FROM delivery_unit WHERE status NOT IN ('"
        + UnitStatus.OFFLINE.wireName() + "','" + UnitStatus.IDLE.wireName() + "')"
        + " AND last_contact_at IS NOT NULL AND last_contact_at < ? ORDER BY id";
    return JdbcTemplate.query(conn, sql, ROW_MAPPER, cutoff);
  }

  @Override
  public List<DeliveryUnit> findAll(Connection conn) {
    return JdbcTemplate.query(conn, "SELECT " + COLUMNS + " FROM delivery_unit ORDER BY id", ROW_MAPPER);
  }
}
