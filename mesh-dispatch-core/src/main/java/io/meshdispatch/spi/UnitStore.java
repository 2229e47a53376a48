package io.meshdispatch.spi;

import io.meshdispatch.model.DeliveryUnit;
import io.meshdispatch.model.UnitStatus;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence operations for delivery units. Same conventions as {@link DeliveryStore}.
 */
public interface UnitStore {

  void insert(Connection conn, DeliveryUnit unit);

  Optional<DeliveryUnit> find(Connection conn, String unitId);

  Optional<DeliveryUnit> findForUpdate(Connection conn, String unitId);

  /**
   * Writes every mutable column of {@code updated} if the stored status still equals
   * {@code expected}.
   *
   * @return 1 if the row was updated, 0 otherwise
   */
  int compareAndSet(Connection conn, DeliveryUnit updated, UnitStatus expected);

  /**
   * Returns units that are neither {@code offline} nor {@code idle} and whose last
   * contact is strictly before {@code cutoff}. Units never heard from are not returned.
   */
  List<DeliveryUnit> findStale(Connection conn, Instant cutoff);

  /**
   * Returns all units ordered by id.
   */
  List<DeliveryUnit> findAll(Connection conn);
}
