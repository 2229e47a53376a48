package io.meshdispatch.spi;

import io.meshdispatch.model.Coordinates;
import io.meshdispatch.model.Delivery;
import io.meshdispatch.model.DeliveryStatus;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence operations for deliveries.
 *
 * <p>All methods take an explicit {@link Connection}; the caller owns the transaction.
 * Status changes are compare-and-set on the current status: implementations must only
 * update a row whose stored status equals the expected one and report the number of rows
 * changed.
 */
public interface DeliveryStore {

  /**
   * Inserts a {@code pending} delivery.
   *
   * @param conn        the JDBC connection
   * @param address     destination address text
   * @param coordinates resolved destination, or {@code null}
   * @param now         creation time
   * @return the stored delivery with its generated id
   */
  Delivery insert(Connection conn, String address, Coordinates coordinates, Instant now);

  Optional<Delivery> find(Connection conn, long deliveryId);

  /**
   * Reads a delivery and locks its row until the transaction ends.
   */
  Optional<Delivery> findForUpdate(Connection conn, long deliveryId);

  /**
   * Writes every mutable column of {@code updated} if the stored status still equals
   * {@code expected}.
   *
   * @return 1 if the row was updated, 0 if the status had changed or the row is gone
   */
  int compareAndSet(Connection conn, Delivery updated, DeliveryStatus expected);

  /**
   * Sets the resolved destination of a delivery.
   *
   * @return rows updated
   */
  int updateCoordinates(Connection conn, long deliveryId, Coordinates coordinates);

  /**
   * Returns the delivery currently bound to the unit ({@code assigned}, {@code en_route}
   * or {@code arrived_dest}), if any.
   */
  Optional<Delivery> findActiveByUnit(Connection conn, String unitId);

  /**
   * Returns all deliveries, newest first.
   */
  List<Delivery> findAll(Connection conn);
}
