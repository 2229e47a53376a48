package io.meshdispatch.jdbc.store;

import io.meshdispatch.DispatchStoreException;
import io.meshdispatch.spi.DeliveryStore;
import io.meshdispatch.spi.PendingAckStore;
import io.meshdispatch.spi.UnitStore;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * Base JDBC store for one database flavor. Hands out the {@link DeliveryStore},
 * {@link UnitStore} and {@link PendingAckStore} over the {@code delivery},
 * {@code delivery_unit} and {@code pending_ack} tables, written in SQL portable across
 * H2, PostgreSQL and MySQL.
 *
 * <p>Subclasses name themselves and the JDBC URLs they handle, and may override
 * {@link #forUpdateClause()} and {@link #schemaResource()}. Register custom implementations via
 * {@code META-INF/services/io.meshdispatch.jdbc.store.AbstractJdbcDispatchStore}.
 *
 * @see JdbcDispatchStores
 */
public abstract class AbstractJdbcDispatchStore {
  private final JdbcDeliveryStore deliveryStore = new JdbcDeliveryStore(this);
  private final JdbcUnitStore unitStore = new JdbcUnitStore(this);
  private final JdbcPendingAckStore pendingAckStore = new JdbcPendingAckStore();

  /**
   * Unique identifier for this store (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this store handles (e.g., "jdbc:mysql:", "jdbc:mariadb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  public DeliveryStore deliveryStore() {
    return deliveryStore;
  }

  public UnitStore unitStore() {
    return unitStore;
  }

  public PendingAckStore pendingAckStore() {
    return pendingAckStore;
  }

  /**
   * Classpath location of the DDL script creating this store's tables.
   */
  public String schemaResource() {
    return "io/meshdispatch/jdbc/schema-" + name() + ".sql";
  }

  /**
   * Suffix for single-row reads that lock the row until the transaction ends.
   */
  protected String forUpdateClause() {
    return " FOR UPDATE";
  }

  /**
   * Executes the statements of {@link #schemaResource()} on {@code conn}. Statements are
   * separated by {@code ;} and must be re-runnable.
   */
  public void createSchema(Connection conn) {
    String script = readSchema();
    try (Statement statement = conn.createStatement()) {
      for (String sql : script.split(";")) {
        String trimmed = stripComments(sql);
        if (!trimmed.isEmpty()) {
          statement.execute(trimmed);
        }
      }
    } catch (SQLException e) {
      throw new DispatchStoreException("Failed to create schema from " + schemaResource(), e);
    }
  }

  private String readSchema() {
    ClassLoader loader = AbstractJdbcDispatchStore.class.getClassLoader();
    try (InputStream in = loader.getResourceAsStream(schemaResource())) {
      if (in == null) {
        throw new IllegalStateException("Schema resource not found: " + schemaResource());
      }
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new DispatchStoreException("Failed to read " + schemaResource(), e);
    }
  }

  private static String stripComments(String sql) {
    StringBuilder sb = new StringBuilder();
    for (String line : sql.split("\n")) {
      if (!line.trim().startsWith("--")) {
        sb.append(line).append('\n');
      }
    }
    return sb.toString().trim();
  }
}
