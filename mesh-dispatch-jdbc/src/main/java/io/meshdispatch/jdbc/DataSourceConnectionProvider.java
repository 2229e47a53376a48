package io.meshdispatch.jdbc;

import io.meshdispatch.spi.ConnectionProvider;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * {@link ConnectionProvider} for the dispatch tables, backed by a {@link DataSource}.
 *
 * <p>Every dispatch transaction writes, so a connection that reports itself read-only
 * (a replica behind a routing pool, for example) is closed and rejected.
 */
public final class DataSourceConnectionProvider implements ConnectionProvider {
  private final DataSource dataSource;

  public DataSourceConnectionProvider(DataSource dataSource) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
  }

  public DataSource dataSource() {
    return dataSource;
  }

  @Override
  public Connection getConnection() throws SQLException {
    Connection conn = dataSource.getConnection();
    boolean readOnly;
    try {
      readOnly = conn.isReadOnly();
    } catch (SQLException e) {
      conn.close();
      throw e;
    }
    if (readOnly) {
      conn.close();
      throw new SQLException("Dispatch store connection is read-only");
    }
    return conn;
  }
}
