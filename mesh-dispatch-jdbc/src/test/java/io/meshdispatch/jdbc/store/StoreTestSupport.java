package io.meshdispatch.jdbc.store;

import org.h2.jdbcx.JdbcDataSource;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.UUID;

final class StoreTestSupport {
  private StoreTestSupport() {
  }

  /** Opens a connection to a fresh H2 database with the dispatch schema created twice. */
  static Connection openWithSchema(AbstractJdbcDispatchStore store) throws SQLException {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:store_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    Connection conn = ds.getConnection();
    store.createSchema(conn);
    // scripts must be re-runnable
    store.createSchema(conn);
    return conn;
  }
}
