package io.meshdispatch.jdbc;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class DataSourceConnectionProviderTest {

  @Test
  void rejectsNullDataSource() {
    assertThrows(NullPointerException.class, () -> new DataSourceConnectionProvider(null));
  }

  @Test
  void opensConnectionsFromDataSource() throws SQLException {
    JdbcDataSource ds = DispatchFixture.newDataSource();
    DataSourceConnectionProvider provider = new DataSourceConnectionProvider(ds);
    assertSame(ds, provider.dataSource());

    try (Connection conn = provider.getConnection()) {
      assertNotNull(conn);
      assertFalse(conn.isClosed());
    }
  }

  @Test
  void rejectsAndClosesReadOnlyConnection() throws SQLException {
    JdbcDataSource ds = DispatchFixture.newDataSource();
    AtomicReference<Connection> opened = new AtomicReference<>();
    DataSource readOnly = (DataSource) Proxy.newProxyInstance(
        getClass().getClassLoader(), new Class<?>[]{DataSource.class},
        (proxy, method, args) -> {
          if (!method.getName().equals("getConnection")) {
            throw new UnsupportedOperationException(method.getName());
          }
          Connection real = ds.getConnection();
          opened.set(real);
          return Proxy.newProxyInstance(
              getClass().getClassLoader(), new Class<?>[]{Connection.class},
              (p, m, a) -> m.getName().equals("isReadOnly") ? Boolean.TRUE : m.invoke(real, a));
        });
    DataSourceConnectionProvider provider = new DataSourceConnectionProvider(readOnly);

    SQLException ex = assertThrows(SQLException.class, provider::getConnection);
    assertTrue(ex.getMessage().contains("read-only"));
    assertTrue(opened.get().isClosed());
  }
}
