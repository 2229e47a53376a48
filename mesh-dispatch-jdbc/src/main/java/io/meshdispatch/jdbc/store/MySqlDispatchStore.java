package io.meshdispatch.jdbc.store;

import java.util.List;

/**
 * MySQL store. Also handles MariaDB and TiDB URLs.
 */
public final class MySqlDispatchStore extends AbstractJdbcDispatchStore {

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:mariadb:", "jdbc:tidb:");
  }
}
