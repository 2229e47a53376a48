package io.meshdispatch.jdbc.store;

import java.util.List;

/**
 * PostgreSQL store.
 */
public final class PostgresDispatchStore extends AbstractJdbcDispatchStore {

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }
}
