package io.meshdispatch.jdbc.store;

import java.util.List;

/**
 * H2 store. Primarily for testing and single-node deployments.
 */
public final class H2DispatchStore extends AbstractJdbcDispatchStore {

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }
}
