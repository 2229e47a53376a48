/**
 * JDBC persistence for the dispatch core.
 *
 * <p>Store implementations live in {@link io.meshdispatch.jdbc.store}; pick one by name
 * or detect it from a {@code DataSource} with {@link io.meshdispatch.jdbc.store.JdbcDispatchStores}.
 */
package io.meshdispatch.jdbc;
