/**
 * Database-specific dispatch stores and their registry.
 *
 * @see io.meshdispatch.jdbc.store.JdbcDispatchStores
 */
package io.meshdispatch.jdbc.store;
