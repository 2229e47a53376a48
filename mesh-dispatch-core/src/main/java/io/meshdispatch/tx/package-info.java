/**
 * Transaction handling over a {@link io.meshdispatch.spi.ConnectionProvider}.
 */
package io.meshdispatch.tx;
