/**
 * Extension points: durable stores, radio transport, geocoding and metrics.
 */
package io.meshdispatch.spi;
