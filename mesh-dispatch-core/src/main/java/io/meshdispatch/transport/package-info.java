/**
 * Radio link implementations.
 */
package io.meshdispatch.transport;
