/**
 * Decoupling buffer between the radio reader and the single frame consumer.
 */
package io.meshdispatch.inbound;
