/**
 * Acknowledged, retried delivery of outbound commands to units.
 */
package io.meshdispatch.outbound;
