/**
 * Micrometer metrics integration.
 */
package io.meshdispatch.micrometer;
