/**
 * Delivery lifecycle.
 */
package io.meshdispatch.delivery;
