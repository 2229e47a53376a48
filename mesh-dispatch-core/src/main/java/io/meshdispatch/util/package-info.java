/**
 * Small shared helpers.
 */
package io.meshdispatch.util;
