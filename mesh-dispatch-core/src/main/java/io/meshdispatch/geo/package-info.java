/**
 * Distance math and address geocoding.
 */
package io.meshdispatch.geo;
