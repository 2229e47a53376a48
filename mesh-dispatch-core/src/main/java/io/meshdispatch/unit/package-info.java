/**
 * Unit lifecycle: radio-driven transitions, staleness sweep and reconnection.
 */
package io.meshdispatch.unit;
