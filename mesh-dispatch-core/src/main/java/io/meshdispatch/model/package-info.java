/**
 * Domain snapshots: deliveries, units and pending acknowledgments, plus their status enums.
 */
package io.meshdispatch.model;
