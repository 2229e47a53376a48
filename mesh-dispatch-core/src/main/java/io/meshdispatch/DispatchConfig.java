package io.meshdispatch;

import io.meshdispatch.model.Coordinates;
import io.meshdispatch.outbound.ExponentialBackoffRetryPolicy;
import io.meshdispatch.outbound.FixedIntervalRetryPolicy;
import io.meshdispatch.outbound.RetryPolicy;
import io.meshdispatch.unit.UnitFailurePolicy;

/**
 * Tunables of a {@link MeshDispatch} instance. Defaults suit a small fleet on a
 * LoRa-class mesh: long acknowledgment timeouts and a generous offline threshold.
 */
public final class DispatchConfig {

  /** How the wait between reliable sends grows. */
  public enum Backoff {
    FIXED,
    EXPONENTIAL
  }

  private int inboundQueueCapacity = 500;
  private long inboundDrainTimeoutMs = 5000L;

  private long ackTimeoutMs = 45_000L;
  private Backoff backoff = Backoff.FIXED;
  private long maxRetryDelayMs = 600_000L;
  private int maxAttempts = 5;
  private long retryTickMs = 1000L;
  private int retryBatchSize = 50;

  private long offlineTimeoutMs = 300_000L;
  private long offlineSweepIntervalMs = 5000L;
  private double arrivalProximityMeters = 50.0;
  private Coordinates baseCoordinates;
  private UnitFailurePolicy unitFailurePolicy = UnitFailurePolicy.ERROR;

  private int geocoderAttempts = 3;
  private long geocoderBaseDelayMs = 1000L;

  public int getInboundQueueCapacity() {
    return inboundQueueCapacity;
  }

  public DispatchConfig setInboundQueueCapacity(int inboundQueueCapacity) {
    this.inboundQueueCapacity = inboundQueueCapacity;
    return this;
  }

  public long getInboundDrainTimeoutMs() {
    return inboundDrainTimeoutMs;
  }

  public DispatchConfig setInboundDrainTimeoutMs(long inboundDrainTimeoutMs) {
    this.inboundDrainTimeoutMs = inboundDrainTimeoutMs;
    return this;
  }

  public long getAckTimeoutMs() {
    return ackTimeoutMs;
  }

  public DispatchConfig setAckTimeoutMs(long ackTimeoutMs) {
    this.ackTimeoutMs = ackTimeoutMs;
    return this;
  }

  public Backoff getBackoff() {
    return backoff;
  }

  public DispatchConfig setBackoff(Backoff backoff) {
    this.backoff = backoff;
    return this;
  }

  public long getMaxRetryDelayMs() {
    return maxRetryDelayMs;
  }

  public DispatchConfig setMaxRetryDelayMs(long maxRetryDelayMs) {
    this.maxRetryDelayMs = maxRetryDelayMs;
    return this;
  }

  public int getMaxAttempts() {
    return maxAttempts;
  }

  public DispatchConfig setMaxAttempts(int maxAttempts) {
    this.maxAttempts = maxAttempts;
    return this;
  }

  public long getRetryTickMs() {
    return retryTickMs;
  }

  public DispatchConfig setRetryTickMs(long retryTickMs) {
    this.retryTickMs = retryTickMs;
    return this;
  }

  public int getRetryBatchSize() {
    return retryBatchSize;
  }

  public DispatchConfig setRetryBatchSize(int retryBatchSize) {
    this.retryBatchSize = retryBatchSize;
    return this;
  }

  public long getOfflineTimeoutMs() {
    return offlineTimeoutMs;
  }

  public DispatchConfig setOfflineTimeoutMs(long offlineTimeoutMs) {
    this.offlineTimeoutMs = offlineTimeoutMs;
    return this;
  }

  public long getOfflineSweepIntervalMs() {
    return offlineSweepIntervalMs;
  }

  public DispatchConfig setOfflineSweepIntervalMs(long offlineSweepIntervalMs) {
    this.offlineSweepIntervalMs = offlineSweepIntervalMs;
    return this;
  }

  public double getArrivalProximityMeters() {
    return arrivalProximityMeters;
  }

  public DispatchConfig setArrivalProximityMeters(double arrivalProximityMeters) {
    this.arrivalProximityMeters = arrivalProximityMeters;
    return this;
  }

  public Coordinates getBaseCoordinates() {
    return baseCoordinates;
  }

  public DispatchConfig setBaseCoordinates(Coordinates baseCoordinates) {
    this.baseCoordinates = baseCoordinates;
    return this;
  }

  public UnitFailurePolicy getUnitFailurePolicy() {
    return unitFailurePolicy;
  }

  public DispatchConfig setUnitFailurePolicy(UnitFailurePolicy unitFailurePolicy) {
    this.unitFailurePolicy = unitFailurePolicy;
    return this;
  }

  public int getGeocoderAttempts() {
    return geocoderAttempts;
  }

  public DispatchConfig setGeocoderAttempts(int geocoderAttempts) {
    this.geocoderAttempts = geocoderAttempts;
    return this;
  }

  public long getGeocoderBaseDelayMs() {
    return geocoderBaseDelayMs;
  }

  public DispatchConfig setGeocoderBaseDelayMs(long geocoderBaseDelayMs) {
    this.geocoderBaseDelayMs = geocoderBaseDelayMs;
    return this;
  }

  /**
   * Builds the retry policy described by {@link #getBackoff()}, {@link #getAckTimeoutMs()}
   * and {@link #getMaxRetryDelayMs()}.
   */
  public RetryPolicy retryPolicy() {
    return switch (backoff) {
      case FIXED -> new FixedIntervalRetryPolicy(ackTimeoutMs);
      case EXPONENTIAL -> new ExponentialBackoffRetryPolicy(ackTimeoutMs, Math.max(ackTimeoutMs, maxRetryDelayMs));
    };
  }
}
