package io.meshdispatch.spring.boot;

import io.meshdispatch.DispatchConfig;
import io.meshdispatch.geo.NominatimGeocoder;
import io.meshdispatch.model.Coordinates;
import io.meshdispatch.transport.TcpTransport;
import io.meshdispatch.unit.UnitFailurePolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for mesh dispatch.
 *
 * @see MeshDispatchAutoConfiguration
 */
@ConfigurationProperties(prefix = "meshdispatch")
public class MeshDispatchProperties {

  /**
   * Start the inbound queue, retry loop and offline sweep as soon as the context is up.
   */
  private boolean autoStart = true;

  private final Inbound inbound = new Inbound();
  private final Retry retry = new Retry();
  private final Unit unit = new Unit();
  private final Geocoder geocoder = new Geocoder();
  private final Transport transport = new Transport();
  private final Schema schema = new Schema();
  private final Metrics metrics = new Metrics();

  public boolean isAutoStart() {
    return autoStart;
  }

  public void setAutoStart(boolean autoStart) {
    this.autoStart = autoStart;
  }

  public Inbound getInbound() {
    return inbound;
  }

  public Retry getRetry() {
    return retry;
  }

  public Unit getUnit() {
    return unit;
  }

  public Geocoder getGeocoder() {
    return geocoder;
  }

  public Transport getTransport() {
    return transport;
  }

  public Schema getSchema() {
    return schema;
  }

  public Metrics getMetrics() {
    return metrics;
  }

  /**
   * Maps these properties onto a {@link DispatchConfig}.
   */
  public DispatchConfig toDispatchConfig() {
    DispatchConfig config = new DispatchConfig()
        .setInboundQueueCapacity(inbound.getCapacity())
        .setInboundDrainTimeoutMs(inbound.getDrainTimeoutMs())
        .setAckTimeoutMs(retry.getAckTimeoutMs())
        .setBackoff(retry.getBackoff())
        .setMaxRetryDelayMs(retry.getMaxDelayMs())
        .setMaxAttempts(retry.getMaxAttempts())
        .setRetryTickMs(retry.getTickMs())
        .setRetryBatchSize(retry.getBatchSize())
        .setOfflineTimeoutMs(unit.getOfflineTimeoutMs())
        .setOfflineSweepIntervalMs(unit.getSweepIntervalMs())
        .setArrivalProximityMeters(unit.getArrivalProximityMeters())
        .setUnitFailurePolicy(unit.getFailurePolicy())
        .setGeocoderAttempts(geocoder.getAttempts())
        .setGeocoderBaseDelayMs(geocoder.getBaseDelayMs());
    if (unit.getBaseLat() != null && unit.getBaseLon() != null) {
      config.setBaseCoordinates(new Coordinates(unit.getBaseLat(), unit.getBaseLon()));
    }
    return config;
  }

  public static class Inbound {
    /**
     * Maximum frames buffered between the radio reader and the coordinator.
     */
    private int capacity = 500;

    private long drainTimeoutMs = 5000;

    public int getCapacity() {
      return capacity;
    }

    public void setCapacity(int capacity) {
      this.capacity = capacity;
    }

    public long getDrainTimeoutMs() {
      return drainTimeoutMs;
    }

    public void setDrainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
    }
  }

  public static class Retry {
    /**
     * Wait before the first retransmission of an unacknowledged message.
     */
    private long ackTimeoutMs = 45000;

    private DispatchConfig.Backoff backoff = DispatchConfig.Backoff.FIXED;

    /**
     * Cap on the wait between sends with exponential backoff.
     */
    private long maxDelayMs = 600000;

    /**
     * Total sends of a reliable message before it is declared exhausted.
     */
    private int maxAttempts = 5;

    private long tickMs = 1000;
    private int batchSize = 50;

    public long getAckTimeoutMs() {
      return ackTimeoutMs;
    }

    public void setAckTimeoutMs(long ackTimeoutMs) {
      this.ackTimeoutMs = ackTimeoutMs;
    }

    public DispatchConfig.Backoff getBackoff() {
      return backoff;
    }

    public void setBackoff(DispatchConfig.Backoff backoff) {
      this.backoff = backoff;
    }

    public long getMaxDelayMs() {
      return maxDelayMs;
    }

    public void setMaxDelayMs(long maxDelayMs) {
      this.maxDelayMs = maxDelayMs;
    }

    public int getMaxAttempts() {
      return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
    }

    public long getTickMs() {
      return tickMs;
    }

    public void setTickMs(long tickMs) {
      this.tickMs = tickMs;
    }

    public int getBatchSize() {
      return batchSize;
    }

    public void setBatchSize(int batchSize) {
      this.batchSize = batchSize;
    }
  }

  public static class Unit {
    /**
     * Silence after which a working unit is marked offline.
     */
    private long offlineTimeoutMs = 300000;

    private long sweepIntervalMs = 5000;
    private double arrivalProximityMeters = 50.0;

    /**
     * Depot latitude; returning units become idle when they report arrival near it.
     */
    private Double baseLat;

    private Double baseLon;

    /**
     * Unit status after its delivery fails.
     */
    private UnitFailurePolicy failurePolicy = UnitFailurePolicy.ERROR;

    public long getOfflineTimeoutMs() {
      return offlineTimeoutMs;
    }

    public void setOfflineTimeoutMs(long offlineTimeoutMs) {
      this.offlineTimeoutMs = offlineTimeoutMs;
    }

    public long getSweepIntervalMs() {
      return sweepIntervalMs;
    }

    public void setSweepIntervalMs(long sweepIntervalMs) {
      this.sweepIntervalMs = sweepIntervalMs;
    }

    public double getArrivalProximityMeters() {
      return arrivalProximityMeters;
    }

    public void setArrivalProximityMeters(double arrivalProximityMeters) {
      this.arrivalProximityMeters = arrivalProximityMeters;
    }

    public Double getBaseLat() {
      return baseLat;
    }

    public void setBaseLat(Double baseLat) {
      this.baseLat = baseLat;
    }

    public Double getBaseLon() {
      return baseLon;
    }

    public void setBaseLon(Double baseLon) {
      this.baseLon = baseLon;
    }

    public UnitFailurePolicy getFailurePolicy() {
      return failurePolicy;
    }

    public void setFailurePolicy(UnitFailurePolicy failurePolicy) {
      this.failurePolicy = failurePolicy;
    }
  }

  public static class Geocoder {
    private String baseUrl = NominatimGeocoder.DEFAULT_BASE_URL;

    /**
     * User-Agent sent to the geocoding service, which requires one.
     */
    private String userAgent = "mesh-dispatch";

    private long timeoutMs = 10000;
    private int attempts = 3;
    private long baseDelayMs = 1000;

    public String getBaseUrl() {
      return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
      this.baseUrl = baseUrl;
    }

    public String getUserAgent() {
      return userAgent;
    }

    public void setUserAgent(String userAgent) {
      this.userAgent = userAgent;
    }

    public long getTimeoutMs() {
      return timeoutMs;
    }

    public void setTimeoutMs(long timeoutMs) {
      this.timeoutMs = timeoutMs;
    }

    public int getAttempts() {
      return attempts;
    }

    public void setAttempts(int attempts) {
      this.attempts = attempts;
    }

    public long getBaseDelayMs() {
      return baseDelayMs;
    }

    public void setBaseDelayMs(long baseDelayMs) {
      this.baseDelayMs = baseDelayMs;
    }
  }

  public static class Transport {
    /**
     * Radio gateway host. The TCP transport is only created when this is set.
     */
    private String host;

    private int port = TcpTransport.DEFAULT_PORT;
    private int connectTimeoutMs = 5000;
    private long reconnectBaseDelayMs = 1000;
    private long reconnectMaxDelayMs = 30000;
    private int sendBufferCapacity = 100;

    /**
     * Longest line accepted from the gateway; longer lines are discarded.
     */
    private int maxFrameBytes = TcpTransport.DEFAULT_MAX_FRAME_BYTES;

    public String getHost() {
      return host;
    }

    public void setHost(String host) {
      this.host = host;
    }

    public int getPort() {
      return port;
    }

    public void setPort(int port) {
      this.port = port;
    }

    public int getConnectTimeoutMs() {
      return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(int connectTimeoutMs) {
      this.connectTimeoutMs = connectTimeoutMs;
    }

    public long getReconnectBaseDelayMs() {
      return reconnectBaseDelayMs;
    }

    public void setReconnectBaseDelayMs(long reconnectBaseDelayMs) {
      this.reconnectBaseDelayMs = reconnectBaseDelayMs;
    }

    public long getReconnectMaxDelayMs() {
      return reconnectMaxDelayMs;
    }

    public void setReconnectMaxDelayMs(long reconnectMaxDelayMs) {
      this.reconnectMaxDelayMs = reconnectMaxDelayMs;
    }

    public int getSendBufferCapacity() {
      return sendBufferCapacity;
    }

    public void setSendBufferCapacity(int sendBufferCapacity) {
      this.sendBufferCapacity = sendBufferCapacity;
    }

    public int getMaxFrameBytes() {
      return maxFrameBytes;
    }

    public void setMaxFrameBytes(int maxFrameBytes) {
      this.maxFrameBytes = maxFrameBytes;
    }
  }

  public static class Schema {
    /**
     * Create the dispatch tables on startup if they do not exist.
     */
    private boolean initialize = false;

    public boolean isInitialize() {
      return initialize;
    }

    public void setInitialize(boolean initialize) {
      this.initialize = initialize;
    }
  }

  public static class Metrics {
    private boolean enabled = true;
    private String namePrefix = "meshdispatch";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getNamePrefix() {
      return namePrefix;
    }

    public void setNamePrefix(String namePrefix) {
      this.namePrefix = namePrefix;
    }
  }
}
