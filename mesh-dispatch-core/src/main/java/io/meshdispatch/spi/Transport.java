package io.meshdispatch.spi;

import io.meshdispatch.TransportException;

/**
 * Opaque send/receive channel to the radio network. Implementations carry no business
 * logic and add no retries of their own.
 */
public interface Transport extends AutoCloseable {

  /**
   * Starts receiving. {@code listener} is invoked once per received frame.
   */
  void start(FrameListener listener);

  /**
   * Hands a frame to the link without blocking. Delivery is best-effort.
   *
   * @throws TransportException if the link is down or the send buffer is full
   */
  void send(byte[] frame);

  /**
   * {@code true} while the link is believed to be up.
   */
  boolean isConnected();

  @Override
  void close();
}
