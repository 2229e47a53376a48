package io.meshdispatch.spi;

/**
 * Receives raw frames from a {@link Transport}, once per frame and in arrival order.
 *
 * <p>Invoked on the transport's reader thread; implementations must not block.
 */
@FunctionalInterface
public interface FrameListener {

  void onFrame(byte[] frame);
}
