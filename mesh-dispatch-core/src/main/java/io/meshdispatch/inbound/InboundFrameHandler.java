package io.meshdispatch.inbound;

/**
 * Processes frames taken from the {@link InboundQueue}, one at a time and in order.
 */
@FunctionalInterface
public interface InboundFrameHandler {

  void handle(InboundFrame frame);
}
