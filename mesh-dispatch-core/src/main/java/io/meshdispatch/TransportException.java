package io.meshdispatch;

/**
 * A frame could not be handed to the radio link (link down, send buffer full).
 * Reliable messages are re-sent by the retry timer; nothing else is retried.
 */
public class TransportException extends DispatchException {

  public TransportException(String message) {
    super(message);
  }

  public TransportException(String message, Throwable cause) {
    super(message, cause);
  }
}
