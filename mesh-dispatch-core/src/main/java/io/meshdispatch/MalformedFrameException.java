package io.meshdispatch;

/**
 * An inbound frame could not be decoded into an envelope. The frame is dropped.
 */
public class MalformedFrameException extends DispatchException {

  public MalformedFrameException(String message) {
    super(message);
  }

  public MalformedFrameException(String message, Throwable cause) {
    super(message, cause);
  }
}
