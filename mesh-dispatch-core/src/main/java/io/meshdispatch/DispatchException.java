package io.meshdispatch;

/**
 * Base class of every error raised by the dispatch core.
 *
 * <p>All dispatch errors are unchecked. Guard violations ({@link InvalidTransitionException},
 * {@link DeliveryNotFoundException}, ...) are reported synchronously to the caller and are
 * never retried; transport and parse errors are contained at the radio boundary.
 */
public class DispatchException extends RuntimeException {

  public DispatchException(String message) {
    super(message);
  }

  public DispatchException(String message, Throwable cause) {
    super(message, cause);
  }
}
