package io.meshdispatch;

import io.meshdispatch.model.Delivery;

/**
 * Address resolution failed.
 *
 * <p>Raised by {@link io.meshdispatch.spi.Geocoder} implementations and re-raised by
 * {@link DispatchCoordinator#createDelivery(String)}. In the latter case the delivery
 * has already been stored without coordinates and is available via {@link #delivery()}
 * so the caller can offer a manual retry.
 */
public class GeocodeException extends DispatchException {
  private final boolean notFound;
  private final transient Delivery delivery;

  public GeocodeException(String message, boolean notFound) {
    this(message, notFound, null, null);
  }

  public GeocodeException(String message, Throwable cause) {
    this(message, false, cause, null);
  }

  private GeocodeException(String message, boolean notFound, Throwable cause, Delivery delivery) {
    super(message, cause);
    this.notFound = notFound;
    this.delivery = delivery;
  }

  /**
   * Returns a copy of this error bound to the delivery that was created despite it.
   */
  public GeocodeException withDelivery(Delivery created) {
    GeocodeException bound = new GeocodeException(getMessage(), notFound, getCause(), created);
    bound.setStackTrace(getStackTrace());
    return bound;
  }

  /**
   * {@code true} when the geocoder definitively found no match; such failures are not retried.
   */
  public boolean isNotFound() {
    return notFound;
  }

  /**
   * The delivery stored without coordinates, or {@code null} when raised by a geocoder.
   */
  public Delivery delivery() {
    return delivery;
  }
}
