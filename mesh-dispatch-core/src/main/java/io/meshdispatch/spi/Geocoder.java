package io.meshdispatch.spi;

import io.meshdispatch.GeocodeException;
import io.meshdispatch.model.Coordinates;

/**
 * Resolves free-text addresses to coordinates.
 */
@FunctionalInterface
public interface Geocoder {

  /**
   * @param address address text
   * @return the resolved coordinates
   * @throws GeocodeException if the address cannot be resolved; {@link GeocodeException#isNotFound()}
   *     distinguishes a definitive miss from a transient failure
   */
  Coordinates resolve(String address);
}
