package io.meshdispatch.geo;

import io.meshdispatch.GeocodeException;
import io.meshdispatch.model.Coordinates;
import io.meshdispatch.spi.Geocoder;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Decorates a {@link Geocoder} with bounded exponential-backoff retries.
 *
 * <p>Waits {@code baseDelayMs * 2^(attempt-1)} between attempts. A definitive
 * {@linkplain GeocodeException#isNotFound() not found} is never retried.
 */
public final class RetryingGeocoder implements Geocoder {
  private static final Logger logger = Logger.getLogger(RetryingGeocoder.class.getName());

  private final Geocoder delegate;
  private final int maxAttempts;
  private final long baseDelayMs;
  private final Sleeper sleeper;

  public RetryingGeocoder(Geocoder delegate, int maxAttempts, long baseDelayMs) {
    this(delegate, maxAttempts, baseDelayMs, Thread::sleep);
  }

  public RetryingGeocoder(Geocoder delegate, int maxAttempts, long baseDelayMs, Sleeper sleeper) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    if (baseDelayMs < 0) {
      throw new IllegalArgumentException("baseDelayMs must be >= 0");
    }
    this.maxAttempts = maxAttempts;
    this.baseDelayMs = baseDelayMs;
  }

  @Override
  public Coordinates resolve(String address) {
    if (address == null || address.isBlank()) {
      throw new GeocodeException("Address is empty", true);
    }
    GeocodeException last = null;
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      try {
        return delegate.resolve(address);
      } catch (GeocodeException e) {
        if (e.isNotFound()) {
          throw e;
        }
        last = e;
        logger.log(Level.WARNING, "Geocoding attempt " + attempt + "/" + maxAttempts
            + " failed for '" + address + "': " + e.getMessage());
      }
      if (attempt < maxAttempts) {
        pause(baseDelayMs << (attempt - 1), last);
      }
    }
    throw last;
  }

  private void pause(long delayMs, GeocodeException pending) {
    try {
      sleeper.sleep(delayMs);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      pending.addSuppressed(e);
      throw pending;
    }
  }

  /** Pause between attempts; replaceable in tests. */
  @FunctionalInterface
  public interface Sleeper {
    void sleep(long millis) throws InterruptedException;
  }
}
