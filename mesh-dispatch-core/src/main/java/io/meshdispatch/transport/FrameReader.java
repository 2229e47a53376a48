package io.meshdispatch.transport;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Splits a byte stream into newline-terminated frames of at most {@code maxFrameBytes}.
 * A longer frame is discarded up to its terminating newline.
 */
final class FrameReader {
  private static final Logger logger = Logger.getLogger(FrameReader.class.getName());

  private final InputStream in;
  private final int maxFrameBytes;
  private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

  FrameReader(InputStream in, int maxFrameBytes) {
    if (maxFrameBytes <= 0) {
      throw new IllegalArgumentException("maxFrameBytes must be > 0, got: " + maxFrameBytes);
    }
    this.in = in;
    this.maxFrameBytes = maxFrameBytes;
  }

  /**
   * Returns the next frame without its newline, or {@code null} at end of stream.
   */
  byte[] next() throws IOException {
    buffer.reset();
    long skipped = 0;
    int b;
    while ((b = in.read()) != -1) {
      if (b == '\n') {
        if (skipped > 0) {
          logger.log(Level.WARNING, "Discarded oversized frame of {0} bytes (limit {1})",
              new Object[]{skipped, maxFrameBytes});
          skipped = 0;
          continue;
        }
        return buffer.toByteArray();
      }
      if (skipped > 0) {
        skipped++;
      } else if (buffer.size() >= maxFrameBytes) {
        skipped = buffer.size() + 1L;
        buffer.reset();
      } else {
        buffer.write(b);
      }
    }
    return skipped == 0 && buffer.size() > 0 ? buffer.toByteArray() : null;
  }
}
