package io.meshdispatch.envelope;

import io.meshdispatch.MalformedFrameException;

import java.nio.charset.StandardCharsets;

/**
 * Converts envelopes to and from their compact JSON wire form.
 *
 * <p>Implementations must be thread-safe: the inbound consumer decodes while dispatcher
 * threads and the retry scheduler encode.
 */
public interface EnvelopeCodec {

  /**
   * Encodes an envelope as a single-line JSON object. Absent fields are omitted.
   */
  String encode(Envelope envelope);

  /**
   * Decodes a JSON object.
   *
   * @throws MalformedFrameException if the text is not a JSON object, lacks a known
   *     {@code type}, or a field has the wrong shape
   */
  Envelope decode(String json);

  default Envelope decode(byte[] frame) {
    return decode(new String(frame, StandardCharsets.UTF_8));
  }
}
