package io.meshdispatch.geo;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.meshdispatch.GeocodeException;
import io.meshdispatch.model.Coordinates;
import io.meshdispatch.spi.Geocoder;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

/**
 * {@link Geocoder} backed by an OpenStreetMap Nominatim search endpoint.
 *
 * <p>Issues {@code GET <baseUrl>/search?format=json&limit=1&q=<address>} and takes the first
 * hit. An empty result array is a definitive not-found; HTTP and I/O errors are transient.
 */
public final class NominatimGeocoder implements Geocoder {
  public static final String DEFAULT_BASE_URL = "https://nominatim.openstreetmap.org";

  private final HttpClient httpClient;
  private final ObjectMapper mapper;
  private final String baseUrl;
  private final String userAgent;
  private final Duration timeout;

  public NominatimGeocoder(String baseUrl, String userAgent, Duration timeout) {
    this(HttpClient.newBuilder().connectTimeout(timeout).build(), new ObjectMapper(),
        baseUrl, userAgent, timeout);
  }

  NominatimGeocoder(HttpClient httpClient, ObjectMapper mapper, String baseUrl, String userAgent,
      Duration timeout) {
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    this.mapper = Objects.requireNonNull(mapper, "mapper");
    Objects.requireNonNull(baseUrl, "baseUrl");
    this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    this.userAgent = Objects.requireNonNull(userAgent, "userAgent");
    this.timeout = Objects.requireNonNull(timeout, "timeout");
  }

  @Override
  public Coordinates resolve(String address) {
    URI uri = URI.create(baseUrl + "/search?format=json&limit=1&q="
        + URLEncoder.encode(address, StandardCharsets.UTF_8));
    HttpRequest request = HttpRequest.newBuilder(uri)
        .header("User-Agent", userAgent)
        .header("Accept", "application/json")
        .timeout(timeout)
        .GET()
        .build();
    HttpResponse<String> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      throw new GeocodeException("Geocoder request failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new GeocodeException("Geocoder request interrupted", e);
    }
    if (response.statusCode() != 200) {
      throw new GeocodeException("Geocoder returned HTTP " + response.statusCode(), false);
    }
    return parse(address, response.body());
  }

  Coordinates parse(String address, String body) {
    JsonNode results;
    try {
      results = mapper.readTree(body);
    } catch (IOException e) {
      throw new GeocodeException("Unreadable geocoder response", e);
    }
    if (results == null || !results.isArray()) {
      throw new GeocodeException("Unexpected geocoder response", false);
    }
    if (results.isEmpty()) {
      throw new GeocodeException("No results for '" + address + "'", true);
    }
    JsonNode first = results.get(0);
    try {
      return new Coordinates(Double.parseDouble(first.path("lat").asText()),
          Double.parseDouble(first.path("lon").asText()));
    } catch (IllegalArgumentException e) {
      throw new GeocodeException("Geocoder returned invalid coordinates", e);
    }
  }
}
