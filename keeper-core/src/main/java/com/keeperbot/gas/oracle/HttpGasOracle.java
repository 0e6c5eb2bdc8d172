package com.keeperbot.gas.oracle;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Oracle reading a JSON document with a numeric {@code fast} field.
 */
public abstract class HttpGasOracle extends CachingGasOracle {

  private static final Duration HTTP_TIMEOUT = Duration.ofSeconds(10);

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final URI uri;

  protected HttpGasOracle(String name, URI uri, HttpClient httpClient, ObjectMapper objectMapper,
                          Duration refreshInterval, Duration expiry, Clock clock) {
    super(name, refreshInterval, expiry, clock);
    this.uri = Objects.requireNonNull(uri, "uri");
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
  }

  /**
   * Wei per unit of the {@code fast} field.
   */
  protected abstract BigDecimal weiPerUnit();

  @Override
  protected BigInteger fetchFastPrice() throws IOException, InterruptedException {
    HttpRequest request = HttpRequest.newBuilder(uri)
        .GET()
        .timeout(HTTP_TIMEOUT)
        .header("Accept", "application/json")
        .build();
    HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    if (response.statusCode() != 200) {
      throw new IOException("HTTP " + response.statusCode() + " from " + uri.getHost());
    }
    return parseFastPrice(objectMapper.readTree(response.body()));
  }

  BigInteger parseFastPrice(JsonNode body) throws IOException {
    JsonNode fast = body == null ? null : body.get("fast");
    if (fast == null || !fast.isNumber()) {
      throw new IOException("missing numeric 'fast' field");
    }
    return fast.decimalValue().multiply(weiPerUnit()).setScale(0, RoundingMode.DOWN).toBigInteger();
  }
}
