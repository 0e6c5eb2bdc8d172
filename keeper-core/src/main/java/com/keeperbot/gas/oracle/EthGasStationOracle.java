package com.keeperbot.gas.oracle;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.math.BigDecimal;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;

/**
 * ethgasstation.info; prices are reported in tenths of a gwei.
 */
public final class EthGasStationOracle extends HttpGasOracle {

  private static final String URL = "https://ethgasstation.info/api/ethgasAPI.json";

  public EthGasStationOracle(String apiKey, HttpClient httpClient, ObjectMapper objectMapper,
                             Duration refreshInterval, Duration expiry, Clock clock) {
    super("ethgasstation",
        URI.create(URL + "?api-key=" + URLEncoder.encode(apiKey, StandardCharsets.UTF_8)),
        httpClient, objectMapper, refreshInterval, expiry, clock);
  }

  @Override
  protected BigDecimal weiPerUnit() {
    return BigDecimal.valueOf(100_000_000L);
  }
}
