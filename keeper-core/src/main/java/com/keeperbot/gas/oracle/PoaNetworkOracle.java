package com.keeperbot.gas.oracle;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.math.BigDecimal;
import java.net.URI;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;

public final class PoaNetworkOracle extends HttpGasOracle {

  private static final String DEFAULT_URL = "https://gasprice.poa.network/";

  public PoaNetworkOracle(String altUrl, HttpClient httpClient, ObjectMapper objectMapper,
                          Duration refreshInterval, Duration expiry, Clock clock) {
    super("poanetwork",
        URI.create(altUrl == null || altUrl.isBlank() ? DEFAULT_URL : altUrl),
        httpClient, objectMapper, refreshInterval, expiry, clock);
  }

  @Override
  protected BigDecimal weiPerUnit() {
    return BigDecimal.valueOf(1_000_000_000L);
  }
}
