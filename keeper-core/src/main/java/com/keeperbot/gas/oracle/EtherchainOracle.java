package com.keeperbot.gas.oracle;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.math.BigDecimal;
import java.net.URI;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;

public final class EtherchainOracle extends HttpGasOracle {

  private static final URI URL = URI.create("https://www.etherchain.org/api/gasPriceOracle");

  public EtherchainOracle(HttpClient httpClient, ObjectMapper objectMapper,
                          Duration refreshInterval, Duration expiry, Clock clock) {
    super("etherchain", URL, httpClient, objectMapper, refreshInterval, expiry, clock);
  }

  @Override
  protected BigDecimal weiPerUnit() {
    return BigDecimal.valueOf(1_000_000_000L);
  }
}
