package com.keeperbot.gas;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.keeperbot.config.KeeperProperties;
import com.keeperbot.gas.oracle.CachingGasOracle;
import com.keeperbot.gas.oracle.EthGasStationOracle;
import com.keeperbot.gas.oracle.EtherchainOracle;
import com.keeperbot.gas.oracle.FixedGasOracle;
import com.keeperbot.gas.oracle.GasOracle;
import com.keeperbot.gas.oracle.GasOracleSource;
import com.keeperbot.gas.oracle.NodeGasOracle;
import com.keeperbot.gas.oracle.PoaNetworkOracle;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;

/**
 * Builds the gas price strategy from configuration: smart, fixed, or left to the node.
 */
@Slf4j
@RequiredArgsConstructor
public class GasPriceFactory {

  private final @NonNull HttpClient httpClient;
  private final @NonNull ObjectMapper objectMapper;
  private final @NonNull Clock clock;

  public GasPrice create(KeeperProperties.Gas gas) {
    if (gas.smartGasPrice()) {
      GasOracleSource source = GasOracleSource.select(gas);
      log.info("using smart gas price with oracle source {}", source);
      return new SmartGasPrice(
          oracle(source, gas),
          GasPrice.gwei(gas.stepGwei()),
          GasPrice.gwei(gas.capGwei()),
          new IncreasingGasPrice(
              GasPrice.gwei(gas.initialGwei()),
              GasPrice.gwei(gas.increaseGwei()),
              gas.everySeconds(),
              GasPrice.gwei(gas.maxGwei())));
    }
    if (gas.gasPrice() != null) {
      log.info("using fixed gas price {} wei", gas.gasPrice());
      return new FixedGasPrice(gas.gasPrice());
    }
    log.info("gas price left to the node");
    return new DefaultGasPrice();
  }

  GasOracle oracle(GasOracleSource source, KeeperProperties.Gas gas) {
    Duration refresh = Duration.ofSeconds(gas.refreshIntervalSeconds());
    Duration expiry = Duration.ofSeconds(gas.expirySeconds());
    CachingGasOracle caching;
    if (source instanceof GasOracleSource.EthGasStation s) {
      caching = new EthGasStationOracle(s.apiKey(), httpClient, objectMapper, refresh, expiry, clock);
    } else if (source instanceof GasOracleSource.Etherchain) {
      caching = new EtherchainOracle(httpClient, objectMapper, refresh, expiry, clock);
    } else if (source instanceof GasOracleSource.PoaNetwork s) {
      caching = new PoaNetworkOracle(s.altUrl(), httpClient, objectMapper, refresh, expiry, clock);
    } else if (source instanceof GasOracleSource.Node s) {
      caching = new NodeGasOracle(s.rpcUrl(), refresh, expiry, clock);
    } else if (source instanceof GasOracleSource.Fixed s) {
      return new FixedGasOracle(s.fastPrice());
    } else {
      return GasOracle.none();
    }
    caching.start();
    return caching;
  }
}
