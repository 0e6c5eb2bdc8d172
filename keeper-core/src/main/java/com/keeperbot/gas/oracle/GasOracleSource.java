package com.keeperbot.gas.oracle;

import com.keeperbot.config.KeeperProperties;
import com.keeperbot.gas.GasPrice;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * The one oracle source picked from configuration.
 */
public interface GasOracleSource {

  record EthGasStation(String apiKey) implements GasOracleSource {}

  record Etherchain() implements GasOracleSource {}

  record PoaNetwork(String altUrl) implements GasOracleSource {}

  record Node(String rpcUrl) implements GasOracleSource {}

  record Fixed(BigInteger fastPrice) implements GasOracleSource {}

  record None() implements GasOracleSource {}

  /**
   * Resolves the configured source. Configuring more than one is rejected.
   */
  static GasOracleSource select(KeeperProperties.Gas gas) {
    List<GasOracleSource> selected = new ArrayList<>();
    if (!gas.ethGasStationApiKey().isBlank()) {
      selected.add(new EthGasStation(gas.ethGasStationApiKey().trim()));
    }
    if (gas.etherchainGasPrice()) {
      selected.add(new Etherchain());
    }
    if (gas.poanetworkGasPrice()) {
      selected.add(new PoaNetwork(gas.poanetworkUrl().trim()));
    }
    if (gas.fixedGasPrice() != null) {
      BigDecimal wei = gas.fixedGasPrice()
          .multiply(BigDecimal.valueOf(gas.initialMultiplier()))
          .multiply(new BigDecimal(GasPrice.GWEI));
      selected.add(new Fixed(wei.setScale(0, RoundingMode.HALF_UP).toBigIntegerExact()));
    }
    if (gas.nodeGasPrice()) {
      selected.add(new Node(gas.rpcUrl()));
    }

    if (selected.size() > 1) {
      throw new IllegalArgumentException("only one gas oracle source may be configured, got " + selected);
    }
    return selected.isEmpty() ? new None() : selected.get(0);
  }
}
