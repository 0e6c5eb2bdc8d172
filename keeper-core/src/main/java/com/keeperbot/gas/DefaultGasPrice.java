package com.keeperbot.gas;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Leaves the price to the node.
 */
public final class DefaultGasPrice implements GasPrice {

  @Override
  public Optional<BigInteger> getGasPrice(long elapsedSeconds) {
    return Optional.empty();
  }
}
