package com.keeperbot.gas.oracle;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Source of a reference "fast" gas price.
 */
public interface GasOracle extends AutoCloseable {

  /**
   * @return the fast price in wei, empty when the source is stale or unreachable
   */
  Optional<BigInteger> fastPrice();

  @Override
  default void close() {
  }

  static GasOracle none() {
    return Optional::empty;
  }
}
