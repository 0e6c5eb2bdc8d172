package com.keeperbot.gas.oracle;

import java.math.BigInteger;
import java.util.Objects;
import java.util.Optional;

/**
 * Manually configured fast price.
 */
public final class FixedGasOracle implements GasOracle {

  private final BigInteger fastPrice;

  public FixedGasOracle(BigInteger fastPrice) {
    this.fastPrice = Objects.requireNonNull(fastPrice, "fastPrice");
  }

  @Override
  public Optional<BigInteger> fastPrice() {
    return Optional.of(fastPrice);
  }
}
