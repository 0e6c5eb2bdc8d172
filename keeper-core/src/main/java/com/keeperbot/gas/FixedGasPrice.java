package com.keeperbot.gas;

import java.math.BigInteger;
import java.util.Objects;
import java.util.Optional;

public final class FixedGasPrice implements GasPrice {

  private final BigInteger price;

  public FixedGasPrice(BigInteger price) {
    this.price = Objects.requireNonNull(price, "price");
    if (price.signum() <= 0) {
      throw new IllegalArgumentException("gas price must be positive, got " + price);
    }
  }

  @Override
  public Optional<BigInteger> getGasPrice(long elapsedSeconds) {
    return Optional.of(price);
  }
}
