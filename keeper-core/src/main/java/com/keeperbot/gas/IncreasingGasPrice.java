package com.keeperbot.gas;

import java.math.BigInteger;
import java.util.Objects;
import java.util.Optional;

/**
 * {@code min(initial + floor(elapsed / everySeconds) * increase, maxPrice)}.
 */
public final class IncreasingGasPrice implements GasPrice {

  private final BigInteger initialPrice;
  private final BigInteger increaseBy;
  private final long everySeconds;
  private final BigInteger maxPrice;

  public IncreasingGasPrice(BigInteger initialPrice, BigInteger increaseBy, long everySeconds, BigInteger maxPrice) {
    this.initialPrice = Objects.requireNonNull(initialPrice, "initialPrice");
    this.increaseBy = Objects.requireNonNull(increaseBy, "increaseBy");
    this.maxPrice = Objects.requireNonNull(maxPrice, "maxPrice");
    if (everySeconds <= 0) {
      throw new IllegalArgumentException("everySeconds must be positive, got " + everySeconds);
    }
    this.everySeconds = everySeconds;
  }

  @Override
  public Optional<BigInteger> getGasPrice(long elapsedSeconds) {
    return Optional.of(price(elapsedSeconds));
  }

  public BigInteger price(long elapsedSeconds) {
    long steps = Math.max(0L, elapsedSeconds) / everySeconds;
    BigInteger price = initialPrice.add(increaseBy.multiply(BigInteger.valueOf(steps)));
    return price.min(maxPrice);
  }
}
