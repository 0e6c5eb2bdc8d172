package com.keeperbot.gas;

import com.keeperbot.gas.oracle.GasOracle;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.Objects;
import java.util.Optional;

/**
 * Starts from the oracle's fast price plus 10%, adds {@code step} every 60 seconds and stops at
 * fast plus 10% plus {@code cap}. Without a fresh oracle sample it falls back to a purely time
 * based increasing price.
 */
@Slf4j
public final class SmartGasPrice implements GasPrice, AutoCloseable {

  private static final long STEP_SECONDS = 60L;
  private static final BigInteger FAST_MULTIPLIER_NUMERATOR = BigInteger.valueOf(11);
  private static final BigInteger FAST_MULTIPLIER_DENOMINATOR = BigInteger.TEN;

  private final GasOracle oracle;
  private final BigInteger step;
  private final BigInteger cap;
  private final IncreasingGasPrice fallback;

  public SmartGasPrice(GasOracle oracle, BigInteger step, BigInteger cap, IncreasingGasPrice fallback) {
    this.oracle = Objects.requireNonNull(oracle, "oracle");
    this.step = Objects.requireNonNull(step, "step");
    this.cap = Objects.requireNonNull(cap, "cap");
    this.fallback = Objects.requireNonNull(fallback, "fallback");
  }

  @Override
  public Optional<BigInteger> getGasPrice(long elapsedSeconds) {
    return Optional.of(price(elapsedSeconds, sample()));
  }

  /**
   * @param fastPrice oracle fast price in wei, {@code null} when no fresh sample is available
   */
  public BigInteger price(long elapsedSeconds, BigInteger fastPrice) {
    if (fastPrice == null) {
      return fallback.price(elapsedSeconds);
    }
    BigInteger base = fastPrice.multiply(FAST_MULTIPLIER_NUMERATOR).divide(FAST_MULTIPLIER_DENOMINATOR);
    long steps = Math.max(0L, elapsedSeconds) / STEP_SECONDS;
    BigInteger escalated = base.add(step.multiply(BigInteger.valueOf(steps)));
    return escalated.min(base.add(cap));
  }

  private BigInteger sample() {
    try {
      return oracle.fastPrice().orElse(null);
    } catch (RuntimeException e) {
      log.debug("gas oracle sample failed, using fallback pricing: {}", e.toString());
      return null;
    }
  }

  @Override
  public void close() {
    oracle.close();
  }
}
