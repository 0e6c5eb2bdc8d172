package com.keeperbot.gas;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Gas price for a transaction that has been pending for some time.
 */
public interface GasPrice {

  BigInteger GWEI = BigInteger.valueOf(1_000_000_000L);

  /**
   * @param elapsedSeconds seconds since the transaction was first sent
   * @return price in wei, or empty to let the node choose
   */
  Optional<BigInteger> getGasPrice(long elapsedSeconds);

  static BigInteger gwei(long value) {
    return BigInteger.valueOf(value).multiply(GWEI);
  }
}
