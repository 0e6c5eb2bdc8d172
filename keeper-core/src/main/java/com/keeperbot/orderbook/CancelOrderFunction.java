package com.keeperbot.orderbook;

/**
 * Venue call cancelling one order.
 */
@FunctionalInterface
public interface CancelOrderFunction {

  /**
   * @return {@code true} when the exchange confirmed the cancellation
   */
  boolean cancel(Order order) throws Exception;
}
