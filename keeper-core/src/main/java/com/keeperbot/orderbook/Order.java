package com.keeperbot.orderbook;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * A resting order on the exchange. Two orders are the same order when their exchange ids match.
 */
public record Order(
    String orderId,
    Instant timestamp,
    String pair,
    OrderSide side,
    BigDecimal price,
    BigDecimal amount
) {

  public Order {
    Objects.requireNonNull(orderId, "orderId");
    Objects.requireNonNull(side, "side");
  }

  public boolean isSell() {
    return side.isSell();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof Order other && orderId.equals(other.orderId);
  }

  @Override
  public int hashCode() {
    return orderId.hashCode();
  }
}
