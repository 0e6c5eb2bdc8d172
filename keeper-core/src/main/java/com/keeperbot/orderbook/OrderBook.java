package com.keeperbot.orderbook;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Immutable view of our orders and balances as published by {@link OrderBookManager}.
 *
 * {@code orders} already contains orders placed since the last exchange fetch and excludes
 * orders being cancelled or confirmed cancelled.
 */
public record OrderBook(
    List<Order> orders,
    Map<String, BigDecimal> balances,
    boolean ready,
    boolean ordersBeingPlaced,
    boolean ordersBeingCancelled,
    long refreshCount,
    Instant refreshedAt
) {

  public OrderBook {
    orders = orders == null ? List.of() : List.copyOf(orders);
    balances = balances == null ? Map.of() : Map.copyOf(balances);
  }

  public static OrderBook notReady(boolean ordersBeingPlaced, boolean ordersBeingCancelled) {
    return new OrderBook(List.of(), Map.of(), false, ordersBeingPlaced, ordersBeingCancelled, 0L, null);
  }

  public List<Order> buyOrders() {
    return orders.stream().filter(o -> !o.isSell()).toList();
  }

  public List<Order> sellOrders() {
    return orders.stream().filter(Order::isSell).toList();
  }

  public BigDecimal balance(String asset) {
    return balances.getOrDefault(asset, BigDecimal.ZERO);
  }
}
