package com.keeperbot.reporting;

import com.keeperbot.orderbook.Order;

import java.time.Instant;
import java.util.List;

/**
 * Sink for our active orders, called after every published order book snapshot.
 */
public interface OrderHistoryReporter {

  void report(Instant timestamp, List<Order> ourBuyOrders, List<Order> ourSellOrders);

  static OrderHistoryReporter noop() {
    return (timestamp, ourBuyOrders, ourSellOrders) -> {
    };
  }
}
