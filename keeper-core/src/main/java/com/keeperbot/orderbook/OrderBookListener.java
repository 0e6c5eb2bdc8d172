package com.keeperbot.orderbook;

@FunctionalInterface
public interface OrderBookListener {

  void onOrderBookPublished(OrderBook orderBook);
}
