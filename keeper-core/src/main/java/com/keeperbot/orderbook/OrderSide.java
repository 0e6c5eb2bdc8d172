package com.keeperbot.orderbook;

public enum OrderSide {
  BUY,
  SELL;

  public boolean isSell() {
    return this == SELL;
  }
}
