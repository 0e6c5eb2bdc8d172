package com.keeperbot.exchange;

import com.keeperbot.orderbook.Order;
import com.keeperbot.orderbook.OrderSide;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Venue the keeper trades on.
 */
public interface ExchangeApi {

    /**
     * Our open orders on the pair.
     */
    List<Order> getOrders(String pair) throws Exception;

    /**
     * Available balances keyed by upper case asset symbol.
     */
    Map<String, BigDecimal> getBalances() throws Exception;

    /**
     * @return the new order id, empty when the venue did not create an order
     */
    Optional<String> placeOrder(String pair, OrderSide side, BigDecimal price, BigDecimal amount) throws Exception;

    /**
     * @return {@code true} when the order is no longer open on the venue
     */
    boolean cancelOrder(Order order) throws Exception;
}
