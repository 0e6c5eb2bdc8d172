package com.keeperbot.exchange;

import com.keeperbot.orderbook.OrderSide;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Order the keeper wants to place. {@code amount} is in the sell token of the pair, {@code price}
 * in buy token per sell token.
 */
public record NewOrder(OrderSide side, BigDecimal price, BigDecimal amount) {

    public NewOrder {
        Objects.requireNonNull(side, "side");
        Objects.requireNonNull(price, "price");
        Objects.requireNonNull(amount, "amount");
        if (price.signum() <= 0 || amount.signum() <= 0) {
            throw new IllegalArgumentException("price and amount must be positive: " + price + " / " + amount);
        }
    }
}
