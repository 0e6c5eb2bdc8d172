package com.keeperbot.exchange;

import com.keeperbot.config.KeeperProperties;
import com.keeperbot.orderbook.Order;
import com.keeperbot.orderbook.OrderSide;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * In-memory exchange for local runs. Orders never fill; placing an order reserves its funds and
 * cancelling it releases them.
 */
@Slf4j
public class PaperExchangeApi implements ExchangeApi {

    private final Clock clock;
    private final Map<String, Order> openOrders = new LinkedHashMap<>();
    private final Map<String, BigDecimal> available = new HashMap<>();

    public PaperExchangeApi(KeeperProperties.Paper paper, Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
        available.putAll(paper.balances());
        log.info("paper exchange started with balances {}", available);
    }

    @Override
    public synchronized List<Order> getOrders(String pair) {
        List<Order> orders = new ArrayList<>();
        for (Order order : openOrders.values()) {
            if (order.pair().equalsIgnoreCase(pair)) {
                orders.add(order);
            }
        }
        orders.sort(Comparator.comparing(Order::timestamp));
        return orders;
    }

    @Override
    public synchronized Map<String, BigDecimal> getBalances() {
        return Map.copyOf(available);
    }

    @Override
    public synchronized Optional<String> placeOrder(String pair, OrderSide side, BigDecimal price, BigDecimal amount) {
        Reservation reservation = reservation(pair, side, price, amount);
        BigDecimal balance = available.getOrDefault(reservation.asset(), BigDecimal.ZERO);
        if (balance.compareTo(reservation.amount()) < 0) {
            log.warn("paper order rejected: {} {} needs {} {} but only {} available",
                    side, pair, reservation.amount(), reservation.asset(), balance);
            return Optional.empty();
        }
        available.put(reservation.asset(), balance.subtract(reservation.amount()));

        String orderId = "paper-" + UUID.randomUUID();
        openOrders.put(orderId, new Order(orderId, clock.instant(), pair, side, price, amount));
        log.debug("paper order {} open: {} {} @ {}", orderId, side, amount, price);
        return Optional.of(orderId);
    }

    @Override
    public synchronized boolean cancelOrder(Order order) {
        Order open = order == null ? null : openOrders.remove(order.orderId());
        if (open == null) {
            return false;
        }
        Reservation reservation = reservation(open.pair(), open.side(), open.price(), open.amount());
        available.merge(reservation.asset(), reservation.amount(), BigDecimal::add);
        return true;
    }

    private static Reservation reservation(String pair, OrderSide side, BigDecimal price, BigDecimal amount) {
        String[] tokens = pair.toUpperCase().split("/");
        if (tokens.length != 2) {
            throw new IllegalArgumentException("pair must be in SELL/BUY form, got '" + pair + "'");
        }
        return side.isSell()
                ? new Reservation(tokens[0], amount)
                : new Reservation(tokens[1], amount.multiply(price));
    }

    private record Reservation(String asset, BigDecimal amount) {
    }
}
