package com.keeperbot.engine;

import com.keeperbot.config.KeeperProperties;
import com.keeperbot.exchange.ExchangeApi;
import com.keeperbot.exchange.NewOrder;
import com.keeperbot.orderbook.Order;
import com.keeperbot.orderbook.OrderBookManager;
import com.keeperbot.reporting.OrderHistoryReporter;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Connects the order book manager to the exchange for the configured pair.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class KeeperEngine {

    static final int SHUTDOWN_CANCEL_ROUNDS = 10;

    private final @NonNull KeeperProperties properties;
    private final @NonNull OrderBookManager orderBookManager;
    private final @NonNull ExchangeApi exchange;
    private final @NonNull OrderHistoryReporter historyReporter;
    private final @NonNull Clock clock;

    @PostConstruct
    public void start() {
        orderBookManager.enableHistoryReporting(historyReporter, this::ourBuyOrders, this::ourSellOrders);
        orderBookManager.start(Duration.ofSeconds(properties.refreshFrequencySeconds()));
        log.info("keeper engine started: mode={}, pair={} ({} -> {})",
                properties.mode(), properties.pair(), tokenSell(), tokenBuy());
    }

    @PreDestroy
    public void shutdown() {
        log.info("keeper engine stopping, cancelling all open orders");
        try {
            if (!orderBookManager.cancelAllOrders(SHUTDOWN_CANCEL_ROUNDS)) {
                log.warn("open orders may remain on the exchange after shutdown");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("interrupted while cancelling orders on shutdown");
        }
    }

    /**
     * Places the orders one after another.
     */
    public void placeOrders(List<NewOrder> newOrders) {
        String pair = properties.pair();
        for (NewOrder newOrder : newOrders) {
            orderBookManager.placeOrder(() -> exchange
                    .placeOrder(pair, newOrder.side(), newOrder.price(), newOrder.amount())
                    .map(orderId -> new Order(orderId, clock.instant(), pair, newOrder.side(),
                            newOrder.price(), newOrder.amount()))
                    .orElse(null));
        }
    }

    public void cancelOrders(List<Order> orders) {
        orderBookManager.cancelOrders(orders);
    }

    public List<Order> ourBuyOrders() {
        return orderBookManager.currentOrderBook().buyOrders().stream()
                .filter(o -> properties.pair().equalsIgnoreCase(o.pair()))
                .toList();
    }

    public List<Order> ourSellOrders() {
        return orderBookManager.currentOrderBook().sellOrders().stream()
                .filter(o -> properties.pair().equalsIgnoreCase(o.pair()))
                .toList();
    }

    public String tokenSell() {
        return properties.tokenSell();
    }

    public String tokenBuy() {
        return properties.tokenBuy();
    }
}
