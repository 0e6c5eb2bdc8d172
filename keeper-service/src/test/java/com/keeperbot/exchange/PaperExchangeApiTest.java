package com.keeperbot.exchange;

import com.keeperbot.config.KeeperProperties;
import com.keeperbot.orderbook.Order;
import com.keeperbot.orderbook.OrderSide;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class PaperExchangeApiTest {

    private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");

    private PaperExchangeApi exchange;

    @BeforeEach
    void setUp() {
        KeeperProperties.Paper paper = new KeeperProperties.Paper(
                Map.of("ETH", new BigDecimal("10"), "USD", new BigDecimal("1000")));
        exchange = new PaperExchangeApi(paper, Clock.fixed(NOW, ZoneId.of("UTC")));
    }

    @Test
    void sellOrderReservesSellToken() {
        Optional<String> id = exchange.placeOrder("ETH/USD", OrderSide.SELL, new BigDecimal("1800"), new BigDecimal("4"));

        assertThat(id).isPresent();
        assertThat(exchange.getBalances().get("ETH")).isEqualByComparingTo("6");
        assertThat(exchange.getOrders("ETH/USD")).singleElement()
                .satisfies(order -> {
                    assertThat(order.orderId()).isEqualTo(id.get());
                    assertThat(order.timestamp()).isEqualTo(NOW);
                    assertThat(order.isSell()).isTrue();
                });
    }

    @Test
    void buyOrderReservesPriceTimesAmountOfBuyToken() {
        exchange.placeOrder("ETH/USD", OrderSide.BUY, new BigDecimal("200"), new BigDecimal("2.5"));

        assertThat(exchange.getBalances().get("USD")).isEqualByComparingTo("500");
    }

    @Test
    void orderExceedingBalanceIsNotCreated() {
        Optional<String> id = exchange.placeOrder("ETH/USD", OrderSide.BUY, new BigDecimal("2000"), BigDecimal.ONE);

        assertThat(id).isEmpty();
        assertThat(exchange.getOrders("ETH/USD")).isEmpty();
        assertThat(exchange.getBalances().get("USD")).isEqualByComparingTo("1000");
    }

    @Test
    void cancelReleasesReservedFunds() {
        exchange.placeOrder("ETH/USD", OrderSide.SELL, new BigDecimal("1800"), new BigDecimal("4"));
        Order order = exchange.getOrders("ETH/USD").get(0);

        assertThat(exchange.cancelOrder(order)).isTrue();
        assertThat(exchange.getOrders("ETH/USD")).isEmpty();
        assertThat(exchange.getBalances().get("ETH")).isEqualByComparingTo("10");
    }

    @Test
    void cancellingUnknownOrderReturnsFalse() {
        Order unknown = new Order("nope", NOW, "ETH/USD", OrderSide.BUY, BigDecimal.ONE, BigDecimal.ONE);

        assertThat(exchange.cancelOrder(unknown)).isFalse();
    }

    @Test
    void ordersAreFilteredByPair() {
        exchange.placeOrder("ETH/USD", OrderSide.SELL, BigDecimal.ONE, BigDecimal.ONE);

        assertThat(exchange.getOrders("ETH/DAI")).isEmpty();
        assertThat(exchange.getOrders("eth/usd")).hasSize(1);
    }
}
