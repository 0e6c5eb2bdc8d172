package com.keeperbot.web;

import com.keeperbot.config.KeeperProperties;
import com.keeperbot.gas.FixedGasPrice;
import com.keeperbot.orderbook.Order;
import com.keeperbot.orderbook.OrderBookManager;
import com.keeperbot.orderbook.OrderSide;
import com.keeperbot.orderbook.PlacementExecutionPolicy;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class KeeperStatusControllerTest {

    private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");

    @Test
    void reportsOrderBookRegistryAndGasQuote() {
        // Given
        Order buy = new Order("B1", NOW, "ETH/USD", OrderSide.BUY, new BigDecimal("1700"), BigDecimal.ONE);
        Order sell = new Order("S1", NOW, "ETH/USD", OrderSide.SELL, new BigDecimal("1900"), BigDecimal.ONE);
        try (OrderBookManager manager = new OrderBookManager(
                () -> List.of(buy, sell),
                () -> Map.of("ETH", BigDecimal.TEN),
                order -> true,
                PlacementExecutionPolicy.serialized(),
                Clock.fixed(NOW, ZoneId.of("UTC")),
                new SimpleMeterRegistry())) {
            manager.refresh();
            manager.cancelOrders(List.of(sell));
            KeeperProperties properties = new KeeperProperties(null, null, null, null, null, null, null);
            KeeperStatusController controller = new KeeperStatusController(properties, manager,
                    new FixedGasPrice(BigInteger.valueOf(21_000_000_000L)));

            // When
            KeeperStatusController.KeeperStatusResponse status = controller.status().getBody();

            // Then
            assertThat(status).isNotNull();
            assertThat(status.mode()).isEqualTo("PAPER");
            assertThat(status.ready()).isTrue();
            assertThat(status.refreshedAt()).isEqualTo(NOW);
            assertThat(status.buyOrders()).isEqualTo(1);
            assertThat(status.sellOrders()).isZero();
            assertThat(status.ordersCancelled()).isEqualTo(1);
            assertThat(status.balances()).containsKey("ETH");
            assertThat(status.gasPriceWei()).isEqualTo("21000000000");
        }
    }
}
