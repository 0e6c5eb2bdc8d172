package com.keeperbot.web;

import com.keeperbot.config.KeeperProperties;
import com.keeperbot.gas.GasPrice;
import com.keeperbot.orderbook.OrderBook;
import com.keeperbot.orderbook.OrderBookManager;
import com.keeperbot.orderbook.RegistrySnapshot;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

@RestController
@RequestMapping("/api/keeper")
@RequiredArgsConstructor
public class KeeperStatusController {

    private final @NonNull KeeperProperties properties;
    private final @NonNull OrderBookManager orderBookManager;
    private final @NonNull GasPrice gasPrice;

    @GetMapping("/status")
    public ResponseEntity<KeeperStatusResponse> status() {
        OrderBook book = orderBookManager.currentOrderBook();
        RegistrySnapshot registry = orderBookManager.registrySnapshot();
        return ResponseEntity.ok(new KeeperStatusResponse(
                properties.mode().name(),
                properties.pair(),
                book.ready(),
                book.refreshCount(),
                book.refreshedAt(),
                book.buyOrders().size(),
                book.sellOrders().size(),
                book.ordersBeingPlaced(),
                book.ordersBeingCancelled(),
                book.balances(),
                registry.ordersPlaced().size(),
                registry.orderIdsCancelling().size(),
                registry.orderIdsCancelled().size(),
                registry.currentlyPlacingOrders(),
                gasPrice.getGasPrice(0).map(Object::toString).orElse(null)
        ));
    }

    public record KeeperStatusResponse(
            String mode,
            String pair,
            boolean ready,
            long refreshCount,
            Instant refreshedAt,
            int buyOrders,
            int sellOrders,
            boolean ordersBeingPlaced,
            boolean ordersBeingCancelled,
            Map<String, BigDecimal> balances,
            int ordersPlaced,
            int ordersCancelling,
            int ordersCancelled,
            int currentlyPlacingOrders,
            String gasPriceWei
    ) {
    }
}
