package com.keeperbot.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.keeperbot.exchange.ExchangeApi;
import com.keeperbot.exchange.PaperExchangeApi;
import com.keeperbot.gas.GasPrice;
import com.keeperbot.gas.GasPriceFactory;
import com.keeperbot.orderbook.OrderBookManager;
import com.keeperbot.orderbook.PlacementExecutionPolicy;
import com.keeperbot.reporting.HttpOrderHistoryReporter;
import com.keeperbot.reporting.OrderHistoryReporter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;

@Slf4j
@Configuration
public class KeeperConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public HttpClient httpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public ExchangeApi exchangeApi(KeeperProperties properties, Clock clock) {
        if (properties.mode() == KeeperProperties.TradingMode.PAPER) {
            return new PaperExchangeApi(properties.paper(), clock);
        }
        throw new IllegalStateException("keeper.mode=LIVE requires an ExchangeApi bean for the target venue");
    }

    @Bean
    public OrderBookManager orderBookManager(
            KeeperProperties properties,
            ExchangeApi exchange,
            Clock clock,
            MeterRegistry meterRegistry
    ) {
        String pair = properties.pair();
        return new OrderBookManager(
                () -> exchange.getOrders(pair),
                exchange::getBalances,
                exchange::cancelOrder,
                placementPolicy(properties.placement()),
                clock,
                meterRegistry
        );
    }

    @Bean
    public OrderHistoryReporter orderHistoryReporter(
            KeeperProperties properties,
            HttpClient httpClient,
            ObjectMapper objectMapper,
            Clock clock
    ) {
        KeeperProperties.OrderHistory history = properties.orderHistory();
        if (!history.enabled()) {
            return OrderHistoryReporter.noop();
        }
        log.info("reporting order history to {} every {}s", history.url(), history.everySeconds());
        return new HttpOrderHistoryReporter(
                httpClient,
                objectMapper,
                URI.create(history.url()),
                properties.pair(),
                Duration.ofSeconds(history.everySeconds()),
                clock
        );
    }

    @Bean
    public GasPrice gasPrice(KeeperProperties properties, HttpClient httpClient, ObjectMapper objectMapper, Clock clock) {
        return new GasPriceFactory(httpClient, objectMapper, clock).create(properties.gas());
    }

    static PlacementExecutionPolicy placementPolicy(KeeperProperties.Placement placement) {
        if (placement.mode() == KeeperProperties.PlacementMode.WORKER_POOL) {
            return PlacementExecutionPolicy.workerPool(placement.maxWorkers());
        }
        return PlacementExecutionPolicy.serialized();
    }
}
