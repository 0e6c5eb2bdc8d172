package com.keeperbot.reporting;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.keeperbot.orderbook.Order;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Posts our active orders as JSON to an external endpoint, at most once per interval.
 */
@Slf4j
public class HttpOrderHistoryReporter implements OrderHistoryReporter {

    private static final Duration HTTP_TIMEOUT = Duration.ofSeconds(10);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final URI uri;
    private final String pair;
    private final Duration every;
    private final Clock clock;

    private final AtomicReference<Instant> lastReportedAt = new AtomicReference<>();

    public HttpOrderHistoryReporter(HttpClient httpClient, ObjectMapper objectMapper, URI uri, String pair,
                                    Duration every, Clock clock) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.uri = Objects.requireNonNull(uri, "uri");
        this.pair = Objects.requireNonNull(pair, "pair");
        this.every = Objects.requireNonNull(every, "every");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public void report(Instant timestamp, List<Order> ourBuyOrders, List<Order> ourSellOrders) {
        if (!claimSlot()) {
            return;
        }

        String body;
        try {
            body = objectMapper.writeValueAsString(payload(timestamp, ourBuyOrders, ourSellOrders));
        } catch (JsonProcessingException e) {
            log.warn("order history payload serialization failed: {}", e.toString());
            return;
        }

        HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(HTTP_TIMEOUT)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        httpClient.sendAsync(request, HttpResponse.BodyHandlers.discarding())
                .whenComplete((response, error) -> {
                    if (error != null) {
                        log.warn("order history report to {} failed: {}", uri.getHost(), error.toString());
                    } else if (response.statusCode() / 100 != 2) {
                        log.warn("order history report to {} returned HTTP {}", uri.getHost(), response.statusCode());
                    } else {
                        log.debug("reported {} buy and {} sell orders", ourBuyOrders.size(), ourSellOrders.size());
                    }
                });
    }

    private boolean claimSlot() {
        Instant now = clock.instant();
        while (true) {
            Instant last = lastReportedAt.get();
            if (last != null && now.isBefore(last.plus(every))) {
                return false;
            }
            if (lastReportedAt.compareAndSet(last, now)) {
                return true;
            }
        }
    }

    ObjectNode payload(Instant timestamp, List<Order> ourBuyOrders, List<Order> ourSellOrders) {
        ObjectNode root = objectMapper.createObjectNode()
                .put("timestamp", timestamp.getEpochSecond())
                .put("pair", pair);
        writeOrders(root.putArray("buyOrders"), ourBuyOrders);
        writeOrders(root.putArray("sellOrders"), ourSellOrders);
        return root;
    }

    private static void writeOrders(ArrayNode target, List<Order> orders) {
        for (Order order : orders) {
            target.addObject()
                    .put("orderId", order.orderId())
                    .put("price", order.price())
                    .put("amount", order.amount());
        }
    }
}
