package com.keeperbot.orderbook;

import java.util.List;
import java.util.Set;

/**
 * Point-in-time copy of {@link OrderRegistry} bookkeeping. Safe to share between threads.
 */
public record RegistrySnapshot(
    List<Order> ordersPlaced,
    Set<String> orderIdsCancelling,
    Set<String> orderIdsCancelled,
    int currentlyPlacingOrders
) {}
