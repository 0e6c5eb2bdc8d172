package com.keeperbot.orderbook;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * In-memory record of the orders we placed, the cancellations in flight and the last exchange fetch.
 *
 * Not thread-safe: every call must be made while holding the owning {@link OrderBookManager} lock.
 */
@Slf4j
public final class OrderRegistry {

  private final List<Placement> ordersPlaced = new ArrayList<>();
  private final Set<String> orderIdsCancelling = new LinkedHashSet<>();
  private final Set<String> orderIdsCancelled = new LinkedHashSet<>();
  private int currentlyPlacingOrders;
  private long placementSequence;
  private RemoteState remote;

  public void beginPlacement() {
    currentlyPlacingOrders++;
  }

  public void endPlacement() {
    if (currentlyPlacingOrders <= 0) {
      throw new IllegalStateException("endPlacement() without a matching beginPlacement()");
    }
    currentlyPlacingOrders--;
  }

  public void recordPlaced(Order order) {
    Objects.requireNonNull(order, "order");
    placementSequence++;
    ordersPlaced.add(new Placement(order, placementSequence));
  }

  /**
   * Number of orders recorded so far. A fetch started at sequence {@code n} may not contain orders
   * recorded after {@code n}.
   */
  public long placementSequence() {
    return placementSequence;
  }

  /**
   * Marks the order as cancelling.
   *
   * @return {@code false} when the order is already confirmed cancelled and must not be cancelled again
   */
  public boolean beginCancel(String orderId) {
    if (orderIdsCancelled.contains(orderId)) {
      return false;
    }
    if (!orderIdsCancelling.add(orderId)) {
      log.debug("order {} is already being cancelled", orderId);
    }
    return true;
  }

  /**
   * Moves the order from cancelling to cancelled and forgets it as placed.
   * A confirmation for an order that is not cancelling is ignored.
   */
  public boolean confirmCancel(String orderId) {
    if (!orderIdsCancelling.remove(orderId)) {
      log.warn("cancel confirmation for order {} which is not being cancelled, ignoring", orderId);
      return false;
    }
    orderIdsCancelled.add(orderId);
    ordersPlaced.removeIf(p -> p.order().orderId().equals(orderId));
    return true;
  }

  /**
   * Clears the cancelling mark after a failed attempt so that a later cancel can retry.
   */
  public boolean abandonCancel(String orderId) {
    if (!orderIdsCancelling.remove(orderId)) {
      log.info("order {} was not in the cancelling set, nothing to remove", orderId);
      return false;
    }
    return true;
  }

  public boolean isCancelled(String orderId) {
    return orderIdsCancelled.contains(orderId);
  }

  public void applyRefresh(List<Order> orders, Map<String, BigDecimal> balances, long fetchSequence, Instant refreshedAt) {
    long refreshCount = remote == null ? 1 : remote.refreshCount() + 1;
    remote = new RemoteState(List.copyOf(orders), Map.copyOf(balances), fetchSequence, refreshedAt, refreshCount);
  }

  public RegistrySnapshot snapshot() {
    List<Order> placed = new ArrayList<>(ordersPlaced.size());
    for (Placement p : ordersPlaced) {
      placed.add(p.order());
    }
    return new RegistrySnapshot(
        List.copyOf(placed),
        Collections.unmodifiableSet(new LinkedHashSet<>(orderIdsCancelling)),
        Collections.unmodifiableSet(new LinkedHashSet<>(orderIdsCancelled)),
        currentlyPlacingOrders
    );
  }

  /**
   * Our current view of the book: the last fetch, plus orders placed after that fetch started,
   * minus everything cancelling or cancelled.
   */
  public OrderBook orderBook() {
    boolean placing = currentlyPlacingOrders > 0;
    boolean cancelling = !orderIdsCancelling.isEmpty();
    if (remote == null) {
      return OrderBook.notReady(placing, cancelling);
    }

    List<Order> orders = new ArrayList<>(remote.orders());
    for (Placement p : ordersPlaced) {
      if (p.sequence() > remote.fetchSequence() && !orders.contains(p.order())) {
        orders.add(p.order());
      }
    }
    orders.removeIf(o -> orderIdsCancelling.contains(o.orderId()) || orderIdsCancelled.contains(o.orderId()));

    return new OrderBook(orders, remote.balances(), true, placing, cancelling,
        remote.refreshCount(), remote.refreshedAt());
  }

  private record Placement(Order order, long sequence) {}

  private record RemoteState(
      List<Order> orders,
      Map<String, BigDecimal> balances,
      long fetchSequence,
      Instant refreshedAt,
      long refreshCount
  ) {}
}
