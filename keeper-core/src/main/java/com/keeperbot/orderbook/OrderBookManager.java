package com.keeperbot.orderbook;

import com.keeperbot.reporting.OrderHistoryReporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Keeps our view of the exchange order book consistent while orders are placed, cancelled and
 * refreshed from different threads.
 *
 * All registry updates, and all placement and cancellation attempts, run under a single fair lock
 * because the venue session behind them handles one order action at a time. Refresh fetches from
 * the exchange outside the lock and only takes it to apply the result. Every state change is
 * followed by a published {@link OrderBook}.
 */
@Slf4j
public class OrderBookManager implements AutoCloseable {

  private static final Duration READY_POLL_INTERVAL = Duration.ofMillis(500);
  private static final Duration WAIT_POLL_INTERVAL = Duration.ofMillis(100);
  private static final Duration CANCEL_ALL_REFRESH_TIMEOUT = Duration.ofSeconds(30);

  private final Callable<List<Order>> ordersFetcher;
  private final Callable<Map<String, BigDecimal>> balancesFetcher;
  private final CancelOrderFunction cancelFunction;
  private final PlacementExecutionPolicy placementPolicy;
  private final Clock clock;

  private final ReentrantLock lock = new ReentrantLock(true);
  private final OrderRegistry registry = new OrderRegistry();

  private final AtomicReference<OrderBook> current = new AtomicReference<>(OrderBook.notReady(false, false));
  private final CountDownLatch firstRefresh = new CountDownLatch(1);
  private final AtomicBoolean refreshInProgress = new AtomicBoolean(false);
  private final AtomicBoolean started = new AtomicBoolean(false);
  private final List<OrderBookListener> listeners = new CopyOnWriteArrayList<>();
  private volatile HistoryReporting historyReporting;

  private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
    Thread t = new Thread(r, "order-book-refresh");
    t.setDaemon(true);
    return t;
  });

  private final Counter ordersPlaced;
  private final Counter placementsEmpty;
  private final Counter placementsFailed;
  private final Counter ordersCancelled;
  private final Counter cancelsFailed;
  private final Counter cancelsErrored;
  private final Counter cancelsSkipped;
  private final Counter refreshesOk;
  private final Counter refreshesFailed;
  private final Counter refreshesSkipped;

  public OrderBookManager(
      Callable<List<Order>> ordersFetcher,
      Callable<Map<String, BigDecimal>> balancesFetcher,
      CancelOrderFunction cancelFunction,
      PlacementExecutionPolicy placementPolicy,
      Clock clock,
      MeterRegistry meterRegistry
  ) {
    this.ordersFetcher = Objects.requireNonNull(ordersFetcher, "ordersFetcher");
    this.balancesFetcher = Objects.requireNonNull(balancesFetcher, "balancesFetcher");
    this.cancelFunction = Objects.requireNonNull(cancelFunction, "cancelFunction");
    this.placementPolicy = Objects.requireNonNull(placementPolicy, "placementPolicy");
    this.clock = Objects.requireNonNull(clock, "clock");
    Objects.requireNonNull(meterRegistry, "meterRegistry");

    this.ordersPlaced = counter(meterRegistry, "keeper.orders.placed", "placed");
    this.placementsEmpty = counter(meterRegistry, "keeper.orders.placed", "empty");
    this.placementsFailed = counter(meterRegistry, "keeper.orders.placed", "error");
    this.ordersCancelled = counter(meterRegistry, "keeper.orders.cancelled", "cancelled");
    this.cancelsFailed = counter(meterRegistry, "keeper.orders.cancelled", "failed");
    this.cancelsErrored = counter(meterRegistry, "keeper.orders.cancelled", "error");
    this.cancelsSkipped = counter(meterRegistry, "keeper.orders.cancelled", "skipped");
    this.refreshesOk = counter(meterRegistry, "keeper.refresh", "ok");
    this.refreshesFailed = counter(meterRegistry, "keeper.refresh", "failed");
    this.refreshesSkipped = counter(meterRegistry, "keeper.refresh", "skipped");

    Gauge.builder("keeper.orders.placing", registry, r -> placingCount())
        .description("Placement attempts in flight")
        .register(meterRegistry);
  }

  private double placingCount() {
    lock.lock();
    try {
      return registry.snapshot().currentlyPlacingOrders();
    } finally {
      lock.unlock();
    }
  }

  private static Counter counter(MeterRegistry registry, String name, String outcome) {
    return Counter.builder(name).tag("outcome", outcome).register(registry);
  }

  /**
   * Starts refreshing the order book in the background, first run immediately.
   */
  public void start(Duration refreshFrequency) {
    Objects.requireNonNull(refreshFrequency, "refreshFrequency");
    if (refreshFrequency.isZero() || refreshFrequency.isNegative()) {
      throw new IllegalArgumentException("refreshFrequency must be positive, got " + refreshFrequency);
    }
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("order book manager already started");
    }
    scheduler.scheduleAtFixedRate(() -> refresh(), 0, refreshFrequency.toMillis(), TimeUnit.MILLISECONDS);
    log.info("order book manager started (refreshFrequency={}, serializedPlacement={})",
        refreshFrequency, placementPolicy.serializesAttempts());
  }

  public void addListener(OrderBookListener listener) {
    listeners.add(Objects.requireNonNull(listener, "listener"));
  }

  /**
   * Reports our buy and sell orders after every published snapshot once the book is ready.
   */
  public void enableHistoryReporting(OrderHistoryReporter reporter,
                                     Supplier<List<Order>> ourBuyOrders,
                                     Supplier<List<Order>> ourSellOrders) {
    historyReporting = new HistoryReporting(
        Objects.requireNonNull(reporter, "reporter"),
        Objects.requireNonNull(ourBuyOrders, "ourBuyOrders"),
        Objects.requireNonNull(ourSellOrders, "ourSellOrders"));
  }

  /**
   * Fetches orders and balances once and publishes the result.
   *
   * @return {@code false} when another refresh was already running or the fetch failed
   */
  public boolean refresh() {
    if (!refreshInProgress.compareAndSet(false, true)) {
      refreshesSkipped.increment();
      log.debug("order book refresh still in progress, skipping");
      return false;
    }

    try {
      long fetchSequence;
      lock.lock();
      try {
        fetchSequence = registry.placementSequence();
      } finally {
        lock.unlock();
      }

      List<Order> orders = Objects.requireNonNull(ordersFetcher.call(), "fetched orders");
      Map<String, BigDecimal> balances = Objects.requireNonNull(balancesFetcher.call(), "fetched balances");

      lock.lock();
      try {
        registry.applyRefresh(orders, balances, fetchSequence, clock.instant());
      } finally {
        lock.unlock();
      }
      refreshesOk.increment();
      log.debug("order book refreshed: {} orders, {} balances", orders.size(), balances.size());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      refreshesFailed.increment();
      log.warn("order book refresh interrupted, keeping last snapshot");
      return false;
    } catch (Exception e) {
      refreshesFailed.increment();
      log.warn("order book refresh failed, keeping last snapshot: {}", e.toString());
      return false;
    } finally {
      refreshInProgress.set(false);
    }

    publish();
    return true;
  }

  /**
   * Last published order book. Blocks until the first refresh has succeeded.
   */
  public OrderBook getOrderBook() {
    try {
      while (!firstRefresh.await(READY_POLL_INTERVAL.toMillis(), TimeUnit.MILLISECONDS)) {
        log.debug("waiting for the first order book refresh");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("interrupted while waiting for the order book", e);
    }
    return current.get();
  }

  /**
   * Last published order book without waiting; may not be ready yet.
   */
  public OrderBook currentOrderBook() {
    return current.get();
  }

  public RegistrySnapshot registrySnapshot() {
    lock.lock();
    try {
      return registry.snapshot();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Places one order. The function is called exactly once; a {@code null} result means no order
   * was created. Exceptions thrown by the function are logged and never reach the caller.
   *
   * An {@link Error} is not a venue failure and is rethrown, but only after the placing counter
   * has been released and a snapshot published.
   */
  public void placeOrder(Callable<Order> placeOrderFunction) {
    Objects.requireNonNull(placeOrderFunction, "placeOrderFunction");

    lock.lock();
    try {
      registry.beginPlacement();
    } finally {
      lock.unlock();
    }
    publish();

    try {
      placementPolicy.execute(() -> attemptPlacement(placeOrderFunction));
    } catch (RejectedExecutionException e) {
      placementsFailed.increment();
      log.warn("order placement rejected: {}", e.toString());
      lock.lock();
      try {
        registry.endPlacement();
      } finally {
        lock.unlock();
      }
      publish();
    }
  }

  private void attemptPlacement(Callable<Order> placeOrderFunction) {
    try {
      Order order = placementPolicy.serializesAttempts()
          ? placeExclusively(placeOrderFunction)
          : placeConcurrently(placeOrderFunction);
      if (order != null) {
        ordersPlaced.increment();
        log.info("placed order {} ({} {} @ {})", order.orderId(), order.side(), order.amount(), order.price());
      } else {
        placementsEmpty.increment();
        log.info("placement attempt produced no order");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      placementsFailed.increment();
      log.warn("order placement interrupted");
    } catch (Exception e) {
      placementsFailed.increment();
      log.error("order placement failed", e);
    } finally {
      lock.lock();
      try {
        registry.endPlacement();
      } finally {
        lock.unlock();
      }
      publish();
    }
  }

  private Order placeExclusively(Callable<Order> placeOrderFunction) throws Exception {
    lock.lock();
    try {
      Order order = placeOrderFunction.call();
      if (order != null) {
        registry.recordPlaced(order);
      }
      return order;
    } finally {
      lock.unlock();
    }
  }

  private Order placeConcurrently(Callable<Order> placeOrderFunction) throws Exception {
    Order order = placeOrderFunction.call();
    if (order != null) {
      lock.lock();
      try {
        registry.recordPlaced(order);
      } finally {
        lock.unlock();
      }
    }
    return order;
  }

  /**
   * Cancels the orders one after another. Orders already confirmed cancelled are skipped.
   * Publishes at least once, even for an empty list.
   */
  public void cancelOrders(List<Order> orders) {
    Objects.requireNonNull(orders, "orders");

    lock.lock();
    try {
      for (Order order : orders) {
        registry.beginCancel(order.orderId());
      }
    } finally {
      lock.unlock();
    }
    publish();

    for (Order order : orders) {
      cancelOne(order);
    }
  }

  private void cancelOne(Order order) {
    String orderId = order.orderId();
    lock.lock();
    try {
      if (!registry.beginCancel(orderId)) {
        cancelsSkipped.increment();
        log.debug("order {} already cancelled, skipping", orderId);
      } else if (cancelFunction.cancel(order)) {
        registry.confirmCancel(orderId);
        ordersCancelled.increment();
        log.info("cancelled order {}", orderId);
      } else {
        registry.abandonCancel(orderId);
        cancelsFailed.increment();
        log.warn("failed to cancel order {}", orderId);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      registry.abandonCancel(orderId);
      cancelsErrored.increment();
      log.warn("cancel of order {} interrupted", orderId);
    } catch (Exception e) {
      registry.abandonCancel(orderId);
      cancelsErrored.increment();
      log.warn("failed to cancel order {}: {}", orderId, e.toString());
    } finally {
      lock.unlock();
    }
    publish();
  }

  public void waitForOrderCancellation() throws InterruptedException {
    while (current.get().ordersBeingCancelled()) {
      Thread.sleep(WAIT_POLL_INTERVAL.toMillis());
    }
  }

  /**
   * Waits until no placement and no cancellation is in flight.
   */
  public void waitForStableOrderBook() throws InterruptedException {
    while (true) {
      OrderBook book = current.get();
      if (!book.ordersBeingPlaced() && !book.ordersBeingCancelled()) {
        return;
      }
      Thread.sleep(WAIT_POLL_INTERVAL.toMillis());
    }
  }

  /**
   * Waits for a refresh that started after this call, running one directly when none is in flight.
   *
   * @return {@code false} on timeout
   */
  public boolean waitForOrderBookRefresh(Duration timeout) throws InterruptedException {
    long before = current.get().refreshCount();
    if (refresh()) {
      return true;
    }
    long deadline = System.nanoTime() + timeout.toNanos();
    while (current.get().refreshCount() <= before) {
      if (System.nanoTime() - deadline >= 0) {
        return false;
      }
      Thread.sleep(WAIT_POLL_INTERVAL.toMillis());
      if (refresh()) {
        return true;
      }
    }
    return true;
  }

  /**
   * Cancels every open order, re-reading the exchange between rounds, until the book is empty.
   *
   * @return {@code true} when no open order is left
   */
  public boolean cancelAllOrders(int maxRounds) throws InterruptedException {
    if (!current.get().ready()) {
      log.warn("order book never refreshed, cannot tell which orders to cancel");
      return false;
    }
    for (int round = 1; round <= maxRounds; round++) {
      waitForStableOrderBook();
      List<Order> orders = getOrderBook().orders();
      if (orders.isEmpty()) {
        log.info("no open orders left");
        return true;
      }
      log.info("cancelling {} open orders (round {}/{})", orders.size(), round, maxRounds);
      cancelOrders(orders);
      waitForOrderCancellation();
      if (!waitForOrderBookRefresh(CANCEL_ALL_REFRESH_TIMEOUT)) {
        log.warn("order book did not refresh within {} after cancelling", CANCEL_ALL_REFRESH_TIMEOUT);
      }
    }
    List<Order> left = getOrderBook().orders();
    if (!left.isEmpty()) {
      log.warn("{} orders still open after {} cancel rounds", left.size(), maxRounds);
    }
    return left.isEmpty();
  }

  private void publish() {
    OrderBook book;
    lock.lock();
    try {
      book = registry.orderBook();
      current.set(book);
    } finally {
      lock.unlock();
    }
    if (book.ready()) {
      firstRefresh.countDown();
    }

    for (OrderBookListener listener : listeners) {
      try {
        listener.onOrderBookPublished(book);
      } catch (Exception e) {
        log.warn("order book listener failed: {}", e.toString());
      }
    }
    reportHistory(book);
  }

  private void reportHistory(OrderBook book) {
    HistoryReporting reporting = historyReporting;
    if (reporting == null || !book.ready()) {
      return;
    }
    try {
      reporting.reporter().report(clock.instant(), reporting.ourBuyOrders().get(), reporting.ourSellOrders().get());
    } catch (Exception e) {
      log.warn("order history reporting failed: {}", e.toString());
    }
  }

  @Override
  public void close() {
    scheduler.shutdownNow();
    placementPolicy.close();
    log.info("order book manager stopped");
  }

  private record HistoryReporting(
      OrderHistoryReporter reporter,
      Supplier<List<Order>> ourBuyOrders,
      Supplier<List<Order>> ourSellOrders
  ) {}
}
