package com.keeperbot.orderbook;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class OrderBookManagerConcurrencyTest {

  private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");
  private static final int THREADS = 8;

  private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
  private final ExecutorService callers = Executors.newFixedThreadPool(THREADS);
  private OrderBookManager manager;

  @AfterEach
  void tearDown() {
    callers.shutdownNow();
    if (manager != null) {
      manager.close();
    }
  }

  @Test
  void serializedPlacementAttemptsNeverOverlap() throws Exception {
    // Given
    AtomicInteger inFlight = new AtomicInteger();
    AtomicInteger maxInFlight = new AtomicInteger();
    AtomicInteger ids = new AtomicInteger();
    manager = manager(List::of, order -> true, PlacementExecutionPolicy.serialized());
    manager.refresh();

    // When
    runConcurrently(() -> manager.placeOrder(() -> {
      maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
      Thread.sleep(5);
      inFlight.decrementAndGet();
      return order("O-" + ids.incrementAndGet());
    }));

    // Then
    assertThat(maxInFlight.get()).isEqualTo(1);
    assertThat(manager.registrySnapshot().ordersPlaced()).hasSize(THREADS);
    assertThat(manager.registrySnapshot().currentlyPlacingOrders()).isZero();
    assertThat(manager.getOrderBook().orders()).hasSize(THREADS);
  }

  @Test
  void workerPoolPlacementRecordsEveryOrder() throws Exception {
    AtomicInteger ids = new AtomicInteger();
    manager = manager(List::of, order -> true, PlacementExecutionPolicy.workerPool(3));
    manager.refresh();

    runConcurrently(() -> manager.placeOrder(() -> order("W-" + ids.incrementAndGet())));
    manager.waitForStableOrderBook();

    assertThat(manager.registrySnapshot().ordersPlaced()).hasSize(THREADS);
    assertThat(manager.registrySnapshot().currentlyPlacingOrders()).isZero();
    assertThat(manager.getOrderBook().ordersBeingPlaced()).isFalse();
  }

  @Test
  void concurrentCancelsOfTheSameOrderCancelItOnce() throws Exception {
    // Given
    Order a = order("A");
    AtomicInteger cancelCalls = new AtomicInteger();
    manager = manager(() -> List.of(a), order -> {
      cancelCalls.incrementAndGet();
      Thread.sleep(5);
      return true;
    }, PlacementExecutionPolicy.serialized());
    manager.refresh();

    // When
    runConcurrently(() -> manager.cancelOrders(List.of(a)));

    // Then
    RegistrySnapshot snapshot = manager.registrySnapshot();
    assertThat(cancelCalls.get()).isEqualTo(1);
    assertThat(snapshot.orderIdsCancelling()).isEmpty();
    assertThat(snapshot.orderIdsCancelled()).containsExactly("A");
    assertThat(manager.getOrderBook().ordersBeingCancelled()).isFalse();
  }

  @Test
  void overlappingRefreshIsSkipped() throws Exception {
    // Given: a fetch that blocks until released
    CountDownLatch fetchStarted = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    manager = manager(() -> {
      fetchStarted.countDown();
      release.await(5, TimeUnit.SECONDS);
      return List.of();
    }, order -> true, PlacementExecutionPolicy.serialized());
    Future<Boolean> first = callers.submit(manager::refresh);
    assertThat(fetchStarted.await(5, TimeUnit.SECONDS)).isTrue();

    // When
    boolean second = manager.refresh();
    release.countDown();

    // Then
    assertThat(second).isFalse();
    assertThat(first.get(5, TimeUnit.SECONDS)).isTrue();
    assertThat(manager.currentOrderBook().refreshCount()).isEqualTo(1);
    assertThat(meterRegistry.get("keeper.refresh").tag("outcome", "skipped").counter().count()).isEqualTo(1.0);
  }

  @Test
  void placementDuringSlowRefreshIsNotLost() throws Exception {
    // Given: a fetch that started before the order existed
    CountDownLatch fetchStarted = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    manager = manager(() -> {
      fetchStarted.countDown();
      release.await(5, TimeUnit.SECONDS);
      return List.of();
    }, order -> true, PlacementExecutionPolicy.serialized());
    Future<Boolean> refresh = callers.submit(manager::refresh);
    assertThat(fetchStarted.await(5, TimeUnit.SECONDS)).isTrue();

    // When
    manager.placeOrder(() -> order("late"));
    release.countDown();
    refresh.get(5, TimeUnit.SECONDS);

    // Then
    assertThat(manager.getOrderBook().orders()).extracting(Order::orderId).containsExactly("late");
  }

  private OrderBookManager manager(Callable<List<Order>> fetcher, CancelOrderFunction cancel,
                                   PlacementExecutionPolicy policy) {
    return new OrderBookManager(fetcher, Map::of, cancel, policy, Clock.fixed(NOW, ZoneId.of("UTC")), meterRegistry);
  }

  private void runConcurrently(Runnable action) throws Exception {
    CountDownLatch go = new CountDownLatch(1);
    List<Future<?>> futures = new ArrayList<>();
    for (int i = 0; i < THREADS; i++) {
      futures.add(callers.submit(() -> {
        go.await();
        action.run();
        return null;
      }));
    }
    go.countDown();
    for (Future<?> future : futures) {
      future.get(10, TimeUnit.SECONDS);
    }
  }

  private static Order order(String id) {
    return new Order(id, NOW, "ETH/USD", OrderSide.BUY, new BigDecimal("1800"), BigDecimal.ONE);
  }
}
