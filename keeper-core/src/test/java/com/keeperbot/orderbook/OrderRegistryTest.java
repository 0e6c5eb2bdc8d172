package com.keeperbot.orderbook;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OrderRegistryTest {

  private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");

  private final OrderRegistry registry = new OrderRegistry();

  @Test
  void orderBookIsNotReadyBeforeFirstRefresh() {
    registry.beginPlacement();

    OrderBook book = registry.orderBook();

    assertThat(book.ready()).isFalse();
    assertThat(book.ordersBeingPlaced()).isTrue();
    assertThat(book.orders()).isEmpty();
  }

  @Test
  void endPlacementWithoutBeginIsRejected() {
    assertThatThrownBy(registry::endPlacement).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void ordersPlacedAfterFetchStartedAreMergedIntoTheView() {
    Order a = order("A");
    Order b = order("B");
    registry.recordPlaced(a);
    long fetchSequence = registry.placementSequence();
    registry.recordPlaced(b);

    // the fetch saw A but started before B was recorded
    registry.applyRefresh(List.of(a), Map.of("ETH", BigDecimal.ONE), fetchSequence, NOW);

    assertThat(registry.orderBook().orders()).containsExactly(a, b);
    assertThat(registry.orderBook().refreshCount()).isEqualTo(1);
  }

  @Test
  void orderMissingFromLaterFetchIsNotResurrected() {
    Order a = order("A");
    registry.recordPlaced(a);

    // filled on the exchange, so the fetch no longer reports it
    registry.applyRefresh(List.of(), Map.of(), registry.placementSequence(), NOW);

    assertThat(registry.orderBook().orders()).isEmpty();
    assertThat(registry.snapshot().ordersPlaced()).containsExactly(a);
  }

  @Test
  void cancellingAndCancelledOrdersAreHidden() {
    Order a = order("A");
    Order b = order("B");
    registry.applyRefresh(List.of(a, b), Map.of(), 0, NOW);

    registry.beginCancel("A");
    assertThat(registry.orderBook().orders()).containsExactly(b);
    assertThat(registry.orderBook().ordersBeingCancelled()).isTrue();

    registry.confirmCancel("A");
    assertThat(registry.orderBook().orders()).containsExactly(b);
    assertThat(registry.orderBook().ordersBeingCancelled()).isFalse();
    assertThat(registry.isCancelled("A")).isTrue();
  }

  @Test
  void confirmedCancelRemovesPlacedOrderAndBlocksFurtherCancels() {
    Order a = order("A");
    registry.recordPlaced(a);
    registry.beginCancel("A");

    assertThat(registry.confirmCancel("A")).isTrue();

    RegistrySnapshot snapshot = registry.snapshot();
    assertThat(snapshot.ordersPlaced()).isEmpty();
    assertThat(snapshot.orderIdsCancelling()).isEmpty();
    assertThat(snapshot.orderIdsCancelled()).containsExactly("A");
    assertThat(registry.beginCancel("A")).isFalse();
  }

  @Test
  void abandonedCancelCanBeRetried() {
    registry.beginCancel("A");

    assertThat(registry.abandonCancel("A")).isTrue();
    assertThat(registry.snapshot().orderIdsCancelling()).isEmpty();
    assertThat(registry.beginCancel("A")).isTrue();
  }

  @Test
  void outcomesForUnknownIdsAreIgnored() {
    assertThat(registry.confirmCancel("missing")).isFalse();
    assertThat(registry.abandonCancel("missing")).isFalse();
    assertThat(registry.snapshot().orderIdsCancelled()).isEmpty();
  }

  private static Order order(String id) {
    return new Order(id, NOW, "ETH/USD", OrderSide.BUY, new BigDecimal("100"), BigDecimal.ONE);
  }
}
