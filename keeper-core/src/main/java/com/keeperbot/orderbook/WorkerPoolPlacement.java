package com.keeperbot.orderbook;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs attempts on a bounded pool so that several placements can be in flight at once.
 * Only valid for venues whose transport tolerates concurrent requests.
 */
@Slf4j
final class WorkerPoolPlacement implements PlacementExecutionPolicy {

  private final AtomicInteger threadIndex = new AtomicInteger();
  private final ExecutorService pool;

  WorkerPoolPlacement(int maxWorkers) {
    if (maxWorkers < 1) {
      throw new IllegalArgumentException("maxWorkers must be >= 1, got " + maxWorkers);
    }
    this.pool = Executors.newFixedThreadPool(maxWorkers, r -> {
      Thread t = new Thread(r, "order-placement-" + threadIndex.incrementAndGet());
      t.setDaemon(true);
      return t;
    });
  }

  @Override
  public void execute(Runnable attempt) {
    pool.execute(attempt);
  }

  @Override
  public boolean serializesAttempts() {
    return false;
  }

  @Override
  public void close() {
    pool.shutdown();
    try {
      if (!pool.awaitTermination(10, TimeUnit.SECONDS)) {
        log.warn("placement workers still busy after 10s, interrupting");
        pool.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      pool.shutdownNow();
    }
  }
}
