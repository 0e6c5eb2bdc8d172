package com.keeperbot.orderbook;

/**
 * Decides where a placement attempt runs.
 */
public interface PlacementExecutionPolicy extends AutoCloseable {

  /**
   * Runs or schedules one placement attempt. The attempt never throws.
   */
  void execute(Runnable attempt);

  /**
   * When {@code true} the attempt itself runs under the manager lock, so attempts never overlap
   * with each other, with cancellations or with registry updates.
   */
  boolean serializesAttempts();

  @Override
  default void close() {
  }

  static PlacementExecutionPolicy serialized() {
    return SerializedPlacement.INSTANCE;
  }

  static PlacementExecutionPolicy workerPool(int maxWorkers) {
    return new WorkerPoolPlacement(maxWorkers);
  }
}
