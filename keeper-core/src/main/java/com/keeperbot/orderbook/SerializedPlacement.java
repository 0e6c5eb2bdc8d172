package com.keeperbot.orderbook;

/**
 * Runs each attempt on the calling thread, under the manager lock.
 */
enum SerializedPlacement implements PlacementExecutionPolicy {
  INSTANCE;

  @Override
  public void execute(Runnable attempt) {
    attempt.run();
  }

  @Override
  public boolean serializesAttempts() {
    return true;
  }
}
