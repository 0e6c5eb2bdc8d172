package com.keeperbot.gas.oracle;

import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Polls a remote source in the background and serves the last sample until it expires.
 */
@Slf4j
public abstract class CachingGasOracle implements GasOracle {

  private final String name;
  private final Duration refreshInterval;
  private final Duration expiry;
  private final Clock clock;

  private final AtomicReference<Sample> last = new AtomicReference<>();
  private final AtomicBoolean started = new AtomicBoolean(false);
  private final ScheduledExecutorService scheduler;

  protected CachingGasOracle(String name, Duration refreshInterval, Duration expiry, Clock clock) {
    this.name = Objects.requireNonNull(name, "name");
    this.refreshInterval = Objects.requireNonNull(refreshInterval, "refreshInterval");
    this.expiry = Objects.requireNonNull(expiry, "expiry");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
      Thread t = new Thread(r, "gas-oracle-" + name);
      t.setDaemon(true);
      return t;
    });
  }

  /**
   * Fetches the current fast price in wei.
   */
  protected abstract BigInteger fetchFastPrice() throws Exception;

  public void start() {
    if (!started.compareAndSet(false, true)) {
      return;
    }
    scheduler.scheduleAtFixedRate(this::refresh, 0, refreshInterval.toMillis(), TimeUnit.MILLISECONDS);
    log.info("gas oracle {} started (refreshInterval={}, expiry={})", name, refreshInterval, expiry);
  }

  public void refresh() {
    try {
      BigInteger price = fetchFastPrice();
      if (price == null || price.signum() <= 0) {
        log.warn("gas oracle {} returned no usable fast price: {}", name, price);
        return;
      }
      last.set(new Sample(price, clock.instant()));
      log.debug("gas oracle {} fast price {} wei", name, price);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("gas oracle {} refresh interrupted", name);
    } catch (Exception e) {
      log.warn("gas oracle {} refresh failed: {}", name, e.toString());
    }
  }

  @Override
  public Optional<BigInteger> fastPrice() {
    Sample sample = last.get();
    if (sample == null) {
      return Optional.empty();
    }
    Duration age = Duration.between(sample.fetchedAt(), clock.instant());
    if (age.compareTo(expiry) > 0) {
      return Optional.empty();
    }
    return Optional.of(sample.price());
  }

  @Override
  public void close() {
    scheduler.shutdownNow();
  }

  private record Sample(BigInteger price, Instant fetchedAt) {}
}
