package com.keeperbot.gas.oracle;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.Callable;

import static com.keeperbot.gas.GasPrice.gwei;
import static org.assertj.core.api.Assertions.assertThat;

class CachingGasOracleTest {

  private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");

  private final MutableClock clock = new MutableClock(NOW);

  @Test
  void servesNothingBeforeTheFirstSample() {
    TestOracle oracle = new TestOracle(() -> gwei(40));

    assertThat(oracle.fastPrice()).isEmpty();
  }

  @Test
  void servesLastSampleUntilItExpires() {
    TestOracle oracle = new TestOracle(() -> gwei(40));
    oracle.refresh();

    clock.advance(Duration.ofSeconds(600));
    assertThat(oracle.fastPrice()).contains(gwei(40));

    clock.advance(Duration.ofSeconds(1));
    assertThat(oracle.fastPrice()).isEmpty();
  }

  @Test
  void failedRefreshKeepsThePreviousSample() {
    TestOracle oracle = new TestOracle(() -> gwei(40));
    oracle.refresh();
    oracle.fetch = () -> {
      throw new IOException("HTTP 503");
    };

    clock.advance(Duration.ofSeconds(60));
    oracle.refresh();

    assertThat(oracle.fastPrice()).contains(gwei(40));
  }

  @Test
  void interruptedRefreshKeepsTheInterruptFlag() {
    TestOracle oracle = new TestOracle(() -> {
      throw new InterruptedException("shutting down");
    });

    oracle.refresh();

    assertThat(Thread.interrupted()).isTrue();
    assertThat(oracle.fastPrice()).isEmpty();
  }

  @Test
  void nonPositiveSampleIsIgnored() {
    TestOracle oracle = new TestOracle(() -> BigInteger.ZERO);
    oracle.refresh();

    assertThat(oracle.fastPrice()).isEmpty();
  }

  private final class TestOracle extends CachingGasOracle {
    private Callable<BigInteger> fetch;

    TestOracle(Callable<BigInteger> fetch) {
      super("test", Duration.ofSeconds(60), Duration.ofSeconds(600), clock);
      this.fetch = fetch;
    }

    @Override
    protected BigInteger fetchFastPrice() throws Exception {
      return fetch.call();
    }
  }

  private static final class MutableClock extends Clock {
    private Instant now;

    MutableClock(Instant now) {
      this.now = now;
    }

    void advance(Duration duration) {
      now = now.plus(duration);
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return now;
    }
  }
}
