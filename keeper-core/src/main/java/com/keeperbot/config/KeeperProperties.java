package com.keeperbot.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

@Validated
@ConfigurationProperties(prefix="keeper")
public record KeeperProperties(
    TradingMode mode,
    /**
     * Token pair in {@code SELL/BUY} form, e.g. {@code ETH/USD}.
     */
    String pair,
    /**
     * Order book refresh frequency.
     */
    @NotNull @Min(1) Integer refreshFrequencySeconds,
    @Valid Placement placement,
    @Valid OrderHistory orderHistory,
    @Valid Gas gas,
    @Valid Paper paper
) {

  public KeeperProperties {
    if (mode == null) {
      mode = TradingMode.PAPER;
    }
    if (pair == null || pair.isBlank()) {
      pair = "ETH/USD";
    }
    pair = pair.trim();
    if (!pair.contains("/")) {
      throw new IllegalArgumentException("keeper.pair must be in SELL/BUY form, got '" + pair + "'");
    }
    if (refreshFrequencySeconds == null) {
      refreshFrequencySeconds = 3;
    }
    if (placement == null) {
      placement = new Placement(null, null);
    }
    if (orderHistory == null) {
      orderHistory = new OrderHistory(null, null);
    }
    if (gas == null) {
      gas = defaultGas();
    }
    if (paper == null) {
      paper = new Paper(null);
    }
  }

  /**
   * Sell token of the pair, upper case.
   */
  public String tokenSell() {
    return pair.split("/")[0].toUpperCase();
  }

  /**
   * Buy token of the pair, upper case.
   */
  public String tokenBuy() {
    return pair.split("/")[1].toUpperCase();
  }

  private static Gas defaultGas() {
    return new Gas(null, null, null, null, null, null, null, null, null, null,
        null, null, null, null, null, null, null, null);
  }

  public enum TradingMode {
    /**
     * Orders go to the in-memory paper exchange.
     */
    PAPER,
    LIVE,
  }

  public enum PlacementMode {
    /**
     * Every placement attempt runs on the calling thread while holding the order book lock.
     * Required when the venue multiplexes all order actions over one stateful session.
     */
    SERIALIZED,
    /**
     * Placement attempts run on a bounded worker pool; only the bookkeeping is locked.
     */
    WORKER_POOL
  }

  public record Placement(
      PlacementMode mode,
      @NotNull @Min(1) Integer maxWorkers
  ) {
    public Placement {
      if (mode == null) {
        mode = PlacementMode.SERIALIZED;
      }
      if (maxWorkers == null) {
        maxWorkers = 5;
      }
    }
  }

  public record OrderHistory(
      /**
       * Endpoint receiving our active orders. Blank disables reporting.
       */
      String url,
      /**
       * Minimum interval between two reports.
       */
      @NotNull @Min(1) Integer everySeconds
  ) {
    public OrderHistory {
      if (url == null) {
        url = "";
      }
      url = url.trim();
      if (everySeconds == null) {
        everySeconds = 30;
      }
    }

    public boolean enabled() {
      return !url.isEmpty();
    }
  }

  public record Gas(
      /**
       * Use the escalating price driven by the configured oracle source.
       */
      Boolean smartGasPrice,
      /**
       * EthGasStation API key (oracle source).
       */
      String ethGasStationApiKey,
      /**
       * Use etherchain.org (oracle source).
       */
      Boolean etherchainGasPrice,
      /**
       * Use POANetwork (oracle source).
       */
      Boolean poanetworkGasPrice,
      /**
       * Alternative POANetwork endpoint. Blank uses the public one.
       */
      String poanetworkUrl,
      /**
       * Fixed fast price in gwei (oracle source); scaled by {@code initialMultiplier}.
       */
      @DecimalMin(value = "0.0", inclusive = false) BigDecimal fixedGasPrice,
      /**
       * Use the node's {@code eth_gasPrice} (oracle source).
       */
      Boolean nodeGasPrice,
      /**
       * JSON-RPC endpoint for {@code nodeGasPrice}.
       */
      String rpcUrl,
      /**
       * Static gas price in wei used when smart pricing is off.
       */
      BigInteger gasPrice,
      @NotNull @DecimalMin("0.0") Double initialMultiplier,
      @NotNull @Min(0) Long stepGwei,
      @NotNull @Min(0) Long capGwei,
      @NotNull @Min(0) Long initialGwei,
      @NotNull @Min(0) Long increaseGwei,
      @NotNull @Min(1) Long everySeconds,
      @NotNull @Min(0) Long maxGwei,
      @NotNull @Min(1) Long refreshIntervalSeconds,
      @NotNull @Min(1) Long expirySeconds
  ) {
    public Gas {
      if (smartGasPrice == null) {
        smartGasPrice = false;
      }
      if (ethGasStationApiKey == null) {
        ethGasStationApiKey = "";
      }
      if (etherchainGasPrice == null) {
        etherchainGasPrice = false;
      }
      if (poanetworkGasPrice == null) {
        poanetworkGasPrice = false;
      }
      if (poanetworkUrl == null) {
        poanetworkUrl = "";
      }
      if (nodeGasPrice == null) {
        nodeGasPrice = false;
      }
      if (rpcUrl == null || rpcUrl.isBlank()) {
        rpcUrl = "http://localhost:8545";
      }
      if (initialMultiplier == null) {
        initialMultiplier = 1.0;
      }
      if (stepGwei == null) {
        stepGwei = 10L;
      }
      if (capGwei == null) {
        capGwei = 50L;
      }
      if (initialGwei == null) {
        initialGwei = 20L;
      }
      if (increaseGwei == null) {
        increaseGwei = 10L;
      }
      if (everySeconds == null) {
        everySeconds = 60L;
      }
      if (maxGwei == null) {
        maxGwei = 100L;
      }
      if (refreshIntervalSeconds == null) {
        refreshIntervalSeconds = 60L;
      }
      if (expirySeconds == null) {
        expirySeconds = 600L;
      }
    }

    /**
     * Number of oracle sources switched on. At most one is allowed.
     */
    public int oracleSourceCount() {
      int count = 0;
      if (!ethGasStationApiKey.isBlank()) count++;
      if (etherchainGasPrice) count++;
      if (poanetworkGasPrice) count++;
      if (fixedGasPrice != null) count++;
      if (nodeGasPrice) count++;
      return count;
    }
  }

  public record Paper(
      /**
       * Starting balances of the paper account, keyed by asset symbol.
       */
      Map<String, BigDecimal> balances
  ) {
    public Paper {
      if (balances == null || balances.isEmpty()) {
        balances = Map.of("ETH", BigDecimal.valueOf(100), "USD", BigDecimal.valueOf(100_000));
      } else {
        Map<String, BigDecimal> normalized = new LinkedHashMap<>();
        balances.forEach((asset, amount) -> {
          if (asset != null && !asset.isBlank()) {
            normalized.put(asset.trim().toUpperCase(), Objects.requireNonNullElse(amount, BigDecimal.ZERO));
          }
        });
        balances = Map.copyOf(normalized);
      }
    }
  }
}
