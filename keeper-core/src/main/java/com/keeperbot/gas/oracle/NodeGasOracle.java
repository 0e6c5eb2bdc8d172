package com.keeperbot.gas.oracle;

import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.methods.response.EthGasPrice;
import org.web3j.protocol.http.HttpService;

import java.io.IOException;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Price reported by the node's {@code eth_gasPrice}.
 */
public final class NodeGasOracle extends CachingGasOracle {

  private final String rpcUrl;
  private volatile Web3j web3j;

  public NodeGasOracle(String rpcUrl, Duration refreshInterval, Duration expiry, Clock clock) {
    super("node", refreshInterval, expiry, clock);
    this.rpcUrl = Objects.requireNonNull(rpcUrl, "rpcUrl");
  }

  private Web3j web3j() {
    Web3j existing = web3j;
    if (existing != null) {
      return existing;
    }
    synchronized (this) {
      if (web3j == null) {
        web3j = Web3j.build(new HttpService(rpcUrl));
      }
      return web3j;
    }
  }

  @Override
  protected BigInteger fetchFastPrice() throws IOException {
    EthGasPrice response = web3j().ethGasPrice().send();
    if (response.hasError()) {
      throw new IOException("eth_gasPrice error: " + response.getError().getMessage());
    }
    return response.getGasPrice();
  }

  @Override
  public void close() {
    super.close();
    Web3j existing = web3j;
    if (existing != null) {
      existing.shutdown();
    }
  }
}
