/*
 * どこで: Monitor 監視設定
 * 何を: サイト単位の HTTP クライアント設定(期限と接続プール)を保持する
 * なぜ: 応答の遅いエンドポイントと速いエンドポイントを独立に調整するため
 */
package com.example.sitemonitor.monitor;

import java.time.Duration;

public record ClientConfig(
    Duration timeout, int maxIdleConnections, Duration idleConnectionTimeout) {

  public static final ClientConfig DEFAULT =
      new ClientConfig(Duration.ofSeconds(10), 100, Duration.ofSeconds(90));

  public ClientConfig {
    if (timeout == null || timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("timeout must be positive");
    }
    if (maxIdleConnections < 0) {
      throw new IllegalArgumentException("maxIdleConnections must not be negative");
    }
    if (idleConnectionTimeout == null
        || idleConnectionTimeout.isNegative()
        || idleConnectionTimeout.isZero()) {
      throw new IllegalArgumentException("idleConnectionTimeout must be positive");
    }
  }
}
