/*
 * どこで: SiteMonitor 設定バインド
 * 何を: 保存済みレコードから作るサイトの既定監視用 HTTP クライアント設定を保持する
 * なぜ: タイムアウトとプールサイズをコード変更なしに環境ごとに調整するため
 */
package com.example.sitemonitor.config;

import com.example.sitemonitor.monitor.ClientConfig;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "monitor.client")
@Validated
public record MonitorClientProperties(
    Duration timeout, @PositiveOrZero Integer maxIdleConnections, Duration idleConnectionTimeout) {

  public MonitorClientProperties {
    timeout = timeout == null ? ClientConfig.DEFAULT.timeout() : timeout;
    maxIdleConnections =
        maxIdleConnections == null ? ClientConfig.DEFAULT.maxIdleConnections() : maxIdleConnections;
    idleConnectionTimeout =
        idleConnectionTimeout == null
            ? ClientConfig.DEFAULT.idleConnectionTimeout()
            : idleConnectionTimeout;
  }

  @AssertTrue(message = "monitor.client.timeout must be positive")
  public boolean isTimeoutPositive() {
    return isPositive(timeout);
  }

  @AssertTrue(message = "monitor.client.idle-connection-timeout must be positive")
  public boolean isIdleConnectionTimeoutPositive() {
    return isPositive(idleConnectionTimeout);
  }

  public ClientConfig toClientConfig() {
    return new ClientConfig(timeout, maxIdleConnections, idleConnectionTimeout);
  }

  private static boolean isPositive(Duration duration) {
    return !duration.isZero() && !duration.isNegative();
  }
}
