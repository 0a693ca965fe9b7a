/*
 * どこで: SiteMonitor 設定バインド
 * 何を: Slack webhook 配信の HTTP タイムアウトを保持する
 * なぜ: 遅い webhook が自サイトのポーリングを遅らせる時間に上限を設けるため
 */
package com.example.sitemonitor.config;

import jakarta.validation.constraints.AssertTrue;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notifier.slack")
@Validated
public record SlackNotifierProperties(Duration connectTimeout, Duration readTimeout) {

  public SlackNotifierProperties {
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(5) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(10) : readTimeout;
  }

  @AssertTrue(message = "notifier.slack timeouts must be positive")
  public boolean isTimeoutsPositive() {
    // 0 はポーリングスレッドの無期限待ちになるため許容しない
    return !connectTimeout.isZero()
        && !connectTimeout.isNegative()
        && !readTimeout.isZero()
        && !readTimeout.isNegative();
  }
}
