/*
 * どこで: SiteMonitor 設定バインドのテスト
 * 何を: 監視用 HTTP クライアント/Slack 設定のバインド・既定値・バリデーションを検証する
 * なぜ: 不正なタイムアウトでポーリングスレッドを止めず、起動時に検出するため
 */
package com.example.sitemonitor.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.sitemonitor.monitor.ClientConfig;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

class MonitorPropertiesBindingTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner().withUserConfiguration(TestConfiguration.class);

  @Test
  void bindsDurationAndPoolSettings() {
    contextRunner
        .withPropertyValues(
            "monitor.client.timeout=2s",
            "monitor.client.max-idle-connections=8",
            "monitor.client.idle-connection-timeout=1m",
            "notifier.slack.connect-timeout=750ms",
            "notifier.slack.read-timeout=3s")
        .run(
            context -> {
              assertThat(context).hasNotFailed();
              final ClientConfig client =
                  context.getBean(MonitorClientProperties.class).toClientConfig();
              final SlackNotifierProperties slack = context.getBean(SlackNotifierProperties.class);

              assertThat(client)
                  .isEqualTo(new ClientConfig(Duration.ofSeconds(2), 8, Duration.ofMinutes(1)));
              assertThat(slack.connectTimeout()).isEqualTo(Duration.ofMillis(750));
              assertThat(slack.readTimeout()).isEqualTo(Duration.ofSeconds(3));
            });
  }

  @Test
  void missingSettingsFallBackToDefaults() {
    contextRunner.run(
        context -> {
          assertThat(context).hasNotFailed();
          assertThat(context.getBean(MonitorClientProperties.class).toClientConfig())
              .isEqualTo(ClientConfig.DEFAULT);
          assertThat(context.getBean(SlackNotifierProperties.class).readTimeout())
              .isEqualTo(Duration.ofSeconds(10));
        });
  }

  @Test
  void zeroTimeoutFailsStartup() {
    contextRunner
        .withPropertyValues("monitor.client.timeout=0s")
        .run(context -> assertThat(context).hasFailed());
  }

  @Test
  void negativePoolSizeFailsStartup() {
    contextRunner
        .withPropertyValues("monitor.client.max-idle-connections=-1")
        .run(context -> assertThat(context).hasFailed());
  }

  @Test
  void zeroSlackReadTimeoutFailsStartup() {
    contextRunner
        .withPropertyValues("notifier.slack.read-timeout=0s")
        .run(context -> assertThat(context).hasFailed());
  }

  @Configuration
  @EnableConfigurationProperties({MonitorClientProperties.class, SlackNotifierProperties.class})
  static class TestConfiguration {}
}
