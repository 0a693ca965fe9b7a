package com.example.sitemonitor.notifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.sitemonitor.notification.NotificationObserver;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestClient;

class SlackObserverFactoryTest {

  private final SlackObserverFactory factory =
      new SlackObserverFactory(new ObjectMapper(), RestClient.create());

  @Test
  void createsSlackObserverFromWebhookConfig() {
    final NotificationObserver observer =
        factory.create(
            slack(
                "{\"webhook_url\":\"https://hooks.slack.test/services/T/B/X\","
                    + "\"channel\":\"#ops\"}"));

    assertThat(observer.name()).isEqualTo("slack");
    assertThat(factory.type()).isEqualTo(NotifierType.SLACK);
  }

  @Test
  void rejectsUnparseablePayload() {
    assertThatThrownBy(() -> factory.create(slack("[1,2")))
        .isInstanceOf(NotifierConfigurationException.class)
        .hasMessage("invalid slack notifier config notifierId=5");
  }

  @Test
  void rejectsPayloadWithoutWebhookUrl() {
    assertThatThrownBy(() -> factory.create(slack(null)))
        .isInstanceOf(NotifierConfigurationException.class)
        .hasMessage("slack notifier is missing webhook_url notifierId=5");
  }

  @Test
  void rejectsMalformedWebhookUrl() {
    assertThatThrownBy(() -> factory.create(slack("{\"webhook_url\":\"https://hooks slack\"}")))
        .isInstanceOf(NotifierConfigurationException.class)
        .hasMessage("slack notifier has malformed webhook_url notifierId=5");
  }

  @Test
  void rejectsWebhookUrlWithoutScheme() {
    assertThatThrownBy(() -> factory.create(slack("{\"webhook_url\":\"hooks.slack.com/x\"}")))
        .isInstanceOf(NotifierConfigurationException.class)
        .hasMessage("slack notifier webhook_url must be an absolute http(s) URL notifierId=5");
  }

  @Test
  void rejectsNonHttpWebhookUrl() {
    assertThatThrownBy(
            () -> factory.create(slack("{\"webhook_url\":\"ftp://hooks.slack.test/x\"}")))
        .isInstanceOf(NotifierConfigurationException.class)
        .hasMessageContaining("absolute http(s) URL");
  }

  private static Notifier slack(String configJson) {
    return new Notifier(5L, 1L, new NotifierConfig(NotifierType.SLACK, configJson));
  }
}
