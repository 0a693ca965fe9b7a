/*
 * どこで: Notifier 設定
 * 何を: SLACK 種別の notifier から Slack webhook observer を生成する
 * なぜ: 不正な webhook_url を送信時ではなく設定時点で検出するため
 */
package com.example.sitemonitor.notifier;

import com.example.sitemonitor.notification.NotificationObserver;
import com.example.sitemonitor.notification.SlackWebhookObserver;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.URI;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

@Component
public class SlackObserverFactory implements NotificationObserverFactory {

  private final ObjectMapper objectMapper;
  private final RestClient slackRestClient;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper and RestClient are shared Spring-managed components")
  public SlackObserverFactory(
      ObjectMapper objectMapper, @Qualifier("slackRestClient") RestClient slackRestClient) {
    this.objectMapper = objectMapper;
    this.slackRestClient = slackRestClient;
  }

  @Override
  public NotifierType type() {
    return NotifierType.SLACK;
  }

  @Override
  public NotificationObserver create(Notifier notifier) {
    final SlackWebhookConfig config;
    try {
      config = objectMapper.readValue(notifier.config().configJson(), SlackWebhookConfig.class);
    } catch (JsonProcessingException ex) {
      throw new NotifierConfigurationException(
          "invalid slack notifier config notifierId=" + notifier.id(), ex);
    }
    if (config.webhookUrl() == null || config.webhookUrl().isBlank()) {
      throw new NotifierConfigurationException(
          "slack notifier is missing webhook_url notifierId=" + notifier.id());
    }
    final URI webhookUri;
    try {
      webhookUri = URI.create(config.webhookUrl());
    } catch (IllegalArgumentException ex) {
      throw new NotifierConfigurationException(
          "slack notifier has malformed webhook_url notifierId=" + notifier.id(), ex);
    }
    if (!isHttpUrl(webhookUri)) {
      // 相対 URI は RestClient が送信時に拒否するため、設定時点で弾く
      throw new NotifierConfigurationException(
          "slack notifier webhook_url must be an absolute http(s) URL notifierId=" + notifier.id());
    }
    return new SlackWebhookObserver(slackRestClient, webhookUri.toString());
  }

  private static boolean isHttpUrl(URI uri) {
    final String scheme = uri.getScheme();
    return uri.isAbsolute()
        && uri.getHost() != null
        && ("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme));
  }
}
