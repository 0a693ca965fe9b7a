/*
 * どこで: 通知チャネル
 * 何を: サイトの状態変化を Slack incoming webhook へ POST する
 * なぜ: ユーザーがサイトごとに接続する通知先が Slack のため
 */
package com.example.sitemonitor.notification;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.URI;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

public class SlackWebhookObserver implements NotificationObserver {

  static final String NAME = "slack";

  private final RestClient restClient;
  private final URI webhookUri;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient is a shared Spring-managed component")
  public SlackWebhookObserver(RestClient restClient, String webhookUrl) {
    if (webhookUrl == null || webhookUrl.isBlank()) {
      throw new IllegalArgumentException("webhookUrl is required");
    }
    this.restClient = restClient;
    this.webhookUri = URI.create(webhookUrl);
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public void notify(NotificationState state) {
    try {
      restClient
          .post()
          .uri(webhookUri)
          .contentType(MediaType.APPLICATION_JSON)
          .body(new SlackMessage(format(state)))
          .retrieve()
          .toBodilessEntity();
    } catch (RestClientResponseException ex) {
      throw new NotificationDeliveryException(
          NAME, "slack webhook rejected notification status=" + ex.getStatusCode().value(), ex);
    } catch (ResourceAccessException ex) {
      throw new NotificationDeliveryException(NAME, "slack webhook unreachable", ex);
    } catch (RestClientException ex) {
      throw new NotificationDeliveryException(NAME, "slack webhook request failed", ex);
    }
  }

  static String format(NotificationState state) {
    final StringBuilder text =
        new StringBuilder()
            .append('[')
            .append(state.status().toUpperCase(Locale.ROOT))
            .append("] ")
            .append(state.message());
    if (state.updatedAt() != null) {
      text.append(" (").append(DateTimeFormatter.ISO_INSTANT.format(state.updatedAt())).append(')');
    }
    return text.toString();
  }

  record SlackMessage(String text) {}
}
