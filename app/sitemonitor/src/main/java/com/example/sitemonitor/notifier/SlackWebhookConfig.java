/*
 * どこで: Notifier ドメインモデル
 * 何を: SLACK 種別 notifier の JSON ペイロードを表す
 * なぜ: webhook_url を型付きで取り出すため
 */
package com.example.sitemonitor.notifier;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SlackWebhookConfig(@JsonProperty("webhook_url") String webhookUrl) {}
