/*
 * どこで: Notifier ドメインモデル
 * 何を: notifier レコードの種別付き設定ペイロードを保持する
 * なぜ: notifier 種別ごとに自身の JSON ペイロードを解釈するため
 */
package com.example.sitemonitor.notifier;

public record NotifierConfig(NotifierType type, String configJson) {

  public NotifierConfig {
    if (type == null) {
      throw new IllegalArgumentException("type is required");
    }
    configJson = configJson == null || configJson.isBlank() ? "{}" : configJson;
  }
}
