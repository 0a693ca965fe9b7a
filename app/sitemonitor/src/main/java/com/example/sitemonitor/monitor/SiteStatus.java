/*
 * どこで: Monitor ドメインモデル
 * 何を: 監視サイトが取りうる死活状態を定義する
 * なぜ: チェック結果と通知で同じ語彙を使うため
 */
package com.example.sitemonitor.monitor;

import java.util.Locale;

public enum SiteStatus {
  UP,
  DOWN,
  ERROR,
  PAUSED;

  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
