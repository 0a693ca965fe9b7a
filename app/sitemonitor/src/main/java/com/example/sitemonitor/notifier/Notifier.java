/*
 * どこで: Notifier ドメインモデル
 * 何を: notifiers テーブルの 1 行を表す
 * なぜ: サイトに属する永続化済み通知チャネル 1 件を扱うため
 */
package com.example.sitemonitor.notifier;

public record Notifier(long id, long siteId, NotifierConfig config) {

  public NotifierType type() {
    return config.type();
  }
}
