/*
 * どこで: 通知ファンアウト
 * 何を: サイトの状態変化を受け取れる通知チャネルを表す
 * なぜ: hub を変更せずに新しいチャネルを追加できるようにするため
 */
package com.example.sitemonitor.notification;

public interface NotificationObserver {

  /** ログと配信エラーに使う短いチャネル名。 */
  String name();

  /**
   * このチャネルへ状態を配信する。
   *
   * @throws NotificationDeliveryException チャネルが拒否した、または処理できなかった場合
   */
  void notify(NotificationState state);
}
