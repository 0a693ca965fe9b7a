/*
 * どこで: Notifier 設定
 * 何を: notifier 種別 1 つ分の observer を生成する
 * なぜ: チャネル種別の追加を設定サービスの変更なしに factory 追加だけで済ませるため
 */
package com.example.sitemonitor.notifier;

import com.example.sitemonitor.notification.NotificationObserver;

public interface NotificationObserverFactory {

  NotifierType type();

  /**
   * @throws NotifierConfigurationException notifier のペイロードが使えない場合
   */
  NotificationObserver create(Notifier notifier);
}
