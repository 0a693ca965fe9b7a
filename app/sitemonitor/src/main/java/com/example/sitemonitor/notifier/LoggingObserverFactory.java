/*
 * どこで: Notifier 設定
 * 何を: LOG 種別の notifier からログ出力 observer を生成する
 * なぜ: 外部連携なしの通知チャネルも同じ設定経路で扱うため
 */
package com.example.sitemonitor.notifier;

import com.example.sitemonitor.notification.LoggingObserver;
import com.example.sitemonitor.notification.NotificationObserver;
import org.springframework.stereotype.Component;

@Component
public class LoggingObserverFactory implements NotificationObserverFactory {

  @Override
  public NotifierType type() {
    return NotifierType.LOG;
  }

  @Override
  public NotificationObserver create(Notifier notifier) {
    return new LoggingObserver();
  }
}
