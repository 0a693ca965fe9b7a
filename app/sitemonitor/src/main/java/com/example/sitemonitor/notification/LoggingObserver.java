/*
 * どこで: 通知チャネル
 * 何を: サイトの状態変化をアプリケーションログへ出力する
 * なぜ: 外部連携なしでも通知チャネルを持てるようにするため
 */
package com.example.sitemonitor.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingObserver implements NotificationObserver {

  private static final Logger logger = LoggerFactory.getLogger(LoggingObserver.class);

  @Override
  public String name() {
    return "log";
  }

  @Override
  public void notify(NotificationState state) {
    logger.info(
        "site notification name={} status={} updatedAt={} message={}",
        state.name(),
        state.status(),
        state.updatedAt(),
        state.message());
  }
}
