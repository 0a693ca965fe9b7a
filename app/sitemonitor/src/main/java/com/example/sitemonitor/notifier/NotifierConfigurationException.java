/*
 * どこで: Notifier 設定
 * 何を: 保存済み notifier 設定から通知チャネルを作れなかったことを表す
 * なぜ: 他サイトの処理を続けつつ、どのサイトで失敗したかを呼び出し側へ伝えるため
 */
package com.example.sitemonitor.notifier;

public class NotifierConfigurationException extends RuntimeException {

  public NotifierConfigurationException(String message) {
    super(message);
  }

  public NotifierConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
