/*
 * どこで: Notifier ドメインモデル
 * 何を: notifier レコードが表せる通知チャネルの種別を定義する
 * なぜ: 種別タグで保存済み設定に対応する observer factory を選ぶため
 */
package com.example.sitemonitor.notifier;

public enum NotifierType {
  SLACK,
  LOG
}
