/*
 * どこで: 通知ドメインモデル
 * 何を: サイトの全通知チャネルへ配る状態変化イベントを表す
 * なぜ: 1 回のファンアウトで全 observer が同じ不変値を共有するため
 */
package com.example.sitemonitor.notification;

import java.time.Instant;

public record NotificationState(String name, String status, String message, Instant updatedAt) {}
