/*
 * どこで: SiteMonitor ドメインモデル
 * 何を: sites テーブルの 1 行を表す
 * なぜ: サイト管理層が保存した内容から bootstrap が監視対象を組み立てるため
 */
package com.example.sitemonitor.model;

import java.time.Duration;
import java.time.Instant;

public record SiteRecord(
    long id, String url, Duration interval, boolean enabled, Instant createdAt) {}
