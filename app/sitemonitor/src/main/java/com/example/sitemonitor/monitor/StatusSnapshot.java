/*
 * どこで: Monitor ドメインモデル
 * 何を: サイトの観測状態の不変コピーを表す
 * なぜ: 読み手がサイトのロックで守られた状態を直接参照しないようにするため
 */
package com.example.sitemonitor.monitor;

import java.time.Instant;

/**
 * {@link MonitoredSite} のある時点の状態。
 *
 * @param status 最後に観測した状態。初回チェック前は {@code null}
 * @param changedAt {@code status} が最後に変わった時刻。初回チェック前は {@code null}
 * @param enabled スナップショット取得時にチェックが有効だったか
 */
public record StatusSnapshot(SiteStatus status, Instant changedAt, boolean enabled) {

  /** ユーザーに見せる状態。無効化中のサイトは {@link SiteStatus#PAUSED} になる。 */
  public SiteStatus effectiveStatus() {
    return enabled ? status : SiteStatus.PAUSED;
  }

  public boolean hasObservation() {
    return status != null;
  }
}
