/*
 * どこで: Monitor スケジューラ
 * 何を: ポーリングタスクが観測した状態遷移を受け取る
 * なぜ: スケジューラを通知の配信方法から切り離すため
 */
package com.example.sitemonitor.monitor;

@FunctionalInterface
public interface SiteStatusListener {

  SiteStatusListener NO_OP = (site, previous, current, detail) -> {};

  /**
   * チェックで状態が変わった後、サイトのポーリングスレッドから呼ばれる。
   *
   * @param detail チェックの失敗内容。成功時は {@code null}
   */
  void onStatusChange(
      MonitoredSite site, StatusSnapshot previous, StatusSnapshot current, String detail);
}
