/*
 * どこで: Monitor スケジューラ
 * 何を: 1 サイト分のポーリングループのハンドルを表す
 * なぜ: 停止要求は待たずに送り、終了を待つ必要がある呼び出し側だけ完了シグナルを使うため
 */
package com.example.sitemonitor.monitor;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

public final class PollingTask {

  private final CountDownLatch cancellation = new CountDownLatch(1);
  private final CountDownLatch completion = new CountDownLatch(1);

  PollingTask() {}

  /** ループに停止を要求する。即座に返り、複数回呼んでもよい。 */
  public void cancel() {
    cancellation.countDown();
  }

  public boolean isCancelled() {
    return cancellation.getCount() == 0;
  }

  public boolean isDone() {
    return completion.getCount() == 0;
  }

  /** ループが終了し、レジストリからサイトを削除するまで待つ。 */
  public boolean awaitTermination(Duration timeout) throws InterruptedException {
    return completion.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
  }

  /**
   * ポーリング間隔 1 回分、または停止要求まで待機する。
   *
   * @return 停止要求があった場合 {@code true}
   */
  boolean awaitCancellation(Duration interval) throws InterruptedException {
    return cancellation.await(interval.toNanos(), TimeUnit.NANOSECONDS);
  }

  void markDone() {
    completion.countDown();
  }
}
