/*
 * どこで: 通知ファンアウト
 * 何を: サイトの observer を保持し、全員へ状態をブロードキャストする
 * なぜ: 1 つのチャネルの故障で他のチャネルの通知を止めないため
 */
package com.example.sitemonitor.notification;

import java.util.ArrayList;
import java.util.List;

/**
 * observer パターンの subject 側。
 *
 * <p>登録と {@link #notify} のスナップショット取得は同じ mutex を使う。observer の呼び出しは mutex
 * の外で行うため、遅いチャネルが {@link #attach} を塞がない。
 */
public class NotificationHub {

  private final Object lock = new Object();
  private final List<NotificationObserver> observers = new ArrayList<>();

  public void attach(NotificationObserver observer) {
    if (observer == null) {
      throw new IllegalArgumentException("observer is required");
    }
    synchronized (lock) {
      observers.add(observer);
    }
  }

  /**
   * 登録済みの全 observer を同じ状態で呼び出す。
   *
   * @return 失敗した observer ごとのエラー。全員が受理した場合は空
   */
  public List<NotificationDeliveryException> notify(NotificationState state) {
    final List<NotificationObserver> snapshot;
    synchronized (lock) {
      snapshot = List.copyOf(observers);
    }
    final List<NotificationDeliveryException> errors = new ArrayList<>();
    for (NotificationObserver observer : snapshot) {
      try {
        observer.notify(state);
      } catch (NotificationDeliveryException ex) {
        errors.add(ex);
      } catch (RuntimeException ex) {
        errors.add(
            new NotificationDeliveryException(
                observer.name(), observer.name() + " delivery failed: " + ex.getMessage(), ex));
      }
    }
    return errors;
  }

  public int observerCount() {
    synchronized (lock) {
      return observers.size();
    }
  }
}
