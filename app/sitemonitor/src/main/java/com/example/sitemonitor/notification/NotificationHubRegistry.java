/*
 * どこで: 通知ファンアウト
 * 何を: サイト ID から通知チャネルを持つ hub を引けるようにする
 * なぜ: 再同期時は hub ごと差し替え、配信中に組み立て途中の集合を見せないため
 */
package com.example.sitemonitor.notification;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

@Component
public class NotificationHubRegistry {

  private final Map<Long, NotificationHub> hubs = new ConcurrentHashMap<>();

  public Optional<NotificationHub> hubFor(long siteId) {
    return Optional.ofNullable(hubs.get(siteId));
  }

  public void replace(long siteId, NotificationHub hub) {
    if (hub == null) {
      throw new IllegalArgumentException("hub is required");
    }
    hubs.put(siteId, hub);
  }

  public void remove(long siteId) {
    hubs.remove(siteId);
  }
}
