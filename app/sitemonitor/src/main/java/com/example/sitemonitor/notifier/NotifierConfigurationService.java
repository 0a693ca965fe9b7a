/*
 * どこで: Notifier 設定
 * 何を: 保存済み notifier レコードからサイトの通知チャネルを組み立てる
 * なぜ: 各サイトの通知 hub をユーザーの設定内容と同期させるため
 */
package com.example.sitemonitor.notifier;

import com.example.sitemonitor.notification.NotificationHub;
import com.example.sitemonitor.notification.NotificationHubRegistry;
import com.example.sitemonitor.notification.NotificationObserver;
import com.example.sitemonitor.repository.NotifierRepository;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
public class NotifierConfigurationService {

  private static final Logger logger = LoggerFactory.getLogger(NotifierConfigurationService.class);

  private final NotifierRepository notifierRepository;
  private final NotificationHubRegistry hubRegistry;
  private final Map<NotifierType, NotificationObserverFactory> factories =
      new EnumMap<>(NotifierType.class);

  public NotifierConfigurationService(
      NotifierRepository notifierRepository,
      NotificationHubRegistry hubRegistry,
      List<NotificationObserverFactory> observerFactories) {
    this.notifierRepository = notifierRepository;
    this.hubRegistry = hubRegistry;
    for (NotificationObserverFactory factory : observerFactories) {
      final NotificationObserverFactory previous = factories.put(factory.type(), factory);
      if (previous != null) {
        throw new IllegalStateException("duplicate observer factory for type=" + factory.type());
      }
    }
  }

  /**
   * サイトの hub を保存済み notifier から作った新しい hub に差し替える。差し替え前に全レコードを
   * 検証するため、不正なレコードがあれば以前の hub はそのまま残る。
   *
   * @return 新しい hub に登録した observer 数
   * @throws NotifierConfigurationException notifier を読めない、または生成できない場合
   */
  public int configureObservers(long siteId) {
    final List<Notifier> notifiers;
    try {
      notifiers = notifierRepository.findBySiteId(siteId);
    } catch (DataAccessException ex) {
      throw new NotifierConfigurationException("failed to get notifiers siteId=" + siteId, ex);
    }
    final NotificationHub hub = new NotificationHub();
    for (Notifier notifier : notifiers) {
      hub.attach(createObserver(notifier));
    }
    hubRegistry.replace(siteId, hub);
    logger.info(
        "site notification channels configured siteId={} observers={}",
        siteId,
        hub.observerCount());
    return hub.observerCount();
  }

  public void clearObservers(long siteId) {
    hubRegistry.remove(siteId);
    logger.info("site notification channels cleared siteId={}", siteId);
  }

  NotificationObserver createObserver(Notifier notifier) {
    final NotificationObserverFactory factory = factories.get(notifier.type());
    if (factory == null) {
      throw new NotifierConfigurationException(
          "no observer factory for notifier type=" + notifier.type() + " id=" + notifier.id());
    }
    return factory.create(notifier);
  }
}
