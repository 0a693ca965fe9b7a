/*
 * どこで: SiteMonitor サービス層
 * 何を: 永続化済みサイトの監視を開始・停止する
 * なぜ: 再起動前に保存されたサイトをアプリ起動完了後に監視再開するため
 */
package com.example.sitemonitor.service;

import com.example.sitemonitor.config.MonitorClientProperties;
import com.example.sitemonitor.model.SiteRecord;
import com.example.sitemonitor.monitor.MonitorManager;
import com.example.sitemonitor.monitor.MonitoredSite;
import com.example.sitemonitor.monitor.SiteAlreadyRegisteredException;
import com.example.sitemonitor.notifier.NotifierConfigurationException;
import com.example.sitemonitor.notifier.NotifierConfigurationService;
import com.example.sitemonitor.repository.SiteRepository;
import java.time.Clock;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "monitor.bootstrap.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class SiteMonitoringBootstrap {

  private static final Logger logger = LoggerFactory.getLogger(SiteMonitoringBootstrap.class);

  private final SiteRepository siteRepository;
  private final MonitorManager monitorManager;
  private final NotifierConfigurationService notifierConfigurationService;
  private final MonitorClientProperties clientProperties;
  private final Clock clock;

  @EventListener(ApplicationReadyEvent.class)
  public void startAll() {
    final List<SiteRecord> records = siteRepository.findAll();
    int started = 0;
    for (SiteRecord record : records) {
      if (startMonitoring(record)) {
        started++;
      }
    }
    logger.info("site monitoring bootstrap finished sites={} started={}", records.size(), started);
  }

  /**
   * レコードから監視サイトを作り、通知チャネルを設定して登録する。通知チャネルを設定できなくても
   * 監視は開始する。監視中の id は通知チャネルも含めて触らない。
   *
   * @return サイトを登録できた場合 {@code true}
   */
  public boolean startMonitoring(SiteRecord record) {
    if (monitorManager.isRegistered(record.id())) {
      logger.warn("site monitoring already active siteId={} url={}", record.id(), record.url());
      return false;
    }
    final MonitoredSite site;
    try {
      site =
          new MonitoredSite(
              record.id(),
              record.url(),
              record.interval(),
              clientProperties.toClientConfig(),
              clock);
    } catch (IllegalArgumentException ex) {
      logger.error(
          "site monitoring could not start siteId={} url={}", record.id(), record.url(), ex);
      return false;
    }
    site.setEnabled(record.enabled());
    // 初回チェック前に hub を用意しておく
    configureChannels(record.id());
    try {
      monitorManager.register(site);
      return true;
    } catch (SiteAlreadyRegisteredException ex) {
      // 並行登録に負けた場合も hub は同じ保存内容から作られているので消さない
      logger.warn("site monitoring already active siteId={} url={}", record.id(), record.url());
      return false;
    } catch (RuntimeException ex) {
      notifierConfigurationService.clearObservers(record.id());
      logger.error(
          "site monitoring could not start siteId={} url={}", record.id(), record.url(), ex);
      return false;
    }
  }

  public void stopMonitoring(long siteId) {
    monitorManager.revoke(siteId);
    notifierConfigurationService.clearObservers(siteId);
  }

  private void configureChannels(long siteId) {
    try {
      notifierConfigurationService.configureObservers(siteId);
    } catch (NotifierConfigurationException ex) {
      logger.warn("site notification channels not configured siteId={}", siteId, ex);
    } catch (RuntimeException ex) {
      // 通知設定の失敗で監視自体は止めない
      logger.error("site notification channels failed unexpectedly siteId={}", siteId, ex);
    }
  }
}
