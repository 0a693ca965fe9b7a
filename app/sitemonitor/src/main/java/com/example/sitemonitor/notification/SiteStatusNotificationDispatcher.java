/*
 * どこで: 通知ファンアウト
 * 何を: サイトの状態遷移をそのサイトの hub へのブロードキャストに変換する
 * なぜ: スケジューラと通知チャネルをつなぎ、配信結果を記録するため
 */
package com.example.sitemonitor.notification;

import com.example.sitemonitor.monitor.MonitoredSite;
import com.example.sitemonitor.monitor.SiteStatus;
import com.example.sitemonitor.monitor.SiteStatusListener;
import com.example.sitemonitor.monitor.StatusSnapshot;
import com.example.sitemonitor.service.MonitorMetrics;
import com.google.common.annotations.VisibleForTesting;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class SiteStatusNotificationDispatcher implements SiteStatusListener {

  private static final Logger logger =
      LoggerFactory.getLogger(SiteStatusNotificationDispatcher.class);

  private final NotificationHubRegistry hubRegistry;
  private final MonitorMetrics metrics;

  @Override
  public void onStatusChange(
      MonitoredSite site, StatusSnapshot previous, StatusSnapshot current, String detail) {
    if (isHealthyBaseline(previous, current)) {
      // 初回観測の UP は基準値として扱い、通知しない
      logger.debug(
          "site initial status recorded siteId={} status={}", site.id(), current.status());
      return;
    }
    final Optional<NotificationHub> hub = hubRegistry.hubFor(site.id());
    if (hub.isEmpty()) {
      logger.debug("site has no notification channels siteId={}", site.id());
      return;
    }
    final NotificationState state = toState(site, current, detail);
    final List<NotificationDeliveryException> errors = hub.get().notify(state);
    for (NotificationDeliveryException error : errors) {
      logger.warn(
          "site notification delivery failed siteId={} observer={} error={}",
          site.id(),
          error.observer(),
          error.getMessage(),
          error);
      metrics.recordDeliveryFailure(error.observer());
    }
    metrics.recordDispatch(errors.isEmpty());
    logger.info(
        "site notification dispatched siteId={} status={} failed={}",
        site.id(),
        state.status(),
        errors.size());
  }

  private static boolean isHealthyBaseline(StatusSnapshot previous, StatusSnapshot current) {
    // 初回観測の DOWN/ERROR は登録時点で既に障害中なので通知対象に残す
    return !previous.hasObservation() && current.status() == SiteStatus.UP;
  }

  @VisibleForTesting
  static NotificationState toState(MonitoredSite site, StatusSnapshot current, String detail) {
    final String status = current.status().label();
    final StringBuilder message =
        new StringBuilder("Site ").append(site.url()).append(" is now ").append(status);
    if (detail != null && !detail.isBlank()) {
      message.append(" (").append(detail).append(')');
    }
    return new NotificationState(site.url(), status, message.toString(), current.changedAt());
  }
}
