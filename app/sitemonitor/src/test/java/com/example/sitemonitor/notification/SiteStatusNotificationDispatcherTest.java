/*
 * どこで: 通知ファンアウトのテスト
 * 何を: どの遷移を通知するかと配信結果の記録を検証する
 * なぜ: dispatcher がポーリングタスクと通知チャネルをつなぐ唯一の経路のため
 */
package com.example.sitemonitor.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.example.sitemonitor.monitor.ClientConfig;
import com.example.sitemonitor.monitor.MonitoredSite;
import com.example.sitemonitor.monitor.SiteStatus;
import com.example.sitemonitor.monitor.StatusSnapshot;
import com.example.sitemonitor.service.MonitorMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class SiteStatusNotificationDispatcherTest {

  private static final Instant UP_AT = Instant.parse("2026-01-17T00:00:00Z");
  private static final Instant DOWN_AT = Instant.parse("2026-01-17T00:05:00Z");
  private static final String URL = "https://example.test/health";

  private final MonitoredSite site =
      new MonitoredSite(21L, URL, Duration.ofSeconds(30), ClientConfig.DEFAULT);

  private SimpleMeterRegistry meterRegistry;
  private NotificationHubRegistry hubRegistry;
  private SiteStatusNotificationDispatcher dispatcher;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    hubRegistry = new NotificationHubRegistry();
    dispatcher =
        new SiteStatusNotificationDispatcher(hubRegistry, new MonitorMetrics(meterRegistry));
  }

  @Test
  void transitionIsBroadcastToTheSitesHub() {
    final NotificationObserver observer = mock(NotificationObserver.class);
    final NotificationHub hub = new NotificationHub();
    hub.attach(observer);
    hubRegistry.replace(21L, hub);

    dispatcher.onStatusChange(
        site,
        new StatusSnapshot(SiteStatus.UP, UP_AT, true),
        new StatusSnapshot(SiteStatus.DOWN, DOWN_AT, true),
        "HTTP error: 503");

    final ArgumentCaptor<NotificationState> captor =
        ArgumentCaptor.forClass(NotificationState.class);
    verify(observer).notify(captor.capture());
    final NotificationState state = captor.getValue();
    assertThat(state.name()).isEqualTo(URL);
    assertThat(state.status()).isEqualTo("down");
    assertThat(state.message()).isEqualTo("Site " + URL + " is now down (HTTP error: 503)");
    assertThat(state.updatedAt()).isEqualTo(DOWN_AT);
    assertThat(dispatchCount("complete")).isEqualTo(1.0d);
  }

  @Test
  void initialUpObservationIsNotBroadcast() {
    final NotificationObserver observer = mock(NotificationObserver.class);
    final NotificationHub hub = new NotificationHub();
    hub.attach(observer);
    hubRegistry.replace(21L, hub);

    dispatcher.onStatusChange(
        site,
        new StatusSnapshot(null, null, true),
        new StatusSnapshot(SiteStatus.UP, UP_AT, true),
        null);

    verify(observer, never()).notify(any());
    assertThat(meterRegistry.find("sitemonitor.notification.dispatch.total").counter()).isNull();
  }

  @Test
  void initialDownObservationIsBroadcast() {
    final NotificationObserver observer = mock(NotificationObserver.class);
    final NotificationHub hub = new NotificationHub();
    hub.attach(observer);
    hubRegistry.replace(21L, hub);

    dispatcher.onStatusChange(
        site,
        new StatusSnapshot(null, null, true),
        new StatusSnapshot(SiteStatus.DOWN, DOWN_AT, true),
        "HTTP error: 500");

    final ArgumentCaptor<NotificationState> captor =
        ArgumentCaptor.forClass(NotificationState.class);
    verify(observer).notify(captor.capture());
    assertThat(captor.getValue().status()).isEqualTo("down");
    assertThat(captor.getValue().message())
        .isEqualTo("Site " + URL + " is now down (HTTP error: 500)");
    assertThat(dispatchCount("complete")).isEqualTo(1.0d);
  }

  @Test
  void initialErrorObservationIsBroadcast() {
    final NotificationObserver observer = mock(NotificationObserver.class);
    final NotificationHub hub = new NotificationHub();
    hub.attach(observer);
    hubRegistry.replace(21L, hub);

    dispatcher.onStatusChange(
        site,
        new StatusSnapshot(null, null, true),
        new StatusSnapshot(SiteStatus.ERROR, DOWN_AT, true),
        "connection error: refused");

    verify(observer).notify(any());
  }

  @Test
  void siteWithoutHubIsSkipped() {
    dispatcher.onStatusChange(
        site,
        new StatusSnapshot(SiteStatus.UP, UP_AT, true),
        new StatusSnapshot(SiteStatus.ERROR, DOWN_AT, true),
        "connection error: refused");

    assertThat(meterRegistry.find("sitemonitor.notification.dispatch.total").counter()).isNull();
  }

  @Test
  void partialDeliveryIsRecordedPerFailingObserver() {
    final NotificationObserver healthy = mock(NotificationObserver.class);
    final NotificationObserver broken = mock(NotificationObserver.class);
    doThrow(new NotificationDeliveryException("slack", "rejected"))
        .when(broken)
        .notify(any());
    final NotificationHub hub = new NotificationHub();
    hub.attach(broken);
    hub.attach(healthy);
    hubRegistry.replace(21L, hub);

    dispatcher.onStatusChange(
        site,
        new StatusSnapshot(SiteStatus.DOWN, UP_AT, true),
        new StatusSnapshot(SiteStatus.UP, DOWN_AT, true),
        null);

    verify(healthy).notify(any());
    assertThat(dispatchCount("partial")).isEqualTo(1.0d);
    assertThat(
            meterRegistry
                .get("sitemonitor.notification.delivery.failure.total")
                .tag("observer", "slack")
                .counter()
                .count())
        .isEqualTo(1.0d);
  }

  @Test
  void toStateOmitsEmptyDetail() {
    final NotificationState state =
        SiteStatusNotificationDispatcher.toState(
            site, new StatusSnapshot(SiteStatus.UP, UP_AT, true), " ");

    assertThat(state.message()).isEqualTo("Site " + URL + " is now up");
    assertThat(List.of(state.name(), state.status())).containsExactly(URL, "up");
  }

  private double dispatchCount(String result) {
    return meterRegistry
        .get("sitemonitor.notification.dispatch.total")
        .tag("result", result)
        .counter()
        .count();
  }
}
