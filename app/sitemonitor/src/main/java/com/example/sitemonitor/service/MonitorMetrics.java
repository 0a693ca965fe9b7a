/*
 * どこで: SiteMonitor サービス層
 * 何を: チェック結果・通知配信結果・登録サイト数を記録する
 * なぜ: 死活チェックの健全性と通知配信を Prometheus から観測できるようにするため
 */
package com.example.sitemonitor.service;

import com.example.sitemonitor.monitor.SiteStatus;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring-managed component")
public class MonitorMetrics {

  static final String METRIC_CHECK_TOTAL = "sitemonitor.check.total";
  static final String METRIC_DISPATCH_TOTAL = "sitemonitor.notification.dispatch.total";
  static final String METRIC_DELIVERY_FAILURE_TOTAL =
      "sitemonitor.notification.delivery.failure.total";
  static final String METRIC_SITES_REGISTERED = "sitemonitor.sites.registered";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger registeredSites = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();

  public MonitorMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_SITES_REGISTERED, registeredSites, AtomicInteger::get)
        .description("Number of sites with an active polling task")
        .register(meterRegistry);
  }

  public void recordCheckResult(SiteStatus status) {
    if (status == null) {
      return;
    }
    counter(METRIC_CHECK_TOTAL, "Site check outcomes", "result", status.label()).increment();
  }

  public void recordDispatch(boolean complete) {
    counter(
            METRIC_DISPATCH_TOTAL,
            "Status change broadcasts by delivery completeness",
            "result",
            complete ? "complete" : "partial")
        .increment();
  }

  public void recordDeliveryFailure(String observer) {
    counter(
            METRIC_DELIVERY_FAILURE_TOTAL,
            "Notifications rejected by an alert channel",
            "observer",
            observer == null ? "unknown" : observer)
        .increment();
  }

  public void updateRegisteredSites(int count) {
    registeredSites.set(Math.max(count, 0));
  }

  private Counter counter(String name, String description, String tagKey, String tagValue) {
    return counters.computeIfAbsent(
        name + '|' + tagValue,
        ignored ->
            Counter.builder(name)
                .description(description)
                .tags(Tags.of(tagKey, tagValue))
                .register(meterRegistry));
  }
}
