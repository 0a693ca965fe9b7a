/*
 * どこで: Monitor スケジューラ
 * 何を: 監視サイトのレジストリとバックグラウンドのポーリングループを管理する
 * なぜ: サイトごとに独立した周期で監視し、失敗するサイトが他を止めないようにするため
 */
package com.example.sitemonitor.monitor;

import com.example.sitemonitor.service.MonitorMetrics;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * 登録サイトごとにポーリングループを 1 本起動する。
 *
 * <p>レジストリは並行 map で、参照はロックを取らない。登録とループ終了時の自己削除は {@code
 * registryLock} で直列化する。有効化/無効化と状態更新はサイト自身のロックだけを取る。
 */
@Component
public class MonitorManager {

  private static final Logger logger = LoggerFactory.getLogger(MonitorManager.class);
  private static final String MDC_SITE_ID = "site_id";
  private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

  private final Map<Long, MonitoredSite> sites = new ConcurrentHashMap<>();
  private final Object registryLock = new Object();
  private final SiteStatusListener listener;
  private final MonitorMetrics metrics;
  private final ExecutorService executor;

  @Autowired
  public MonitorManager(SiteStatusListener listener, MonitorMetrics metrics) {
    this(listener, metrics, newPollingExecutor());
  }

  @VisibleForTesting
  MonitorManager(SiteStatusListener listener, MonitorMetrics metrics, ExecutorService executor) {
    this.listener = listener;
    this.metrics = metrics;
    this.executor = executor;
  }

  private static ExecutorService newPollingExecutor() {
    return Executors.newCachedThreadPool(
        new ThreadFactoryBuilder().setNameFormat("site-monitor-%d").setDaemon(true).build());
  }

  /**
   * サイトの監視を開始する。初回チェックは待たずに返る。
   *
   * @throws SiteAlreadyRegisteredException 同じ id のサイトを監視中の場合
   */
  public void register(MonitoredSite site) {
    if (site == null) {
      throw new IllegalArgumentException("site is required");
    }
    synchronized (registryLock) {
      if (sites.containsKey(site.id())) {
        throw new SiteAlreadyRegisteredException(site.id(), site.url());
      }
      final PollingTask task = new PollingTask();
      site.attach(task);
      sites.put(site.id(), site);
      try {
        executor.execute(() -> poll(site, task));
      } catch (RejectedExecutionException ex) {
        sites.remove(site.id());
        throw ex;
      } finally {
        metrics.updateRegisteredSites(sites.size());
      }
    }
    logger.info(
        "site monitoring started siteId={} url={} interval={}",
        site.id(),
        site.url(),
        site.interval());
  }

  /**
   * サイトの監視を停止する。レジストリからの削除はループ終了時に行うため、戻った直後は id がまだ
   * 登録されていることがある。
   */
  public void revoke(long siteId) {
    final MonitoredSite site = sites.get(siteId);
    if (site == null) {
      logger.info("site revoke ignored because no monitoring was active siteId={}", siteId);
      return;
    }
    site.pollingTask().cancel();
    logger.info("site monitoring stopping siteId={} url={}", siteId, site.url());
  }

  public void enable(long siteId) {
    final MonitoredSite site = sites.get(siteId);
    if (site == null) {
      logger.info("site enable ignored because site is not registered siteId={}", siteId);
      return;
    }
    site.setEnabled(true);
    logger.info("site monitoring enabled siteId={} url={}", siteId, site.url());
  }

  public void disable(long siteId) {
    final MonitoredSite site = sites.get(siteId);
    if (site == null) {
      logger.info("site disable ignored because site is not registered siteId={}", siteId);
      return;
    }
    site.setEnabled(false);
    logger.info("site monitoring disabled siteId={} url={}", siteId, site.url());
  }

  public Optional<MonitoredSite> find(long siteId) {
    return Optional.ofNullable(sites.get(siteId));
  }

  public boolean isRegistered(long siteId) {
    return sites.containsKey(siteId);
  }

  public int registeredCount() {
    return sites.size();
  }

  public Set<Long> registeredIds() {
    return Set.copyOf(sites.keySet());
  }

  private void poll(MonitoredSite site, PollingTask task) {
    try {
      // チェック中に来た起床は捨てる(キューに積まない)
      while (!task.awaitCancellation(site.interval())) {
        if (!site.isEnabled()) {
          continue;
        }
        checkOnce(site);
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      logger.warn("site polling interrupted siteId={} url={}", site.id(), site.url());
    } finally {
      deregister(site);
      site.close();
      task.markDone();
      logger.info("site monitoring stopped siteId={} url={}", site.id(), site.url());
    }
  }

  @VisibleForTesting
  void checkOnce(MonitoredSite site) {
    MDC.put(MDC_SITE_ID, String.valueOf(site.id()));
    try {
      final StatusSnapshot previous = site.snapshot();
      String detail = null;
      try {
        site.check();
      } catch (SiteCheckException ex) {
        detail = ex.getMessage();
        logger.warn(
            "site check failed siteId={} url={} reason={} error={}",
            site.id(),
            site.url(),
            ex.reason(),
            ex.getMessage());
      } catch (RuntimeException ex) {
        logger.error("site check aborted unexpectedly siteId={} url={}", site.id(), site.url(), ex);
        return;
      }
      final StatusSnapshot current = site.snapshot();
      metrics.recordCheckResult(current.status());
      if (previous.status() != current.status()) {
        publish(site, previous, current, detail);
      }
    } finally {
      MDC.remove(MDC_SITE_ID);
    }
  }

  private void publish(
      MonitoredSite site, StatusSnapshot previous, StatusSnapshot current, String detail) {
    logger.info(
        "site status changed siteId={} url={} from={} to={}",
        site.id(),
        site.url(),
        previous.status(),
        current.status());
    try {
      listener.onStatusChange(site, previous, current, detail);
    } catch (RuntimeException ex) {
      logger.error("site status listener failed siteId={} url={}", site.id(), site.url(), ex);
    }
  }

  private void deregister(MonitoredSite site) {
    synchronized (registryLock) {
      sites.remove(site.id(), site);
      metrics.updateRegisteredSites(sites.size());
    }
  }

  @PreDestroy
  public void shutdown() {
    final List<MonitoredSite> active = List.copyOf(sites.values());
    for (MonitoredSite site : active) {
      site.pollingTask().cancel();
    }
    executor.shutdown();
    try {
      if (!executor.awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
        logger.warn("site polling executor did not terminate in time; interrupting");
        executor.shutdownNow();
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      executor.shutdownNow();
    }
    logger.info("site monitor shut down stoppedSites={}", active.size());
  }
}
