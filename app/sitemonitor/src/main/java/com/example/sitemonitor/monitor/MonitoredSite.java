/*
 * どこで: Monitor ドメインモデル
 * 何を: 監視エンドポイント 1 件のポリシー・監視用 HTTP クライアント・観測状態を保持する
 * なぜ: ロックと接続プールをサイトごとに持ち、サイト間で競合させないため
 */
package com.example.sitemonitor.monitor;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import okhttp3.ConnectionPool;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;

public class MonitoredSite {

  private final long id;
  private final String url;
  private final Duration interval;
  private final ClientConfig clientConfig;
  private final OkHttpClient client;
  private final Clock clock;
  private final ReadWriteLock lock = new ReentrantReadWriteLock();

  // lock で保護
  private boolean enabled = true;
  private SiteStatus status;
  private Instant statusChangedAt;

  private volatile PollingTask pollingTask;

  public MonitoredSite(long id, String url, Duration interval, ClientConfig clientConfig) {
    this(id, url, interval, clientConfig, Clock.systemUTC());
  }

  public MonitoredSite(
      long id, String url, Duration interval, ClientConfig clientConfig, Clock clock) {
    if (url == null || HttpUrl.parse(url) == null) {
      throw new IllegalArgumentException("url must be an http(s) URL: " + url);
    }
    if (interval == null || interval.isNegative() || interval.isZero()) {
      throw new IllegalArgumentException("interval must be positive");
    }
    if (clientConfig == null) {
      throw new IllegalArgumentException("clientConfig is required");
    }
    if (clock == null) {
      throw new IllegalArgumentException("clock is required");
    }
    this.id = id;
    this.url = url;
    this.interval = interval;
    this.clientConfig = clientConfig;
    this.clock = clock;
    this.client = newClient(clientConfig);
  }

  private static OkHttpClient newClient(ClientConfig config) {
    final ConnectionPool pool =
        new ConnectionPool(
            config.maxIdleConnections(),
            config.idleConnectionTimeout().toMillis(),
            TimeUnit.MILLISECONDS);
    return new OkHttpClient.Builder()
        .callTimeout(config.timeout())
        .connectionPool(pool)
        .retryOnConnectionFailure(false)
        .build();
  }

  /**
   * サイトへ GET を 1 回発行し、結果を状態として記録する。
   *
   * @throws SiteCheckException 到達できない、またはエラーコードが返った場合。送出時点で状態は更新済み
   */
  public void check() {
    final Request request = new Request.Builder().url(url).get().build();
    final int code;
    try (Response response = client.newCall(request).execute()) {
      code = response.code();
    } catch (IOException ex) {
      updateStatus(SiteStatus.ERROR);
      throw new SiteCheckException("connection error: " + describe(ex), ex);
    }
    if (code >= 400) {
      updateStatus(SiteStatus.DOWN);
      throw new SiteCheckException("HTTP error: " + code, code);
    }
    updateStatus(SiteStatus.UP);
  }

  private void updateStatus(SiteStatus next) {
    lock.writeLock().lock();
    try {
      if (status != next) {
        status = next;
        statusChangedAt = Instant.now(clock);
      }
    } finally {
      lock.writeLock().unlock();
    }
  }

  public StatusSnapshot snapshot() {
    lock.readLock().lock();
    try {
      return new StatusSnapshot(status, statusChangedAt, enabled);
    } finally {
      lock.readLock().unlock();
    }
  }

  public boolean isEnabled() {
    lock.readLock().lock();
    try {
      return enabled;
    } finally {
      lock.readLock().unlock();
    }
  }

  public void setEnabled(boolean enabled) {
    lock.writeLock().lock();
    try {
      this.enabled = enabled;
    } finally {
      lock.writeLock().unlock();
    }
  }

  void attach(PollingTask task) {
    this.pollingTask = task;
  }

  PollingTask pollingTask() {
    return pollingTask;
  }

  /** このサイトのクライアントが保持する接続を解放する。 */
  void close() {
    client.connectionPool().evictAll();
    client.dispatcher().executorService().shutdown();
  }

  private static String describe(IOException ex) {
    return ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
  }

  public long id() {
    return id;
  }

  public String url() {
    return url;
  }

  public Duration interval() {
    return interval;
  }

  public ClientConfig clientConfig() {
    return clientConfig;
  }

  @Override
  public String toString() {
    return "MonitoredSite{id=" + id + ", url=" + url + ", interval=" + interval + "}";
  }
}
