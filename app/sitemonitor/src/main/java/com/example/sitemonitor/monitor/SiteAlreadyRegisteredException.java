package com.example.sitemonitor.monitor;

public class SiteAlreadyRegisteredException extends RuntimeException {

  private final long siteId;

  public SiteAlreadyRegisteredException(long siteId, String url) {
    super("site " + url + " already being monitored (id=" + siteId + ")");
    this.siteId = siteId;
  }

  public long siteId() {
    return siteId;
  }
}
