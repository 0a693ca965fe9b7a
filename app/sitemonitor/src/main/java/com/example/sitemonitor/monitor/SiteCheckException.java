/*
 * どこで: Monitor 死活チェック
 * 何を: 正常なエンドポイントを観測できなかった 1 回のチェックを表す
 * なぜ: ポーリングループが理由ごとにログを出し、停止せずに継続するため
 */
package com.example.sitemonitor.monitor;

public class SiteCheckException extends RuntimeException {

  public enum Reason {
    TRANSPORT_FAILURE,
    UNHEALTHY_RESPONSE
  }

  private final Reason reason;
  private final int statusCode;

  public SiteCheckException(String message, Throwable cause) {
    super(message, cause);
    this.reason = Reason.TRANSPORT_FAILURE;
    this.statusCode = -1;
  }

  public SiteCheckException(String message, int statusCode) {
    super(message);
    this.reason = Reason.UNHEALTHY_RESPONSE;
    this.statusCode = statusCode;
  }

  public Reason reason() {
    return reason;
  }

  /** {@link Reason#UNHEALTHY_RESPONSE} の HTTP ステータスコード。それ以外は {@code -1}。 */
  public int statusCode() {
    return statusCode;
  }
}
