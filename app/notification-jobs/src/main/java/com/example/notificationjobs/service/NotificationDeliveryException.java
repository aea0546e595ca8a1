/*
 * どこで: NotificationJobs サービス層
 * 何を: 下流の送信エンドポイントへの受け渡し失敗を表す
 * なぜ: 失敗理由をジョブの error 列と配信メトリクスに残すため
 */
package com.example.notificationjobs.service;

public class NotificationDeliveryException extends RuntimeException {

  public enum Reason {
    REJECTED,
    TIMEOUT,
    BAD_GATEWAY,
    INVALID_PAYLOAD
  }

  private final Reason reason;

  public NotificationDeliveryException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public NotificationDeliveryException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
