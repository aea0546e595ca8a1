/*
 * どこで: NotificationJobs サービス層
 * 何を: 直近 24 時間の上限に達したため登録を拒否したことを表す
 * なぜ: 429 にマッピングして呼び出し側に待機させるため
 */
package com.example.notificationjobs.service;

public class NotificationJobQuotaExceededException extends RuntimeException {

  private final int dailyCap;

  public NotificationJobQuotaExceededException(int dailyCap) {
    super("daily notification job limit reached: " + dailyCap);
    this.dailyCap = dailyCap;
  }

  public int dailyCap() {
    return dailyCap;
  }
}
