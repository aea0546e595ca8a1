/*
 * どこで: NotificationJobs サービス層
 * 何を: 拒否された登録入力や管理入力を表す
 * なぜ: 状態を変える前に API 層で 400 へマッピングするため
 */
package com.example.notificationjobs.service;

public class InvalidNotificationJobRequestException extends RuntimeException {

  public InvalidNotificationJobRequestException(String message) {
    super(message);
  }
}
