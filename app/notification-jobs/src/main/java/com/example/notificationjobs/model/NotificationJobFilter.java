/*
 * どこで: NotificationJobs ドメインモデル
 * 何を: 管理 API の一覧用の任意フィルタを表す
 * なぜ: どちらのフィルタも任意で AND で組み合わせるため
 */
package com.example.notificationjobs.model;

public record NotificationJobFilter(NotificationJobStatus status, String createdBy) {

  public NotificationJobFilter {
    createdBy = createdBy == null || createdBy.isBlank() ? null : createdBy;
  }

  public static NotificationJobFilter none() {
    return new NotificationJobFilter(null, null);
  }
}
