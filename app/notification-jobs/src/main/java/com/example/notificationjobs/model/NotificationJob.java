/*
 * どこで: NotificationJobs ドメインモデル
 * 何を: notification_jobs テーブル 1 行のスナップショットを表す
 * なぜ: ストア/processor/管理 API で共有するため
 */
package com.example.notificationjobs.model;

import java.time.Instant;

public record NotificationJob(
    String jobId,
    String title,
    String body,
    String payloadJson,
    NotificationTarget target,
    Instant scheduledTime,
    Instant createdAt,
    String createdBy,
    int attempts,
    int maxAttempts,
    NotificationJobStatus status,
    String error,
    Instant processedAt,
    Instant nextAttemptAt) {

  /** ready なジョブを claim する WHERE 句と同じ条件。 */
  public boolean isEligible(Instant now) {
    return status == NotificationJobStatus.PENDING
        && !scheduledTime.isAfter(now)
        && attempts < maxAttempts
        && (nextAttemptAt == null || !nextAttemptAt.isAfter(now));
  }

  /** 保存行に markProcessing が成功した直後の状態。 */
  public NotificationJob asProcessing() {
    return new NotificationJob(
        jobId,
        title,
        body,
        payloadJson,
        target,
        scheduledTime,
        createdAt,
        createdBy,
        attempts + 1,
        maxAttempts,
        NotificationJobStatus.PROCESSING,
        error,
        processedAt,
        nextAttemptAt);
  }
}
