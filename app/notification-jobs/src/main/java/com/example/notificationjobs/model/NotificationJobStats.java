package com.example.notificationjobs.model;

import java.util.Map;

public record NotificationJobStats(
    long pending, long processing, long completed, long failed, long cancelled, long total) {

  public static NotificationJobStats fromCounts(Map<NotificationJobStatus, Long> counts) {
    final long pending = counts.getOrDefault(NotificationJobStatus.PENDING, 0L);
    final long processing = counts.getOrDefault(NotificationJobStatus.PROCESSING, 0L);
    final long completed = counts.getOrDefault(NotificationJobStatus.COMPLETED, 0L);
    final long failed = counts.getOrDefault(NotificationJobStatus.FAILED, 0L);
    final long cancelled = counts.getOrDefault(NotificationJobStatus.CANCELLED, 0L);
    return new NotificationJobStats(
        pending,
        processing,
        completed,
        failed,
        cancelled,
        pending + processing + completed + failed + cancelled);
  }
}
