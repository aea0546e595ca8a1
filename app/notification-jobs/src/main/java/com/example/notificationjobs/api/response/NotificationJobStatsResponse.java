package com.example.notificationjobs.api.response;

import com.example.notificationjobs.model.NotificationJobStats;

public record NotificationJobStatsResponse(
    long pending, long processing, long completed, long failed, long cancelled, long total) {

  public static NotificationJobStatsResponse from(NotificationJobStats stats) {
    return new NotificationJobStatsResponse(
        stats.pending(),
        stats.processing(),
        stats.completed(),
        stats.failed(),
        stats.cancelled(),
        stats.total());
  }
}
