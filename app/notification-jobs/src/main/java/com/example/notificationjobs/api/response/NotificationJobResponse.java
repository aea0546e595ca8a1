/*
 * どこで: NotificationJobs API レスポンス DTO
 * 何を: 保存済みジョブ 1 件の全項目を表す
 * なぜ: 詳細 API と一覧 API で共有するため
 */
package com.example.notificationjobs.api.response;

import com.example.notificationjobs.model.NotificationJob;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Instant;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "Payload JsonNode is built per response and never mutated afterwards")
public record NotificationJobResponse(
    String jobId,
    String title,
    String body,
    JsonNode payload,
    List<String> userIds,
    boolean allUsers,
    Instant scheduledTime,
    Instant createdAt,
    String createdBy,
    int attempts,
    int maxAttempts,
    String status,
    String error,
    Instant processedAt,
    Instant nextAttemptAt) {

  public static NotificationJobResponse from(NotificationJob job, JsonNode payload) {
    return new NotificationJobResponse(
        job.jobId(),
        job.title(),
        job.body(),
        payload,
        job.target().userIds(),
        job.target().allUsers(),
        job.scheduledTime(),
        job.createdAt(),
        job.createdBy(),
        job.attempts(),
        job.maxAttempts(),
        job.status().name(),
        job.error(),
        job.processedAt(),
        job.nextAttemptAt());
  }
}
