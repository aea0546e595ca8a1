/*
 * どこで: NotificationJobs API リクエスト DTO
 * 何を: 一括キャンセル API の入力を表す
 * なぜ: 1 回の呼び出しでキャンセルできる件数を制限するため
 */
package com.example.notificationjobs.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "API DTO record is only read to drive the cancel loop")
public record CancelNotificationJobsRequest(@NotEmpty @Size(max = 50) List<@NotBlank String> jobIds) {}
