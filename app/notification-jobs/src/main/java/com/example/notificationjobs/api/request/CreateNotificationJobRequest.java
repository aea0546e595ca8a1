/*
 * どこで: NotificationJobs API リクエスト DTO
 * 何を: 通知予約 API の入力を表す
 * なぜ: 形式とサイズの制約をキューに届く前に適用するため
 */
package com.example.notificationjobs.api.request;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Future;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.List;
import org.hibernate.validator.constraints.URL;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "API DTO record is only read once to build the job")
public record CreateNotificationJobRequest(
    @NotBlank @Size(max = 100) String title,
    @NotBlank @Size(max = 300) String body,
    @URL @Size(max = 2048) String icon,
    @URL @Size(max = 2048) String badge,
    @URL @Size(max = 2048) String image,
    JsonNode data,
    @Size(max = 3) List<@Valid NotificationActionRequest> actions,
    @Size(max = 64) String tag,
    Boolean requireInteraction,
    Boolean silent,
    @Size(max = 31) List<@NotNull @Min(0) @Max(10000) Integer> vibrate,
    @Size(max = 1000) List<@NotBlank String> userIds,
    Boolean allUsers,
    @NotNull @Future Instant scheduledTime,
    @Min(1) @Max(10) Integer maxAttempts) {

  @JsonIgnore
  @AssertTrue(message = "exactly one of user_ids or all_users must be set")
  public boolean isTargetValid() {
    final boolean hasUsers = userIds != null && !userIds.isEmpty();
    final boolean broadcast = Boolean.TRUE.equals(allUsers);
    return hasUsers != broadcast;
  }
}
