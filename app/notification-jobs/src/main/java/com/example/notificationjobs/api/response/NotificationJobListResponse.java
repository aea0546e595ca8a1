package com.example.notificationjobs.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationJobListResponse(
    List<NotificationJobResponse> jobs, PaginationResponse pagination) {

  public NotificationJobListResponse {
    jobs = jobs == null ? List.of() : List.copyOf(jobs);
  }
}
