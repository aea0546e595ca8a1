package com.example.notificationjobs.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CancelNotificationJobsResponse(
    List<CancelNotificationJobResponse> results, int cancelledCount) {

  public CancelNotificationJobsResponse {
    results = results == null ? List.of() : List.copyOf(results);
  }
}
