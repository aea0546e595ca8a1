package com.example.notificationjobs.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PaginationResponse(long total, int limit, int offset, boolean hasMore) {

  public static PaginationResponse of(long total, int limit, int offset, int returned) {
    return new PaginationResponse(total, limit, offset, (long) offset + returned < total);
  }
}
