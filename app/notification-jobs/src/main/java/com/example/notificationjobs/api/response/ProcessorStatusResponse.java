/*
 * どこで: NotificationJobs API レスポンス DTO
 * 何を: 運用者向けの processor ライフサイクル状態を表す
 * なぜ: このプロセスの値のみを返し、他レプリカは各自のループを報告するため
 */
package com.example.notificationjobs.api.response;

import com.example.notificationjobs.model.ProcessorStatus;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ProcessorStatusResponse(
    boolean running,
    long intervalMs,
    int idleTicks,
    int idleStopTicks,
    boolean startOnDemand,
    Instant lastTickAt,
    Instant lastProcessedAt,
    String lastError) {

  public static ProcessorStatusResponse from(ProcessorStatus status) {
    return new ProcessorStatusResponse(
        status.running(),
        status.intervalMillis(),
        status.idleTicks(),
        status.idleStopTicks(),
        status.startOnDemand(),
        status.lastTickAt(),
        status.lastProcessedAt(),
        status.lastError());
  }
}
