/*
 * どこで: NotificationJobs 設定バインド
 * 何を: 登録時の既定値と上限 (試行回数、日次上限) を保持する
 * なぜ: 呼び出し側が指定できるリトライ回数を制限し、登録量を抑えるため
 */
package com.example.notificationjobs.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * @param dailyCap 直近 24 時間に作成できるジョブの上限。{@code 0} で無効
 */
@ConfigurationProperties(prefix = "notification.jobs.queue")
@Validated
public record NotificationJobQueueProperties(
    @Positive int defaultMaxAttempts, @Positive int maxAttemptsLimit, @Min(0) int dailyCap) {

  @AssertTrue(message = "notification.jobs.queue.default-max-attempts must not exceed max-attempts-limit")
  public boolean isDefaultWithinLimit() {
    return defaultMaxAttempts <= maxAttemptsLimit;
  }
}
