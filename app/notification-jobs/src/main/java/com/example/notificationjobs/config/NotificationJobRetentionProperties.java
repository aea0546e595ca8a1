/*
 * どこで: NotificationJobs 設定バインド
 * 何を: janitor の実行間隔と保持期間の設定を保持する
 * なぜ: 保持ポリシーと掃除頻度を環境ごとに調整できるようにするため
 */
package com.example.notificationjobs.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.jobs.retention")
@Validated
public record NotificationJobRetentionProperties(
    boolean enabled,
    @Min(0) int retentionDays,
    @Min(0) int maxRetentionDays,
    @NotNull Duration cleanupInterval) {

  @AssertTrue(message = "notification.jobs.retention.retention-days must not exceed max-retention-days")
  public boolean isRetentionDaysWithinMax() {
    return retentionDays <= maxRetentionDays;
  }

  @AssertTrue(message = "notification.jobs.retention.cleanup-interval must be positive")
  public boolean isCleanupIntervalPositive() {
    return cleanupInterval != null && !cleanupInterval.isZero() && !cleanupInterval.isNegative();
  }
}
