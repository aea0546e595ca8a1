/*
 * どこで: NotificationJobs 設定バインド
 * 何を: processor のポーリング/バッチ/アイドル自動停止/リトライ設定を保持する
 * なぜ: 運用パラメータをコード外に置き、起動時に検証するため
 */
package com.example.notificationjobs.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.jobs.processor")
@Validated
public record NotificationJobProcessorProperties(
    boolean enabled,
    @NotNull Duration pollInterval,
    @Positive int batchSize,
    @Positive int idleStopTicks,
    boolean startOnBoot,
    boolean startOnDemand,
    boolean atomicClaim,
    @Positive int errorMessageMaxLength,
    @NotNull Duration retryBackoffBase,
    @NotNull Duration retryBackoffMax,
    @DecimalMin("1.0") double retryBackoffMultiplier) {

  @AssertTrue(message = "notification.jobs.processor.poll-interval must be positive")
  public boolean isPollIntervalPositive() {
    return pollInterval != null && !pollInterval.isZero() && !pollInterval.isNegative();
  }

  @AssertTrue(message = "notification.jobs.processor.retry-backoff-base must not be negative")
  public boolean isRetryBackoffBaseNonNegative() {
    // 0 はバックオフ無効で、失敗したジョブは次のポーリングで再試行する
    return retryBackoffBase != null && !retryBackoffBase.isNegative();
  }

  @AssertTrue(
      message = "notification.jobs.processor.retry-backoff-max must not be below retry-backoff-base")
  public boolean isRetryBackoffMaxConsistent() {
    return retryBackoffBase == null
        || retryBackoffMax == null
        || retryBackoffMax.compareTo(retryBackoffBase) >= 0;
  }
}
