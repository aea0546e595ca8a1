/*
 * どこで: NotificationJobs サービス層
 * 何を: 配信試行の失敗後に適用するリトライ規則
 * なぜ: 試行回数は固定上限とし、試行間のバックオフは設定で有効化するため
 */
package com.example.notificationjobs.service;

import com.example.notificationjobs.config.NotificationJobProcessorProperties;
import com.example.notificationjobs.model.NotificationJobStatus;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class NotificationJobRetryPolicy {

  private final NotificationJobProcessorProperties properties;

  /**
   * 試行失敗後にジョブが遷移する状態。
   *
   * @param attempts 直前に失敗した試行を含む試行回数
   */
  public NotificationJobStatus statusAfterFailure(int attempts, int maxAttempts) {
    return attempts < maxAttempts ? NotificationJobStatus.PENDING : NotificationJobStatus.FAILED;
  }

  /**
   * ジョブを再取得できる最も早い時刻。{@code null} なら次のポーリングで再試行する。
   *
   * @param attempts 直前に失敗した試行を含む試行回数
   */
  public Instant nextAttemptAt(Instant now, int attempts) {
    final Duration backoff = computeBackoff(attempts);
    return backoff.isZero() ? null : now.plus(backoff);
  }

  Duration computeBackoff(int attempts) {
    final Duration base = properties.retryBackoffBase();
    if (base.isZero() || attempts < 1) {
      return Duration.ZERO;
    }
    final double exp =
        base.toMillis() * Math.pow(properties.retryBackoffMultiplier(), attempts - 1);
    final double capped = Math.min(exp, properties.retryBackoffMax().toMillis());
    return Duration.ofMillis((long) Math.ceil(capped));
  }
}
