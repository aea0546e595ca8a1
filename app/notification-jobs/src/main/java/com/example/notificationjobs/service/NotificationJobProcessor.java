/*
 * どこで: NotificationJobs サービス層
 * 何を: 1 回のポーリング tick で ready なジョブを claim し、順に送信して結果を記録する
 * なぜ: 1 回の配信試行に伴う状態遷移を 1 箇所にまとめるため
 */
package com.example.notificationjobs.service;

import com.example.notificationjobs.config.NotificationJobProcessorProperties;
import com.example.notificationjobs.model.NotificationJob;
import com.example.notificationjobs.model.NotificationJobStatus;
import com.example.notificationjobs.repository.NotificationJobRepository;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

@Service
public class NotificationJobProcessor {

  static final String MDC_JOB_ID = "job_id";

  private static final Logger logger = LoggerFactory.getLogger(NotificationJobProcessor.class);
  private static final String UNKNOWN_ERROR = "unknown error";

  private final NotificationJobRepository repository;
  private final NotificationSender sender;
  private final NotificationJobRetryPolicy retryPolicy;
  private final NotificationJobProcessorProperties properties;
  private final NotificationJobMetrics metrics;
  private final Clock clock;
  private final AtomicBoolean inFlight = new AtomicBoolean(false);

  public NotificationJobProcessor(
      NotificationJobRepository repository,
      NotificationSender sender,
      NotificationJobRetryPolicy retryPolicy,
      NotificationJobProcessorProperties properties,
      NotificationJobMetrics metrics,
      Clock clock) {
    this.repository = repository;
    this.sender = sender;
    this.retryPolicy = retryPolicy;
    this.properties = properties;
    this.metrics = metrics;
    this.clock = clock;
  }

  /**
   * 1 tick を実行する。このインスタンスで前の tick が実行中ならストアに触れずスキップ結果を返す。
   * ストアの例外は呼び出し側へ伝播する。
   */
  public TickResult processTick() {
    if (!inFlight.compareAndSet(false, true)) {
      logger.debug("notification job tick skipped because previous tick is still running");
      return TickResult.skippedTick();
    }
    try {
      return runTick();
    } finally {
      inFlight.set(false);
    }
  }

  private TickResult runTick() {
    final Instant now = Instant.now(clock);
    final List<NotificationJob> ready =
        properties.atomicClaim()
            ? repository.claimReady(properties.batchSize(), now)
            : repository.findReady(properties.batchSize(), now);
    if (ready.isEmpty()) {
      return new TickResult(false, 0, 0, 0, 0, 0);
    }
    logger.info("notification job tick claimed count={}", ready.size());

    int completed = 0;
    int retried = 0;
    int failed = 0;
    int abandoned = 0;
    for (NotificationJob candidate : ready) {
      final Optional<NotificationJob> claimed = acquire(candidate, now);
      if (claimed.isEmpty()) {
        abandoned++;
        continue;
      }
      switch (deliver(claimed.get())) {
        case COMPLETED -> completed++;
        case PENDING -> retried++;
        case FAILED -> failed++;
        default -> abandoned++;
      }
    }
    return new TickResult(false, ready.size(), completed, retried, failed, abandoned);
  }

  private Optional<NotificationJob> acquire(NotificationJob candidate, Instant now) {
    if (properties.atomicClaim()) {
      // claimReady で既に PROCESSING へ遷移済み
      return Optional.of(candidate);
    }
    if (repository.markProcessing(candidate.jobId(), now) == 0) {
      logger.info(
          "notification job no longer claimable id={} status={}",
          candidate.jobId(),
          candidate.status());
      return Optional.empty();
    }
    return Optional.of(candidate.asProcessing());
  }

  /** 保存行の最終状態を返す。行が奪われていた場合は CANCELLED。 */
  private NotificationJobStatus deliver(NotificationJob job) {
    MDC.put(MDC_JOB_ID, job.jobId());
    try {
      try {
        sender.send(job);
      } catch (RuntimeException ex) {
        return handleFailure(job, ex);
      }
      final int updated = repository.markCompleted(job.jobId(), Instant.now(clock));
      if (updated == 0) {
        logger.warn("notification job delivered but no longer processing id={}", job.jobId());
        metrics.recordDeliveryResult(NotificationJobMetrics.RESULT_ABANDONED);
        return NotificationJobStatus.CANCELLED;
      }
      metrics.recordDeliveryResult(NotificationJobMetrics.RESULT_COMPLETED);
      logger.info("notification job completed id={} attempt={}", job.jobId(), job.attempts());
      return NotificationJobStatus.COMPLETED;
    } finally {
      MDC.remove(MDC_JOB_ID);
    }
  }

  @VisibleForTesting
  NotificationJobStatus handleFailure(NotificationJob job, RuntimeException ex) {
    final Instant now = Instant.now(clock);
    final NotificationJobStatus expected =
        retryPolicy.statusAfterFailure(job.attempts(), job.maxAttempts());
    final Instant nextAttemptAt =
        expected == NotificationJobStatus.PENDING
            ? retryPolicy.nextAttemptAt(now, job.attempts())
            : null;
    final Optional<NotificationJobStatus> outcome =
        repository.markFailed(job.jobId(), truncateError(ex.getMessage()), now, nextAttemptAt);
    if (outcome.isEmpty()) {
      logger.warn(
          "notification job failed but no longer processing id={} attempt={}",
          job.jobId(),
          job.attempts(),
          ex);
      metrics.recordDeliveryResult(NotificationJobMetrics.RESULT_ABANDONED);
      return NotificationJobStatus.CANCELLED;
    }
    if (outcome.get() == NotificationJobStatus.FAILED) {
      logger.warn(
          "notification job failed permanently id={} attempts={}/{}",
          job.jobId(),
          job.attempts(),
          job.maxAttempts(),
          ex);
      metrics.recordDeliveryResult(NotificationJobMetrics.RESULT_FAILED);
      return NotificationJobStatus.FAILED;
    }
    logger.warn(
        "notification job will retry id={} attempt={}/{} nextAttemptAt={}",
        job.jobId(),
        job.attempts(),
        job.maxAttempts(),
        nextAttemptAt,
        ex);
    metrics.recordDeliveryResult(NotificationJobMetrics.RESULT_RETRY);
    return NotificationJobStatus.PENDING;
  }

  @VisibleForTesting
  String truncateError(String message) {
    if (message == null) {
      return UNKNOWN_ERROR;
    }
    final int maxLength = properties.errorMessageMaxLength();
    if (message.length() <= maxLength) {
      return message;
    }
    return message.substring(0, maxLength);
  }
}
