/*
 * どこで: NotificationJobs サービス層
 * 何を: 登録契約と運用向けの統計/一覧/キャンセル/クリーンアップを提供する
 * なぜ: API と janitor が通る単一の入口とし、新しい仕事で processor を起こすため
 */
package com.example.notificationjobs.service;

import com.example.notificationjobs.config.NotificationJobQueueProperties;
import com.example.notificationjobs.config.NotificationJobRetentionProperties;
import com.example.notificationjobs.model.NewNotificationJob;
import com.example.notificationjobs.model.NotificationJob;
import com.example.notificationjobs.model.NotificationJobFilter;
import com.example.notificationjobs.model.NotificationJobPage;
import com.example.notificationjobs.model.NotificationJobStats;
import com.example.notificationjobs.model.NotificationJobStatus;
import com.example.notificationjobs.model.ProcessorStatus;
import com.example.notificationjobs.repository.NotificationJobRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationJobQueueService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationJobQueueService.class);
  private static final Duration DAILY_CAP_WINDOW = Duration.ofHours(24);
  private static final String EMPTY_PAYLOAD = "{}";

  private final NotificationJobRepository repository;
  private final NotificationJobProcessorController processorController;
  private final NotificationJobIdGenerator idGenerator;
  private final NotificationJobQueueProperties queueProperties;
  private final NotificationJobRetentionProperties retentionProperties;
  private final NotificationJobMetrics metrics;
  private final Clock clock;

  /**
   * PENDING のジョブを保存し processor に通知する。検証するのは入力の形だけで、
   * 過去の予定時刻は次の tick で対象になるだけとする。
   *
   * @throws InvalidNotificationJobRequestException 必須項目の欠落や試行回数が範囲外の場合
   * @throws NotificationJobQuotaExceededException 直近 24 時間の上限に達した場合
   */
  public String addJob(NewNotificationJob request) {
    validate(request);
    final int maxAttempts = resolveMaxAttempts(request.maxAttempts());
    final Instant now = Instant.now(clock);
    enforceDailyCap(now);

    final NotificationJob job =
        new NotificationJob(
            idGenerator.newJobId(),
            request.title(),
            request.body(),
            request.payloadJson() == null ? EMPTY_PAYLOAD : request.payloadJson(),
            request.target(),
            request.scheduledTime(),
            now,
            request.createdBy(),
            0,
            maxAttempts,
            NotificationJobStatus.PENDING,
            null,
            null,
            null);
    final String jobId = repository.insert(job);
    logger.info(
        "notification job added id={} scheduledTime={} createdBy={} maxAttempts={}",
        jobId,
        job.scheduledTime(),
        job.createdBy(),
        maxAttempts);
    processorController.onJobAdded(job);
    return jobId;
  }

  /** この呼び出しで CANCELLED に遷移した場合のみ {@code true}。 */
  public boolean cancelJob(String jobId) {
    final boolean cancelled = repository.cancel(jobId, Instant.now(clock)) > 0;
    if (cancelled) {
      logger.info("notification job cancelled id={}", jobId);
    }
    return cancelled;
  }

  public NotificationJob getJob(String jobId) {
    return repository.findById(jobId).orElseThrow(() -> new NotificationJobNotFoundException(jobId));
  }

  public NotificationJobStats getStats() {
    final NotificationJobStats stats = NotificationJobStats.fromCounts(repository.countByStatus());
    metrics.updateBacklogCurrent(stats.pending());
    return stats;
  }

  public NotificationJobPage listJobs(NotificationJobFilter filter, int limit, int offset) {
    if (limit < 1) {
      throw new InvalidNotificationJobRequestException("limit must be positive");
    }
    if (offset < 0) {
      throw new InvalidNotificationJobRequestException("offset must not be negative");
    }
    final NotificationJobFilter effective = filter == null ? NotificationJobFilter.none() : filter;
    final List<NotificationJob> jobs = repository.findPage(effective, limit, offset);
    return new NotificationJobPage(jobs, repository.countMatching(effective));
  }

  /**
   * {@code retentionDays} 日より前に処理を終えた終端状態のジョブを削除する。
   *
   * @throws InvalidNotificationJobRequestException 日数が 0..max-retention-days の範囲外の場合
   */
  public int cleanup(int retentionDays) {
    if (retentionDays < 0 || retentionDays > retentionProperties.maxRetentionDays()) {
      throw new InvalidNotificationJobRequestException(
          "retention days must be between 0 and " + retentionProperties.maxRetentionDays());
    }
    final Instant threshold = Instant.now(clock).minus(Duration.ofDays(retentionDays));
    final int deleted = repository.deleteTerminalProcessedBefore(threshold);
    metrics.recordCleanupDeleted(deleted);
    logger.info(
        "notification job cleanup deleted count={} retentionDays={} threshold={}",
        deleted,
        retentionDays,
        threshold);
    return deleted;
  }

  public ProcessorStatus getProcessorStatus() {
    return processorController.status();
  }

  private void validate(NewNotificationJob request) {
    if (request == null) {
      throw new InvalidNotificationJobRequestException("job is required");
    }
    requireText(request.title(), "title");
    requireText(request.body(), "body");
    requireText(request.createdBy(), "createdBy");
    if (request.target() == null) {
      throw new InvalidNotificationJobRequestException("target is required");
    }
    if (request.scheduledTime() == null) {
      throw new InvalidNotificationJobRequestException("scheduledTime is required");
    }
  }

  private int resolveMaxAttempts(Integer requested) {
    if (requested == null) {
      return queueProperties.defaultMaxAttempts();
    }
    if (requested < 1 || requested > queueProperties.maxAttemptsLimit()) {
      throw new InvalidNotificationJobRequestException(
          "maxAttempts must be between 1 and " + queueProperties.maxAttemptsLimit());
    }
    return requested;
  }

  private void enforceDailyCap(Instant now) {
    final int dailyCap = queueProperties.dailyCap();
    if (dailyCap <= 0) {
      return;
    }
    final long recent = repository.countCreatedSince(now.minus(DAILY_CAP_WINDOW));
    if (recent >= dailyCap) {
      logger.warn("notification job daily cap reached count={} cap={}", recent, dailyCap);
      throw new NotificationJobQuotaExceededException(dailyCap);
    }
  }

  private static void requireText(String value, String field) {
    if (value == null || value.isBlank()) {
      throw new InvalidNotificationJobRequestException(field + " is required");
    }
  }
}
