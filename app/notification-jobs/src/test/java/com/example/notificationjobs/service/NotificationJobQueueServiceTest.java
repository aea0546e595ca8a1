/*
 * どこで: NotificationJobs キューサービス単体テスト
 * 何を: 登録時の既定値と上限、日次上限、キャンセルの冪等性、クリーンアップの範囲チェックを検証する
 * なぜ: 不正な入力をストアに届く前に拒否するため
 */
package com.example.notificationjobs.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.notificationjobs.config.NotificationJobQueueProperties;
import com.example.notificationjobs.config.NotificationJobRetentionProperties;
import com.example.notificationjobs.model.NewNotificationJob;
import com.example.notificationjobs.model.NotificationJob;
import com.example.notificationjobs.model.NotificationJobFilter;
import com.example.notificationjobs.model.NotificationJobPage;
import com.example.notificationjobs.model.NotificationJobStats;
import com.example.notificationjobs.model.NotificationJobStatus;
import com.example.notificationjobs.model.NotificationTarget;
import com.example.notificationjobs.repository.NotificationJobRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class NotificationJobQueueServiceTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-01-17T00:00:00Z");
  private static final NotificationJobRetentionProperties RETENTION =
      new NotificationJobRetentionProperties(true, 30, 365, Duration.ofHours(24));

  @Mock private NotificationJobRepository repository;
  @Mock private NotificationJobProcessorController processorController;
  @Mock private NotificationJobIdGenerator idGenerator;
  @Mock private NotificationJobMetrics metrics;

  private NotificationJobQueueService service;

  @BeforeEach
  void setUp() {
    service = newService(0);
  }

  @Test
  void addJobStoresPendingJobWithDefaultsAndWakesProcessor() {
    when(idGenerator.newJobId()).thenReturn("notif_1_abc");
    when(repository.insert(any())).thenReturn("notif_1_abc");

    final String jobId = service.addJob(request(null));

    assertThat(jobId).isEqualTo("notif_1_abc");
    final ArgumentCaptor<NotificationJob> captor = ArgumentCaptor.forClass(NotificationJob.class);
    verify(repository).insert(captor.capture());
    final NotificationJob stored = captor.getValue();
    assertThat(stored.status()).isEqualTo(NotificationJobStatus.PENDING);
    assertThat(stored.attempts()).isZero();
    assertThat(stored.maxAttempts()).isEqualTo(3);
    assertThat(stored.createdAt()).isEqualTo(FIXED_NOW);
    assertThat(stored.payloadJson()).isEqualTo("{}");
    assertThat(stored.processedAt()).isNull();
    verify(processorController).onJobAdded(stored);
  }

  @Test
  void addJobKeepsRequestedMaxAttempts() {
    when(idGenerator.newJobId()).thenReturn("notif_1_abc");
    when(repository.insert(any())).thenReturn("notif_1_abc");

    service.addJob(request(10));

    final ArgumentCaptor<NotificationJob> captor = ArgumentCaptor.forClass(NotificationJob.class);
    verify(repository).insert(captor.capture());
    assertThat(captor.getValue().maxAttempts()).isEqualTo(10);
  }

  @Test
  void addJobRejectsMaxAttemptsOutsideLimit() {
    assertThatThrownBy(() -> service.addJob(request(0)))
        .isInstanceOf(InvalidNotificationJobRequestException.class);
    assertThatThrownBy(() -> service.addJob(request(11)))
        .isInstanceOf(InvalidNotificationJobRequestException.class);
    verifyNoInteractions(repository, processorController);
  }

  @Test
  void addJobRejectsMissingFields() {
    final NewNotificationJob noTitle =
        new NewNotificationJob(
            " ", "body", null, NotificationTarget.broadcast(), FIXED_NOW, "admin-1", null);
    final NewNotificationJob noSchedule =
        new NewNotificationJob(
            "title", "body", null, NotificationTarget.broadcast(), null, "admin-1", null);

    assertThatThrownBy(() -> service.addJob(noTitle))
        .isInstanceOf(InvalidNotificationJobRequestException.class)
        .hasMessageContaining("title");
    assertThatThrownBy(() -> service.addJob(noSchedule))
        .isInstanceOf(InvalidNotificationJobRequestException.class)
        .hasMessageContaining("scheduledTime");
    verifyNoInteractions(repository);
  }

  @Test
  void addJobAcceptsPastScheduledTime() {
    when(idGenerator.newJobId()).thenReturn("notif_1_abc");
    when(repository.insert(any())).thenReturn("notif_1_abc");
    final NewNotificationJob past =
        new NewNotificationJob(
            "title",
            "body",
            "{}",
            NotificationTarget.broadcast(),
            FIXED_NOW.minus(Duration.ofDays(1)),
            "admin-1",
            null);

    assertThat(service.addJob(past)).isEqualTo("notif_1_abc");
  }

  @Test
  void addJobRejectsWhenDailyCapReached() {
    service = newService(2);
    when(repository.countCreatedSince(FIXED_NOW.minus(Duration.ofHours(24)))).thenReturn(2L);

    assertThatThrownBy(() -> service.addJob(request(null)))
        .isInstanceOf(NotificationJobQuotaExceededException.class);
    verify(repository, never()).insert(any());
  }

  @Test
  void addJobAllowedBelowDailyCap() {
    service = newService(2);
    when(repository.countCreatedSince(FIXED_NOW.minus(Duration.ofHours(24)))).thenReturn(1L);
    when(idGenerator.newJobId()).thenReturn("notif_1_abc");
    when(repository.insert(any())).thenReturn("notif_1_abc");

    assertThat(service.addJob(request(null))).isEqualTo("notif_1_abc");
  }

  @Test
  void cancelJobReturnsTrueOnlyWhenRowChanged() {
    when(repository.cancel("job-1", FIXED_NOW)).thenReturn(1).thenReturn(0);

    assertThat(service.cancelJob("job-1")).isTrue();
    assertThat(service.cancelJob("job-1")).isFalse();
  }

  @Test
  void getJobThrowsWhenMissing() {
    when(repository.findById("missing")).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.getJob("missing"))
        .isInstanceOf(NotificationJobNotFoundException.class)
        .hasMessageContaining("missing");
  }

  @Test
  void getStatsFillsMissingStatusesAndUpdatesBacklog() {
    when(repository.countByStatus())
        .thenReturn(
            Map.of(NotificationJobStatus.PENDING, 4L, NotificationJobStatus.COMPLETED, 6L));

    final NotificationJobStats stats = service.getStats();

    assertThat(stats).isEqualTo(new NotificationJobStats(4, 0, 6, 0, 0, 10));
    verify(metrics).updateBacklogCurrent(4L);
  }

  @Test
  void listJobsReturnsPageAndTotal() {
    final NotificationJobFilter filter = new NotificationJobFilter(NotificationJobStatus.FAILED, null);
    when(repository.findPage(filter, 20, 40)).thenReturn(List.of());
    when(repository.countMatching(filter)).thenReturn(41L);

    final NotificationJobPage page = service.listJobs(filter, 20, 40);

    assertThat(page.jobs()).isEmpty();
    assertThat(page.total()).isEqualTo(41L);
  }

  @Test
  void cleanupRejectsNegativeRetentionAndDeletesNothing() {
    assertThatThrownBy(() -> service.cleanup(-1))
        .isInstanceOf(InvalidNotificationJobRequestException.class);
    assertThatThrownBy(() -> service.cleanup(366))
        .isInstanceOf(InvalidNotificationJobRequestException.class);
    verifyNoInteractions(repository);
  }

  @Test
  void cleanupDeletesTerminalJobsOlderThanWindow() {
    when(repository.deleteTerminalProcessedBefore(FIXED_NOW.minus(Duration.ofDays(30))))
        .thenReturn(7);

    assertThat(service.cleanup(30)).isEqualTo(7);
    verify(metrics).recordCleanupDeleted(7);
  }

  private NotificationJobQueueService newService(int dailyCap) {
    return new NotificationJobQueueService(
        repository,
        processorController,
        idGenerator,
        new NotificationJobQueueProperties(3, 10, dailyCap),
        RETENTION,
        metrics,
        Clock.fixed(FIXED_NOW, ZoneOffset.UTC));
  }

  private static NewNotificationJob request(Integer maxAttempts) {
    return new NewNotificationJob(
        "Maintenance",
        "Servers restart at 02:00",
        null,
        NotificationTarget.users(List.of("user-1")),
        FIXED_NOW.plus(Duration.ofHours(1)),
        "admin-1",
        maxAttempts);
  }
}
