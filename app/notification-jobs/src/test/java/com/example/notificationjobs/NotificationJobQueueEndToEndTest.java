/*
 * どこで: NotificationJobs end-to-end テスト
 * 何を: 登録/tick/リトライ/キャンセル/クリーンアップを Postgres と操作可能な Clock で通しで検証する
 * なぜ: 試行回数の上限とキャンセルの意味は SQL ガードと processor の組み合わせで決まるため
 */
package com.example.notificationjobs;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import com.example.notificationjobs.model.NewNotificationJob;
import com.example.notificationjobs.model.NotificationJob;
import com.example.notificationjobs.model.NotificationJobStats;
import com.example.notificationjobs.model.NotificationJobStatus;
import com.example.notificationjobs.model.NotificationTarget;
import com.example.notificationjobs.repository.NotificationJobRepository;
import com.example.notificationjobs.service.InvalidNotificationJobRequestException;
import com.example.notificationjobs.service.NotificationJobProcessor;
import com.example.notificationjobs.service.NotificationJobQueueService;
import com.example.notificationjobs.service.NotificationSender;
import com.example.notificationjobs.service.TickResult;
import com.example.notificationjobs.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

@SpringBootTest
@ActiveProfiles("test")
class NotificationJobQueueEndToEndTest extends AbstractPostgresContainerTest {

  private static final Instant BASE_TIME = Instant.parse("2026-01-17T00:00:00Z");

  @Autowired private NotificationJobQueueService queueService;
  @Autowired private NotificationJobProcessor processor;
  @Autowired private NotificationJobRepository repository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;
  @Autowired private MutableClock clock;

  @MockitoBean private NotificationSender sender;

  @BeforeEach
  void setUp() {
    jdbcTemplate.update("DELETE FROM notification_jobs", new MapSqlParameterSource());
    clock.setInstant(BASE_TIME);
  }

  @Test
  void alwaysFailingDeliveryExhaustsBudget() {
    doThrow(new IllegalStateException("push endpoint down")).when(sender).send(any());
    final String jobId = queueService.addJob(job(BASE_TIME, 3));

    for (int tick = 1; tick <= 3; tick++) {
      final TickResult result = processor.processTick();
      assertThat(result.claimed()).isEqualTo(1);
      final NotificationJob stored = repository.findById(jobId).orElseThrow();
      assertThat(stored.attempts()).isEqualTo(tick);
      assertThat(stored.attempts()).isLessThanOrEqualTo(stored.maxAttempts());
    }

    final NotificationJob failed = repository.findById(jobId).orElseThrow();
    assertThat(failed.status()).isEqualTo(NotificationJobStatus.FAILED);
    assertThat(failed.attempts()).isEqualTo(3);
    assertThat(failed.error()).isEqualTo("push endpoint down");
    assertThat(failed.processedAt()).isEqualTo(BASE_TIME);

    // FAILED は終端のため以降の tick は何も拾わない
    assertThat(processor.processTick().isIdle()).isTrue();
    assertThat(repository.findById(jobId).orElseThrow().attempts()).isEqualTo(3);
  }

  @Test
  void futureJobIsNotClaimedEarly() {
    final String jobId = queueService.addJob(job(BASE_TIME.plus(Duration.ofHours(1)), 3));

    assertThat(processor.processTick().claimed()).isZero();

    clock.advance(Duration.ofHours(1).plusMillis(1));
    final TickResult result = processor.processTick();

    assertThat(result.claimed()).isEqualTo(1);
    assertThat(result.completed()).isEqualTo(1);
    final NotificationJob completed = repository.findById(jobId).orElseThrow();
    assertThat(completed.status()).isEqualTo(NotificationJobStatus.COMPLETED);
    assertThat(completed.attempts()).isEqualTo(1);
    assertThat(completed.processedAt()).isEqualTo(BASE_TIME.plus(Duration.ofHours(1)).plusMillis(1));
  }

  @Test
  void cancelledJobIsNeverDelivered() {
    final String jobId = queueService.addJob(job(BASE_TIME, 3));

    assertThat(queueService.cancelJob(jobId)).isTrue();
    assertThat(queueService.cancelJob(jobId)).isFalse();

    final TickResult result = processor.processTick();

    assertThat(result.claimed()).isZero();
    verifyNoInteractions(sender);
    assertThat(queueService.getJob(jobId).status()).isEqualTo(NotificationJobStatus.CANCELLED);
  }

  @Test
  void retriedJobIsDeliveredOnLaterTick() {
    doThrow(new IllegalStateException("flaky")).doNothing().when(sender).send(any());
    final String jobId = queueService.addJob(job(BASE_TIME, 3));

    assertThat(processor.processTick().retried()).isEqualTo(1);
    final NotificationJob retrying = repository.findById(jobId).orElseThrow();
    assertThat(retrying.status()).isEqualTo(NotificationJobStatus.PENDING);
    assertThat(retrying.processedAt()).isNull();

    assertThat(processor.processTick().completed()).isEqualTo(1);
    final NotificationJob completed = repository.findById(jobId).orElseThrow();
    assertThat(completed.status()).isEqualTo(NotificationJobStatus.COMPLETED);
    assertThat(completed.attempts()).isEqualTo(2);
    verify(sender, times(2)).send(any());
  }

  @Test
  void cleanupRejectsNegativeWindowAndKeepsActiveJobs() {
    final String pending = queueService.addJob(job(BASE_TIME, 3));
    final String cancelled = queueService.addJob(job(BASE_TIME, 3));
    queueService.cancelJob(cancelled);

    assertThatThrownBy(() -> queueService.cleanup(-1))
        .isInstanceOf(InvalidNotificationJobRequestException.class);
    assertThat(queueService.getStats().total()).isEqualTo(2L);

    clock.advance(Duration.ofDays(31));
    assertThat(queueService.cleanup(30)).isEqualTo(1);

    final NotificationJobStats stats = queueService.getStats();
    assertThat(stats.pending()).isEqualTo(1L);
    assertThat(stats.cancelled()).isZero();
    assertThat(repository.findById(pending)).isPresent();
  }

  private static NewNotificationJob job(Instant scheduledTime, int maxAttempts) {
    return new NewNotificationJob(
        "Maintenance",
        "Servers restart at 02:00",
        "{\"tag\":\"maint\"}",
        NotificationTarget.users(List.of("user-1", "user-2")),
        scheduledTime,
        "admin-1",
        maxAttempts);
  }

  @TestConfiguration
  static class ClockConfiguration {

    @Bean
    @Primary
    MutableClock testClock() {
      return new MutableClock(BASE_TIME);
    }
  }
}
