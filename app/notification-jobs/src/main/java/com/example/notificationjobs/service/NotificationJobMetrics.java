/*
 * どこで: NotificationJobs サービス層
 * 何を: 配信結果、tick の所要時間/失敗、processor 状態、滞留数、削除件数を記録する
 * なぜ: キューの健全性はメトリクスと管理 API でしか観測できないため
 */
package com.example.notificationjobs.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring-managed component and cannot be copied")
public class NotificationJobMetrics {

  public static final String RESULT_COMPLETED = "completed";
  public static final String RESULT_RETRY = "retry";
  public static final String RESULT_FAILED = "failed";
  public static final String RESULT_ABANDONED = "abandoned";

  private static final String METRIC_DELIVERY_TOTAL = "notification.jobs.delivery.total";
  private static final String METRIC_TICK_DURATION = "notification.jobs.tick.duration";
  private static final String METRIC_TICK_ERRORS = "notification.jobs.tick.errors";
  private static final String METRIC_PROCESSOR_RUNNING = "notification.jobs.processor.running";
  private static final String METRIC_BACKLOG_CURRENT = "notification.jobs.backlog.current";
  private static final String METRIC_CLEANUP_DELETED = "notification.jobs.cleanup.deleted";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> deliveryCounters = new ConcurrentHashMap<>();
  private final AtomicInteger processorRunning = new AtomicInteger(0);
  private final AtomicLong backlogCurrent = new AtomicLong(0);
  private final Timer tickTimer;
  private final Counter tickErrorCounter;
  private final Counter cleanupDeletedCounter;

  public NotificationJobMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_PROCESSOR_RUNNING, processorRunning, AtomicInteger::get)
        .description("1 while the notification job processor loop is scheduled")
        .register(meterRegistry);
    Gauge.builder(METRIC_BACKLOG_CURRENT, backlogCurrent, AtomicLong::get)
        .description("Pending notification jobs at the last stats read")
        .register(meterRegistry);
    this.tickTimer =
        Timer.builder(METRIC_TICK_DURATION)
            .description("Duration of one processor tick")
            .register(meterRegistry);
    this.tickErrorCounter =
        Counter.builder(METRIC_TICK_ERRORS)
            .description("Processor ticks that ended with an exception")
            .register(meterRegistry);
    this.cleanupDeletedCounter =
        Counter.builder(METRIC_CLEANUP_DELETED)
            .description("Terminal notification jobs deleted by retention cleanup")
            .register(meterRegistry);
  }

  public void recordDeliveryResult(String result) {
    deliveryCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_DELIVERY_TOTAL)
                    .description("Notification job delivery outcomes")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordTick(Duration duration) {
    tickTimer.record(duration);
  }

  public void recordTickError() {
    tickErrorCounter.increment();
  }

  public void updateProcessorRunning(boolean running) {
    processorRunning.set(running ? 1 : 0);
  }

  public void updateBacklogCurrent(long pending) {
    backlogCurrent.set(Math.max(pending, 0L));
  }

  public void recordCleanupDeleted(int deleted) {
    if (deleted > 0) {
      cleanupDeletedCounter.increment(deleted);
    }
  }
}
