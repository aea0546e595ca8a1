/*
 * どこで: NotificationJobs サービス層
 * 何を: ポーリングループを開始/停止し、アイドル tick を数えて自動停止し、新しい仕事で再開する
 * なぜ: ループは仕事がある間だけ動かし、新規ジョブか起動時の開始で起こすため
 */
package com.example.notificationjobs.service;

import com.example.notificationjobs.config.NotificationJobProcessorProperties;
import com.example.notificationjobs.model.NotificationJob;
import com.example.notificationjobs.model.ProcessorStatus;
import com.google.common.annotations.VisibleForTesting;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

/**
 * このプロセスにおける processor ループのライフサイクル。
 *
 * <p>稼働フラグはプロセス内のみの値。複数レプリカが同じストアに対してループを動かしても、
 * repository の条件付き更新で整合性を保つ。
 */
@Component
public class NotificationJobProcessorController {

  private static final Logger logger =
      LoggerFactory.getLogger(NotificationJobProcessorController.class);

  private final NotificationJobProcessor processor;
  private final TaskScheduler taskScheduler;
  private final NotificationJobProcessorProperties properties;
  private final NotificationJobMetrics metrics;
  private final Clock clock;

  private final Object lock = new Object();
  private ScheduledFuture<?> scheduledTick;
  private Duration interval;
  private int idleTicks;
  private Instant lastTickAt;
  private Instant lastProcessedAt;
  private String lastError;
  private boolean workSignalled;

  public NotificationJobProcessorController(
      NotificationJobProcessor processor,
      TaskScheduler taskScheduler,
      NotificationJobProcessorProperties properties,
      NotificationJobMetrics metrics,
      Clock clock) {
    this.processor = processor;
    this.taskScheduler = taskScheduler;
    this.properties = properties;
    this.metrics = metrics;
    this.clock = clock;
    this.interval = properties.pollInterval();
  }

  /** 設定のポーリング間隔で開始する。 */
  public boolean start() {
    return start(properties.pollInterval());
  }

  /**
   * {@link #tick()} を固定間隔で登録する。最初の tick は即時に実行される。
   *
   * @return 既に稼働中だった場合は {@code false}
   */
  public boolean start(Duration pollInterval) {
    if (pollInterval == null || pollInterval.isZero() || pollInterval.isNegative()) {
      throw new IllegalArgumentException("poll interval must be positive");
    }
    synchronized (lock) {
      if (scheduledTick != null) {
        return false;
      }
      interval = pollInterval;
      idleTicks = 0;
      workSignalled = false;
      scheduledTick = taskScheduler.scheduleWithFixedDelay(this::tick, pollInterval);
    }
    metrics.updateProcessorRunning(true);
    logger.info("notification job processor started intervalMs={}", pollInterval.toMillis());
    return true;
  }

  /**
   * 登録済みのループを取り消す。実行中の tick はそのバッチを最後まで処理する。
   *
   * @return 稼働していなかった場合は {@code false}
   */
  public boolean stop() {
    synchronized (lock) {
      if (!cancelScheduledTick()) {
        return false;
      }
    }
    metrics.updateProcessorRunning(false);
    logger.info("notification job processor stopped");
    return true;
  }

  public boolean isRunning() {
    synchronized (lock) {
      return scheduledTick != null;
    }
  }

  /**
   * ジョブ保存後に呼ばれる起床フック。稼働中は未処理の仕事があることだけを記録し、
   * 既に空振りした tick がそのままアイドル停止しないようにする。
   */
  public void onJobAdded(NotificationJob job) {
    if (!properties.enabled() || !properties.startOnDemand()) {
      return;
    }
    synchronized (lock) {
      if (scheduledTick != null) {
        workSignalled = true;
        return;
      }
      if (!start()) {
        return;
      }
    }
    logger.info("notification job processor started on demand jobId={}", job.jobId());
  }

  @EventListener(ApplicationReadyEvent.class)
  public void onApplicationReady() {
    if (properties.enabled() && properties.startOnBoot()) {
      start();
    }
  }

  @PreDestroy
  public void shutdown() {
    stop();
  }

  public ProcessorStatus status() {
    synchronized (lock) {
      return new ProcessorStatus(
          scheduledTick != null,
          interval.toMillis(),
          idleTicks,
          properties.idleStopTicks(),
          properties.startOnDemand(),
          lastTickAt,
          lastProcessedAt,
          lastError);
    }
  }

  @VisibleForTesting
  void tick() {
    final Instant startedAt = Instant.now(clock);
    final TickResult result;
    try {
      result = processor.processTick();
    } catch (RuntimeException ex) {
      logger.warn("notification job tick failed", ex);
      metrics.recordTickError();
      synchronized (lock) {
        lastTickAt = startedAt;
        lastError = ex.getMessage() == null ? ex.getClass().getName() : ex.getMessage();
      }
      return;
    } finally {
      metrics.recordTick(Duration.between(startedAt, Instant.now(clock)));
    }
    if (result.skipped()) {
      return;
    }
    final boolean stopped;
    synchronized (lock) {
      lastTickAt = startedAt;
      lastError = null;
      if (!result.isIdle()) {
        idleTicks = 0;
        lastProcessedAt = startedAt;
      } else if (workSignalled) {
        // この tick の実行中にジョブが追加されたため、次の tick で拾う
        idleTicks = 0;
      } else {
        idleTicks++;
      }
      workSignalled = false;
      stopped = idleTicks >= properties.idleStopTicks() && cancelScheduledTick();
    }
    if (stopped) {
      metrics.updateProcessorRunning(false);
      logger.info(
          "notification job processor stopped after idle ticks idleStopTicks={}",
          properties.idleStopTicks());
    }
  }

  // 前提: 呼び出し側が lock を保持している
  private boolean cancelScheduledTick() {
    if (scheduledTick == null) {
      return false;
    }
    scheduledTick.cancel(false);
    scheduledTick = null;
    idleTicks = 0;
    return true;
  }
}
