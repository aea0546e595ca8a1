/*
 * どこで: NotificationJobs スケジューリング設定
 * 何を: processor の tick と janitor を動かす TaskScheduler を提供する
 * なぜ: processor 制御が自身の固定間隔タスクを実行時に開始/取消するため
 */
package com.example.notificationjobs.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
public class NotificationJobSchedulerConfig {

  // processor の tick 用と @Scheduled の janitor 用に 1 スレッドずつ
  private static final int POOL_SIZE = 2;

  @Bean
  ThreadPoolTaskScheduler notificationJobTaskScheduler() {
    final ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(POOL_SIZE);
    scheduler.setThreadNamePrefix("notification-jobs-");
    scheduler.setRemoveOnCancelPolicy(true);
    scheduler.setWaitForTasksToCompleteOnShutdown(true);
    scheduler.setAwaitTerminationSeconds(30);
    return scheduler;
  }
}
