/*
 * どこで: NotificationJobs クリーンアップワーカー
 * 何を: 保持期間クリーンアップを定期実行する
 * なぜ: processor ループの稼働状態に関係なく動かすため
 */
package com.example.notificationjobs.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "notification.jobs.retention.enabled", havingValue = "true")
public class NotificationJobRetentionWorker {

  private final NotificationJobRetentionService retentionService;

  @Scheduled(fixedDelayString = "${notification.jobs.retention.cleanup-interval}")
  public void run() {
    retentionService.cleanup();
  }
}
