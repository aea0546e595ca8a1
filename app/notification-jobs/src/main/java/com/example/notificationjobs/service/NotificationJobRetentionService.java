/*
 * どこで: NotificationJobs サービス層
 * 何を: 終端状態のジョブに保持期間を適用し、滞留した PROCESSING 行を報告する
 * なぜ: 無制限な増加を防ぎつつ、停止した processor が残した行を見える状態に保つため
 */
package com.example.notificationjobs.service;

import com.example.notificationjobs.config.NotificationJobRetentionProperties;
import com.example.notificationjobs.repository.NotificationJobRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationJobRetentionService {

  private static final Logger logger =
      LoggerFactory.getLogger(NotificationJobRetentionService.class);

  private final NotificationJobRepository repository;
  private final NotificationJobQueueService queueService;
  private final NotificationJobRetentionProperties properties;
  private final Clock clock;

  public int cleanup() {
    final Instant threshold =
        Instant.now(clock).minus(Duration.ofDays(properties.retentionDays()));
    final int staleProcessing = repository.countStaleProcessing(threshold);
    if (staleProcessing > 0) {
      // ここでは削除せず運用者の判断に委ねる
      logger.error(
          "notification job retention found stale processing jobs count={} threshold={}",
          staleProcessing,
          threshold);
    }
    return queueService.cleanup(properties.retentionDays());
  }
}
