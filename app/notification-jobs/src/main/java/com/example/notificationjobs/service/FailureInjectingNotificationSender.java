/*
 * どこで: NotificationJobs サービス層
 * 何を: CI/テスト専用で、特定の作成者のジョブの配信を失敗させる sender
 * なぜ: 実送信経路に触れずにリトライから FAILED までを通しで再現するため
 */
package com.example.notificationjobs.service;

import com.example.notificationjobs.model.NotificationJob;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

@Component
@Primary
@RequiredArgsConstructor
@Profile({"ci", "test"})
@ConditionalOnProperty(
    prefix = "notification.jobs.delivery.failure-injection",
    name = "enabled",
    havingValue = "true")
public class FailureInjectingNotificationSender implements NotificationSender {

  private final LocalNotificationSender delegate;

  @Value("${notification.jobs.delivery.failure-injection.created-by-prefix:}")
  private String createdByPrefix;

  @Override
  public void send(NotificationJob job) {
    if (shouldInjectFailure(job.createdBy())) {
      throw new IllegalStateException(
          "notification delivery failure injection matched createdBy=" + job.createdBy());
    }
    delegate.send(job);
  }

  private boolean shouldInjectFailure(String createdBy) {
    if (createdByPrefix == null || createdByPrefix.isBlank()) {
      return false;
    }
    return createdBy != null && createdBy.startsWith(createdByPrefix);
  }
}
