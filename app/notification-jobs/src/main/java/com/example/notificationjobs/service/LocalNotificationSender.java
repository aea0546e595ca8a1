/*
 * どこで: NotificationJobs サービス層
 * 何を: 受け渡しをログに残すだけの sender
 * なぜ: プッシュ送信なしでジョブのライフサイクル全体を動かすため
 */
package com.example.notificationjobs.service;

import com.example.notificationjobs.model.NotificationJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    name = "notification.jobs.delivery.mode",
    havingValue = "local",
    matchIfMissing = true)
public class LocalNotificationSender implements NotificationSender {

  private static final Logger logger = LoggerFactory.getLogger(LocalNotificationSender.class);

  @Override
  public void send(NotificationJob job) {
    logger.info(
        "notification simulated send id={} allUsers={} recipients={} title={}",
        job.jobId(),
        job.target().allUsers(),
        job.target().userIds().size(),
        job.title());
  }
}
