/*
 * どこで: NotificationJobs サービス層
 * 何を: claim したジョブごとに 1 回呼ばれる配信コールバック
 * なぜ: キューはジョブを受け渡し、例外が出たかどうかだけを見るため
 */
package com.example.notificationjobs.service;

import com.example.notificationjobs.model.NotificationJob;

public interface NotificationSender {

  /** 成功時は正常に戻る。RuntimeException はすべて試行失敗として扱う。 */
  void send(NotificationJob job);
}
